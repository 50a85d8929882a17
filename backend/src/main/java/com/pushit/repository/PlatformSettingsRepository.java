package com.pushit.repository;

import com.pushit.entity.Platform;
import com.pushit.entity.PlatformSettings;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlatformSettingsRepository extends JpaRepository<PlatformSettings, Long> {

    Optional<PlatformSettings> findByPlatform(Platform platform);
}
