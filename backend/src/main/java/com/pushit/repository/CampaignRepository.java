package com.pushit.repository;

import com.pushit.entity.Campaign;
import com.pushit.entity.CampaignStatus;
import com.pushit.entity.Platform;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    List<Campaign> findByBrandIdOrderByCreatedAtDesc(Long brandId);

    List<Campaign> findByStatusAndPlatformOrderByCreatedAtDesc(
            CampaignStatus status, Platform platform);

    List<Campaign> findByStatusOrderByCreatedAtDesc(CampaignStatus status);
}
