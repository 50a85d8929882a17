package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.dto.request.PlatformSettingsRequest;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformSettings;
import com.pushit.repository.PlatformSettingsRepository;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlatformSettingsService {

    private final PlatformSettingsRepository platformSettingsRepository;
    private final AppProperties appProperties;

    /** Minimum followers for the platform, or the configured default without a settings row. */
    @Transactional(readOnly = true)
    public long minimumFollowers(Platform platform) {
        return platformSettingsRepository
                .findByPlatform(platform)
                .map(PlatformSettings::getMinimumFollowers)
                .orElse(appProperties.verification().defaultMinimumFollowers());
    }

    /** Platforms without a settings row are active. */
    @Transactional(readOnly = true)
    public boolean isActive(Platform platform) {
        return platformSettingsRepository
                .findByPlatform(platform)
                .map(PlatformSettings::isActive)
                .orElse(true);
    }

    /** Effective settings for every platform, including defaults for missing rows. */
    @Transactional(readOnly = true)
    public List<PlatformSettings> listAll() {
        Map<Platform, PlatformSettings> byPlatform = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            byPlatform.put(
                    platform,
                    PlatformSettings.builder()
                            .platform(platform)
                            .minimumFollowers(
                                    appProperties.verification().defaultMinimumFollowers())
                            .build());
        }
        platformSettingsRepository.findAll().forEach(s -> byPlatform.put(s.getPlatform(), s));
        return List.copyOf(byPlatform.values());
    }

    @Transactional
    public PlatformSettings update(Platform platform, PlatformSettingsRequest request) {
        PlatformSettings settings =
                platformSettingsRepository
                        .findByPlatform(platform)
                        .orElseGet(() -> PlatformSettings.builder().platform(platform).build());
        settings.setMinimumFollowers(request.getMinimumFollowers());
        settings.setActive(request.isActive());
        PlatformSettings saved = platformSettingsRepository.save(settings);
        log.info(
                "Platform settings for {} updated: minimum followers {}, active {}",
                platform,
                saved.getMinimumFollowers(),
                saved.isActive());
        return saved;
    }
}
