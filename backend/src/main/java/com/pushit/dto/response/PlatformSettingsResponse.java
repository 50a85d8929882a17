package com.pushit.dto.response;

import com.pushit.entity.Platform;
import com.pushit.entity.PlatformSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformSettingsResponse {
    private Platform platform;
    private long minimumFollowers;
    private boolean active;

    public static PlatformSettingsResponse fromEntity(PlatformSettings settings) {
        return PlatformSettingsResponse.builder()
                .platform(settings.getPlatform())
                .minimumFollowers(settings.getMinimumFollowers())
                .active(settings.isActive())
                .build();
    }
}
