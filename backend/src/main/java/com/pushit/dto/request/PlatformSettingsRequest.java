package com.pushit.dto.request;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformSettingsRequest {
    @Min(value = 0, message = "Minimum followers cannot be negative")
    private long minimumFollowers;

    @Builder.Default private boolean active = true;
}
