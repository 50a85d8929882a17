package com.pushit.dto.request;

import com.pushit.entity.Platform;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial profile update; null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfluencerProfileRequest {
    @Size(max = 100)
    private String displayName;

    @Size(max = 2000)
    private String bio;

    @Size(max = 100)
    private String niche;

    private Platform primaryPlatform;

    @Size(min = 3, max = 3, message = "Currency code must have 3 letters")
    private String currencyCode;
}
