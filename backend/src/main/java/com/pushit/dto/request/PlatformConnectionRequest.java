package com.pushit.dto.request;

import com.pushit.entity.Platform;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformConnectionRequest {
    @NotNull(message = "Platform is required")
    private Platform platform;

    @NotBlank(message = "Handle is required")
    @Size(max = 100)
    private String handle;

    @Min(value = 0, message = "Followers count cannot be negative")
    private long followersCount;

    @DecimalMin(value = "0.0", message = "Engagement rate cannot be negative")
    private double engagementRate;

    @Min(value = 0, message = "Average views cannot be negative")
    private long averageViews;

    @Size(max = 500)
    private String samplePostUrl;

    private String accessToken;

    @Size(max = 100)
    private String platformAccountId;
}
