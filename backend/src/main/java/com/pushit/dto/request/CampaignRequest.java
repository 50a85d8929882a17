package com.pushit.dto.request;

import com.pushit.entity.Platform;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignRequest {
    @NotBlank(message = "Campaign name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 5000)
    private String description;

    @NotNull(message = "Platform is required")
    private Platform platform;

    @Size(max = 100)
    private String niche;

    @Min(value = 0, message = "Package videos cannot be negative")
    private int packageVideos;

    @NotNull(message = "Budget is required")
    @DecimalMin(value = "0.01", message = "Budget must be positive")
    private BigDecimal budget;

    @Size(min = 3, max = 3, message = "Currency code must have 3 letters")
    private String currency;

    private LocalDate startDate;

    private LocalDate dueDate;
}
