package com.pushit.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutUpdateRequest {
    @Size(max = 100)
    private String reference;

    @Size(max = 2000)
    private String notes;
}
