package com.pushit.dto.request;

import jakarta.validation.constraints.Email;
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
public class BrandProfileRequest {
    @Size(max = 200)
    private String companyName;

    @Size(max = 100)
    private String industry;

    @Size(max = 5000)
    private String description;

    @Size(max = 255)
    private String website;

    @Email(message = "Contact email must be valid")
    private String contactEmail;

    @Size(max = 30)
    private String phoneNumber;

    @Size(max = 500)
    private String address;

    @Size(min = 3, max = 3, message = "Currency code must have 3 letters")
    private String currencyCode;
}
