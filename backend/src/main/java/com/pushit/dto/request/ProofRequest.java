package com.pushit.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProofRequest {
    @NotBlank(message = "Proof link is required")
    @Size(max = 500)
    @Pattern(regexp = "^https?://.+", message = "Proof link must be an http(s) URL")
    private String proofLink;
}
