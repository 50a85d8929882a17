package com.pushit.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobAcceptanceResponse {
    private SubmissionResponse submission;
    private PayoutResponse payout;
}
