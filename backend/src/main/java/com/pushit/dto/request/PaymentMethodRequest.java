package com.pushit.dto.request;

import com.pushit.entity.MobileMoneyNetwork;
import com.pushit.entity.PaymentMethodType;
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
public class PaymentMethodRequest {
    @NotNull(message = "Method type is required")
    private PaymentMethodType methodType;

    @Size(max = 100)
    private String bankName;

    @Size(max = 50)
    private String accountNumber;

    @Size(max = 100)
    private String accountName;

    private MobileMoneyNetwork mobileMoneyNetwork;

    @Size(max = 20)
    private String mobileMoneyNumber;

    @Size(max = 100)
    private String mobileMoneyName;

    private boolean makeDefault;
}
