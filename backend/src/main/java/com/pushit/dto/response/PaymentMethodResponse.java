package com.pushit.dto.response;

import com.pushit.entity.MobileMoneyNetwork;
import com.pushit.entity.PaymentMethod;
import com.pushit.entity.PaymentMethodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodResponse {
    private Long id;
    private PaymentMethodType methodType;
    private boolean isDefault;
    private String bankName;
    private String accountNumber;
    private String accountName;
    private MobileMoneyNetwork mobileMoneyNetwork;
    private String mobileMoneyNumber;
    private String mobileMoneyName;

    public static PaymentMethodResponse fromEntity(PaymentMethod method) {
        return PaymentMethodResponse.builder()
                .id(method.getId())
                .methodType(method.getMethodType())
                .isDefault(method.isDefault())
                .bankName(method.getBankName())
                .accountNumber(method.getAccountNumber())
                .accountName(method.getAccountName())
                .mobileMoneyNetwork(method.getMobileMoneyNetwork())
                .mobileMoneyNumber(method.getMobileMoneyNumber())
                .mobileMoneyName(method.getMobileMoneyName())
                .build();
    }
}
