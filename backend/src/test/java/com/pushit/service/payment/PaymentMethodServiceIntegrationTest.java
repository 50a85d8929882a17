package com.pushit.service.payment;

import static org.junit.jupiter.api.Assertions.*;

import com.pushit.dto.request.PaymentMethodRequest;
import com.pushit.entity.Influencer;
import com.pushit.entity.MobileMoneyNetwork;
import com.pushit.entity.PaymentMethod;
import com.pushit.entity.PaymentMethodType;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.PaymentMethodRepository;
import com.pushit.repository.UserRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PaymentMethodServiceIntegrationTest {

    @Autowired private PaymentMethodService paymentMethodService;

    @Autowired private PaymentMethodRepository paymentMethodRepository;

    @Autowired private InfluencerRepository influencerRepository;

    @Autowired private UserRepository userRepository;

    private Influencer influencer;

    @BeforeEach
    void setUp() {
        User user =
                userRepository.save(
                        User.builder()
                                .email("ama@creators.test")
                                .passwordHash("hash")
                                .role(UserRole.INFLUENCER)
                                .build());
        influencer =
                influencerRepository.save(
                        Influencer.builder().user(user).displayName("Ama").build());
    }

    @Test
    @DisplayName("The first method becomes the default")
    void add_FirstMethod_IsDefault() {
        PaymentMethod bank = paymentMethodService.add(influencer, bank(false));

        assertTrue(bank.isDefault());
        assertEquals(bank.getId(), defaults().get(0).getId());
    }

    @Test
    @DisplayName("Adding a method as default leaves exactly one default")
    void add_MakeDefault_MovesDefault() {
        paymentMethodService.add(influencer, bank(false));
        PaymentMethod momo = paymentMethodService.add(influencer, mobileMoney(true));

        List<PaymentMethod> defaults = defaults();
        assertEquals(1, defaults.size());
        assertEquals(momo.getId(), defaults.get(0).getId());
    }

    @Test
    void add_NotDefault_KeepsExistingDefault() {
        PaymentMethod bank = paymentMethodService.add(influencer, bank(false));
        paymentMethodService.add(influencer, mobileMoney(false));

        List<PaymentMethod> defaults = defaults();
        assertEquals(1, defaults.size());
        assertEquals(bank.getId(), defaults.get(0).getId());
    }

    @Test
    void setDefault_SwitchesTheSingleDefault() {
        PaymentMethod bank = paymentMethodService.add(influencer, bank(false));
        paymentMethodService.add(influencer, mobileMoney(true));

        paymentMethodService.setDefault(influencer.getId(), bank.getId());

        List<PaymentMethod> defaults = defaults();
        assertEquals(1, defaults.size());
        assertEquals(bank.getId(), defaults.get(0).getId());
    }

    @Test
    void delete_Default_PromotesRemainingMethod() {
        PaymentMethod bank = paymentMethodService.add(influencer, bank(false));
        PaymentMethod momo = paymentMethodService.add(influencer, mobileMoney(true));

        paymentMethodService.delete(influencer.getId(), momo.getId());

        List<PaymentMethod> defaults = defaults();
        assertEquals(1, defaults.size());
        assertEquals(bank.getId(), defaults.get(0).getId());
        assertEquals(1, paymentMethodRepository.countByInfluencerId(influencer.getId()));
    }

    @Test
    void add_BankWithoutAccountNumber_IsRejected() {
        PaymentMethodRequest request = bank(false);
        request.setAccountNumber(" ");

        assertThrows(
                IllegalArgumentException.class,
                () -> paymentMethodService.add(influencer, request));
        assertEquals(0, paymentMethodRepository.countByInfluencerId(influencer.getId()));
    }

    private List<PaymentMethod> defaults() {
        return paymentMethodRepository.findDefaults(influencer.getId());
    }

    private static PaymentMethodRequest bank(boolean makeDefault) {
        return PaymentMethodRequest.builder()
                .methodType(PaymentMethodType.BANK)
                .bankName("GCB Bank")
                .accountNumber("1021130045678")
                .accountName("Ama Mensah")
                .makeDefault(makeDefault)
                .build();
    }

    private static PaymentMethodRequest mobileMoney(boolean makeDefault) {
        return PaymentMethodRequest.builder()
                .methodType(PaymentMethodType.MOBILE_MONEY)
                .mobileMoneyNetwork(MobileMoneyNetwork.MTN)
                .mobileMoneyNumber("0244123456")
                .mobileMoneyName("Ama Mensah")
                .makeDefault(makeDefault)
                .build();
    }
}
