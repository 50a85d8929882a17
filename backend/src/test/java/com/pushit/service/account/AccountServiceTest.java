package com.pushit.service.account;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.dto.request.RegisterRequest;
import com.pushit.entity.Brand;
import com.pushit.entity.Currency;
import com.pushit.entity.Influencer;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.exception.ApiException;
import com.pushit.exception.InvalidTokenException;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.UserRepository;
import com.pushit.security.EmailVerificationTokenService;
import com.pushit.security.EmailVerificationTokenService.VerifiedToken;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.email.EmailService;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AccountServiceTest {

    @Mock private UserRepository userRepository;

    @Mock private BrandRepository brandRepository;

    @Mock private InfluencerRepository influencerRepository;

    @Mock private CurrencyService currencyService;

    @Mock private PasswordEncoder passwordEncoder;

    @Mock private EmailVerificationTokenService tokenService;

    @Mock private EmailService emailService;

    @InjectMocks private AccountService accountService;

    private final Currency cedi = Currency.builder().id(1L).code("GHS").isDefault(true).build();

    @BeforeEach
    void setUp() {
        when(passwordEncoder.encode(anyString())).thenReturn("encoded");
        when(currencyService.getDefault()).thenReturn(Optional.of(cedi));
        when(tokenService.generateToken(any(User.class))).thenReturn("token");
        when(userRepository.save(any(User.class)))
                .thenAnswer(
                        invocation -> {
                            User user = invocation.getArgument(0);
                            user.setId(5L);
                            return user;
                        });
    }

    @Test
    void register_Brand_CreatesProfileInDefaultCurrencyAndSendsLink() {
        User user = accountService.register(request(" Owner@Acme.TEST ", "BRAND"));

        assertEquals("owner@acme.test", user.getEmail());
        assertEquals("encoded", user.getPasswordHash());
        assertFalse(user.isEmailVerified());

        ArgumentCaptor<Brand> brand = ArgumentCaptor.forClass(Brand.class);
        verify(brandRepository).save(brand.capture());
        assertSame(cedi, brand.getValue().getCurrency());
        verify(influencerRepository, never()).save(any());
        verify(emailService).sendVerificationEmail("owner@acme.test", "token");
    }

    @Test
    void register_Influencer_CreatesInfluencerProfile() {
        accountService.register(request("ama@creators.test", "INFLUENCER"));

        verify(influencerRepository).save(any(Influencer.class));
        verify(brandRepository, never()).save(any());
    }

    @Test
    void register_TakenEmail_IsConflict() {
        when(userRepository.existsByEmailIgnoreCase("owner@acme.test")).thenReturn(true);

        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () -> accountService.register(request("owner@acme.test", "BRAND")));
        assertEquals("EMAIL_TAKEN", ex.getErrorCode());
        verify(userRepository, never()).save(any());
    }

    @Test
    void register_Admin_IsForbidden() {
        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () -> accountService.register(request("root@pushit.test", "ADMIN")));
        assertEquals("ROLE_NOT_ALLOWED", ex.getErrorCode());
    }

    @Test
    void confirmEmail_MarksVerified() {
        User user = User.builder().id(5L).email("ama@creators.test").build();
        when(tokenService.parse("token")).thenReturn(new VerifiedToken(5L, "ama@creators.test"));
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));

        assertTrue(accountService.confirmEmail("token").isEmailVerified());
    }

    @Test
    void confirmEmail_SecondUse_IsRejected() {
        User user = User.builder().id(5L).email("ama@creators.test").emailVerified(true).build();
        when(tokenService.parse("token")).thenReturn(new VerifiedToken(5L, "ama@creators.test"));
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));

        assertThrows(InvalidTokenException.class, () -> accountService.confirmEmail("token"));
    }

    @Test
    void confirmEmail_AddressChangedSinceIssue_IsRejected() {
        User user = User.builder().id(5L).email("new@creators.test").build();
        when(tokenService.parse("token")).thenReturn(new VerifiedToken(5L, "ama@creators.test"));
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));

        assertThrows(InvalidTokenException.class, () -> accountService.confirmEmail("token"));
        verify(userRepository, never()).save(any());
    }

    private static RegisterRequest request(String email, String role) {
        RegisterRequest request = new RegisterRequest();
        request.setEmail(email);
        request.setPassword("s3cure-Passw0rd");
        request.setRole(role);
        return request;
    }
}
