package com.pushit.service.email;

import com.pushit.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/** Outbound transactional email. Sending is a no-op unless {@code app.email.enabled} is set. */
@Slf4j
@Service
public class EmailService {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final AppProperties.Email settings;

    public EmailService(ObjectProvider<JavaMailSender> mailSender, AppProperties appProperties) {
        this.mailSender = mailSender;
        this.settings = appProperties.email();
    }

    /**
     * @return true when the message was handed to the mail server
     */
    public boolean sendEmail(String to, String subject, String body) {
        if (!settings.enabled()) {
            log.debug("Email disabled, not sending '{}' to {}", subject, to);
            return false;
        }
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.warn("Email enabled but no mail server configured, '{}' not sent", subject);
            return false;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(settings.from());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);
        try {
            sender.send(message);
            log.info("Email '{}' sent to {}", subject, to);
            return true;
        } catch (MailException e) {
            log.error("Failed to send email to {}: {}", to, e.getMessage(), e);
            return false;
        }
    }

    public boolean sendVerificationEmail(String to, String token) {
        String link = settings.verificationBaseUrl() + "?token=" + token;
        String body =
                String.format(
                        "Welcome to PushIt!%n%n"
                                + "Confirm your email address by opening the link below:%n%n%s%n%n"
                                + "The link expires in %d hours and can only be used once.",
                        link,
                        settings.tokenTtl().toHours());
        return sendEmail(to, "Verify your PushIt email address", body);
    }
}
