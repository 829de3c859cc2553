package com.eyelevel.invoiceingestion.service.notification;

import com.eyelevel.invoiceingestion.exception.NotificationDeliveryException;
import com.eyelevel.invoiceingestion.exception.UnrecoverableJobException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Sends through the Spring Boot configured {@link JavaMailSender} ({@code spring.mail.*}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaMailNotificationSender implements NotificationSender {

    private final ObjectProvider<JavaMailSender> mailSender;

    @Override
    public String send(final OutboundMessage message) {
        final JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new UnrecoverableJobException("No mail transport is configured (spring.mail.host is not set).");
        }
        try {
            final MimeMessage mime = sender.createMimeMessage();
            final MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            helper.setFrom(message.from());
            helper.setTo(message.recipients().toArray(new String[0]));
            helper.setSubject(message.subject());
            helper.setText(message.body() == null ? "" : message.body(), true);
            sender.send(mime);
            return mime.getMessageID();
        } catch (MessagingException | MailException e) {
            throw new NotificationDeliveryException(e.getMessage() != null ? e.getMessage() : "Mail delivery failed",
                                                    DeliveryErrorClassifier.transportCode(e), null, e);
        }
    }
}
