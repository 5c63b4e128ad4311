package com.sporehub.backend.delivery.mail;

import com.sporehub.backend.common.web.DeliveryFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpMailDelivery implements MailDelivery {

    static final String CHANNEL = "email";

    private final JavaMailSender mail;
    private final MailSenderProperties props;

    @Override
    public void deliver(String recipient, String subject, String htmlBody, String textBody) {
        if (!props.isEnabled()) {
            throw new DeliveryFailedException(CHANNEL, "Email delivery is disabled");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new DeliveryFailedException(CHANNEL, "Recipient is required");
        }

        try {
            MimeMessage msg = mail.createMimeMessage();
            boolean multipart = htmlBody != null && textBody != null;
            MimeMessageHelper h = new MimeMessageHelper(msg, multipart, StandardCharsets.UTF_8.name());
            h.setFrom(props.getSender(), props.getSenderName());
            h.setTo(recipient.trim());
            h.setSubject(subject == null ? "" : subject);
            if (multipart) {
                h.setText(textBody, htmlBody);
            } else if (htmlBody != null) {
                h.setText(htmlBody, true);
            } else {
                h.setText(textBody == null ? "" : textBody, false);
            }
            mail.send(msg);
            log.info("email sent to={} subject={}", recipient, subject);
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.warn("email send failed to={} cause={}", recipient, e.getMessage());
            throw new DeliveryFailedException(CHANNEL, "Failed to send email", e);
        }
    }
}
