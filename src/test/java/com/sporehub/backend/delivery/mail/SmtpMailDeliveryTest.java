package com.sporehub.backend.delivery.mail;

import com.sporehub.backend.common.web.DeliveryFailedException;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SmtpMailDeliveryTest {

    private final JavaMailSender sender = mock(JavaMailSender.class);
    private final MailSenderProperties props = new MailSenderProperties();
    private SmtpMailDelivery delivery;

    @BeforeEach
    void setUp() {
        when(sender.createMimeMessage()).thenAnswer(inv -> new MimeMessage(Session.getInstance(new Properties())));
        delivery = new SmtpMailDelivery(sender, props);
    }

    @Test
    void sends_multipart_message_from_configured_sender() throws Exception {
        delivery.deliver(" grower@example.com ", "Your code", "<b>123456</b>", "123456");

        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(sender).send(captor.capture());
        MimeMessage sent = captor.getValue();

        assertThat(sent.getSubject()).isEqualTo("Your code");
        assertThat(((InternetAddress) sent.getRecipients(Message.RecipientType.TO)[0]).getAddress())
                .isEqualTo("grower@example.com");
        assertThat(((InternetAddress) sent.getFrom()[0]).getAddress()).isEqualTo("no-reply@sporehub.app");
    }

    @Test
    void transport_failure_becomes_delivery_failed() {
        doThrow(new MailSendException("connection refused")).when(sender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> delivery.deliver("a@b.com", "s", "<p>h</p>", "t"))
                .isInstanceOf(DeliveryFailedException.class)
                .hasMessage("Failed to send email")
                .satisfies(e -> assertThat(((DeliveryFailedException) e).channel()).isEqualTo("email"));
    }

    @Test
    void disabled_delivery_never_touches_smtp() {
        props.setEnabled(false);

        assertThatThrownBy(() -> delivery.deliver("a@b.com", "s", "<p>h</p>", "t"))
                .isInstanceOf(DeliveryFailedException.class)
                .hasMessage("Email delivery is disabled");
        verify(sender, never()).send(any(MimeMessage.class));
    }
}
