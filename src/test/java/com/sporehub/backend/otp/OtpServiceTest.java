package com.sporehub.backend.otp;

import com.sporehub.backend.common.web.DeliveryFailedException;
import com.sporehub.backend.common.web.InvalidRequestException;
import com.sporehub.backend.delivery.mail.MailDelivery;
import com.sporehub.backend.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OtpServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-05-10T12:00:00Z"));
    private final InMemoryOtpStore store = new InMemoryOtpStore();
    private final OtpProperties props = new OtpProperties();
    private final MailDelivery mail = mock(MailDelivery.class);
    private final OtpCodeGenerator codes = mock(OtpCodeGenerator.class);
    private ExecutorService executor;
    private OtpService service;

    @BeforeEach
    void setUp() {
        props.setDeliveryTimeout(Duration.ofMillis(500));
        executor = Executors.newSingleThreadExecutor();
        service = new OtpService(store, codes, new OtpTemplateRenderer(props), mail, props, executor, clock);
        when(codes.next()).thenReturn("482913", "105577", "900001");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void login_code_verifies_once_then_is_gone() {
        OtpIssueResult issued = service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThat(issued.code()).isEqualTo("482913");
        assertThat(issued.delivered()).isTrue();
        assertThat(issued.record().expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));

        clock.advance(Duration.ofMinutes(1));
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.NOT_FOUND);
    }

    @Test
    void expiry_depends_on_purpose() {
        Instant now = clock.instant();
        assertThat(service.issue("a@b.com", OtpPurpose.PASSWORD_RESET).record().expiresAt())
                .isEqualTo(now.plus(Duration.ofMinutes(15)));
        assertThat(service.issue("a@b.com", OtpPurpose.VERIFICATION).record().expiresAt())
                .isEqualTo(now.plus(Duration.ofMinutes(30)));
    }

    @Test
    void correct_code_after_expiry_is_expired_not_invalid() {
        service.issue("a@b.com", OtpPurpose.LOGIN);
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.EXPIRED);
        // expired record is removed
        assertThat(store.find("a@b.com", OtpPurpose.LOGIN)).isEmpty();
    }

    @Test
    void wrong_code_before_expiry_is_invalid_and_keeps_record() {
        service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "000000")).isEqualTo(OtpVerificationResult.INVALID);
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
    }

    @Test
    void reissue_supersedes_previous_code() {
        service.issue("a@b.com", OtpPurpose.LOGIN);
        service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.INVALID);
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "105577")).isEqualTo(OtpVerificationResult.VALID);
    }

    @Test
    void purposes_are_isolated() {
        service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThat(service.verify("a@b.com", OtpPurpose.REGISTRATION, "482913")).isEqualTo(OtpVerificationResult.NOT_FOUND);
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
    }

    @Test
    void email_is_normalised() {
        service.issue("  A@B.com ", OtpPurpose.LOGIN);

        assertThat(service.verify("a@b.COM", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
        verify(mail).deliver(eq("a@b.com"), anyString(), contains("482913"), contains("482913"));
    }

    @Test
    void invalid_email_is_rejected_before_storing() {
        assertThatThrownBy(() -> service.issue("not-an-email", OtpPurpose.LOGIN))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void delivery_failure_keeps_record() {
        doThrow(new DeliveryFailedException("email", "Failed to send email"))
                .when(mail).deliver(anyString(), anyString(), anyString(), anyString());

        OtpIssueResult issued = service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThat(issued.delivery()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(issued.deliveryError()).isEqualTo("Failed to send email");
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
    }

    @Test
    void slow_delivery_times_out_and_keeps_record() {
        doAnswer(inv -> {
            Thread.sleep(5_000);
            return null;
        }).when(mail).deliver(anyString(), anyString(), anyString(), anyString());

        OtpIssueResult issued = service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThat(issued.delivery()).isEqualTo(DeliveryStatus.TIMED_OUT);
        assertThat(store.find("a@b.com", OtpPurpose.LOGIN)).isPresent();
    }

    @Test
    void resend_delivers_same_code_with_original_expiry() {
        OtpIssueResult issued = service.issue("a@b.com", OtpPurpose.VERIFICATION);
        clock.advance(Duration.ofMinutes(10));

        service.resend("a@b.com", OtpPurpose.VERIFICATION, "482913");

        verify(mail, times(2)).deliver(eq("a@b.com"), anyString(), contains("482913"), anyString());
        assertThat(store.find("a@b.com", OtpPurpose.VERIFICATION))
                .get()
                .extracting(OtpRecord::expiresAt)
                .isEqualTo(issued.record().expiresAt());
    }

    @Test
    void resend_without_matching_record_fails() {
        assertThatThrownBy(() -> service.resend("a@b.com", OtpPurpose.LOGIN, "482913"))
                .isInstanceOf(NoActiveRecordException.class);

        service.issue("a@b.com", OtpPurpose.LOGIN);
        assertThatThrownBy(() -> service.resend("a@b.com", OtpPurpose.LOGIN, "111111"))
                .isInstanceOf(NoActiveRecordException.class);

        clock.advance(Duration.ofMinutes(6));
        assertThatThrownBy(() -> service.resend("a@b.com", OtpPurpose.LOGIN, "482913"))
                .isInstanceOf(NoActiveRecordException.class);
    }

    @Test
    void resend_transport_failure_is_reported_and_record_kept() {
        service.issue("a@b.com", OtpPurpose.LOGIN);
        doThrow(new DeliveryFailedException("email", "Failed to send email"))
                .when(mail).deliver(anyString(), anyString(), anyString(), anyString());

        assertThatThrownBy(() -> service.resend("a@b.com", OtpPurpose.LOGIN, "482913"))
                .isInstanceOf(DeliveryFailedException.class);
        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
    }

    @Test
    void bad_custom_template_does_not_replace_active_code() {
        service.issue("a@b.com", OtpPurpose.LOGIN);

        assertThatThrownBy(() -> service.issueWithTemplate("a@b.com", OtpPurpose.LOGIN,
                "Your code", "<p>no placeholders</p>", null))
                .isInstanceOf(InvalidRequestException.class);

        assertThat(service.verify("a@b.com", OtpPurpose.LOGIN, "482913")).isEqualTo(OtpVerificationResult.VALID);
    }

    @Test
    void custom_template_is_rendered_and_delivered() {
        service.issueWithTemplate("a@b.com", OtpPurpose.REGISTRATION, "Welcome",
                "<b>{{code}}</b> for {{purpose}}", "{{purpose}}: {{code}}");

        verify(mail).deliver("a@b.com", "Welcome", "<b>482913</b> for Registration", "Registration: 482913");
    }

    @Test
    void sweep_removes_expired_records() {
        service.issue("a@b.com", OtpPurpose.LOGIN);
        service.issue("a@b.com", OtpPurpose.REGISTRATION);
        clock.advance(Duration.ofMinutes(6));

        service.sweepExpired();

        assertThat(store.find("a@b.com", OtpPurpose.LOGIN)).isEmpty();
        assertThat(store.find("a@b.com", OtpPurpose.REGISTRATION)).isPresent();
    }
}
