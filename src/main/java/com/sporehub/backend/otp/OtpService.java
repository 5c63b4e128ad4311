package com.sporehub.backend.otp;

import com.sporehub.backend.common.crypto.Sha256;
import com.sporehub.backend.common.web.DeliveryFailedException;
import com.sporehub.backend.common.web.InvalidRequestException;
import com.sporehub.backend.delivery.mail.MailDelivery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues, re-delivers and verifies one-time codes.
 * - one active record per (email, purpose); a new issue supersedes the old code
 * - the record is stored before delivery and survives a failed delivery
 * - VALID and EXPIRED both remove the record
 */
@Slf4j
@Service
public class OtpService {

    private final OtpStore store;
    private final OtpCodeGenerator codes;
    private final OtpTemplateRenderer templates;
    private final MailDelivery mail;
    private final OtpProperties props;
    private final Executor deliveryExecutor;
    private final Clock clock;

    public OtpService(OtpStore store,
                      OtpCodeGenerator codes,
                      OtpTemplateRenderer templates,
                      MailDelivery mail,
                      OtpProperties props,
                      @Qualifier("otpDeliveryExecutor") Executor deliveryExecutor,
                      Clock clock) {
        this.store = store;
        this.codes = codes;
        this.templates = templates;
        this.mail = mail;
        this.props = props;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
    }

    public OtpIssueResult issue(String email, OtpPurpose purpose) {
        String normalized = normalizeEmail(email);
        requirePurpose(purpose);

        String code = codes.next();
        OtpRecord record = store(normalized, purpose, code);
        OtpMessage msg = templates.renderDefault(purpose, code, props.expiryFor(purpose));
        return deliverIssued(code, record, msg);
    }

    public OtpIssueResult issueWithTemplate(String email, OtpPurpose purpose, String subject,
                                            String htmlTemplate, String textTemplate) {
        String normalized = normalizeEmail(email);
        requirePurpose(purpose);

        String code = codes.next();
        // render first: a bad template must not replace a working code
        OtpMessage msg = templates.renderCustom(purpose, code, subject, htmlTemplate, textTemplate);
        OtpRecord record = store(normalized, purpose, code);
        return deliverIssued(code, record, msg);
    }

    /**
     * Re-delivers {@code code} if it is the active, unexpired code for the pair. Expiry is not extended.
     *
     * @throws NoActiveRecordException  when there is no such record
     * @throws DeliveryFailedException  when transport fails (the record is kept)
     */
    public void resend(String email, OtpPurpose purpose, String code) {
        String normalized = normalizeEmail(email);
        requirePurpose(purpose);
        Instant now = clock.instant();

        OtpRecord active = store.inspect(normalized, purpose, current -> {
            if (current == null) return OtpStore.Inspection.keep(null);
            if (current.isExpired(now)) return OtpStore.Inspection.remove(null);
            return OtpStore.Inspection.keep(current.matches(code) ? current : null);
        });
        if (active == null) throw new NoActiveRecordException(purpose);

        Duration remaining = Duration.between(now, active.expiresAt());
        OtpMessage msg = templates.renderDefault(purpose, code.trim(), remaining);
        DeliveryOutcome outcome = deliver(normalized, msg);
        if (!outcome.status().ok()) {
            throw new DeliveryFailedException("email", "Code could not be delivered: " + outcome.error());
        }
        log.info("otp resent email={} purpose={}", normalized, purpose.wire());
    }

    public OtpVerificationResult verify(String email, OtpPurpose purpose, String presentedCode) {
        String normalized = normalizeEmail(email);
        requirePurpose(purpose);
        Instant now = clock.instant();

        OtpVerificationResult result = store.inspect(normalized, purpose, current -> {
            if (current == null) return OtpStore.Inspection.keep(OtpVerificationResult.NOT_FOUND);
            if (current.isExpired(now)) return OtpStore.Inspection.remove(OtpVerificationResult.EXPIRED);
            if (current.matches(presentedCode)) return OtpStore.Inspection.remove(OtpVerificationResult.VALID);
            return OtpStore.Inspection.keep(OtpVerificationResult.INVALID);
        });

        if (result == OtpVerificationResult.VALID) {
            log.info("otp verified email={} purpose={}", normalized, purpose.wire());
        } else {
            log.warn("otp verification failed email={} purpose={} result={}", normalized, purpose.wire(), result);
        }
        return result;
    }

    @Scheduled(fixedDelayString = "${app.otp.sweep-interval:PT1M}")
    public void sweepExpired() {
        int n = store.removeExpired(clock.instant());
        if (n > 0) log.debug("removed expired otp records: count={}", n);
    }

    // ===== helpers =====

    private OtpRecord store(String email, OtpPurpose purpose, String code) {
        Instant now = clock.instant();
        OtpRecord record = new OtpRecord(email, purpose, Sha256.hex(code), now, now.plus(props.expiryFor(purpose)));
        boolean superseded = store.put(record).isPresent();
        log.info("otp issued email={} purpose={} expiresAt={} superseded={}",
                email, purpose.wire(), record.expiresAt(), superseded);
        return record;
    }

    private OtpIssueResult deliverIssued(String code, OtpRecord record, OtpMessage msg) {
        DeliveryOutcome outcome = deliver(record.email(), msg);
        return new OtpIssueResult(code, record, outcome.status(), outcome.error());
    }

    private record DeliveryOutcome(DeliveryStatus status, String error) {}

    private DeliveryOutcome deliver(String email, OtpMessage msg) {
        CompletableFuture<Void> f;
        try {
            f = CompletableFuture.runAsync(
                    () -> mail.deliver(email, msg.subject(), msg.htmlBody(), msg.textBody()),
                    deliveryExecutor
            );
        } catch (RejectedExecutionException e) {
            log.warn("otp delivery rejected email={}: executor saturated", email);
            return new DeliveryOutcome(DeliveryStatus.FAILED, "delivery queue is full");
        }

        try {
            f.get(props.getDeliveryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return new DeliveryOutcome(DeliveryStatus.DELIVERED, null);
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("otp delivery timed out email={} after={}", email, props.getDeliveryTimeout());
            return new DeliveryOutcome(DeliveryStatus.TIMED_OUT, "delivery timed out");
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            log.warn("otp delivery failed email={} cause={}", email, cause.getMessage());
            return new DeliveryOutcome(DeliveryStatus.FAILED, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return new DeliveryOutcome(DeliveryStatus.FAILED, "interrupted");
        }
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) throw new InvalidRequestException("email is required");
        String e = email.trim().toLowerCase(Locale.ROOT);
        int at = e.indexOf('@');
        if (at <= 0 || at != e.lastIndexOf('@') || at == e.length() - 1) {
            throw new InvalidRequestException("email is invalid");
        }
        return e;
    }

    private static void requirePurpose(OtpPurpose purpose) {
        if (purpose == null) throw new InvalidRequestException("purpose is required");
    }
}
