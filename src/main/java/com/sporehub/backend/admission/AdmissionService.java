package com.sporehub.backend.admission;

import com.sporehub.backend.common.web.RateLimitedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies the configured per-client limit on top of an {@link AdmissionTracker}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService {

    private final AdmissionTracker tracker;
    private final AdmissionProperties props;
    private final Clock clock;

    public boolean admit(String clientKey) {
        if (!props.isEnabled()) return true;
        return tracker.admit(clientKey, props.getRequestsPerMinute(), clock.instant()).allowed();
    }

    public void checkOrThrow(String clientKey) {
        if (!props.isEnabled()) return;
        AdmissionDecision d = tracker.admit(clientKey, props.getRequestsPerMinute(), clock.instant());
        if (!d.allowed()) {
            log.debug("admission rejected clientKey={} retryAfterSec={}", clientKey, d.retryAfterSec());
            throw new RateLimitedException("Rate limit exceeded. Please try again later.", d.retryAfterSec());
        }
    }

    @Scheduled(fixedDelayString = "${app.admission.sweep-interval:PT1M}")
    public void sweepIdleBuckets() {
        Instant idleBefore = clock.instant().minus(props.getIdleTtl());
        int n = tracker.evictIdle(idleBefore);
        if (n > 0) {
            log.debug("evicted idle admission buckets: count={} remaining={}", n, tracker.size());
        }
    }
}
