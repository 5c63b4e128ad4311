package com.sporehub.backend.admission;

import java.time.Duration;
import java.time.Instant;

/**
 * Counter state for one client. All access goes through the bucket monitor.
 */
final class ClientBucket {

    private int count;
    private Instant windowStart;
    private Instant lastSeen;

    ClientBucket(Instant now) {
        this.count = 0;
        this.windowStart = now;
        this.lastSeen = now;
    }

    synchronized AdmissionDecision tryAcquire(int limit, Duration window, Instant now) {
        lastSeen = now;

        if (Duration.between(windowStart, now).compareTo(window) > 0) {
            count = 0;
            windowStart = now;
        }

        if (count >= limit) {
            long remainingMs = windowStart.plus(window).toEpochMilli() - now.toEpochMilli();
            int retryAfter = (int) Math.max(1, (remainingMs + 999) / 1000);
            return AdmissionDecision.reject(retryAfter);
        }

        count++;
        return AdmissionDecision.allow();
    }

    synchronized boolean idleSince(Instant idleBefore) {
        return lastSeen.isBefore(idleBefore);
    }

    synchronized int count() {
        return count;
    }
}
