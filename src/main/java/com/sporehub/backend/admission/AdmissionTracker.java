package com.sporehub.backend.admission;

import java.time.Instant;

/**
 * Per-client fixed-window request counter.
 * Implementations must be safe for concurrent calls with the same client key.
 */
public interface AdmissionTracker {

    /**
     * Counts one request for {@code clientKey} and decides whether it may proceed.
     * A rejected request is not counted.
     */
    AdmissionDecision admit(String clientKey, int limit, Instant now);

    /**
     * Drops buckets last touched before {@code idleBefore}.
     *
     * @return number of buckets removed
     */
    int evictIdle(Instant idleBefore);

    int size();
}
