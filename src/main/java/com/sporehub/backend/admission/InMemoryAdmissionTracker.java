package com.sporehub.backend.admission;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fixed-window limiter.
 * - one bucket per client key, created on first request
 * - the window resets once more than {@code window} has passed since it started
 * - read-modify-write of a bucket is serialised on the bucket itself
 * State is lost on restart and not shared between instances.
 */
@Component
public class InMemoryAdmissionTracker implements AdmissionTracker {

    private final ConcurrentHashMap<String, ClientBucket> buckets = new ConcurrentHashMap<>();
    private final Duration window;

    public InMemoryAdmissionTracker(AdmissionProperties props) {
        Duration window = props.getWindow();
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("admission window must be positive");
        }
        this.window = window;
    }

    @Override
    public AdmissionDecision admit(String clientKey, int limit, Instant now) {
        String key = (clientKey == null || clientKey.isBlank()) ? "unknown" : clientKey;
        int effectiveLimit = Math.max(1, limit);

        while (true) {
            ClientBucket bucket = buckets.computeIfAbsent(key, k -> new ClientBucket(now));
            AdmissionDecision decision = bucket.tryAcquire(effectiveLimit, window, now);
            // the sweeper may have unlinked this bucket between lookup and acquire
            if (buckets.get(key) == bucket) return decision;
        }
    }

    @Override
    public int evictIdle(Instant idleBefore) {
        int[] removed = {0};
        buckets.forEach((key, bucket) -> {
            if (bucket.idleSince(idleBefore) && buckets.remove(key, bucket)) {
                removed[0]++;
            }
        });
        return removed[0];
    }

    @Override
    public int size() {
        return buckets.size();
    }
}
