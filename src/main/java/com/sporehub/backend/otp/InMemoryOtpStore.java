package com.sporehub.backend.otp;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Process-local store. Per-pair atomicity comes from {@link ConcurrentHashMap#compute}.
 */
@Component
public class InMemoryOtpStore implements OtpStore {

    private record Key(String email, OtpPurpose purpose) {}

    private final ConcurrentHashMap<Key, OtpRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<OtpRecord> put(OtpRecord record) {
        return Optional.ofNullable(records.put(new Key(record.email(), record.purpose()), record));
    }

    @Override
    public Optional<OtpRecord> find(String email, OtpPurpose purpose) {
        return Optional.ofNullable(records.get(new Key(email, purpose)));
    }

    @Override
    public <T> T inspect(String email, OtpPurpose purpose, Function<OtpRecord, Inspection<T>> decision) {
        AtomicReference<T> out = new AtomicReference<>();
        records.compute(new Key(email, purpose), (k, current) -> {
            Inspection<T> in = decision.apply(current);
            out.set(in.result());
            return in.remove() ? null : current;
        });
        return out.get();
    }

    @Override
    public int removeExpired(Instant now) {
        int[] removed = {0};
        records.forEach((k, r) -> {
            if (r.isExpired(now) && records.remove(k, r)) removed[0]++;
        });
        return removed[0];
    }

    @Override
    public int size() {
        return records.size();
    }
}
