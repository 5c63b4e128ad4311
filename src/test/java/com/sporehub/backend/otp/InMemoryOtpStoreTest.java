package com.sporehub.backend.otp;

import com.sporehub.backend.common.crypto.Sha256;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryOtpStoreTest {

    private static final Instant T0 = Instant.parse("2026-05-10T12:00:00Z");

    private static OtpRecord record(String email, OtpPurpose purpose, String code, Instant expiresAt) {
        return new OtpRecord(email, purpose, Sha256.hex(code), T0, expiresAt);
    }

    @Test
    void put_returns_superseded_record() {
        InMemoryOtpStore store = new InMemoryOtpStore();
        OtpRecord first = record("a@b.com", OtpPurpose.LOGIN, "111111", T0.plusSeconds(300));

        assertThat(store.put(first)).isEmpty();
        assertThat(store.put(record("a@b.com", OtpPurpose.LOGIN, "222222", T0.plusSeconds(300)))).contains(first);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void removeExpired_keeps_live_records() {
        InMemoryOtpStore store = new InMemoryOtpStore();
        store.put(record("a@b.com", OtpPurpose.LOGIN, "1", T0.plusSeconds(60)));
        store.put(record("a@b.com", OtpPurpose.REGISTRATION, "2", T0.plusSeconds(1800)));

        assertThat(store.removeExpired(T0.plusSeconds(61))).isEqualTo(1);
        assertThat(store.find("a@b.com", OtpPurpose.REGISTRATION)).isPresent();
    }

    @Test
    void concurrent_consumers_see_one_success() throws Exception {
        InMemoryOtpStore store = new InMemoryOtpStore();
        store.put(record("a@b.com", OtpPurpose.LOGIN, "482913", T0.plusSeconds(300)));

        Callable<Boolean> consume = () -> store.inspect("a@b.com", OtpPurpose.LOGIN, r ->
                (r != null && r.matches("482913"))
                        ? OtpStore.Inspection.remove(true)
                        : OtpStore.Inspection.keep(false));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) results.add(pool.submit(consume));

            int successes = 0;
            for (Future<Boolean> f : results) if (f.get()) successes++;
            assertThat(successes).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
