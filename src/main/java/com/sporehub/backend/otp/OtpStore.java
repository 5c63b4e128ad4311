package com.sporehub.backend.otp;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Holds at most one active {@link OtpRecord} per (email, purpose).
 * All operations on the same pair are linearised.
 */
public interface OtpStore {

    /**
     * Stores {@code record}, replacing any record for the same pair.
     *
     * @return the superseded record, if there was one
     */
    Optional<OtpRecord> put(OtpRecord record);

    Optional<OtpRecord> find(String email, OtpPurpose purpose);

    /**
     * Runs {@code decision} against the current record (null when absent) while holding the pair,
     * then removes the record if the decision asks for it.
     */
    <T> T inspect(String email, OtpPurpose purpose, Function<OtpRecord, Inspection<T>> decision);

    /** @return number of records removed */
    int removeExpired(Instant now);

    int size();

    record Inspection<T>(T result, boolean remove) {

        public static <T> Inspection<T> keep(T result) {
            return new Inspection<>(result, false);
        }

        public static <T> Inspection<T> remove(T result) {
            return new Inspection<>(result, true);
        }
    }
}
