package com.sporehub.backend.otp;

public enum OtpVerificationResult {
    /** Code matched before expiry; the record is consumed. */
    VALID,
    /** The record's expiry has passed, whatever code was presented. */
    EXPIRED,
    /** Unexpired record, different code. */
    INVALID,
    /** No active record for the pair. */
    NOT_FOUND
}
