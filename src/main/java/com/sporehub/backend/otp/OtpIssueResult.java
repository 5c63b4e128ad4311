package com.sporehub.backend.otp;

/**
 * Outcome of an issuance. The record is stored even when {@link #delivery()} is not
 * {@link DeliveryStatus#DELIVERED}; the caller can resend the same code.
 */
public record OtpIssueResult(
        String code,
        OtpRecord record,
        DeliveryStatus delivery,
        String deliveryError
) {
    public boolean delivered() {
        return delivery.ok();
    }
}
