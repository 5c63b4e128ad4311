package com.sporehub.backend.otp;

public enum DeliveryStatus {
    DELIVERED,
    FAILED,
    TIMED_OUT;

    public boolean ok() {
        return this == DELIVERED;
    }
}
