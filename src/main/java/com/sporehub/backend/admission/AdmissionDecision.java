package com.sporehub.backend.admission;

public record AdmissionDecision(boolean allowed, int retryAfterSec) {

    static AdmissionDecision allow() {
        return new AdmissionDecision(true, 0);
    }

    static AdmissionDecision reject(int retryAfterSec) {
        return new AdmissionDecision(false, retryAfterSec);
    }
}
