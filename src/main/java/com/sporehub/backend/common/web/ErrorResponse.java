package com.sporehub.backend.common.web;

/**
 * Failure envelope: {@code error} is the status reason phrase, {@code code} the numeric status.
 */
public record ErrorResponse(
        String error,
        String message,
        int code
) {
    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(kind.status().getReasonPhrase(), message, kind.status().value());
    }
}
