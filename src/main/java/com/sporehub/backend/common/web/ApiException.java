package com.sporehub.backend.common.web;

/**
 * Typed outcome thrown by the admission, token and OTP layers.
 * Only {@link ApiExceptionHandler} and {@link ErrorResponseWriter} turn it into a response.
 */
public class ApiException extends RuntimeException {

    private final ErrorKind kind;

    public ApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
