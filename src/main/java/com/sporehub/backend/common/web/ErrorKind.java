package com.sporehub.backend.common.web;

import org.springframework.http.HttpStatus;

/**
 * Every failure this service reports to a client, with the single HTTP status it maps to.
 */
public enum ErrorKind {

    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    DELIVERY_FAILED(HttpStatus.BAD_GATEWAY),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
