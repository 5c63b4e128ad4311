package com.sporehub.backend.common.web;

public class ForbiddenException extends ApiException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
