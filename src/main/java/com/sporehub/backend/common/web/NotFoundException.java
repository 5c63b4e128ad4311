package com.sporehub.backend.common.web;

public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
