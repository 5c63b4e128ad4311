package com.sporehub.backend.common.web;

public class InvalidRequestException extends ApiException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
