package com.sporehub.backend.common.web;

public class UnauthenticatedException extends ApiException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }
}
