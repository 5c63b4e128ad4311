package com.sporehub.backend.auth.security;

import com.sporehub.backend.common.web.ErrorKind;
import com.sporehub.backend.common.web.ApiException;

/**
 * Identity was read outside an authenticated request path.
 */
public class MissingIdentityException extends ApiException {

    public MissingIdentityException(String what) {
        super(ErrorKind.UNAUTHENTICATED, what + " not available: request is not authenticated");
    }
}
