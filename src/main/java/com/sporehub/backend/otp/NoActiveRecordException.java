package com.sporehub.backend.otp;

import com.sporehub.backend.common.web.ErrorKind;
import com.sporehub.backend.common.web.ApiException;

public class NoActiveRecordException extends ApiException {

    public NoActiveRecordException(OtpPurpose purpose) {
        super(ErrorKind.NOT_FOUND, "No active " + purpose.wire() + " code for this email");
    }
}
