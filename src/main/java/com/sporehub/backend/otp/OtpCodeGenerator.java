package com.sporehub.backend.otp;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class OtpCodeGenerator {

    private static final SecureRandom SR = new SecureRandom();

    private final int length;

    public OtpCodeGenerator(OtpProperties props) {
        int length = props.getCodeLength();
        if (length < 4 || length > 10) {
            throw new IllegalStateException("app.otp.code-length must be between 4 and 10, got " + length);
        }
        this.length = length;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) sb.append((char) ('0' + SR.nextInt(10)));
        return sb.toString();
    }
}
