package com.sporehub.backend.common.web;

/**
 * Transport to the recipient failed. When raised after an OTP was stored, the code stays valid for a resend.
 */
public class DeliveryFailedException extends ApiException {

    private final String channel;

    public DeliveryFailedException(String channel, String message) {
        super(ErrorKind.DELIVERY_FAILED, message);
        this.channel = channel;
    }

    public DeliveryFailedException(String channel, String message, Throwable cause) {
        super(ErrorKind.DELIVERY_FAILED, message, cause);
        this.channel = channel;
    }

    public String channel() { return channel; }
}
