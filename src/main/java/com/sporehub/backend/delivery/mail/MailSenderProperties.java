package com.sporehub.backend.delivery.mail;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * app.mail.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.mail")
public class MailSenderProperties {

    /** Sending switch; off means every delivery fails fast with DELIVERY_FAILED. */
    private boolean enabled = true;

    /** From address. */
    private String sender = "no-reply@sporehub.app";

    private String senderName = "Smart Spore Hub";
}
