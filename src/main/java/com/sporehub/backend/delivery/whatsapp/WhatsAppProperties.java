package com.sporehub.backend.delivery.whatsapp;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * app.whatsapp.* (WhatsApp Cloud API)
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.whatsapp")
public class WhatsAppProperties {

    private boolean enabled = false;

    private String baseUrl = "https://graph.facebook.com/v21.0";

    /** Sender phone number id assigned by the platform. */
    private String phoneNumberId;

    private String accessToken;

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(10);
}
