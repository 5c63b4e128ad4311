package com.sporehub.backend.delivery.whatsapp;

import com.sporehub.backend.common.web.DeliveryFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Sends plain text messages through the WhatsApp Cloud API ({@code POST /{phoneNumberId}/messages}).
 */
@Slf4j
@Component
public class WhatsAppCloudMessenger implements ChatMessenger {

    static final String CHANNEL = "whatsapp";
    private static final int MAX_ERROR_SNIPPET_BYTES = 512;

    private final RestClient http;
    private final WhatsAppProperties props;

    public WhatsAppCloudMessenger(@Qualifier("whatsAppRestClient") RestClient http, WhatsAppProperties props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public void sendMessage(String recipient, String body) {
        if (!props.isEnabled() || props.getPhoneNumberId() == null || props.getPhoneNumberId().isBlank()) {
            throw new DeliveryFailedException(CHANNEL, "WhatsApp delivery is not configured");
        }
        String to = normalizePhone(recipient);
        if (to.isEmpty()) throw new DeliveryFailedException(CHANNEL, "Recipient is required");
        if (body == null || body.isBlank()) throw new DeliveryFailedException(CHANNEL, "Message body is required");

        Map<String, Object> payload = Map.of(
                "messaging_product", "whatsapp",
                "recipient_type", "individual",
                "to", to,
                "type", "text",
                "text", Map.of("preview_url", false, "body", body)
        );

        try {
            http.post()
                    .uri("/{phoneNumberId}/messages", props.getPhoneNumberId())
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        String snippet = readBodySnippetQuietly(res);
                        log.warn("whatsapp send rejected status={} body={}", status, snippet);
                        throw new DeliveryFailedException(CHANNEL, "WhatsApp API returned " + status);
                    })
                    .toBodilessEntity();
            log.info("whatsapp message sent to={}", mask(to));
        } catch (RestClientException e) {
            log.warn("whatsapp send failed to={} cause={}", mask(to), e.getMessage());
            throw new DeliveryFailedException(CHANNEL, "Failed to reach WhatsApp API", e);
        }
    }

    /** Digits only, leading {@code +} dropped: the Cloud API expects e.g. 254712345678. */
    static String normalizePhone(String raw) {
        if (raw == null) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    private static String mask(String phone) {
        if (phone.length() <= 4) return "****";
        return "****" + phone.substring(phone.length() - 4);
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(MAX_ERROR_SNIPPET_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }
}
