package com.sporehub.backend.delivery.whatsapp;

import com.sporehub.backend.common.web.DeliveryFailedException;

/**
 * Outbound chat-platform transport.
 */
public interface ChatMessenger {

    /**
     * @param recipient phone number in international format
     * @throws DeliveryFailedException when the platform rejects or cannot be reached
     */
    void sendMessage(String recipient, String body);
}
