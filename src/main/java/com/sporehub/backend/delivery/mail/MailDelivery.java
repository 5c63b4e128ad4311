package com.sporehub.backend.delivery.mail;

import com.sporehub.backend.common.web.DeliveryFailedException;

/**
 * Outbound email transport.
 */
public interface MailDelivery {

    /**
     * @throws DeliveryFailedException when the message could not be handed to the transport
     */
    void deliver(String recipient, String subject, String htmlBody, String textBody);
}
