package com.eyelevel.invoiceingestion.service.notification;

/**
 * Hands a message to a mail provider.
 */
public interface NotificationSender {

    /**
     * @return the provider's message id, or {@code null} if it reports none
     * @throws com.eyelevel.invoiceingestion.exception.NotificationDeliveryException if the provider rejects the
     *                                                                               message
     */
    String send(OutboundMessage message);
}
