package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.provider.ProviderName;

/**
 * Sends one delivery attempt over a channel.
 */
public interface DeliveryTransport {

    NotificationChannel channel();

    ProviderName providerName();

    /**
     * @throws TransportConfigurationException if the transport cannot work until an operator fixes it
     * @throws TransportException for any other failed attempt
     */
    void send(DeliveryRequest request);
}
