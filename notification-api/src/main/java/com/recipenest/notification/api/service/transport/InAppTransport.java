package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.provider.ProviderName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-app channel. The notification row is what the inbox reads, so delivery only has to
 * confirm it exists.
 */
@Component
@Slf4j
public class InAppTransport implements DeliveryTransport {

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.IN_APP;
    }

    @Override
    public ProviderName providerName() {
        return ProviderName.INBOX;
    }

    @Override
    public void send(DeliveryRequest request) {
        log.debug("In-app notification {} available in inbox", request.notificationId());
    }
}
