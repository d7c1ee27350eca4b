package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Channel → transport lookup. Fails at startup if a channel has no transport or two.
 */
@Component
@Slf4j
public class TransportRegistry {

    private final Map<NotificationChannel, DeliveryTransport> transports = new EnumMap<>(NotificationChannel.class);

    public TransportRegistry(List<DeliveryTransport> available) {
        for (DeliveryTransport transport : available) {
            DeliveryTransport previous = transports.put(transport.channel(), transport);
            if (previous != null) {
                throw new IllegalStateException("Duplicate transports for channel " + transport.channel()
                    + ": " + previous.getClass().getSimpleName() + ", " + transport.getClass().getSimpleName());
            }
        }
        for (NotificationChannel channel : NotificationChannel.values()) {
            if (!transports.containsKey(channel)) {
                throw new IllegalStateException("No delivery transport registered for channel " + channel);
            }
        }
        log.info("Registered delivery transports: {}", transports.keySet());
    }

    public DeliveryTransport forChannel(NotificationChannel channel) {
        DeliveryTransport transport = transports.get(channel);
        if (transport == null) {
            throw new TransportConfigurationException("No delivery transport registered for channel " + channel);
        }
        return transport;
    }
}
