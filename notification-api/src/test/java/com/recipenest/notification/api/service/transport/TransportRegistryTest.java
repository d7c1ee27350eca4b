package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.NotificationChannel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TransportRegistryTest {

    private DeliveryTransport transportFor(NotificationChannel channel) {
        DeliveryTransport transport = mock(DeliveryTransport.class);
        when(transport.channel()).thenReturn(channel);
        return transport;
    }

    @Test
    void testForChannel_ReturnsRegisteredTransport() {
        DeliveryTransport email = transportFor(NotificationChannel.EMAIL);
        DeliveryTransport inApp = new InAppTransport();

        TransportRegistry registry = new TransportRegistry(List.of(email, inApp));

        assertSame(email, registry.forChannel(NotificationChannel.EMAIL));
        assertSame(inApp, registry.forChannel(NotificationChannel.IN_APP));
    }

    @Test
    void testConstructor_WhenChannelMissing_FailsFast() {
        assertThrows(IllegalStateException.class,
            () -> new TransportRegistry(List.of(transportFor(NotificationChannel.EMAIL))));
    }

    @Test
    void testConstructor_WhenChannelDuplicated_FailsFast() {
        assertThrows(IllegalStateException.class, () -> new TransportRegistry(List.of(
            transportFor(NotificationChannel.EMAIL),
            transportFor(NotificationChannel.EMAIL),
            new InAppTransport())));
    }
}
