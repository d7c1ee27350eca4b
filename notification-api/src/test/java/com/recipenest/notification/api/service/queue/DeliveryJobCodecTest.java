package com.recipenest.notification.api.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryJobCodecTest {

    private final DeliveryJobCodec codec = new DeliveryJobCodec(new ObjectMapper());

    @Test
    void testEncode_CarriesReferencesOnly() {
        UUID notificationId = UUID.fromString("7d0f1c3e-8d4b-4c55-9a3e-2f5b8e1a0c11");

        String json = codec.encode(new DeliveryJob(notificationId, NotificationChannel.EMAIL, 2));

        assertTrue(json.contains("\"notificationId\":\"7d0f1c3e-8d4b-4c55-9a3e-2f5b8e1a0c11\""));
        assertTrue(json.contains("\"channel\":\"EMAIL\""));
        assertTrue(json.contains("\"attempt\":2"));
        assertFalse(json.contains("messageKey"));
    }

    @Test
    void testDecode_WhenGarbage_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode("not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"channel\":\"EMAIL\",\"attempt\":1}"));
    }
}
