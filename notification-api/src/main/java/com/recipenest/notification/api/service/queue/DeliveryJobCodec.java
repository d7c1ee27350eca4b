package com.recipenest.notification.api.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recipenest.notification.common.queue.DeliveryJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of delivery jobs on the Kafka topic.
 */
@Component
@RequiredArgsConstructor
public class DeliveryJobCodec {

    private final ObjectMapper objectMapper;

    public String encode(DeliveryJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize delivery job " + job.messageKey(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is not a valid delivery job
     */
    public DeliveryJob decode(String payload) {
        try {
            return objectMapper.readValue(payload, DeliveryJob.class);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new IllegalArgumentException("Malformed delivery job: " + e.getMessage(), e);
        }
    }
}
