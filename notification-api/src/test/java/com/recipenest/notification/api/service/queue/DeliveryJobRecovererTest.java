package com.recipenest.notification.api.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.api.service.NotificationMetricsService;
import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.listener.ListenerExecutionFailedException;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryJobRecovererTest {

    @Mock
    private DeliveryStatusRepository deliveryStatusRepository;

    private SimpleMeterRegistry meterRegistry;
    private DeliveryJobCodec codec;
    private DeliveryJobRecoverer recoverer;

    private final DeliveryJob job = new DeliveryJob(UUID.randomUUID(), NotificationChannel.EMAIL, 2);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        NotificationMetricsService metricsService = new NotificationMetricsService(meterRegistry);
        metricsService.init();
        codec = new DeliveryJobCodec(new ObjectMapper());
        recoverer = new DeliveryJobRecoverer(codec, deliveryStatusRepository, metricsService);
    }

    private ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("notification-delivery", 0, 42L, job.messageKey(), value);
    }

    private static ListenerExecutionFailedException listenerFailure(Exception cause) {
        return new ListenerExecutionFailedException("Listener method threw exception", cause);
    }

    @Test
    void testAccept_WhenWorkerKeptFailing_MarksRowFailedForRetry() {
        when(deliveryStatusRepository.revertAttemptToFailed(
            eq(job.notificationId()), eq(NotificationChannel.EMAIL), eq(1), anyString(), any()))
            .thenReturn(1);

        recoverer.accept(record(codec.encode(job)),
            listenerFailure(new DataAccessResourceFailureException("Connection refused")));

        verify(deliveryStatusRepository).revertAttemptToFailed(
            eq(job.notificationId()), eq(NotificationChannel.EMAIL), eq(1),
            eq("Dispatch failed: Connection refused"), any());
        assertEquals(1.0, meterRegistry.get("notification.deliveries.failed").tag("channel", "EMAIL").counter().count());
    }

    @Test
    void testAccept_WhenRowMovedOn_LeavesMetricsAlone() {
        when(deliveryStatusRepository.revertAttemptToFailed(any(), any(), anyInt(), anyString(), any()))
            .thenReturn(0);

        recoverer.accept(record(codec.encode(job)), listenerFailure(new IllegalStateException("boom")));

        assertEquals(0.0, meterRegistry.get("notification.deliveries.failed").tag("channel", "EMAIL").counter().count());
    }

    @Test
    void testAccept_WhenDatabaseStillDown_Propagates() {
        when(deliveryStatusRepository.revertAttemptToFailed(any(), any(), anyInt(), anyString(), any()))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        assertThrows(DataAccessResourceFailureException.class,
            () -> recoverer.accept(record(codec.encode(job)), listenerFailure(new IllegalStateException("boom"))));
    }

    @Test
    void testAccept_WhenPayloadUndecodable_DoesNothing() {
        recoverer.accept(record("not json"), listenerFailure(new IllegalStateException("boom")));

        verifyNoInteractions(deliveryStatusRepository);
    }
}
