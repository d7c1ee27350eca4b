package com.recipenest.notification.api.service;

import com.recipenest.notification.api.config.DeliveryProperties;
import com.recipenest.notification.api.dto.BatchCreateNotificationCommand;
import com.recipenest.notification.api.dto.CreateNotificationCommand;
import com.recipenest.notification.api.dto.CreatedNotification;
import com.recipenest.notification.api.dto.RetryBatchResult;
import com.recipenest.notification.api.dto.RetryStatusSummary;
import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.api.entity.Notification;
import com.recipenest.notification.api.enums.NotificationCategory;
import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.api.repository.NotificationRepository;
import com.recipenest.notification.api.service.directory.RecipientDirectory;
import com.recipenest.notification.api.service.queue.DeliveryQueue;
import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static com.recipenest.notification.api.DeliveryFixtures.WELCOME_PAYLOAD;
import static com.recipenest.notification.api.DeliveryFixtures.emailStatus;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryOrchestratorTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private DeliveryStatusRepository deliveryStatusRepository;

    @Mock
    private DeliveryQueue deliveryQueue;

    @Mock
    private RecipientDirectory recipientDirectory;

    private SimpleMeterRegistry meterRegistry;
    private DeliveryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        NotificationMetricsService metricsService = new NotificationMetricsService(meterRegistry);
        metricsService.init();
        orchestrator = new DeliveryOrchestrator(
            notificationRepository,
            deliveryStatusRepository,
            deliveryQueue,
            recipientDirectory,
            new DeliveryProperties(),
            metricsService
        );
    }

    private void givenSavesAssignIds() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> {
            Notification notification = invocation.getArgument(0);
            ReflectionTestUtils.setField(notification, "id", UUID.randomUUID());
            return notification;
        });
        when(deliveryStatusRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("Create writes one row per channel; in-app is sent immediately, email waits")
    void testCreate_WithoutAutoDispatch_WritesRowsAndPublishesNothing() {
        givenSavesAssignIds();
        UUID recipientId = UUID.randomUUID();

        CreatedNotification created = orchestrator.create(new CreateNotificationCommand(
            recipientId, NotificationCategory.WELCOME, WELCOME_PAYLOAD, "ada@example.com", false));

        Notification notification = created.notification();
        assertEquals("Welcome to RecipeNest!", notification.getSubject());
        assertEquals("Welcome to RecipeNest, Ada", notification.getBody());
        assertEquals(recipientId, notification.getRecipientId());

        Map<NotificationChannel, DeliveryState> states = new EnumMap<>(NotificationChannel.class);
        created.statuses().forEach(status -> states.put(status.getChannel(), status.getStatus()));
        assertEquals(DeliveryState.PENDING, states.get(NotificationChannel.EMAIL));
        assertEquals(DeliveryState.SENT, states.get(NotificationChannel.IN_APP));
        created.statuses().forEach(status -> assertEquals(0, status.getRetryCount()));
        verifyNoInteractions(deliveryQueue);
    }

    @Test
    void testCreate_WhenPayloadMissingKey_ThrowsBadRequestAndWritesNothing() {
        BadRequestException e = assertThrows(BadRequestException.class, () -> orchestrator.create(
            new CreateNotificationCommand(UUID.randomUUID(), NotificationCategory.RECIPE_LIKED,
                Map.of("actor_name", "Bob"), "ada@example.com", true)));

        assertTrue(e.getMessage().contains("recipe_title"));
        verifyNoInteractions(notificationRepository, deliveryStatusRepository, deliveryQueue);
    }

    @Test
    void testCreate_WhenContactMissing_LooksUpRecipientDirectory() {
        givenSavesAssignIds();
        UUID recipientId = UUID.randomUUID();
        when(recipientDirectory.lookupContactAddress(recipientId)).thenReturn("cook@example.com");

        CreatedNotification created = orchestrator.create(new CreateNotificationCommand(
            recipientId, NotificationCategory.WELCOME, WELCOME_PAYLOAD, null, false));

        assertEquals("cook@example.com", created.notification().getContactAddress());
    }

    @Test
    void testCreate_WhenNoContactAndNoRecipient_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> orchestrator.create(new CreateNotificationCommand(
            null, NotificationCategory.WELCOME, WELCOME_PAYLOAD, " ", false)));
        verifyNoInteractions(recipientDirectory, notificationRepository);
    }

    @Test
    void testCreate_WhenContactInvalid_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> orchestrator.create(new CreateNotificationCommand(
            UUID.randomUUID(), NotificationCategory.WELCOME, WELCOME_PAYLOAD, "not-an-email", false)));
    }

    @Test
    void testCreate_WhenDirectoryUnavailable_PropagatesAndWritesNothing() {
        UUID recipientId = UUID.randomUUID();
        when(recipientDirectory.lookupContactAddress(recipientId))
            .thenThrow(new ServiceUnavailableException("Recipient directory unavailable"));

        assertThrows(ServiceUnavailableException.class, () -> orchestrator.create(new CreateNotificationCommand(
            recipientId, NotificationCategory.WELCOME, WELCOME_PAYLOAD, null, true)));
        verifyNoInteractions(notificationRepository);
    }

    @Test
    @DisplayName("Queueing a FAILED row publishes one job numbered after the failed attempts")
    void testQueueForDelivery_WhenFailedRowWins_PublishesOneJob() {
        UUID notificationId = UUID.randomUUID();
        when(deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, NotificationChannel.EMAIL))
            .thenReturn(Optional.of(emailStatus(notificationId, DeliveryState.FAILED, 1)));
        when(deliveryStatusRepository.transitionToQueued(eq(notificationId), eq(NotificationChannel.EMAIL),
            anyCollection(), any())).thenReturn(1);
        when(deliveryQueue.enqueue(any())).thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(orchestrator.queueForDelivery(notificationId, NotificationChannel.EMAIL));

        verify(deliveryQueue).enqueue(new DeliveryJob(notificationId, NotificationChannel.EMAIL, 2));
    }

    @Test
    void testQueueForDelivery_WhenAlreadySent_IsNoOp() {
        UUID notificationId = UUID.randomUUID();
        when(deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, NotificationChannel.EMAIL))
            .thenReturn(Optional.of(emailStatus(notificationId, DeliveryState.SENT, 0)));

        assertFalse(orchestrator.queueForDelivery(notificationId, NotificationChannel.EMAIL));

        verify(deliveryStatusRepository, never()).transitionToQueued(any(), any(), anyCollection(), any());
        verifyNoInteractions(deliveryQueue);
    }

    @Test
    @DisplayName("Losing the conditional update means another caller already queued the row")
    void testQueueForDelivery_WhenConcurrentCallerWon_DoesNotPublish() {
        UUID notificationId = UUID.randomUUID();
        when(deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, NotificationChannel.EMAIL))
            .thenReturn(Optional.of(emailStatus(notificationId, DeliveryState.PENDING, 0)));
        when(deliveryStatusRepository.transitionToQueued(any(), any(), anyCollection(), any())).thenReturn(0);

        assertFalse(orchestrator.queueForDelivery(notificationId, NotificationChannel.EMAIL));

        verifyNoInteractions(deliveryQueue);
    }

    @Test
    void testQueueForDelivery_WhenRowMissing_ThrowsNotFound() {
        UUID notificationId = UUID.randomUUID();
        when(deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, NotificationChannel.EMAIL))
            .thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
            () -> orchestrator.queueForDelivery(notificationId, NotificationChannel.EMAIL));
    }

    @Test
    @DisplayName("A failed publish moves the row back to FAILED")
    void testQueueForDelivery_WhenPublishFails_RevertsToFailed() {
        UUID notificationId = UUID.randomUUID();
        when(deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, NotificationChannel.EMAIL))
            .thenReturn(Optional.of(emailStatus(notificationId, DeliveryState.PENDING, 0)));
        when(deliveryStatusRepository.transitionToQueued(any(), any(), anyCollection(), any())).thenReturn(1);
        when(deliveryQueue.enqueue(any()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(deliveryStatusRepository.revertQueuedToFailed(any(), any(), any(), any())).thenReturn(1);

        assertTrue(orchestrator.queueForDelivery(notificationId, NotificationChannel.EMAIL));

        verify(deliveryStatusRepository).revertQueuedToFailed(
            eq(notificationId), eq(NotificationChannel.EMAIL), eq("Queue publish failed: broker down"), any());
    }

    @Test
    @DisplayName("Batch retry of 100 eligible rows with a limit of 50 queues 50 and reports 50 remaining")
    void testRetryFailed_WhenMoreEligibleThanBatch_QueuesBatchOnly() {
        List<DeliveryStatus> candidates = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            candidates.add(emailStatus(UUID.randomUUID(), DeliveryState.FAILED, 1));
        }
        when(deliveryStatusRepository.countRetryable()).thenReturn(100L);
        when(deliveryStatusRepository.findRetryCandidates(any(Pageable.class))).thenReturn(candidates);
        when(deliveryStatusRepository.findByNotificationIdAndChannel(any(), eq(NotificationChannel.EMAIL)))
            .thenAnswer(invocation -> Optional.of(
                emailStatus(invocation.getArgument(0), DeliveryState.FAILED, 1)));
        when(deliveryStatusRepository.transitionToQueued(any(), any(), anyCollection(), any())).thenReturn(1);
        when(deliveryQueue.enqueue(any())).thenReturn(CompletableFuture.completedFuture(null));

        RetryBatchResult result = orchestrator.retryFailed(50);

        assertEquals(50, result.queuedCount());
        assertEquals(50, result.remainingEligible());
        assertEquals(100, result.totalEligible());
        verify(deliveryQueue, times(50)).enqueue(any());
    }

    @Test
    void testRetryFailed_WhenBatchNotPositive_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> orchestrator.retryFailed(0));
    }

    @Test
    void testRetryStatus_WhenRowsQueued_IsNotSafeToRetry() {
        when(deliveryStatusRepository.countRetryable()).thenReturn(4L);
        when(deliveryStatusRepository.countExhausted()).thenReturn(2L);
        when(deliveryStatusRepository.countByStatus(DeliveryState.QUEUED)).thenReturn(1L);

        RetryStatusSummary summary = orchestrator.retryStatus();

        assertEquals(4, summary.failedRetryable());
        assertEquals(2, summary.failedExhausted());
        assertEquals(1, summary.currentlyQueued());
        assertFalse(summary.safeToRetry());
    }

    @Test
    void testDispatchPending_QueuesPendingRows() {
        UUID notificationId = UUID.randomUUID();
        DeliveryStatus pending = emailStatus(notificationId, DeliveryState.PENDING, 0);
        when(deliveryStatusRepository.findByStatusOldestFirst(eq(DeliveryState.PENDING), any(Pageable.class)))
            .thenReturn(List.of(pending));
        when(deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, NotificationChannel.EMAIL))
            .thenReturn(Optional.of(pending));
        when(deliveryStatusRepository.transitionToQueued(any(), any(), anyCollection(), any())).thenReturn(1);
        when(deliveryQueue.enqueue(any())).thenReturn(CompletableFuture.completedFuture(null));

        assertEquals(1, orchestrator.dispatchPending(10));
        verify(deliveryQueue).enqueue(DeliveryJob.firstAttempt(notificationId, NotificationChannel.EMAIL));
    }

    private double counter(String name, NotificationChannel channel) {
        return meterRegistry.get(name).tag("channel", channel.name()).counter().count();
    }

    @Test
    @DisplayName("Creation counters wait for the commit and stay untouched on rollback")
    void testCreate_InsideTransaction_RecordsMetricsOnlyAfterCommit() {
        givenSavesAssignIds();
        TransactionSynchronizationManager.initSynchronization();
        try {
            orchestrator.create(new CreateNotificationCommand(
                UUID.randomUUID(), NotificationCategory.WELCOME, WELCOME_PAYLOAD, "ada@example.com", false));

            assertEquals(0.0, counter("notification.deliveries.created", NotificationChannel.EMAIL));
            assertEquals(0.0, counter("notification.deliveries.sent", NotificationChannel.IN_APP));

            List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
            synchronizations.forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
            assertEquals(0.0, counter("notification.deliveries.created", NotificationChannel.EMAIL));

            synchronizations.forEach(TransactionSynchronization::afterCommit);
            assertEquals(1.0, counter("notification.deliveries.created", NotificationChannel.EMAIL));
            assertEquals(1.0, counter("notification.deliveries.created", NotificationChannel.IN_APP));
            assertEquals(1.0, counter("notification.deliveries.sent", NotificationChannel.IN_APP));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testCreateBatch_CreatesOnePerDistinctRecipientUsingDirectory() {
        givenSavesAssignIds();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(recipientDirectory.lookupContactAddress(first)).thenReturn("first@example.com");
        when(recipientDirectory.lookupContactAddress(second)).thenReturn("second@example.com");

        List<CreatedNotification> created = orchestrator.createBatch(new BatchCreateNotificationCommand(
            List.of(first, second, first), NotificationCategory.WELCOME, WELCOME_PAYLOAD, false));

        assertEquals(2, created.size());
        assertEquals(first, created.get(0).notification().getRecipientId());
        assertEquals("first@example.com", created.get(0).notification().getContactAddress());
        assertEquals(second, created.get(1).notification().getRecipientId());
        assertEquals("second@example.com", created.get(1).notification().getContactAddress());
        verifyNoInteractions(deliveryQueue);
    }

    @Test
    void testCreateBatch_WhenNoRecipients_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> orchestrator.createBatch(new BatchCreateNotificationCommand(
            List.of(), NotificationCategory.WELCOME, WELCOME_PAYLOAD, true)));

        verifyNoInteractions(notificationRepository, recipientDirectory);
    }

    @Test
    void testCreateBatch_WhenPayloadIncomplete_ThrowsBeforeAnyLookup() {
        assertThrows(BadRequestException.class, () -> orchestrator.createBatch(new BatchCreateNotificationCommand(
            List.of(UUID.randomUUID()), NotificationCategory.RECIPE_LIKED, Map.of("actor_name", "Bob"), true)));

        verifyNoInteractions(notificationRepository, recipientDirectory);
    }
}
