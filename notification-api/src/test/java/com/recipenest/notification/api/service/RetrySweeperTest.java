package com.recipenest.notification.api.service;

import com.recipenest.notification.api.config.SweeperProperties;
import com.recipenest.notification.api.dto.RetryBatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrySweeperTest {

    @Mock
    private DeliveryOrchestrator deliveryOrchestrator;

    private RetrySweeper sweeper;

    @BeforeEach
    void setUp() {
        SweeperProperties properties = new SweeperProperties();
        properties.setBatchSize(25);
        sweeper = new RetrySweeper(deliveryOrchestrator, properties);
    }

    @Test
    void testSweep_DispatchesPendingThenRetriesFailed() {
        when(deliveryOrchestrator.dispatchPending(25)).thenReturn(2);
        when(deliveryOrchestrator.retryFailed(25)).thenReturn(new RetryBatchResult(3, 0, 3));

        sweeper.sweep();

        InOrder order = inOrder(deliveryOrchestrator);
        order.verify(deliveryOrchestrator).dispatchPending(25);
        order.verify(deliveryOrchestrator).retryFailed(25);
    }

    @Test
    void testSweep_WhenDatabaseDown_DoesNotThrow() {
        when(deliveryOrchestrator.dispatchPending(25))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertDoesNotThrow(() -> sweeper.sweep());
        verify(deliveryOrchestrator, never()).retryFailed(anyInt());
    }
}
