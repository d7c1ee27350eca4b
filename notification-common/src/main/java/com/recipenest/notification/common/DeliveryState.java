package com.recipenest.notification.common;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-channel delivery state.
 *
 * <ul>
 *   <li>PENDING - created, not yet handed to the queue</li>
 *   <li>QUEUED - a delivery job is in flight (including while waiting for a delayed retry)</li>
 *   <li>SENT - transport accepted the message (terminal)</li>
 *   <li>FAILED - last attempt failed; retryable until retry_count reaches max_retries</li>
 *   <li>ABORTED - archived by an operator or stopped by a configuration error (terminal)</li>
 * </ul>
 */
public enum DeliveryState {
    PENDING,
    QUEUED,
    SENT,
    FAILED,
    ABORTED;

    private static final Set<DeliveryState> TERMINAL = EnumSet.of(SENT, ABORTED);
    private static final Set<DeliveryState> QUEUEABLE = EnumSet.of(PENDING, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isQueueable() {
        return QUEUEABLE.contains(this);
    }

    public static Set<DeliveryState> queueableStates() {
        return EnumSet.copyOf(QUEUEABLE);
    }
}
