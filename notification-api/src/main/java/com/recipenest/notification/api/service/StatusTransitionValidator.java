package com.recipenest.notification.api.service;

import com.recipenest.notification.common.DeliveryState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates delivery state transitions.
 *
 * Pure enum-map lookup: no configuration, no database access, no clock.
 *
 * Valid transitions:
 * - PENDING → QUEUED (dispatch), SENT (channel without transport)
 * - QUEUED → SENT, FAILED (exhausted or publish failure), ABORTED (configuration error)
 * - FAILED → QUEUED (retry), ABORTED (operator archive)
 * - SENT, ABORTED → (terminal)
 */
@Component
@Slf4j
public class StatusTransitionValidator {

    private static final Map<DeliveryState, Set<DeliveryState>> VALID_TRANSITIONS = new EnumMap<>(DeliveryState.class);

    static {
        VALID_TRANSITIONS.put(DeliveryState.PENDING, EnumSet.of(DeliveryState.QUEUED, DeliveryState.SENT));
        VALID_TRANSITIONS.put(DeliveryState.QUEUED,
            EnumSet.of(DeliveryState.SENT, DeliveryState.FAILED, DeliveryState.ABORTED));
        VALID_TRANSITIONS.put(DeliveryState.FAILED, EnumSet.of(DeliveryState.QUEUED, DeliveryState.ABORTED));
        VALID_TRANSITIONS.put(DeliveryState.SENT, EnumSet.noneOf(DeliveryState.class));
        VALID_TRANSITIONS.put(DeliveryState.ABORTED, EnumSet.noneOf(DeliveryState.class));
    }

    public boolean isValidTransition(DeliveryState fromStatus, DeliveryState toStatus) {
        if (fromStatus == toStatus) {
            return true;
        }
        if (fromStatus.isTerminal()) {
            log.warn("Invalid status transition attempted: {} → {} ({} is a terminal state)",
                fromStatus, toStatus, fromStatus);
            return false;
        }
        if (!VALID_TRANSITIONS.get(fromStatus).contains(toStatus)) {
            log.warn("Invalid status transition attempted: {} → {} (not in allowed transitions)",
                fromStatus, toStatus);
            return false;
        }
        return true;
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void assertValidTransition(DeliveryState fromStatus, DeliveryState toStatus) {
        if (!isValidTransition(fromStatus, toStatus)) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", fromStatus, toStatus)
            );
        }
    }
}
