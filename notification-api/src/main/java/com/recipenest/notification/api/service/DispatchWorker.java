package com.recipenest.notification.api.service;

import com.recipenest.notification.api.service.transport.DeliveryRequest;
import com.recipenest.notification.api.service.transport.TransportException;
import com.recipenest.notification.api.service.transport.TransportRegistry;
import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import com.recipenest.notification.common.retry.FailureClassification;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Executes one delivery attempt and applies the retry state machine.
 *
 * <ul>
 *   <li>success: QUEUED → SENT</li>
 *   <li>configuration error: QUEUED → ABORTED, retry_count untouched</li>
 *   <li>other failure with budget left: retry_count + 1, row stays QUEUED, delayed job scheduled</li>
 *   <li>other failure on the last attempt: QUEUED → FAILED with "Failed after N attempts: cause"</li>
 * </ul>
 *
 * The retry count is incremented before the budget check, so with max_retries = 3 the delays
 * are 5 and 10 minutes and the third failure is final.
 *
 * The transport call runs outside any transaction; {@link DeliveryAttemptRecorder} reads the row
 * before it and records the outcome after it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchWorker {

    private final DeliveryAttemptRecorder attemptRecorder;
    private final TransportRegistry transportRegistry;
    private final NotificationMetricsService metricsService;

    /**
     * @throws NotFoundException if the notification or its delivery row no longer exists
     */
    public DispatchOutcome process(DeliveryJob job) {
        Optional<DeliveryRequest> request = attemptRecorder.prepare(job);
        if (request.isEmpty()) {
            return DispatchOutcome.SKIPPED;
        }

        NotificationChannel channel = job.channel();
        TransportException failure = null;
        Timer.Sample sample = metricsService.startTransportTimer();
        try {
            transportRegistry.forChannel(channel).send(request.get());
        } catch (TransportException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new TransportException(describe(e), FailureClassification.TRANSIENT, e);
        } finally {
            metricsService.stopTransportTimer(channel, sample);
        }
        return failure == null ? attemptRecorder.recordSuccess(job) : attemptRecorder.recordFailure(job, failure);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
