package com.recipenest.notification.api.service;

import com.recipenest.notification.common.NotificationChannel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Delivery metrics, exposed at /actuator/prometheus.
 *
 * Meters are registered once per channel in {@link #init()} and looked up from enum maps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationMetricsService {

    private final MeterRegistry meterRegistry;

    private final Map<NotificationChannel, Counter> createdCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> queuedCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> sentCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> failedCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> abortedCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> retryScheduledCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> publishFailedCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, DistributionSummary> retryCountHistograms = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Timer> transportTimers = new EnumMap<>(NotificationChannel.class);

    @PostConstruct
    public void init() {
        for (NotificationChannel channel : NotificationChannel.values()) {
            String tag = channel.name();
            createdCounters.put(channel, counter("notification.deliveries.created",
                "Delivery status rows created", tag));
            queuedCounters.put(channel, counter("notification.deliveries.queued",
                "Rows transitioned to QUEUED and published", tag));
            sentCounters.put(channel, counter("notification.deliveries.sent",
                "Deliveries accepted by the transport", tag));
            failedCounters.put(channel, counter("notification.deliveries.failed",
                "Deliveries that exhausted their retry budget or never reached the queue", tag));
            abortedCounters.put(channel, counter("notification.deliveries.aborted",
                "Deliveries aborted by configuration errors or operators", tag));
            retryScheduledCounters.put(channel, counter("notification.deliveries.retry.scheduled",
                "Delayed retries scheduled after a failed attempt", tag));
            publishFailedCounters.put(channel, counter("notification.queue.publish.failed",
                "Jobs that could not be published to the delivery queue", tag));

            retryCountHistograms.put(channel, DistributionSummary.builder("notification.retry.count")
                .description("Failed attempts before a delivery reached a final state")
                .tag("channel", tag)
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry));

            transportTimers.put(channel, Timer.builder("notification.transport.latency")
                .description("Time spent in the channel transport per attempt")
                .tag("channel", tag)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        }
        log.info("Initialized delivery metrics for {} channels", NotificationChannel.values().length);
    }

    private Counter counter(String name, String description, String channel) {
        return Counter.builder(name)
            .description(description)
            .tag("channel", channel)
            .register(meterRegistry);
    }

    public void recordCreated(NotificationChannel channel) {
        createdCounters.get(channel).increment();
    }

    public void recordQueued(NotificationChannel channel) {
        queuedCounters.get(channel).increment();
    }

    public void recordSent(NotificationChannel channel, int retryCount) {
        sentCounters.get(channel).increment();
        retryCountHistograms.get(channel).record(retryCount);
    }

    public void recordFailed(NotificationChannel channel, int retryCount) {
        failedCounters.get(channel).increment();
        retryCountHistograms.get(channel).record(retryCount);
    }

    public void recordAborted(NotificationChannel channel) {
        abortedCounters.get(channel).increment();
    }

    public void recordRetryScheduled(NotificationChannel channel) {
        retryScheduledCounters.get(channel).increment();
    }

    public void recordPublishFailed(NotificationChannel channel) {
        publishFailedCounters.get(channel).increment();
    }

    public Timer.Sample startTransportTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopTransportTimer(NotificationChannel channel, Timer.Sample sample) {
        sample.stop(transportTimers.get(channel));
    }
}
