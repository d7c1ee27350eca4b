package com.recipenest.notification.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.CooperativeStickyAssignor;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared Kafka consumer settings for delivery job listeners.
 *
 * <pre>{@code
 * String groupId = KafkaConsumerConfigHelper.buildGroupId("notification-dispatch", "prod");
 * Map<String, Object> props = KafkaConsumerConfigHelper.createBaseConsumerProperties(
 *     bootstrapServers, groupId, 10);
 * }</pre>
 */
public final class KafkaConsumerConfigHelper {

    private KafkaConsumerConfigHelper() {
    }

    /**
     * Base consumer properties: string payloads, manual offset commit, cooperative rebalancing.
     *
     * <p>{@code max.poll.interval.ms} must exceed the worst-case time to process
     * {@code maxPollRecords} jobs, each bounded by the transport timeout.
     *
     * @param bootstrapServers Kafka bootstrap servers
     * @param groupId consumer group id (see {@link #buildGroupId(String, String)})
     * @param maxPollRecords records fetched per poll
     * @return properties for DefaultKafkaConsumerFactory
     */
    public static Map<String, Object> createBaseConsumerProperties(String bootstrapServers, String groupId,
                                                                   int maxPollRecords) {
        if (maxPollRecords < 1) {
            throw new IllegalArgumentException("maxPollRecords must be >= 1, got " + maxPollRecords);
        }
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Offsets are committed by the listener after the delivery row is updated
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPollRecords);

        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        configProps.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        configProps.put(ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG,
            CooperativeStickyAssignor.class.getName());

        return configProps;
    }

    /**
     * Prefix a consumer group id with an environment name.
     *
     * <ul>
     *   <li>{@code buildGroupId("notification-dispatch", "prod")} → "prod-notification-dispatch"</li>
     *   <li>{@code buildGroupId("notification-dispatch", null)} → "notification-dispatch"</li>
     * </ul>
     */
    public static String buildGroupId(String baseGroupId, String environmentPrefix) {
        if (baseGroupId == null || baseGroupId.trim().isEmpty()) {
            throw new IllegalArgumentException("Base group id cannot be null or empty");
        }
        if (environmentPrefix != null && !environmentPrefix.trim().isEmpty()) {
            return environmentPrefix.trim() + "-" + baseGroupId.trim();
        }
        return baseGroupId.trim();
    }
}
