package com.recipenest.notification.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConsumerConfigHelperTest {

    @Test
    void testBuildGroupId_WithPrefix_PrependsEnvironment() {
        assertEquals("prod-notification-dispatch",
            KafkaConsumerConfigHelper.buildGroupId("notification-dispatch", "prod"));
    }

    @Test
    void testBuildGroupId_WithBlankPrefix_ReturnsBase() {
        assertEquals("notification-dispatch", KafkaConsumerConfigHelper.buildGroupId("notification-dispatch", " "));
        assertEquals("notification-dispatch", KafkaConsumerConfigHelper.buildGroupId("notification-dispatch", null));
    }

    @Test
    void testCreateBaseConsumerProperties_DisablesAutoCommit() {
        Map<String, Object> props = KafkaConsumerConfigHelper.createBaseConsumerProperties(
            "localhost:9092", "group", 5);

        assertEquals(false, props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals(5, props.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
        assertEquals("group", props.get(ConsumerConfig.GROUP_ID_CONFIG));
    }

    @Test
    void testCreateBaseConsumerProperties_WhenMaxPollRecordsZero_Throws() {
        assertThrows(IllegalArgumentException.class,
            () -> KafkaConsumerConfigHelper.createBaseConsumerProperties("localhost:9092", "group", 0));
    }
}
