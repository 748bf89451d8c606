package com.rah.notification.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared consumer settings for job workers.
 *
 * <p>Job consumers take exactly one record per poll: a worker must never hold a
 * second job of the same kind while the first one is still being handled, and the
 * offset of a job is only committed once its handler has finished.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * String groupId = KafkaConsumerConfigHelper.buildGroupId("whatsapp-worker-group", "prod");
 * Map<String, Object> props = KafkaConsumerConfigHelper.createJobConsumerProperties(
 *     bootstrapServers, groupId);
 * }</pre>
 */
public final class KafkaConsumerConfigHelper {

    /** One job per poll (batch size 1). */
    public static final int JOB_MAX_POLL_RECORDS = 1;

    private KafkaConsumerConfigHelper() {
    }

    /**
     * Creates consumer properties for a job consumer.
     *
     * <p>Manual offset commits, earliest reset for new groups, and a poll interval
     * long enough to cover a slow send plus the error handler's backoff.
     *
     * @param bootstrapServers Kafka bootstrap servers (e.g., "localhost:9092")
     * @param groupId consumer group id (see {@link #buildGroupId})
     * @return properties ready for {@code DefaultKafkaConsumerFactory}
     */
    public static Map<String, Object> createJobConsumerProperties(String bootstrapServers, String groupId) {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Offsets are committed by the listener after the handler returns
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, JOB_MAX_POLL_RECORDS);

        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        configProps.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        configProps.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, 1);
        configProps.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, 500);

        configProps.put(
            ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG,
            "org.apache.kafka.clients.consumer.CooperativeStickyAssignor"
        );

        return configProps;
    }

    /**
     * Builds a consumer group id with an optional environment prefix.
     *
     * <ul>
     *   <li>{@code buildGroupId("whatsapp-worker-group", "prod")} → "prod-whatsapp-worker-group"</li>
     *   <li>{@code buildGroupId("whatsapp-worker-group", null)} → "whatsapp-worker-group"</li>
     *   <li>{@code buildGroupId("whatsapp-worker-group", " ")} → "whatsapp-worker-group"</li>
     * </ul>
     */
    public static String buildGroupId(String baseGroupId, String environmentPrefix) {
        if (environmentPrefix != null && !environmentPrefix.trim().isEmpty()) {
            return environmentPrefix.trim() + "-" + baseGroupId;
        }
        return baseGroupId;
    }
}
