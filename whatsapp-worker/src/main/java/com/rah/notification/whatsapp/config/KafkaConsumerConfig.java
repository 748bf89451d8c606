package com.rah.notification.whatsapp.config;

import com.rah.notification.common.job.JobKind;
import com.rah.notification.common.kafka.KafkaConsumerConfigHelper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

import java.time.Duration;
import java.util.Map;

/**
 * Listener containers for job topics.
 *
 * <p>Every {@code @KafkaListener} gets its own container with a single consumer thread, so
 * each job kind has exactly one job in flight. Containers are started by
 * {@link com.rah.notification.whatsapp.runtime.WorkerRuntime} once the WhatsApp session
 * has been initialized.
 *
 * <p>A listener that throws leaves its offset uncommitted; the error handler seeks back
 * and retries with exponential backoff, then publishes the record to {@code <topic>-dlq}.
 */
@Configuration
@Slf4j
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${kafka.consumer.group-id:whatsapp-worker-group}")
    private String baseGroupId;

    @Value("${kafka.consumer.environment-prefix:}")
    private String environmentPrefix;

    @Value("${worker.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${worker.retry.initial-interval:1s}")
    private Duration initialInterval;

    @Value("${worker.retry.multiplier:2.0}")
    private double multiplier;

    @Value("${worker.retry.max-interval:30s}")
    private Duration maxInterval;

    @Value("${worker.shutdown-timeout:30s}")
    private Duration shutdownTimeout;

    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        String groupId = KafkaConsumerConfigHelper.buildGroupId(baseGroupId, environmentPrefix);
        Map<String, Object> configProps = KafkaConsumerConfigHelper.createJobConsumerProperties(
            bootstrapServers, groupId);
        return new DefaultKafkaConsumerFactory<>(configProps);
    }

    @Bean
    public DefaultErrorHandler jobErrorHandler(KafkaTemplate<String, String> kafkaTemplate) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
            (record, exception) -> {
                log.error("Job {} on {} failed after {} attempts, moving to dead-letter topic: {}",
                    record.key(), record.topic(), maxAttempts, exception.getMessage());
                return new TopicPartition(JobKind.fromTopic(record.topic()).getDlqTopic(), -1);
            });

        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(Math.max(0, maxAttempts - 1));
        backOff.setInitialInterval(initialInterval.toMillis());
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(maxInterval.toMillis());

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.setRetryListeners((record, exception, deliveryAttempt) ->
            log.warn("Job {} on {} failed (attempt {}/{}): {}",
                record.key(), record.topic(), deliveryAttempt, maxAttempts, exception.getMessage()));
        return errorHandler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            DefaultErrorHandler jobErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
            new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory());
        factory.setConcurrency(1);
        factory.setAutoStartup(false);
        factory.setCommonErrorHandler(jobErrorHandler);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        factory.getContainerProperties().setShutdownTimeout(shutdownTimeout.toMillis());
        return factory;
    }
}
