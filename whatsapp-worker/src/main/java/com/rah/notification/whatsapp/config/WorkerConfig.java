package com.rah.notification.whatsapp.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.common.queue.JobQueueClient;
import com.rah.notification.common.queue.ScheduledJobStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class WorkerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Timezone used to print appointment dates and times to customers.
     */
    @Bean
    public ZoneId businessZone(@Value("${worker.timezone:America/Sao_Paulo}") String timezone) {
        return ZoneId.of(timezone);
    }

    @Bean
    public ScheduledJobStore scheduledJobStore(JdbcTemplate jdbcTemplate) {
        return new ScheduledJobStore(jdbcTemplate);
    }

    @Bean
    public JobQueueClient jobQueueClient(KafkaTemplate<String, String> kafkaTemplate,
                                         ScheduledJobStore scheduledJobStore,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        return new JobQueueClient(kafkaTemplate, scheduledJobStore, objectMapper, clock);
    }
}
