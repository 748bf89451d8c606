package com.rah.notification.whatsapp.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.whatsapp.session.CredentialStore;
import com.rah.notification.whatsapp.session.FileCredentialStore;
import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import com.rah.notification.whatsapp.transport.MessagingTransport;
import com.rah.notification.whatsapp.transport.wasender.WasenderTransport;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the single WhatsApp session of the worker.
 *
 * The manager is started and stopped by {@code WorkerRuntime}, not by bean lifecycle
 * callbacks, so that listener containers never run before the session exists.
 */
@Configuration
public class WhatsAppSessionConfig {

    /**
     * Shared by session polling, reconnects and the scheduled job dispatcher.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${worker.scheduler.pool-size:3}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("whatsapp-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public CredentialStore credentialStore(WhatsAppSessionProperties properties, ObjectMapper objectMapper) {
        return new FileCredentialStore(Paths.get(properties.getAuthDir()), objectMapper);
    }

    @Bean
    public MessagingTransport messagingTransport(@Qualifier("wasenderWebClient") WebClient wasenderWebClient,
                                                 ObjectMapper objectMapper,
                                                 TaskScheduler taskScheduler,
                                                 Clock clock,
                                                 WhatsAppSessionProperties properties) {
        return new WasenderTransport(
            wasenderWebClient,
            objectMapper,
            taskScheduler,
            clock,
            properties.getAccessToken(),
            properties.getSessionId(),
            properties.getPollInterval(),
            properties.getSendTimeout()
        );
    }

    @Bean
    public WhatsAppSessionManager whatsAppSessionManager(MessagingTransport messagingTransport,
                                                         CredentialStore credentialStore,
                                                         TaskScheduler taskScheduler,
                                                         WhatsAppSessionProperties properties,
                                                         Clock clock,
                                                         MeterRegistry meterRegistry) {
        WhatsAppSessionManager manager = new WhatsAppSessionManager(
            messagingTransport, credentialStore, taskScheduler, properties.getReconnectDelay(), clock);
        Gauge.builder("whatsapp.session.ready", manager, m -> m.isReady() ? 1 : 0)
            .description("1 when the WhatsApp session can send messages")
            .register(meterRegistry);
        return manager;
    }
}
