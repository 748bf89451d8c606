package com.rah.notification.whatsapp.runtime;

import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

/**
 * Starts and stops the worker in order.
 *
 * <p>Start: initialize the WhatsApp session, then start the job listener containers.
 * Stop: stop the containers (each finishes its in-flight job, bounded by the container
 * shutdown timeout), then shut the session down. Runs after the listener registry on
 * start and before it on stop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerRuntime implements SmartLifecycle {

    static final int PHASE = Integer.MAX_VALUE - 50;

    private final WhatsAppSessionManager sessionManager;
    private final KafkaListenerEndpointRegistry listenerRegistry;

    private volatile boolean running;

    @Override
    public void start() {
        log.info("Starting WhatsApp worker");
        sessionManager.initialize();
        for (MessageListenerContainer container : listenerRegistry.getListenerContainers()) {
            if (!container.isRunning()) {
                container.start();
                log.info("Started job listener {}", container.getListenerId());
            }
        }
        running = true;
        log.info("WhatsApp worker started (session state: {})", sessionManager.getState());
    }

    @Override
    public void stop() {
        log.info("Stopping WhatsApp worker");
        for (MessageListenerContainer container : listenerRegistry.getListenerContainers()) {
            if (container.isRunning()) {
                container.stop();
                log.info("Stopped job listener {}", container.getListenerId());
            }
        }
        sessionManager.shutdown();
        running = false;
        log.info("WhatsApp worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
