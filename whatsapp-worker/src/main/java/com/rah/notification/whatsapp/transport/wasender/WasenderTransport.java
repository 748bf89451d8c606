package com.rah.notification.whatsapp.transport.wasender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.whatsapp.model.SessionCredentials;
import com.rah.notification.whatsapp.transport.MessagingTransport;
import com.rah.notification.whatsapp.transport.TransportConnection;
import com.rah.notification.whatsapp.transport.TransportException;
import com.rah.notification.whatsapp.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link MessagingTransport} backed by the WASender hosted session API.
 *
 * The provider keeps the WhatsApp Web socket; this transport watches the session status
 * on a fixed-delay tick and turns it into connection events. The account access token
 * is only used for session management, messages are sent with the per-session API key.
 */
@Slf4j
public class WasenderTransport implements MessagingTransport {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final String accessToken;
    private final String defaultSessionId;
    private final Duration pollInterval;
    private final Duration requestTimeout;

    public WasenderTransport(WebClient webClient,
                             ObjectMapper objectMapper,
                             TaskScheduler taskScheduler,
                             Clock clock,
                             String accessToken,
                             String defaultSessionId,
                             Duration pollInterval,
                             Duration requestTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.accessToken = accessToken;
        this.defaultSessionId = defaultSessionId;
        this.pollInterval = pollInterval;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public TransportConnection open(SessionCredentials credentials, TransportListener listener) throws TransportException {
        if (isBlank(accessToken)) {
            throw new TransportException("WASender access token is not configured (worker.whatsapp.access-token)");
        }
        String sessionId = credentials != null && !isBlank(credentials.sessionId())
            ? credentials.sessionId()
            : defaultSessionId;
        if (isBlank(sessionId)) {
            throw new TransportException("WASender session id is not configured (worker.whatsapp.session-id)");
        }

        WasenderConnection connection = new WasenderConnection(
            webClient, objectMapper, clock, accessToken, sessionId.trim(), credentials, listener, requestTimeout);
        ScheduledFuture<?> polling = taskScheduler.scheduleWithFixedDelay(
            connection::tick, clock.instant(), pollInterval);
        connection.setPolling(polling);

        log.info("Opened WASender connection for session {} (poll interval: {}s)",
            sessionId, pollInterval.toSeconds());
        return connection;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
