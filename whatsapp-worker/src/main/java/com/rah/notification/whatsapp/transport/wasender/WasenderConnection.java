package com.rah.notification.whatsapp.transport.wasender;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.whatsapp.enums.DisconnectReason;
import com.rah.notification.whatsapp.model.SessionCredentials;
import com.rah.notification.whatsapp.transport.ConnectionUpdate;
import com.rah.notification.whatsapp.transport.TransportConnection;
import com.rah.notification.whatsapp.transport.TransportException;
import com.rah.notification.whatsapp.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ScheduledFuture;

/**
 * One connection attempt against a WASender session.
 *
 * <p>{@link #tick()} runs on the scheduler with a fixed delay, so ticks never overlap and
 * listener callbacks arrive one at a time. Once closed, the connection stops polling and
 * reports nothing further.
 */
@Slf4j
class WasenderConnection implements TransportConnection {

    static final String STATUS_CONNECTED = "connected";
    static final String STATUS_NEED_SCAN = "need_scan";
    static final String STATUS_LOGGED_OUT = "logged_out";
    static final String STATUS_DISCONNECTED = "disconnected";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String accessToken;
    private final String sessionId;
    private final TransportListener listener;
    private final Duration requestTimeout;

    private volatile SessionCredentials credentials;
    private volatile ScheduledFuture<?> polling;
    private volatile boolean closed;

    // only touched from tick()
    private boolean opened;
    private boolean connectRequested;
    private String lastPairingCode;

    WasenderConnection(WebClient webClient,
                       ObjectMapper objectMapper,
                       Clock clock,
                       String accessToken,
                       String sessionId,
                       SessionCredentials credentials,
                       TransportListener listener,
                       Duration requestTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.accessToken = accessToken;
        this.sessionId = sessionId;
        this.credentials = credentials;
        this.listener = listener;
        this.requestTimeout = requestTimeout;
    }

    void setPolling(ScheduledFuture<?> polling) {
        this.polling = polling;
        if (closed) {
            polling.cancel(false);
        }
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * Poll the session once and report what changed.
     */
    void tick() {
        if (closed) {
            return;
        }
        try {
            JsonNode session = fetchSession();
            updateCredentials(session);
            if (closed) {
                return;
            }
            handleStatus(text(session, "status"));
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 401) {
                log.error("WASender rejected the access token for session {} (401)", sessionId);
                closeWith(DisconnectReason.LOGGED_OUT);
            } else {
                log.warn("WASender API error polling session {}: status={}", sessionId, e.getStatusCode().value());
                closeWith(DisconnectReason.CONNECTION_LOST);
            }
        } catch (RuntimeException e) {
            log.warn("Error polling WASender session {}: {}", sessionId, e.getMessage());
            closeWith(DisconnectReason.CONNECTION_LOST);
        }
    }

    private void handleStatus(String status) {
        String normalized = status != null ? status.toLowerCase(Locale.ROOT) : "";
        switch (normalized) {
            case STATUS_CONNECTED -> {
                if (!opened) {
                    opened = true;
                    lastPairingCode = null;
                    listener.onConnectionUpdate(ConnectionUpdate.open());
                }
            }
            case STATUS_NEED_SCAN -> {
                if (opened) {
                    log.warn("WASender session {} needs a new QR scan", sessionId);
                    closeWith(DisconnectReason.LOGGED_OUT);
                } else {
                    requestPairingCode();
                }
            }
            case STATUS_LOGGED_OUT -> closeWith(DisconnectReason.LOGGED_OUT);
            case STATUS_DISCONNECTED -> {
                if (opened) {
                    closeWith(DisconnectReason.CONNECTION_CLOSED);
                } else if (!connectRequested) {
                    requestPairingCode();
                }
            }
            default -> log.debug("WASender session {} status: {}", sessionId, status);
        }
    }

    private void requestPairingCode() {
        JsonNode data;
        if (!connectRequested) {
            log.info("Requesting WASender connect for session {}", sessionId);
            data = dataOf(webClient.post()
                .uri("/whatsapp-sessions/{id}/connect", sessionId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block());
            connectRequested = true;
        } else {
            data = dataOf(webClient.get()
                .uri("/whatsapp-sessions/{id}/qrcode", sessionId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block());
        }

        String code = text(data, "qrCode");
        if (code != null && !code.equals(lastPairingCode)) {
            lastPairingCode = code;
            listener.onConnectionUpdate(ConnectionUpdate.pairing(code));
        }
    }

    private JsonNode fetchSession() {
        return dataOf(webClient.get()
            .uri("/whatsapp-sessions/{id}", sessionId)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(requestTimeout)
            .block());
    }

    private void updateCredentials(JsonNode session) {
        String apiKey = text(session, "api_key");
        if (apiKey == null) {
            return;
        }
        SessionCredentials current = credentials;
        if (current != null && apiKey.equals(current.sessionApiKey()) && sessionId.equals(current.sessionId())) {
            return;
        }
        SessionCredentials updated = new SessionCredentials(
            sessionId, apiKey, text(session, "phone_number"), clock.instant());
        credentials = updated;
        listener.onCredentialsUpdate(updated);
    }

    @Override
    public String sendText(String jid, String text) throws TransportException {
        SessionCredentials current = credentials;
        if (closed) {
            throw new TransportException("Connection closed");
        }
        if (current == null || !current.hasApiKey()) {
            throw new TransportException("Session API key not available yet");
        }

        try {
            String response = webClient.post()
                .uri("/send-message")
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + current.sessionApiKey())
                .bodyValue(new WasenderMessageRequest(jid, text))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block();
            return text(dataOf(response), "msgId");
        } catch (WebClientResponseException.TooManyRequests e) {
            throw new TransportException("Rate limit exceeded (429 Too Many Requests)", 429, e);
        } catch (WebClientResponseException e) {
            throw new TransportException("WASender API error " + e.getStatusCode().value(),
                e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new TransportException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                null, e);
        }
    }

    @Override
    public void close() {
        closed = true;
        cancelPolling();
    }

    private void closeWith(DisconnectReason reason) {
        if (closed) {
            return;
        }
        closed = true;
        cancelPolling();
        listener.onConnectionUpdate(ConnectionUpdate.close(reason));
    }

    private void cancelPolling() {
        ScheduledFuture<?> current = polling;
        if (current != null) {
            current.cancel(false);
        }
    }

    private JsonNode dataOf(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode data = root.get("data");
            return data != null && !data.isNull() ? data : root;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid JSON from WASender: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
