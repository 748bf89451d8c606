package com.rah.notification.whatsapp.session;

import com.rah.notification.whatsapp.enums.DisconnectReason;
import com.rah.notification.whatsapp.enums.SessionState;
import com.rah.notification.whatsapp.model.SessionCredentials;
import com.rah.notification.whatsapp.model.SessionStatus;
import com.rah.notification.whatsapp.transport.ConnectionUpdate;
import com.rah.notification.whatsapp.transport.MessagingTransport;
import com.rah.notification.whatsapp.transport.TransportConnection;
import com.rah.notification.whatsapp.transport.TransportException;
import com.rah.notification.whatsapp.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the single WhatsApp session of this process.
 *
 * <p>The provider allows one linked session per credential set, so every send in the
 * worker goes through this one instance and nothing else ever opens a connection.
 * State changes are driven by transport events (see {@link SessionState}); job handlers
 * only call {@link #isReady()} and {@link #send}.
 *
 * <p>Rules:
 * <ul>
 *   <li>Only events of the current connection are applied; a reconnect bumps the
 *       generation and older connections are ignored</li>
 *   <li>At most one reconnect is pending at a time, after a fixed delay</li>
 *   <li>A logged-out session stays LOGGED_OUT until {@link #relink()}</li>
 *   <li>{@link #send} never throws and never touches the network unless READY</li>
 * </ul>
 */
@Slf4j
public class WhatsAppSessionManager {

    static final String JID_SUFFIX = "@s.whatsapp.net";
    static final String UNKNOWN_MESSAGE_ID = "unknown";

    private final MessagingTransport transport;
    private final CredentialStore credentialStore;
    private final TaskScheduler taskScheduler;
    private final Duration reconnectDelay;
    private final Clock clock;

    private final Object lock = new Object();

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile Instant stateSince;
    private volatile TransportConnection connection;
    private volatile DisconnectReason lastDisconnectReason;
    private volatile String pairingCode;
    private volatile SessionCredentials credentials;

    // guarded by lock
    private long generation;
    private ScheduledFuture<?> pendingReconnect;
    private boolean initialized;
    private boolean shutdown;

    public WhatsAppSessionManager(MessagingTransport transport,
                                  CredentialStore credentialStore,
                                  TaskScheduler taskScheduler,
                                  Duration reconnectDelay,
                                  Clock clock) {
        this.transport = transport;
        this.credentialStore = credentialStore;
        this.taskScheduler = taskScheduler;
        this.reconnectDelay = reconnectDelay;
        this.clock = clock;
        this.stateSince = clock.instant();
    }

    /**
     * Load stored credentials and start the first connection attempt. Safe to call twice.
     */
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                log.debug("WhatsApp session manager already initialized");
                return;
            }
            initialized = true;
            shutdown = false;
            credentials = credentialStore.load().orElse(null);
            log.info("Initializing WhatsApp session ({})",
                credentials != null ? "resuming stored session" : "pairing required");
            connect();
        }
    }

    public boolean isReady() {
        return state == SessionState.READY && connection != null;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Send a text message over the current session.
     *
     * @param recipient phone number with country code (digits) or a full JID
     * @param text message body
     * @return {@code Success(messageId)}, or {@code Failure(reason)}; {@code not_connected}
     *         when the session is not READY
     */
    public SendResult send(String recipient, String text) {
        TransportConnection current = connection;
        if (state != SessionState.READY || current == null) {
            return SendResult.notConnected();
        }

        try {
            String messageId = current.sendText(toJid(recipient), text);
            return SendResult.success(messageId != null ? messageId : UNKNOWN_MESSAGE_ID);
        } catch (TransportException e) {
            log.warn("WhatsApp send to {} failed (status: {}): {}", recipient, e.getStatusCode(), e.getMessage());
            return SendResult.failure(reasonOf(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error sending WhatsApp message to {}", recipient, e);
            return SendResult.failure(reasonOf(e));
        }
    }

    /**
     * Drop the stored credentials and pair a new device. Leaves LOGGED_OUT (or any other
     * state) through a fresh connection whose pairing code shows up in {@link #getStatus()}.
     */
    public SessionStatus relink() {
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("WhatsApp session manager is shut down");
            }
            log.info("Re-linking WhatsApp session (previous state: {})", state);
            initialized = true;
            cancelPendingReconnect();
            generation++;
            closeCurrentConnection();
            credentialStore.clear();
            credentials = null;
            connect();
            return getStatus();
        }
    }

    /**
     * Close the connection and stop reconnecting. Called once on worker shutdown.
     */
    public void shutdown() {
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            cancelPendingReconnect();
            generation++;
            closeCurrentConnection();
            transition(SessionState.DISCONNECTED);
            log.info("WhatsApp session manager shut down");
        }
    }

    public SessionStatus getStatus() {
        return new SessionStatus(state, stateSince, lastDisconnectReason, pairingCode, credentials != null);
    }

    // --- connection lifecycle (callers hold lock) ---

    private void connect() {
        if (shutdown) {
            return;
        }
        long connectionGeneration = ++generation;
        pairingCode = null;
        transition(SessionState.CONNECTING);

        try {
            connection = transport.open(credentials, new ConnectionListener(connectionGeneration));
        } catch (TransportException e) {
            log.warn("Could not start WhatsApp connection (status: {}): {}", e.getStatusCode(), e.getMessage());
            handleClose(connectionGeneration, DisconnectReason.fromStatusCode(e.getStatusCode()));
        } catch (RuntimeException e) {
            log.error("Unexpected error starting WhatsApp connection", e);
            handleClose(connectionGeneration, DisconnectReason.UNKNOWN);
        }
    }

    private void handleClose(long connectionGeneration, DisconnectReason reason) {
        if (connectionGeneration != generation || shutdown) {
            return;
        }
        closeCurrentConnection();
        lastDisconnectReason = reason;

        if (reason.isTerminal()) {
            transition(SessionState.LOGGED_OUT);
            log.error("WhatsApp session logged out ({}). Re-link the device and scan the new QR code; "
                + "messages fail with '{}' until then", reason.getStatusCode(), SendResult.NOT_CONNECTED);
            return;
        }

        transition(SessionState.DISCONNECTED);
        log.warn("WhatsApp connection closed ({}, status: {}), reconnecting in {} ms",
            reason, reason.getStatusCode(), reconnectDelay.toMillis());
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (pendingReconnect != null && !pendingReconnect.isDone()) {
            log.debug("Reconnect already pending");
            return;
        }
        pendingReconnect = taskScheduler.schedule(this::reconnect, clock.instant().plus(reconnectDelay));
    }

    private void reconnect() {
        synchronized (lock) {
            pendingReconnect = null;
            if (shutdown || state != SessionState.DISCONNECTED) {
                return;
            }
            log.info("Reconnecting WhatsApp session");
            connect();
        }
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private void closeCurrentConnection() {
        TransportConnection current = connection;
        connection = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Error closing WhatsApp connection: {}", e.getMessage());
            }
        }
    }

    private void transition(SessionState next) {
        if (state != next) {
            log.debug("WhatsApp session {} -> {}", state, next);
            state = next;
            stateSince = clock.instant();
        }
    }

    static String toJid(String recipient) {
        if (recipient.contains("@")) {
            return recipient;
        }
        return recipient.replaceAll("\\D", "") + JID_SUFFIX;
    }

    private static String reasonOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Listener bound to one connection generation.
     */
    private final class ConnectionListener implements TransportListener {

        private final long connectionGeneration;

        private ConnectionListener(long connectionGeneration) {
            this.connectionGeneration = connectionGeneration;
        }

        @Override
        public void onConnectionUpdate(ConnectionUpdate update) {
            synchronized (lock) {
                if (connectionGeneration != generation || shutdown) {
                    log.debug("Ignoring {} from a superseded WhatsApp connection", update.status());
                    return;
                }
                switch (update.status()) {
                    case OPEN -> {
                        pairingCode = null;
                        transition(SessionState.READY);
                        log.info("WhatsApp connection opened, session ready");
                    }
                    case PAIRING -> {
                        pairingCode = update.pairingCode();
                        log.warn("WhatsApp device not linked. Scan this QR code with WhatsApp "
                            + "(Settings > Linked Devices > Link a Device): {}", update.pairingCode());
                    }
                    case CLOSE -> handleClose(connectionGeneration, update.reason());
                }
            }
        }

        @Override
        public void onCredentialsUpdate(SessionCredentials updated) {
            synchronized (lock) {
                if (connectionGeneration != generation || shutdown) {
                    log.debug("Ignoring credentials from a superseded WhatsApp connection");
                    return;
                }
                credentialStore.save(updated);
                credentials = updated;
                log.info("Stored updated WhatsApp credentials for session {}", updated.sessionId());
            }
        }
    }
}
