package com.rah.notification.whatsapp.transport;

import com.rah.notification.whatsapp.model.SessionCredentials;

/**
 * A WhatsApp network connection factory.
 *
 * Implementation guidelines:
 * - {@link #open} must not block on the handshake; progress is reported through the listener
 * - listener callbacks for one connection are delivered sequentially
 * - {@link TransportListener#onCredentialsUpdate} is delivered before any further network
 *   activity of that connection
 * - never log API keys or message bodies
 */
public interface MessagingTransport {

    /**
     * Start a connection attempt.
     *
     * @param credentials stored credentials, or null to pair a new device
     * @param listener receives connection and credential updates for this connection only
     * @return handle of the new connection
     * @throws TransportException if the attempt cannot even be started
     */
    TransportConnection open(SessionCredentials credentials, TransportListener listener) throws TransportException;
}
