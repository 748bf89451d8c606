package com.rah.notification.whatsapp.transport;

import com.rah.notification.whatsapp.model.SessionCredentials;

/**
 * Receives lifecycle events of a single {@link TransportConnection}.
 */
public interface TransportListener {

    void onConnectionUpdate(ConnectionUpdate update);

    /**
     * New credentials were issued. Implementations must persist them before returning.
     */
    void onCredentialsUpdate(SessionCredentials credentials);
}
