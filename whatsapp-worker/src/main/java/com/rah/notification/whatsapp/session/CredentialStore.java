package com.rah.notification.whatsapp.session;

import com.rah.notification.whatsapp.model.SessionCredentials;

import java.util.Optional;

/**
 * Durable storage for the linked session's credentials.
 */
public interface CredentialStore {

    Optional<SessionCredentials> load();

    /**
     * Persist credentials. Must be durable when the method returns.
     */
    void save(SessionCredentials credentials);

    /**
     * Forget the stored credentials; the next connection pairs a new device.
     */
    void clear();
}
