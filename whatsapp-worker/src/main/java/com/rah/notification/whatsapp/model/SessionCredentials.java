package com.rah.notification.whatsapp.model;

import java.time.Instant;

/**
 * Credentials of the linked WhatsApp session, persisted so that a restart resumes
 * the session without pairing again.
 *
 * @param sessionId provider session id
 * @param sessionApiKey key issued for the session once it is linked; used for sending
 * @param phoneNumber linked phone number, if the provider reports it
 * @param updatedAt last time the transport handed out new credentials
 */
public record SessionCredentials(
    String sessionId,
    String sessionApiKey,
    String phoneNumber,
    Instant updatedAt
) {

    public boolean hasApiKey() {
        return sessionApiKey != null && !sessionApiKey.isBlank();
    }

    /** Never print the API key. */
    @Override
    public String toString() {
        return "SessionCredentials[sessionId=" + sessionId
            + ", phoneNumber=" + phoneNumber
            + ", apiKey=" + (hasApiKey() ? "****" : "none")
            + ", updatedAt=" + updatedAt + "]";
    }
}
