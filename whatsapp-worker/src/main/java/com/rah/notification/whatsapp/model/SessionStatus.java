package com.rah.notification.whatsapp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rah.notification.whatsapp.enums.DisconnectReason;
import com.rah.notification.whatsapp.enums.SessionState;

import java.time.Instant;

/**
 * Point-in-time view of the session for operators.
 *
 * @param state current state
 * @param since when the current state was entered
 * @param lastDisconnectReason reason of the last close, null if none yet
 * @param pairingCode QR code payload to scan while waiting for pairing
 * @param credentialsStored whether credentials are persisted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStatus(
    SessionState state,
    Instant since,
    DisconnectReason lastDisconnectReason,
    String pairingCode,
    boolean credentialsStored
) {
}
