package com.rah.notification.whatsapp.transport;

import com.rah.notification.whatsapp.enums.DisconnectReason;

/**
 * Connection state change reported by a transport.
 *
 * @param status what happened
 * @param reason why the connection closed (CLOSE only)
 * @param pairingCode QR payload to scan (PAIRING only)
 */
public record ConnectionUpdate(
    Status status,
    DisconnectReason reason,
    String pairingCode
) {

    public enum Status {
        OPEN,
        CLOSE,
        PAIRING
    }

    public static ConnectionUpdate open() {
        return new ConnectionUpdate(Status.OPEN, null, null);
    }

    public static ConnectionUpdate close(DisconnectReason reason) {
        return new ConnectionUpdate(Status.CLOSE, reason != null ? reason : DisconnectReason.UNKNOWN, null);
    }

    public static ConnectionUpdate pairing(String pairingCode) {
        return new ConnectionUpdate(Status.PAIRING, null, pairingCode);
    }
}
