package com.rah.notification.whatsapp.enums;

import java.util.Arrays;

/**
 * Why a WhatsApp connection was closed.
 *
 * Status codes follow the WhatsApp Web close codes. Only {@link #LOGGED_OUT} is
 * terminal; every other reason is a recoverable disconnect.
 */
public enum DisconnectReason {
    LOGGED_OUT(401),
    CONNECTION_LOST(408),
    CONNECTION_CLOSED(428),
    CONNECTION_REPLACED(440),
    BAD_SESSION(500),
    RESTART_REQUIRED(515),
    UNKNOWN(-1);

    private final int statusCode;

    DisconnectReason(int statusCode) {
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTerminal() {
        return this == LOGGED_OUT;
    }

    public static DisconnectReason fromStatusCode(Integer statusCode) {
        if (statusCode == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(reason -> reason.statusCode == statusCode)
            .findFirst()
            .orElse(UNKNOWN);
    }
}
