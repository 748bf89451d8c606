package com.rah.notification.whatsapp.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Types of the append-only appointment event log.
 *
 * The worker writes REMINDER_SENT itself and whatever type a {@code send-whatsapp}
 * job names (typically CONFIRMATION_SENT). Other values are written by the booking API.
 */
public enum AppointmentEventType {
    CREATED,
    CONFIRMATION_SENT,
    REMINDER_SENT,
    CANCELLED,
    RESCHEDULED;

    /**
     * Parse an event type coming from a job payload (case-insensitive).
     *
     * @return the type, or empty if the value is blank or unknown
     */
    public static Optional<AppointmentEventType> fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.name().equals(normalized))
            .findFirst();
    }
}
