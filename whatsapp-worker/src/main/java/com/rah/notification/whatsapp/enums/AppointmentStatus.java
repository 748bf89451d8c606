package com.rah.notification.whatsapp.enums;

/**
 * Appointment status as stored by the booking API.
 *
 * Values MUST match the {@code appointments.status} column written by the API.
 * The worker only reads this column.
 */
public enum AppointmentStatus {
    BOOKED,
    CONFIRMED,
    COMPLETED,
    NO_SHOW,
    CANCELLED
}
