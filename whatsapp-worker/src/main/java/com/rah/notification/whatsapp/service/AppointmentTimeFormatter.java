package com.rah.notification.whatsapp.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Formats appointment instants for customers, in the business timezone.
 */
@Component
public class AppointmentTimeFormatter {

    private final DateTimeFormatter dateFormatter;
    private final DateTimeFormatter timeFormatter;

    public AppointmentTimeFormatter(ZoneId businessZone) {
        this.dateFormatter = DateTimeFormatter.ofPattern("dd/MM/yyyy").withZone(businessZone);
        this.timeFormatter = DateTimeFormatter.ofPattern("HH:mm").withZone(businessZone);
    }

    public String formatDate(Instant instant) {
        return dateFormatter.format(instant);
    }

    public String formatTime(Instant instant) {
        return timeFormatter.format(instant);
    }
}
