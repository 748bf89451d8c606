package com.rah.notification.whatsapp.model;

/**
 * Values substituted into a message template. Date and time are already formatted
 * in the business timezone.
 */
public record ComposeFields(
    String name,
    String services,
    String date,
    String time
) {
}
