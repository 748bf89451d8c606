package com.rah.notification.whatsapp.model;

/**
 * Notification templates and business metadata maintained in the CMS.
 *
 * @param confirmationMessageTemplate booking confirmation template, "" when not set
 * @param reminderMessageTemplate reminder template; null means reminders are disabled
 * @param businessName "" when not set
 * @param businessLatitude may be null
 * @param businessLongitude may be null
 */
public record NotificationSettings(
    String confirmationMessageTemplate,
    String reminderMessageTemplate,
    String businessName,
    Double businessLatitude,
    Double businessLongitude
) {

    public boolean hasReminderTemplate() {
        return reminderMessageTemplate != null;
    }
}
