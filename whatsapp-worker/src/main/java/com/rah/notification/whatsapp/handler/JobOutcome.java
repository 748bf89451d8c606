package com.rah.notification.whatsapp.handler;

import java.util.Locale;

/**
 * How a job ended. Every outcome acknowledges the job; infrastructure failures are
 * thrown instead and never show up here.
 */
public enum JobOutcome {
    DELIVERED,
    DELIVERY_FAILED,
    SKIPPED_MALFORMED,
    SKIPPED_NOT_FOUND,
    SKIPPED_CANCELLED,
    SKIPPED_ALREADY_SENT,
    SKIPPED_DISABLED;

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
