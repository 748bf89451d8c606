package com.rah.notification.whatsapp.service;

/**
 * The settings service could not be reached or answered with an unexpected status.
 * Propagates to the listener container so the job is retried.
 */
public class SettingsFetchException extends RuntimeException {

    public SettingsFetchException(String message) {
        super(message);
    }

    public SettingsFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
