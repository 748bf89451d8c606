package com.rah.notification.common.queue;

/**
 * Thrown when a job cannot be handed to the queue.
 */
public class JobPublishException extends RuntimeException {

    public JobPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
