package com.rah.notification.whatsapp.session;

/**
 * Outcome of {@link WhatsAppSessionManager#send}.
 *
 * Expected delivery problems are values, not exceptions: callers branch on the variant
 * and never need a try/catch around a send.
 *
 * Example usage:
 * <pre>
 * SendResult result = sessionManager.send(phone, text);
 * if (result instanceof SendResult.Failure failure) {
 *     log.warn("Send failed: {}", failure.reason());
 * }
 * </pre>
 */
public sealed interface SendResult permits SendResult.Success, SendResult.Failure {

    /** Reason reported when no session is ready. */
    String NOT_CONNECTED = "not_connected";

    record Success(String messageId) implements SendResult {
    }

    record Failure(String reason) implements SendResult {
    }

    static SendResult success(String messageId) {
        return new Success(messageId);
    }

    static SendResult failure(String reason) {
        return new Failure(reason);
    }

    static SendResult notConnected() {
        return new Failure(NOT_CONNECTED);
    }
}
