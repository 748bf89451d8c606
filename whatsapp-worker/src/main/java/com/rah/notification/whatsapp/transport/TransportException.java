package com.rah.notification.whatsapp.transport;

/**
 * Network or protocol failure reported by a transport.
 *
 * Confined to the transport/session boundary: the session manager converts it into a
 * failed send result or a connection close and never lets it reach job handlers.
 */
public class TransportException extends Exception {

    private final Integer statusCode;

    public TransportException(String message) {
        this(message, null, null);
    }

    public TransportException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status reported by the provider, or null for network errors
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
