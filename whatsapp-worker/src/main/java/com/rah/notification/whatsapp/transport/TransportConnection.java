package com.rah.notification.whatsapp.transport;

/**
 * One connection opened by a {@link MessagingTransport}.
 */
public interface TransportConnection {

    /**
     * Send a text message.
     *
     * @param jid recipient JID ({@code <digits>@s.whatsapp.net})
     * @param text message body
     * @return provider message id, may be null if the provider returns none
     * @throws TransportException on network or protocol errors
     */
    String sendText(String jid, String text) throws TransportException;

    /**
     * Stop the connection. No listener callbacks are delivered afterwards.
     */
    void close();
}
