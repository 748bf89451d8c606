package com.rah.notification.whatsapp.enums;

/**
 * Lifecycle of the WhatsApp session owned by the session manager.
 *
 * <ul>
 *   <li>DISCONNECTED → CONNECTING when a connection attempt starts</li>
 *   <li>CONNECTING → READY when the transport reports the connection open</li>
 *   <li>CONNECTING/READY → DISCONNECTED on a recoverable close (a reconnect is scheduled)</li>
 *   <li>CONNECTING/READY → LOGGED_OUT when the device was unlinked; stays there until re-link</li>
 * </ul>
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    READY,
    LOGGED_OUT
}
