package com.sblite.messaging.amqp;

/**
 * Lifecycle of a receiver's link.
 */
public enum ReceiverState {
    /**
     * No session or link has been created yet.
     */
    UNOPENED,

    /**
     * Session and link are attached and shared by every receive path.
     */
    OPEN,

    /**
     * Link and session were closed. Terminal; the link is never recreated.
     */
    CLOSED
}
