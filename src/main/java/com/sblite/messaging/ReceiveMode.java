package com.sblite.messaging;

/**
 * How a receiver settles the messages it is handed.
 */
public enum ReceiveMode {
    /**
     * Message is accepted on delivery; nothing is left to settle.
     */
    RECEIVE_AND_DELETE,

    /**
     * Message stays locked (unsettled) until the application completes or
     * abandons it through its lock token.
     */
    PEEK_LOCK
}
