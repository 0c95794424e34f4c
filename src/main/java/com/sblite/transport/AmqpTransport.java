package com.sblite.transport;

/**
 * Connection-level transport used by receivers.
 *
 * Connection establishment, authentication and framing live behind this
 * interface; receivers only ask for a connection and sessions on it.
 */
public interface AmqpTransport {

    /**
     * Open the underlying connection if it is not already open.
     *
     * @return true if the connection is open when this call returns
     */
    boolean open();

    boolean isOpen();

    /**
     * Begin a new session on the open connection.
     *
     * @throws TransportException if the connection is not open or the session is refused
     */
    TransportSession createSession();

    void close();
}
