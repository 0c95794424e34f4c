package com.sblite.transport;

/**
 * Raised when the transport fails to create a session or attach a link.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
