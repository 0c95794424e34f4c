package com.sblite.messaging.amqp;

import com.sblite.transport.AmqpTransport;
import com.sblite.transport.TransportReceiverLink;
import com.sblite.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session and receiver link of one receiver, created on first use.
 *
 * Whichever receive path opens the link first fixes its addressing; later
 * calls get the same link back whatever addressing they ask for.
 */
class ReceiveLinkHandle {

    private static final Logger log = LoggerFactory.getLogger(ReceiveLinkHandle.class);

    static final String LINK_NAME_PREFIX = "amqp-receive-link ";

    /**
     * How the link's source is addressed.
     */
    enum Addressing {
        /**
         * Subscribe to the entity path.
         */
        PLAIN,

        /**
         * Subscribe to the entity path with the start offset filter.
         */
        FILTERED
    }

    private final AmqpTransport transport;
    private final String path;

    private final Object lock = new Object();

    private volatile ReceiverState state = ReceiverState.UNOPENED;
    private TransportSession session;
    private volatile TransportReceiverLink link;
    private Addressing addressing;

    ReceiveLinkHandle(AmqpTransport transport, String path) {
        this.transport = transport;
        this.path = path;
    }

    /**
     * Return the link, creating session and link if this is the first use.
     *
     * @param requested   addressing to use if the link is created now
     * @param startOffset offset for {@link Addressing#FILTERED}; ignored when empty
     * @throws IllegalStateException if the handle is closed
     */
    TransportReceiverLink materialize(Addressing requested, String startOffset) {
        synchronized (lock) {
            switch (state) {
                case OPEN:
                    return link;
                case CLOSED:
                    throw new IllegalStateException("Receiver for " + path + " is closed");
                default:
                    break;
            }

            Addressing effective = requested == Addressing.FILTERED && startOffset != null && !startOffset.isEmpty()
                    ? Addressing.FILTERED : Addressing.PLAIN;

            TransportSession newSession = transport.createSession();
            try {
                if (effective == Addressing.FILTERED) {
                    link = newSession.createReceiver(LINK_NAME_PREFIX + path,
                            SourceFilters.afterOffset(path, startOffset));
                } else {
                    link = newSession.createReceiver(LINK_NAME_PREFIX + path, path);
                }
            } catch (RuntimeException e) {
                newSession.close();
                throw e;
            }
            session = newSession;
            addressing = effective;
            state = ReceiverState.OPEN;

            if (effective == Addressing.FILTERED) {
                log.info("Opened receive link on {} after offset {}", path, startOffset);
            } else {
                log.info("Opened receive link on {}", path);
            }
            return link;
        }
    }

    /**
     * Close link then session.
     *
     * @return true if the link was open and is now closed; false when it was
     *         never opened or is already closed
     */
    boolean close() {
        synchronized (lock) {
            if (state != ReceiverState.OPEN) {
                return false;
            }
            state = ReceiverState.CLOSED;
            try {
                link.close();
            } finally {
                session.close();
            }
            log.info("Closed receive link on {}", path);
            return true;
        }
    }

    ReceiverState getState() {
        return state;
    }

    boolean isOpen() {
        return state == ReceiverState.OPEN;
    }

    /**
     * The attached link, or null before the first materialization.
     */
    TransportReceiverLink getLink() {
        return link;
    }

    Addressing getAddressing() {
        synchronized (lock) {
            return addressing;
        }
    }
}
