package com.sblite.transport;

/**
 * Receiving end of an attached link.
 *
 * Credit is granted explicitly; the link never prefetches on its own.
 */
public interface TransportReceiverLink {

    /**
     * Grant the sender credit for the given number of messages.
     */
    void setCredit(int credit);

    /**
     * Block until a message arrives.
     *
     * @return the next message, or null once the link has been closed
     *         (locally or by the peer)
     */
    InboundMessage receive();

    /**
     * Settle a delivery with the accepted outcome.
     */
    void accept(InboundMessage message);

    /**
     * Settle a delivery with the released outcome, making it available
     * for redelivery.
     */
    void release(InboundMessage message);

    /**
     * Detach the link. Any thread blocked in {@link #receive()} returns null.
     */
    void close();
}
