package com.sblite.transport;

import org.apache.qpid.proton.amqp.messaging.Source;

/**
 * AMQP 1.0 session able to attach receiver links.
 */
public interface TransportSession {

    /**
     * Attach a receiver link subscribed directly to an address.
     */
    TransportReceiverLink createReceiver(String name, String address);

    /**
     * Attach a receiver link using a fully described source terminus
     * (address plus filter set).
     */
    TransportReceiverLink createReceiver(String name, Source source);

    void close();
}
