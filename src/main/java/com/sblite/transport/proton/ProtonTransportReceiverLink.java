package com.sblite.transport.proton;

import com.sblite.transport.InboundMessage;
import com.sblite.transport.TransportReceiverLink;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonReceiver;
import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.Released;
import org.apache.qpid.proton.amqp.transport.DeliveryState;
import org.apache.qpid.proton.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Receiver link backed by a vertx-proton receiver with prefetch disabled.
 *
 * Deliveries are queued as they arrive on the event loop and taken by the
 * blocking {@link #receive()}. Closing the link, locally or from the peer,
 * queues an end marker so waiting threads return null.
 */
class ProtonTransportReceiverLink implements TransportReceiverLink {

    private static final Logger log = LoggerFactory.getLogger(ProtonTransportReceiverLink.class);

    private static final InboundMessage END_OF_LINK = new ProtonInboundMessage(null, null);

    private final ProtonTransport transport;
    private final ProtonReceiver receiver;
    private final BlockingQueue<InboundMessage> deliveries = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Credit granted and not yet used by a delivery; only touched on the context
    private int outstandingCredit;

    ProtonTransportReceiverLink(ProtonTransport transport, ProtonReceiver receiver) {
        this.transport = transport;
        this.receiver = receiver;
    }

    void onDelivery(ProtonDelivery delivery, Message message) {
        if (outstandingCredit > 0) {
            outstandingCredit--;
        }
        if (closed.get()) {
            log.debug("Dropping delivery on closed link {}", receiver.getName());
            return;
        }
        deliveries.add(new ProtonInboundMessage(delivery, message));
    }

    void onRemoteClose() {
        if (end()) {
            log.info("Link {} closed by peer", receiver.getName());
        }
    }

    /**
     * Set the credit the sender holds, counting deliveries already queued
     * against it.
     */
    @Override
    public void setCredit(int credit) {
        if (closed.get()) {
            return;
        }
        transport.getContext().runOnContext(v -> {
            int missing = credit - outstandingCredit - deliveries.size();
            if (missing > 0 && !closed.get()) {
                outstandingCredit += missing;
                receiver.flow(missing);
            }
        });
    }

    @Override
    public InboundMessage receive() {
        try {
            InboundMessage next = deliveries.take();
            if (next == END_OF_LINK) {
                // Leave the marker for any other waiting thread
                deliveries.add(END_OF_LINK);
                return null;
            }
            return next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @Override
    public void accept(InboundMessage message) {
        settle(message, Accepted.getInstance());
    }

    @Override
    public void release(InboundMessage message) {
        settle(message, Released.getInstance());
    }

    private void settle(InboundMessage message, DeliveryState outcome) {
        if (!(message instanceof ProtonInboundMessage)) {
            throw new IllegalArgumentException("Message was not received on a proton link: " + message);
        }
        if (closed.get()) {
            log.debug("Not settling delivery on closed link {}", receiver.getName());
            return;
        }
        ProtonDelivery delivery = ((ProtonInboundMessage) message).getDelivery();
        transport.getContext().runOnContext(v -> delivery.disposition(outcome, true));
    }

    @Override
    public void close() {
        if (end()) {
            transport.getContext().runOnContext(v -> receiver.close());
        }
    }

    private boolean end() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        deliveries.clear();
        deliveries.add(END_OF_LINK);
        transport.unregister(this);
        return true;
    }

    static class ProtonInboundMessage implements InboundMessage {
        private final ProtonDelivery delivery;
        private final Message message;

        ProtonInboundMessage(ProtonDelivery delivery, Message message) {
            this.delivery = delivery;
            this.message = message;
        }

        ProtonDelivery getDelivery() {
            return delivery;
        }

        @Override
        public byte[] getDeliveryTag() {
            return delivery.getTag();
        }

        @Override
        public Message getMessage() {
            return message;
        }
    }
}
