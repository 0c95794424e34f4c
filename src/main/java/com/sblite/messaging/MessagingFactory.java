package com.sblite.messaging;

import com.sblite.config.ReceiverConfig;
import com.sblite.messaging.amqp.AmqpMessagingFactory;
import com.sblite.transport.proton.ProtonTransport;

/**
 * Entry point: owns the connection and creates receivers on it.
 */
public abstract class MessagingFactory implements AutoCloseable {

    protected final ReceiverConfig config;

    protected MessagingFactory(ReceiverConfig config) {
        this.config = config;
    }

    /**
     * Create a factory connecting over AMQP 1.0 with the given configuration.
     * The connection is opened on first use.
     */
    public static MessagingFactory create(ReceiverConfig config) {
        return new AmqpMessagingFactory(new ProtonTransport(config), config);
    }

    public ReceiverConfig getConfig() {
        return config;
    }

    /**
     * Open the connection if it is not open yet.
     *
     * @return true if connected
     */
    public abstract boolean openConnection();

    public abstract boolean isConnected();

    /**
     * Create a receiver using the configured default receive mode.
     */
    public MessageReceiver createReceiver(String path) {
        return createReceiver(path, config.getDefaultReceiveMode());
    }

    public abstract MessageReceiver createReceiver(String path, ReceiveMode receiveMode);

    /**
     * Create a receiver for a position-based stream that starts reading
     * after the given offset. Events are read with
     * {@link MessageReceiver#receiveEventData()}.
     */
    public MessageReceiver createEventHubReceiver(String path, String startOffset) {
        MessageReceiver receiver = createReceiver(path, ReceiveMode.RECEIVE_AND_DELETE);
        receiver.setStartOffset(startOffset);
        return receiver;
    }

    @Override
    public abstract void close();
}
