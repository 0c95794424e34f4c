package com.sblite.messaging.amqp;

import com.sblite.config.ReceiverConfig;
import com.sblite.messaging.MessagingFactory;
import com.sblite.messaging.ReceiveMode;
import com.sblite.transport.AmqpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Messaging factory for the AMQP protocol.
 */
public class AmqpMessagingFactory extends MessagingFactory {

    private static final Logger log = LoggerFactory.getLogger(AmqpMessagingFactory.class);

    private final AmqpTransport transport;

    // Receivers created by this factory and not yet closed
    private final Set<AmqpMessageReceiver> receivers = ConcurrentHashMap.newKeySet();

    public AmqpMessagingFactory(AmqpTransport transport, ReceiverConfig config) {
        super(config);
        this.transport = transport;
    }

    @Override
    public boolean openConnection() {
        if (transport.isOpen()) {
            return true;
        }
        boolean opened = transport.open();
        if (!opened) {
            log.warn("Could not open connection to {}:{}", config.getHost(), config.getPort());
        }
        return opened;
    }

    @Override
    public boolean isConnected() {
        return transport.isOpen();
    }

    @Override
    public AmqpMessageReceiver createReceiver(String path) {
        return createReceiver(path, config.getDefaultReceiveMode());
    }

    @Override
    public AmqpMessageReceiver createReceiver(String path, ReceiveMode receiveMode) {
        AmqpMessageReceiver receiver = new AmqpMessageReceiver(this, path, receiveMode);
        receivers.add(receiver);
        log.debug("Created {} receiver for {}", receiveMode, path);
        return receiver;
    }

    /**
     * Close every receiver created here, then the connection.
     */
    @Override
    public void close() {
        for (AmqpMessageReceiver receiver : new ArrayList<>(receivers)) {
            try {
                receiver.close();
            } catch (RuntimeException e) {
                log.warn("Error closing receiver for {}", receiver.getPath(), e);
            }
        }
        receivers.clear();
        transport.close();
        log.info("Messaging factory for {}:{} closed", config.getHost(), config.getPort());
    }

    void onReceiverClosed(AmqpMessageReceiver receiver) {
        receivers.remove(receiver);
    }

    AmqpTransport getTransport() {
        return transport;
    }
}
