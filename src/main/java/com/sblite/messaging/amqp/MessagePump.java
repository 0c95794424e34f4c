package com.sblite.messaging.amqp;

import com.sblite.messaging.BrokeredMessage;
import com.sblite.messaging.OnMessageAction;
import com.sblite.messaging.OnMessageOptions;
import com.sblite.messaging.ReceiveMode;
import com.sblite.transport.InboundMessage;
import com.sblite.transport.TransportReceiverLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers messages from a receiver's link to a registered callback.
 *
 * Runs a dedicated delivery thread that grants one credit, waits for the
 * message, hands it to the callback and only then grants the next credit,
 * so at most one message is in flight. The pump settles only when
 * auto-complete is on, and only after the callback. A fault thrown by the callback is not
 * caught: it ends the delivery thread and reaches its uncaught exception
 * handler.
 */
class MessagePump implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MessagePump.class);

    private static final long STOP_TIMEOUT_MS = 5000;

    private final AmqpMessageReceiver receiver;
    private final TransportReceiverLink link;
    private final OnMessageAction callback;
    private final OnMessageOptions options;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Thread thread;

    MessagePump(AmqpMessageReceiver receiver, TransportReceiverLink link,
                OnMessageAction callback, OnMessageOptions options) {
        this.receiver = receiver;
        this.link = link;
        this.callback = callback;
        this.options = options;
        this.thread = new Thread(this, "MessagePump-" + receiver.getPath());
        this.thread.setDaemon(true);
        if (options.getExceptionHandler() != null) {
            this.thread.setUncaughtExceptionHandler(options.getExceptionHandler());
        }
    }

    void start() {
        if (running.compareAndSet(false, true)) {
            thread.start();
            log.info("Message pump started for {} ({})", receiver.getPath(), options);
        }
    }

    /**
     * Stop granting credit. A thread waiting for a message is only released
     * once the link is closed.
     */
    void stop() {
        running.set(false);
    }

    /**
     * Wait for the delivery thread to end; returns at once when called from it.
     */
    void awaitStopped() {
        if (Thread.currentThread() == thread) {
            return;
        }
        try {
            thread.join(STOP_TIMEOUT_MS);
            if (thread.isAlive()) {
                log.warn("Message pump for {} did not stop within {} ms", receiver.getPath(), STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isRunning() {
        return running.get();
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                link.setCredit(1);
                InboundMessage inbound = link.receive();
                if (inbound == null) {
                    log.debug("Link for {} closed, message pump exiting", receiver.getPath());
                    break;
                }
                if (!dispatch(inbound)) {
                    break;
                }
            }
        } finally {
            running.set(false);
            log.info("Message pump stopped for {}", receiver.getPath());
        }
    }

    /**
     * Hand one message to the callback. With auto-complete the message is
     * accepted once the callback is done, even when it threw; in peek-lock
     * mode this is a no-op if the callback already settled it.
     *
     * @return false if the receiver closed before the message could be locked
     */
    private boolean dispatch(InboundMessage inbound) {
        boolean peekLock = receiver.getReceiveMode() == ReceiveMode.PEEK_LOCK;
        BrokeredMessage message = peekLock ? receiver.lock(inbound) : new BrokeredMessage(inbound.getMessage());
        if (message == null) {
            return false;
        }
        try {
            callback.onMessage(message);
        } finally {
            if (options.isAutoComplete()) {
                if (peekLock) {
                    receiver.outcome(message.getLockToken(), true);
                } else {
                    link.accept(inbound);
                }
            }
        }
        return true;
    }
}
