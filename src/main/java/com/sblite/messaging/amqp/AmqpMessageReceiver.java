package com.sblite.messaging.amqp;

import com.sblite.config.ReceiverConfig;
import com.sblite.messaging.BrokeredMessage;
import com.sblite.messaging.EventData;
import com.sblite.messaging.MessageReceiver;
import com.sblite.messaging.OnMessageAction;
import com.sblite.messaging.OnMessageOptions;
import com.sblite.messaging.ReceiveMode;
import com.sblite.transport.InboundMessage;
import com.sblite.transport.TransportReceiverLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Message receiver for the AMQP protocol.
 *
 * Owns one lazily attached link, shared by {@link #receive()},
 * {@link #receiveEventData()} and the message pump. In peek-lock mode every
 * message handed out is recorded in a {@link SettlementTable} until it is
 * completed or abandoned through its lock token.
 */
public class AmqpMessageReceiver extends MessageReceiver {

    private static final Logger log = LoggerFactory.getLogger(AmqpMessageReceiver.class);

    private final AmqpMessagingFactory factory;
    private final ReceiveMode receiveMode;
    private final ReceiveLinkHandle linkHandle;
    private final SettlementTable settlements;
    private final Duration lockDuration;
    private final long lockSweepIntervalMs;

    private final Object pumpLock = new Object();
    private MessagePump pump;
    private ScheduledExecutorService lockSweeper;

    public AmqpMessageReceiver(AmqpMessagingFactory factory, String path) {
        this(factory, path, ReceiveMode.PEEK_LOCK);
    }

    public AmqpMessageReceiver(AmqpMessagingFactory factory, String path, ReceiveMode receiveMode) {
        this(factory, path, receiveMode, Clock.systemUTC());
    }

    AmqpMessageReceiver(AmqpMessagingFactory factory, String path, ReceiveMode receiveMode, Clock clock) {
        super(path);
        if (receiveMode == null) {
            throw new IllegalArgumentException("Receive mode is required");
        }
        this.factory = factory;
        this.receiveMode = receiveMode;
        this.linkHandle = new ReceiveLinkHandle(factory.getTransport(), path);
        this.settlements = new SettlementTable(clock);

        ReceiverConfig config = factory.getConfig();
        this.lockDuration = config.isLockExpiryEnabled() ? Duration.ofMillis(config.getLockDurationMs()) : null;
        this.lockSweepIntervalMs = config.getLockSweepIntervalMs();
    }

    @Override
    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    @Override
    public void setStartOffset(String startOffset) {
        if (linkHandle.getState() != ReceiverState.UNOPENED) {
            log.warn("Ignoring start offset {} for {}: link is already {}", startOffset, path, linkHandle.getState());
            return;
        }
        super.setStartOffset(startOffset);
    }

    @Override
    public BrokeredMessage receive() {
        checkNotClosed();
        if (!factory.openConnection()) {
            log.debug("Receive on {} skipped: not connected", path);
            return null;
        }

        TransportReceiverLink link = openLink(ReceiveLinkHandle.Addressing.PLAIN);
        link.setCredit(1);
        InboundMessage inbound = link.receive();
        if (inbound == null) {
            return null;
        }
        return deliver(link, inbound);
    }

    @Override
    public EventData receiveEventData() {
        checkNotClosed();
        if (!factory.openConnection()) {
            log.debug("Receive on {} skipped: not connected", path);
            return null;
        }

        TransportReceiverLink link = openLink(ReceiveLinkHandle.Addressing.FILTERED);
        link.setCredit(1);
        InboundMessage inbound = link.receive();
        if (inbound == null || isClosed()) {
            return null;
        }
        link.accept(inbound);
        return new EventData(inbound.getMessage());
    }

    @Override
    public void complete(UUID lockToken) {
        checkNotClosed();
        outcome(lockToken, true);
    }

    @Override
    public void abandon(UUID lockToken) {
        checkNotClosed();
        outcome(lockToken, false);
    }

    @Override
    public void onMessage(OnMessageAction callback, OnMessageOptions options) {
        if (callback == null) {
            throw new IllegalArgumentException("Callback is required");
        }
        OnMessageOptions effective = options != null ? options : new OnMessageOptions();
        checkNotClosed();

        synchronized (pumpLock) {
            if (pump != null) {
                throw new IllegalStateException("A message pump is already registered on " + path);
            }
            if (!factory.openConnection()) {
                log.warn("Message pump for {} not started: not connected", path);
                return;
            }
            TransportReceiverLink link = openLink(ReceiveLinkHandle.Addressing.PLAIN);
            pump = new MessagePump(this, link, callback, effective);
            pump.start();
        }
    }

    @Override
    public boolean isClosed() {
        return linkHandle.getState() == ReceiverState.CLOSED;
    }

    @Override
    public void close() {
        MessagePump activePump;
        synchronized (pumpLock) {
            activePump = pump;
        }
        if (activePump != null) {
            activePump.stop();
        }

        if (!linkHandle.close()) {
            log.debug("Close on {} ignored: link is {}", path, linkHandle.getState());
            return;
        }

        if (activePump != null) {
            activePump.awaitStopped();
        }
        stopLockSweeper();
        int dropped = settlements.drain().size();
        if (dropped > 0) {
            log.info("Receiver {} closed with {} locked message(s); the broker will release them", path, dropped);
        }
        factory.onReceiverClosed(this);
    }

    /**
     * Whether a message pump is registered and running.
     */
    public boolean isPumping() {
        synchronized (pumpLock) {
            return pump != null && pump.isRunning();
        }
    }

    public ReceiverState getState() {
        return linkHandle.getState();
    }

    /**
     * Lock tokens of messages handed out and not yet settled.
     */
    public Set<UUID> getPendingLockTokens() {
        return settlements.tokens();
    }

    public int getPendingCount() {
        return settlements.size();
    }

    /**
     * Settle a newly delivered message according to the receive mode and wrap it.
     *
     * @return the message, or null if the receiver was closed meanwhile
     */
    BrokeredMessage deliver(TransportReceiverLink link, InboundMessage inbound) {
        if (receiveMode == ReceiveMode.PEEK_LOCK) {
            return lock(inbound);
        }
        if (isClosed()) {
            log.debug("Dropping message received on {} after close", path);
            return null;
        }
        link.accept(inbound);
        return new BrokeredMessage(inbound.getMessage());
    }

    /**
     * Record a message in the settlement table and wrap it with its lock token.
     *
     * @return the locked message, or null if the receiver was closed meanwhile
     */
    BrokeredMessage lock(InboundMessage inbound) {
        UUID lockToken = settlements.lock(inbound);
        if (isClosed()) {
            // close() may already have drained the table; the broker releases the message on detach
            settlements.remove(lockToken);
            log.debug("Dropping message received on {} after close", path);
            return null;
        }
        return new BrokeredMessage(inbound.getMessage(), lockToken, this);
    }

    /**
     * Resolve a locked message. The entry is removed before the outcome is
     * sent, so a token is settled at most once.
     */
    void outcome(UUID lockToken, boolean accept) {
        SettlementTable.Entry entry = settlements.remove(lockToken);
        if (entry == null) {
            log.debug("Ignoring {} for unknown lock token {}", accept ? "complete" : "abandon", lockToken);
            return;
        }
        TransportReceiverLink link = linkHandle.getLink();
        if (accept) {
            link.accept(entry.getMessage());
        } else {
            link.release(entry.getMessage());
        }
        log.debug("{} message with lock token {}", accept ? "Completed" : "Abandoned", lockToken);
    }

    /**
     * Release every message locked longer than the configured lock duration.
     */
    void releaseExpiredLocks() {
        TransportReceiverLink link = linkHandle.getLink();
        if (lockDuration == null || link == null || !linkHandle.isOpen()) {
            return;
        }
        for (SettlementTable.Entry entry : settlements.removeExpired(lockDuration)) {
            log.warn("Lock on {} expired after {} (locked at {}), releasing message",
                    path, lockDuration, entry.getLockedAt());
            link.release(entry.getMessage());
        }
    }

    private TransportReceiverLink openLink(ReceiveLinkHandle.Addressing addressing) {
        TransportReceiverLink link = linkHandle.materialize(addressing, startOffset);
        startLockSweeper();
        return link;
    }

    private synchronized void startLockSweeper() {
        if (lockDuration == null || receiveMode != ReceiveMode.PEEK_LOCK || lockSweeper != null) {
            return;
        }
        lockSweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "LockSweeper-" + path);
            t.setDaemon(true);
            return t;
        });
        lockSweeper.scheduleWithFixedDelay(this::releaseExpiredLocks,
                lockSweepIntervalMs, lockSweepIntervalMs, TimeUnit.MILLISECONDS);
        log.debug("Lock sweeper started for {} (lock duration {})", path, lockDuration);
    }

    private synchronized void stopLockSweeper() {
        if (lockSweeper != null) {
            lockSweeper.shutdownNow();
            lockSweeper = null;
        }
    }

    private void checkNotClosed() {
        if (isClosed()) {
            throw new IllegalStateException("Receiver for " + path + " is closed");
        }
    }

    ReceiveLinkHandle getLinkHandle() {
        return linkHandle;
    }

    @Override
    public String toString() {
        return String.format("AmqpMessageReceiver{path='%s', mode=%s, state=%s, pending=%d}",
                path, receiveMode, linkHandle.getState(), settlements.size());
    }
}
