package com.sblite.messaging;

import java.util.UUID;

/**
 * Receives messages from a single entity (queue, subscription or partition).
 *
 * Messages can be pulled one at a time with {@link #receive()} or pushed to a
 * callback registered with {@link #onMessage(OnMessageAction, OnMessageOptions)}.
 * In {@link ReceiveMode#PEEK_LOCK} mode every message carries a lock token that
 * must be passed back to {@link #complete(UUID)} or {@link #abandon(UUID)}.
 */
public abstract class MessageReceiver implements AutoCloseable {

    protected final String path;

    protected volatile String startOffset;

    protected MessageReceiver(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Entity path is required");
        }
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public String getStartOffset() {
        return startOffset;
    }

    /**
     * Set the point after which {@link #receiveEventData()} starts reading.
     * Only honoured before the receiver opens its link.
     */
    public void setStartOffset(String startOffset) {
        this.startOffset = startOffset;
    }

    public abstract ReceiveMode getReceiveMode();

    /**
     * Receive the next message, blocking until one arrives.
     *
     * @return the message, or null if no connection could be made or the
     *         link was closed while waiting
     */
    public abstract BrokeredMessage receive();

    /**
     * Receive the next event from a position-based stream. The message is
     * accepted on arrival.
     *
     * @return the event, or null if no connection could be made or the
     *         link was closed while waiting
     */
    public abstract EventData receiveEventData();

    /**
     * Accept the locked message identified by the token. Unknown tokens are ignored.
     */
    public abstract void complete(UUID lockToken);

    /**
     * Release the locked message identified by the token so it can be
     * redelivered. Unknown tokens are ignored.
     */
    public abstract void abandon(UUID lockToken);

    /**
     * Start a message pump delivering every message to the callback.
     */
    public abstract void onMessage(OnMessageAction callback, OnMessageOptions options);

    public abstract boolean isClosed();

    @Override
    public abstract void close();
}
