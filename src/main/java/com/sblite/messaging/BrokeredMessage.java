package com.sblite.messaging;

import org.apache.qpid.proton.message.Message;

import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * Message handed to the application by a {@link MessageReceiver}.
 *
 * Messages received in {@link ReceiveMode#PEEK_LOCK} mode carry a lock token
 * and a reference to the receiver that locked them, so they can be settled
 * with {@link #complete()} or {@link #abandon()}.
 */
public class BrokeredMessage {

    private final Message message;
    private final UUID lockToken;
    private final MessageReceiver receiver;

    /**
     * Message already settled on receipt; it carries no lock token.
     */
    public BrokeredMessage(Message message) {
        this(message, null, null);
    }

    public BrokeredMessage(Message message, UUID lockToken, MessageReceiver receiver) {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        this.message = message;
        this.lockToken = lockToken;
        this.receiver = receiver;
    }

    /**
     * Accept the message on the receiver that locked it.
     *
     * @throws IllegalStateException if the message was not received in peek-lock mode
     */
    public void complete() {
        requireLock().complete(lockToken);
    }

    /**
     * Release the message on the receiver that locked it.
     *
     * @throws IllegalStateException if the message was not received in peek-lock mode
     */
    public void abandon() {
        requireLock().abandon(lockToken);
    }

    private MessageReceiver requireLock() {
        if (lockToken == null || receiver == null) {
            throw new IllegalStateException("Message was not received in peek-lock mode and has no lock token");
        }
        return receiver;
    }

    public boolean isLocked() {
        return lockToken != null;
    }

    public UUID getLockToken() {
        return lockToken;
    }

    public MessageReceiver getReceiver() {
        return receiver;
    }

    /**
     * The underlying protocol message.
     */
    public Message getMessage() {
        return message;
    }

    public Object getMessageId() {
        return message.getMessageId();
    }

    public Object getCorrelationId() {
        return message.getCorrelationId();
    }

    public String getLabel() {
        return message.getSubject();
    }

    public String getContentType() {
        return message.getContentType();
    }

    public String getReplyTo() {
        return message.getReplyTo();
    }

    public long getDeliveryCount() {
        return message.getDeliveryCount();
    }

    public Long getSequenceNumber() {
        return MessageSections.longAnnotation(message, MessageSections.SEQUENCE_NUMBER);
    }

    public Date getEnqueuedTimeUtc() {
        return MessageSections.dateAnnotation(message, MessageSections.ENQUEUED_TIME);
    }

    public Date getLockedUntilUtc() {
        return MessageSections.dateAnnotation(message, MessageSections.LOCKED_UNTIL);
    }

    public Map<String, Object> getProperties() {
        return MessageSections.applicationProperties(message);
    }

    public Object getBody() {
        return MessageSections.bodyValue(message);
    }

    public byte[] getBodyBytes() {
        return MessageSections.bodyBytes(message);
    }

    @Override
    public String toString() {
        return String.format("BrokeredMessage{messageId=%s, lockToken=%s}",
                message.getMessageId(), lockToken);
    }
}
