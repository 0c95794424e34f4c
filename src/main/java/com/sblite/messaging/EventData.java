package com.sblite.messaging;

import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.message.Message;

import java.util.Date;
import java.util.Map;

/**
 * Event read from a position-based stream (an event hub partition).
 * Events are accepted on receipt and carry their stream position in the
 * message annotations.
 */
public class EventData {

    private final Message message;

    public EventData(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        this.message = message;
    }

    public Message getMessage() {
        return message;
    }

    /**
     * Stream offset of this event; pass it back as a start offset to resume after it.
     */
    public String getOffset() {
        Object offset = MessageSections.annotation(message, MessageSections.OFFSET);
        return offset != null ? offset.toString() : null;
    }

    public Long getSequenceNumber() {
        return MessageSections.longAnnotation(message, MessageSections.SEQUENCE_NUMBER);
    }

    public Date getEnqueuedTimeUtc() {
        return MessageSections.dateAnnotation(message, MessageSections.ENQUEUED_TIME);
    }

    public String getPartitionKey() {
        Object key = MessageSections.annotation(message, MessageSections.PARTITION_KEY);
        return key != null ? key.toString() : null;
    }

    public Map<Symbol, Object> getSystemProperties() {
        return MessageSections.annotations(message);
    }

    public Map<String, Object> getProperties() {
        return MessageSections.applicationProperties(message);
    }

    public byte[] getBytes() {
        return MessageSections.bodyBytes(message);
    }

    @Override
    public String toString() {
        return String.format("EventData{offset=%s, sequenceNumber=%s}", getOffset(), getSequenceNumber());
    }
}
