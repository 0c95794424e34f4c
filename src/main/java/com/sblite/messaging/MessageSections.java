package com.sblite.messaging;

import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.amqp.messaging.ApplicationProperties;
import org.apache.qpid.proton.amqp.messaging.Data;
import org.apache.qpid.proton.amqp.messaging.MessageAnnotations;
import org.apache.qpid.proton.amqp.messaging.Section;
import org.apache.qpid.proton.message.Message;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Read helpers over the sections of a proton message.
 */
final class MessageSections {

    static final Symbol OFFSET = Symbol.valueOf("x-opt-offset");
    static final Symbol SEQUENCE_NUMBER = Symbol.valueOf("x-opt-sequence-number");
    static final Symbol ENQUEUED_TIME = Symbol.valueOf("x-opt-enqueued-time");
    static final Symbol PARTITION_KEY = Symbol.valueOf("x-opt-partition-key");
    static final Symbol LOCKED_UNTIL = Symbol.valueOf("x-opt-locked-until");

    private MessageSections() {
    }

    static Object annotation(Message message, Symbol key) {
        MessageAnnotations annotations = message.getMessageAnnotations();
        if (annotations == null || annotations.getValue() == null) {
            return null;
        }
        return annotations.getValue().get(key);
    }

    static Long longAnnotation(Message message, Symbol key) {
        Object value = annotation(message, key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            return Long.parseLong((String) value);
        }
        return null;
    }

    static Date dateAnnotation(Message message, Symbol key) {
        Object value = annotation(message, key);
        if (value instanceof Date) {
            return (Date) value;
        }
        if (value instanceof Number) {
            return new Date(((Number) value).longValue());
        }
        return null;
    }

    /**
     * Application properties as a mutable copy; never null.
     */
    static Map<String, Object> applicationProperties(Message message) {
        ApplicationProperties properties = message.getApplicationProperties();
        if (properties == null || properties.getValue() == null) {
            return new HashMap<>();
        }
        return new HashMap<>(properties.getValue());
    }

    static Map<Symbol, Object> annotations(Message message) {
        MessageAnnotations annotations = message.getMessageAnnotations();
        if (annotations == null || annotations.getValue() == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(annotations.getValue());
    }

    /**
     * Body value: the raw value of an amqp-value section, the bytes of a
     * data section, or null.
     */
    static Object bodyValue(Message message) {
        Section body = message.getBody();
        if (body instanceof AmqpValue) {
            return ((AmqpValue) body).getValue();
        }
        if (body instanceof Data) {
            return toBytes(((Data) body).getValue());
        }
        return null;
    }

    /**
     * Body as bytes. Strings are encoded as UTF-8.
     */
    static byte[] bodyBytes(Message message) {
        Object value = bodyValue(message);
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (value instanceof Binary) {
            return toBytes((Binary) value);
        }
        if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }
        return new byte[0];
    }

    private static byte[] toBytes(Binary binary) {
        if (binary == null) {
            return new byte[0];
        }
        byte[] bytes = new byte[binary.getLength()];
        System.arraycopy(binary.getArray(), binary.getArrayOffset(), bytes, 0, binary.getLength());
        return bytes;
    }
}
