package com.sblite.messaging;

import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.messaging.Data;
import org.apache.qpid.proton.amqp.messaging.MessageAnnotations;
import org.apache.qpid.proton.message.Message;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EventDataTest {

    @Test
    void testStreamPosition() {
        Map<Symbol, Object> annotations = new HashMap<>();
        annotations.put(Symbol.valueOf("x-opt-offset"), "4096");
        annotations.put(Symbol.valueOf("x-opt-sequence-number"), 12L);
        annotations.put(Symbol.valueOf("x-opt-partition-key"), "device-7");
        Message message = Message.Factory.create();
        message.setMessageAnnotations(new MessageAnnotations(annotations));
        message.setBody(new Data(new Binary(new byte[]{1, 2, 3})));

        EventData event = new EventData(message);

        assertThat(event.getOffset()).isEqualTo("4096");
        assertThat(event.getSequenceNumber()).isEqualTo(12L);
        assertThat(event.getPartitionKey()).isEqualTo("device-7");
        assertThat(event.getSystemProperties()).containsKey(Symbol.valueOf("x-opt-offset"));
        assertThat(event.getBytes()).containsExactly(1, 2, 3);
    }

    @Test
    void testNumericOffset() {
        Message message = Message.Factory.create();
        Map<Symbol, Object> annotations = new HashMap<>();
        annotations.put(Symbol.valueOf("x-opt-offset"), 100L);
        message.setMessageAnnotations(new MessageAnnotations(annotations));

        assertThat(new EventData(message).getOffset()).isEqualTo("100");
    }

    @Test
    void testMissingAnnotations() {
        Message message = Message.Factory.create();
        message.setBody(new Data(new Binary("x".getBytes(StandardCharsets.UTF_8))));

        EventData event = new EventData(message);

        assertThat(event.getOffset()).isNull();
        assertThat(event.getSequenceNumber()).isNull();
        assertThat(event.getSystemProperties()).isEmpty();
        assertThat(event.getProperties()).isEmpty();
    }
}
