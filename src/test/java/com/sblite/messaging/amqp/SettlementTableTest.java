package com.sblite.messaging.amqp;

import com.sblite.transport.InboundMessage;
import org.apache.qpid.proton.message.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SettlementTableTest {

    private MutableClock clock;
    private SettlementTable table;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        table = new SettlementTable(clock);
    }

    private static InboundMessage inbound(byte... tag) {
        Message message = Message.Factory.create();
        return new InboundMessage() {
            @Override
            public byte[] getDeliveryTag() {
                return tag;
            }

            @Override
            public Message getMessage() {
                return message;
            }
        };
    }

    @Test
    void testLockStoresEntry() {
        InboundMessage message = inbound((byte) 0x01);

        UUID token = table.lock(message);

        assertThat(token).isNotNull();
        assertThat(table.contains(token)).isTrue();
        assertThat(table.size()).isEqualTo(1);
        assertThat(table.tokens()).containsExactly(token);
    }

    @Test
    void testTokenDerivedFromDeliveryTagAndSequence() {
        UUID token = table.lock(inbound((byte) 0x01));

        assertThat(token).isEqualTo(LockTokens.fromDeliveryTag(new byte[]{0x01}, 1));
    }

    @Test
    void testSettledTagReusedGetsFreshToken() {
        UUID first = table.lock(inbound((byte) 0x01));
        table.remove(first);

        UUID second = table.lock(inbound((byte) 0x01));

        assertThat(second).isNotEqualTo(first);
        assertThat(table.remove(first)).isNull();
        assertThat(table.contains(second)).isTrue();
    }

    @Test
    void testCollidingTagStillGetsUniqueToken() {
        UUID first = table.lock(inbound((byte) 0x07));
        UUID second = table.lock(inbound((byte) 0x07));

        assertThat(second).isNotEqualTo(first);
        assertThat(table.tokens()).containsExactlyInAnyOrder(first, second);
    }

    @Test
    void testRemoveIsOneShot() {
        InboundMessage message = inbound((byte) 0x02);
        UUID token = table.lock(message);

        SettlementTable.Entry removed = table.remove(token);

        assertThat(removed).isNotNull();
        assertThat(removed.getMessage()).isSameAs(message);
        assertThat(table.remove(token)).isNull();
        assertThat(table.contains(token)).isFalse();
    }

    @Test
    void testRemoveUnknownOrNullToken() {
        assertThat(table.remove(UUID.randomUUID())).isNull();
        assertThat(table.remove(null)).isNull();
        assertThat(table.contains(null)).isFalse();
    }

    @Test
    void testRemoveExpired() {
        UUID old = table.lock(inbound((byte) 0x01));
        clock.advance(Duration.ofSeconds(40));
        UUID fresh = table.lock(inbound((byte) 0x02));
        clock.advance(Duration.ofSeconds(25));

        List<SettlementTable.Entry> expired = table.removeExpired(Duration.ofSeconds(60));

        assertThat(expired).hasSize(1);
        assertThat(table.contains(old)).isFalse();
        assertThat(table.contains(fresh)).isTrue();
    }

    @Test
    void testDrainEmptiesTable() {
        table.lock(inbound((byte) 0x01));
        table.lock(inbound((byte) 0x02));

        assertThat(table.drain()).hasSize(2);
        assertThat(table.size()).isEqualTo(0);
    }

    @Test
    void testConcurrentRemovalResolvesOnce() throws Exception {
        int tokens = 200;
        List<UUID> locked = new ArrayList<>();
        for (int i = 0; i < tokens; i++) {
            locked.add(table.lock(inbound((byte) i, (byte) (i >> 8))));
        }

        AtomicInteger resolved = new AtomicInteger();
        Set<UUID> seen = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int worker = 0; worker < 4; worker++) {
            executor.submit(() -> {
                start.await();
                for (UUID token : locked) {
                    if (table.remove(token) != null) {
                        resolved.incrementAndGet();
                        assertThat(seen.add(token)).isTrue();
                    }
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(resolved.get()).isEqualTo(tokens);
        assertThat(table.size()).isEqualTo(0);
    }
}
