package com.sblite.messaging.amqp;

import com.sblite.transport.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Locked (unsettled) messages, keyed by lock token.
 *
 * An entry exists from delivery until the first complete or abandon for its
 * token. Removal is atomic, so concurrent settlement calls for the same token
 * resolve exactly once.
 */
public class SettlementTable {

    private static final Logger log = LoggerFactory.getLogger(SettlementTable.class);

    // Locked messages (by lock token)
    private final Map<UUID, Entry> locked = new ConcurrentHashMap<>();

    // Delivery sequence; mixed into every token so tokens never repeat
    private final AtomicLong sequence = new AtomicLong();

    private final Clock clock;

    public SettlementTable() {
        this(Clock.systemUTC());
    }

    public SettlementTable(Clock clock) {
        this.clock = clock;
    }

    /**
     * Lock a delivered message and return its token.
     *
     * The token is derived from the delivery tag and this table's delivery
     * sequence, so a reused tag still gets a token never handed out before.
     */
    public UUID lock(InboundMessage message) {
        Entry entry = new Entry(message, clock.instant());
        UUID token = LockTokens.fromDeliveryTag(message.getDeliveryTag(), sequence.incrementAndGet());
        while (locked.putIfAbsent(token, entry) != null) {
            log.warn("Lock token {} already pending, minting a random token", token);
            token = UUID.randomUUID();
        }
        log.debug("Locked message under token {}", token);
        return token;
    }

    /**
     * Remove the entry for a token.
     *
     * @return the removed entry, or null if the token is not pending
     */
    public Entry remove(UUID token) {
        if (token == null) {
            return null;
        }
        return locked.remove(token);
    }

    /**
     * Remove every entry locked for longer than the given duration.
     */
    public List<Entry> removeExpired(Duration lockDuration) {
        Instant cutoff = clock.instant().minus(lockDuration);
        List<Entry> expired = new ArrayList<>();
        Iterator<Map.Entry<UUID, Entry>> it = locked.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<UUID, Entry> candidate = it.next();
            if (candidate.getValue().getLockedAt().isBefore(cutoff)
                    && locked.remove(candidate.getKey(), candidate.getValue())) {
                expired.add(candidate.getValue());
            }
        }
        return expired;
    }

    /**
     * Remove and return all entries.
     */
    public List<Entry> drain() {
        List<Entry> drained = new ArrayList<>();
        for (UUID token : new ArrayList<>(locked.keySet())) {
            Entry entry = locked.remove(token);
            if (entry != null) {
                drained.add(entry);
            }
        }
        return drained;
    }

    public boolean contains(UUID token) {
        return token != null && locked.containsKey(token);
    }

    public Set<UUID> tokens() {
        return Collections.unmodifiableSet(locked.keySet());
    }

    public int size() {
        return locked.size();
    }

    /**
     * A locked message.
     */
    public static class Entry {
        private final InboundMessage message;
        private final Instant lockedAt;

        Entry(InboundMessage message, Instant lockedAt) {
            this.message = message;
            this.lockedAt = lockedAt;
        }

        public InboundMessage getMessage() {
            return message;
        }

        public Instant getLockedAt() {
            return lockedAt;
        }
    }
}
