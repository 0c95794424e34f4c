package com.sblite.messaging.amqp;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Derives lock tokens from delivery tags.
 *
 * A sender may reuse a delivery tag once the earlier delivery is settled, so
 * the tag alone does not identify a lock. The token is a name-based UUID over
 * the tag followed by the receiver's delivery sequence number, which never
 * repeats for the lifetime of a receiver.
 */
final class LockTokens {

    private LockTokens() {
    }

    static UUID fromDeliveryTag(byte[] deliveryTag, long sequence) {
        byte[] tag = deliveryTag != null ? deliveryTag : new byte[0];
        ByteBuffer name = ByteBuffer.allocate(tag.length + Long.BYTES);
        name.put(tag).putLong(sequence);
        return UUID.nameUUIDFromBytes(name.array());
    }
}
