package com.sblite.transport;

import org.apache.qpid.proton.message.Message;

/**
 * A message delivered on a receiver link, still tied to its delivery.
 */
public interface InboundMessage {

    byte[] getDeliveryTag();

    Message getMessage();
}
