package com.sblite.messaging;

/**
 * Callback invoked by a message pump for every delivered message.
 */
@FunctionalInterface
public interface OnMessageAction {

    void onMessage(BrokeredMessage message);
}
