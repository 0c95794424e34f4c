package com.sblite.messaging;

/**
 * Options for a message pump registration.
 */
public class OnMessageOptions {

    private boolean autoComplete = true;
    private int maxConcurrentCalls = 1;
    private Thread.UncaughtExceptionHandler exceptionHandler;

    public boolean isAutoComplete() {
        return autoComplete;
    }

    /**
     * When true the pump completes each message after the callback returns,
     * whether or not the callback settled it.
     */
    public OnMessageOptions setAutoComplete(boolean autoComplete) {
        this.autoComplete = autoComplete;
        return this;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    /**
     * Only a single in-flight callback is supported.
     *
     * @throws IllegalArgumentException for any value other than 1
     */
    public OnMessageOptions setMaxConcurrentCalls(int maxConcurrentCalls) {
        if (maxConcurrentCalls != 1) {
            throw new IllegalArgumentException(
                    "maxConcurrentCalls must be 1, was " + maxConcurrentCalls);
        }
        this.maxConcurrentCalls = maxConcurrentCalls;
        return this;
    }

    public Thread.UncaughtExceptionHandler getExceptionHandler() {
        return exceptionHandler;
    }

    /**
     * Handler for faults thrown by the callback. The pump stops after a fault;
     * when no handler is set the JVM default applies.
     */
    public OnMessageOptions setExceptionHandler(Thread.UncaughtExceptionHandler exceptionHandler) {
        this.exceptionHandler = exceptionHandler;
        return this;
    }

    @Override
    public String toString() {
        return String.format("OnMessageOptions{autoComplete=%s, maxConcurrentCalls=%d}",
                autoComplete, maxConcurrentCalls);
    }
}
