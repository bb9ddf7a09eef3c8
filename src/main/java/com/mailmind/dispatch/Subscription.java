package com.mailmind.dispatch;

/**
 * Handle returned by {@link BatchDispatcher#subscribe}; closing it removes the listener.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
