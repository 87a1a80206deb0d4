package io.simmy.core.bus;

/**
 * Handle returned by {@link EventBus#subscribe}. Unsubscribing more than once has no effect.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
