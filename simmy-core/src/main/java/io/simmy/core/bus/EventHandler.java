package io.simmy.core.bus;

@FunctionalInterface
public interface EventHandler {
    void onEvent(Event event);
}
