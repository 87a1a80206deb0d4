package io.simmy.core.bus;

import java.util.function.Consumer;

public interface EventBus {
    Subscription subscribe(String topic, EventHandler handler);

    void publish(String topic, Object payload);

    default <T> Subscription subscribe(String topic, Class<T> payloadType, Consumer<? super T> consumer) {
        return subscribe(topic, event -> consumer.accept(event.payload(payloadType)));
    }
}
