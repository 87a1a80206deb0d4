package io.simmy.core.bus;

import java.util.Objects;

public record Event(String topic, Object payload) {

    public Event {
        Objects.requireNonNull(topic, "topic must not be null");
    }

    public <T> T payload(Class<T> type) {
        if (payload != null && !type.isInstance(payload)) {
            throw new ClassCastException(
                "Payload on '" + topic + "' is " + payload.getClass().getSimpleName() + ", expected " + type.getSimpleName()
            );
        }
        return type.cast(payload);
    }
}
