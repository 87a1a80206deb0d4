package io.simmy.core.bus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous in-process bus. Handlers run on the publishing thread in registration order;
 * a handler that throws is reported on {@link Topics#ERROR} and does not stop its siblings.
 */
public final class InMemoryEventBus implements EventBus {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final Map<String, List<Registration>> handlers = new ConcurrentHashMap<>();

    @Override
    public Subscription subscribe(String topic, EventHandler handler) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        Registration registration = new Registration(handler);
        handlers.computeIfAbsent(topic, ignored -> new CopyOnWriteArrayList<>()).add(registration);
        return () -> {
            if (registration.active.compareAndSet(true, false)) {
                List<Registration> registered = handlers.get(topic);
                if (registered != null) {
                    registered.remove(registration);
                }
            }
        };
    }

    @Override
    public void publish(String topic, Object payload) {
        List<Registration> registered = handlers.get(topic);
        if (registered == null || registered.isEmpty()) {
            return;
        }

        Event event = new Event(topic, payload);
        for (Registration registration : registered) {
            if (!registration.active.get()) {
                continue;
            }
            try {
                registration.handler.onEvent(event);
            } catch (RuntimeException ex) {
                LOG.warn("Handler for topic {} failed", topic, ex);
                if (!Topics.ERROR.equals(topic)) {
                    publish(Topics.ERROR, "Handler for '" + topic + "' failed: " + describe(ex));
                }
            }
        }
    }

    public int subscriberCount(String topic) {
        List<Registration> registered = handlers.get(topic);
        return registered == null ? 0 : registered.size();
    }

    private String describe(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static final class Registration {
        private final EventHandler handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(EventHandler handler) {
            this.handler = handler;
        }
    }
}
