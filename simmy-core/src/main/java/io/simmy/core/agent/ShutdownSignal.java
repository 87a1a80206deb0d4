package io.simmy.core.agent;

import io.simmy.core.bus.EventBus;
import io.simmy.core.bus.Subscription;
import io.simmy.core.bus.Topics;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot shutdown request shared by the input loop and the agent. The first reason wins.
 */
public final class ShutdownSignal {
    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();

    public boolean request(String why) {
        if (reason.compareAndSet(null, why == null ? "" : why)) {
            latch.countDown();
            return true;
        }
        return false;
    }

    public boolean isRequested() {
        return latch.getCount() == 0;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason.get());
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Turns {@link Topics#EXIT_SIGNAL} publications into shutdown requests.
     */
    public Subscription bridge(EventBus bus) {
        return bus.subscribe(Topics.EXIT_SIGNAL, event -> request(String.valueOf(event.payload())));
    }
}
