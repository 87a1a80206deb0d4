package io.simmy.cli;

import io.simmy.core.agent.ShutdownSignal;
import io.simmy.core.bus.EventBus;
import io.simmy.core.bus.Subscription;
import io.simmy.core.bus.Topics;
import io.simmy.core.log.TranscriptLog;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive input loop. Each line is published as a user message and the loop waits for the
 * agent's reply (or an agent error) before prompting again.
 */
public final class ChatSession {
    private static final Logger LOG = LoggerFactory.getLogger(ChatSession.class);
    private static final long POLL_MILLIS = 200;

    private final BufferedReader in;
    private final EventBus bus;
    private final ShutdownSignal shutdown;
    private final TranscriptLog transcriptLog;
    private final ConsolePresenter presenter;
    private final Duration replyTimeout;
    private final Semaphore turnFinished = new Semaphore(0);
    // replies still owed for turns that timed out; they arrive ahead of the current turn's reply
    private int overdueReplies;

    public ChatSession(
        BufferedReader in,
        EventBus bus,
        ShutdownSignal shutdown,
        TranscriptLog transcriptLog,
        ConsolePresenter presenter,
        Duration replyTimeout
    ) {
        this.in = in;
        this.bus = bus;
        this.shutdown = shutdown;
        this.transcriptLog = transcriptLog;
        this.presenter = presenter;
        this.replyTimeout = replyTimeout;
    }

    public void run() throws IOException {
        List<Subscription> subscriptions = List.of(
            bus.subscribe(Topics.NEW_AGENT_MESSAGE, String.class, this::onAgentMessage),
            bus.subscribe(Topics.AGENT_ERROR, event -> turnFinished.release())
        );
        try {
            presenter.greet();
            while (!shutdown.isRequested()) {
                presenter.prompt();
                String line = in.readLine();
                if (line == null) {
                    shutdown.request("End of input");
                    break;
                }
                String text = line.trim();
                if (text.isEmpty()) {
                    continue;
                }
                if (text.equalsIgnoreCase("exit")) {
                    presenter.goodbye();
                    bus.publish(Topics.EXIT_SIGNAL, "User exit");
                    break;
                }
                transcriptLog.appendThread("User: " + text);
                bus.publish(Topics.NEW_USER_MESSAGE, text);
                awaitTurn();
            }
        } finally {
            subscriptions.forEach(Subscription::unsubscribe);
        }
    }

    private void onAgentMessage(String message) {
        try {
            transcriptLog.appendThread("Agent: " + message);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write conversation thread", e);
        } finally {
            turnFinished.release();
        }
    }

    private void awaitTurn() {
        int expected = overdueReplies + 1;
        long deadline = System.nanoTime() + replyTimeout.toNanos();
        try {
            while (!shutdown.isRequested()) {
                if (turnFinished.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    expected--;
                    if (expected == 0) {
                        overdueReplies = 0;
                        return;
                    }
                    continue;
                }
                if (System.nanoTime() > deadline) {
                    LOG.warn("No reply within {}", replyTimeout);
                    overdueReplies = expected;
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown.request("Interrupted");
        }
    }
}
