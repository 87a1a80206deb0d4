package io.simmy.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.simmy.core.agent.ShutdownSignal;
import io.simmy.core.bus.InMemoryEventBus;
import io.simmy.core.bus.Topics;
import io.simmy.core.log.TranscriptLog;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine.Help.Ansi;

class ChatSessionTest {

    @TempDir
    Path tempDir;

    private InMemoryEventBus bus;
    private ShutdownSignal shutdown;
    private TranscriptLog transcriptLog;
    private ConsolePresenter presenter;
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private final List<String> userMessages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus();
        shutdown = new ShutdownSignal();
        shutdown.bridge(bus);
        transcriptLog = new TranscriptLog(tempDir, Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC));
        presenter = new ConsolePresenter(new PrintStream(console, true, StandardCharsets.UTF_8), Ansi.OFF);
        presenter.attach(bus);
        bus.subscribe(Topics.NEW_USER_MESSAGE, String.class, userMessages::add);
    }

    @Test
    void shouldRelayMessagesUntilExit() throws Exception {
        bus.subscribe(Topics.NEW_USER_MESSAGE, String.class,
            text -> bus.publish(Topics.NEW_AGENT_MESSAGE, "You said " + text));

        session("hello\n\n  how are you  \nexit\nnever read\n").run();

        assertThat(userMessages).containsExactly("hello", "how are you");
        assertThat(shutdown.reason()).contains("User exit");
        String output = console.toString(StandardCharsets.UTF_8);
        assertThat(output)
            .startsWith("Simmy: Hello and welcome! My name is Simmy!")
            .contains("You said hello")
            .contains("You said how are you")
            .contains("Simmy: Goodbye!");
        assertThat(Files.readAllLines(tempDir.resolve(TranscriptLog.THREAD_LOG))).containsExactly(
            "2024-01-02 03:04:05: User: hello",
            "2024-01-02 03:04:05: Agent: You said hello",
            "2024-01-02 03:04:05: User: how are you",
            "2024-01-02 03:04:05: Agent: You said how are you"
        );
    }

    @Test
    void shouldContinueAfterAgentError() throws Exception {
        bus.subscribe(Topics.NEW_USER_MESSAGE, String.class,
            text -> bus.publish(Topics.AGENT_ERROR, "Model call failed: offline"));

        session("hello\nexit\n").run();

        assertThat(userMessages).containsExactly("hello");
        assertThat(console.toString(StandardCharsets.UTF_8)).contains("Agent Error: Model call failed: offline");
        assertThat(shutdown.reason()).contains("User exit");
    }

    @Test
    void shouldRequestShutdownAtEndOfInput() throws Exception {
        bus.subscribe(Topics.NEW_USER_MESSAGE, String.class,
            text -> bus.publish(Topics.NEW_AGENT_MESSAGE, "ok"));

        session("hello\n").run();

        assertThat(shutdown.reason()).contains("End of input");
        assertThat(console.toString(StandardCharsets.UTF_8)).doesNotContain("Goodbye!");
    }

    @Test
    void shouldStopWaitingWhenShutdownIsRequested() throws Exception {
        bus.subscribe(Topics.NEW_USER_MESSAGE, String.class, text -> shutdown.request("Signal exit"));

        session("hello\nsecond\n").run();

        assertThat(userMessages).containsExactly("hello");
        assertThat(shutdown.reason()).contains("Signal exit");
    }

    @Test
    void shouldNotMistakeLateReplyForTheNextTurnsReply() throws Exception {
        List<Thread> repliers = new ArrayList<>();
        bus.subscribe(Topics.NEW_USER_MESSAGE, String.class, text -> {
            if (text.equals("fast")) {
                bus.publish(Topics.NEW_AGENT_MESSAGE, "late answer to slow");
                bus.publish(Topics.NEW_AGENT_MESSAGE, "answer to fast");
            } else if (text.equals("third")) {
                Thread replier = new Thread(() -> {
                    try {
                        Thread.sleep(100);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    bus.publish(Topics.NEW_AGENT_MESSAGE, "answer to third");
                });
                repliers.add(replier);
                replier.start();
            }
        });

        session("slow\nfast\nthird\nexit\n", Duration.ofMillis(300)).run();
        for (Thread replier : repliers) {
            replier.join();
        }

        assertThat(Files.readAllLines(tempDir.resolve(TranscriptLog.THREAD_LOG))).containsExactly(
            "2024-01-02 03:04:05: User: slow",
            "2024-01-02 03:04:05: User: fast",
            "2024-01-02 03:04:05: Agent: late answer to slow",
            "2024-01-02 03:04:05: Agent: answer to fast",
            "2024-01-02 03:04:05: User: third",
            "2024-01-02 03:04:05: Agent: answer to third"
        );
    }

    private ChatSession session(String input) {
        return session(input, Duration.ofSeconds(5));
    }

    private ChatSession session(String input, Duration replyTimeout) {
        return new ChatSession(
            new BufferedReader(new StringReader(input)),
            bus,
            shutdown,
            transcriptLog,
            presenter,
            replyTimeout
        );
    }
}
