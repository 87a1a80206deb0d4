package io.simmy.core.log;

import io.simmy.core.bus.EventBus;
import io.simmy.core.bus.Subscription;
import io.simmy.core.bus.Topics;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends timestamped plain-text lines to the files of a log directory.
 *
 * <p>Bus handlers run on whichever thread published, so every write goes through one lock.
 */
public final class TranscriptLog {
    public static final String AGENT_LOG = "agent.log";
    public static final String GENERAL_LOG = "general.log";
    public static final String TOOLBOX_LOG = "toolbox.log";
    public static final String THREAD_LOG = "agent.thread";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Map<String, String> FILES_BY_TOPIC = Map.of(
        Topics.AGENT_LOG, AGENT_LOG,
        Topics.GENERAL_LOG, GENERAL_LOG,
        Topics.TOOLBOX_LOG, TOOLBOX_LOG
    );

    private final Path directory;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public TranscriptLog(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public TranscriptLog(Path directory) {
        this(directory, Clock.systemDefaultZone());
    }

    public Path directory() {
        return directory;
    }

    /**
     * Subscribes the {@code *_log} topics. Write failures surface as handler faults on the bus.
     */
    public List<Subscription> attach(EventBus bus) {
        List<Subscription> subscriptions = new ArrayList<>();
        FILES_BY_TOPIC.forEach((topic, file) -> subscriptions.add(bus.subscribe(topic, event -> {
            try {
                append(file, String.valueOf(event.payload()));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + file, e);
            }
        })));
        return subscriptions;
    }

    public void appendThread(String line) throws IOException {
        append(THREAD_LOG, line);
    }

    public void append(String file, String line) throws IOException {
        String entry = LocalDateTime.now(clock).format(TIMESTAMP) + ": " + line + System.lineSeparator();
        lock.lock();
        try {
            Files.createDirectories(directory);
            Files.writeString(
                directory.resolve(file),
                entry,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } finally {
            lock.unlock();
        }
    }

    public void clear(String file) throws IOException {
        lock.lock();
        try {
            Files.createDirectories(directory);
            Files.writeString(
                directory.resolve(file),
                "",
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
            );
        } finally {
            lock.unlock();
        }
    }
}
