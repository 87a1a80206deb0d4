package io.simmy.core.log;

import static org.assertj.core.api.Assertions.assertThat;

import io.simmy.core.bus.InMemoryEventBus;
import io.simmy.core.bus.Topics;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptLogTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @Test
    void shouldWriteTimestampedLinesPerTopic() throws Exception {
        InMemoryEventBus bus = new InMemoryEventBus();
        TranscriptLog log = new TranscriptLog(tempDir.resolve("logs"), clock);
        log.attach(bus);

        bus.publish(Topics.AGENT_LOG, "User: hi");
        bus.publish(Topics.TOOLBOX_LOG, "Calling scraper");
        bus.publish(Topics.GENERAL_LOG, "started");
        bus.publish(Topics.AGENT_LOG, "Agent replied");

        Path dir = tempDir.resolve("logs");
        assertThat(Files.readAllLines(dir.resolve(TranscriptLog.AGENT_LOG)))
            .containsExactly("2024-03-05 14:07:09: User: hi", "2024-03-05 14:07:09: Agent replied");
        assertThat(Files.readAllLines(dir.resolve(TranscriptLog.TOOLBOX_LOG)))
            .containsExactly("2024-03-05 14:07:09: Calling scraper");
        assertThat(Files.readAllLines(dir.resolve(TranscriptLog.GENERAL_LOG)))
            .containsExactly("2024-03-05 14:07:09: started");
    }

    @Test
    void shouldClearFiles() throws Exception {
        TranscriptLog log = new TranscriptLog(tempDir, clock);
        log.appendThread("User: one");
        log.appendThread("Simmy: two");

        log.clear(TranscriptLog.THREAD_LOG);
        log.appendThread("User: three");

        List<String> lines = Files.readAllLines(tempDir.resolve(TranscriptLog.THREAD_LOG));
        assertThat(lines).containsExactly("2024-03-05 14:07:09: User: three");
    }

    @Test
    void shouldStopWritingAfterUnsubscribe() throws Exception {
        InMemoryEventBus bus = new InMemoryEventBus();
        TranscriptLog log = new TranscriptLog(tempDir, clock);
        log.attach(bus).forEach(subscription -> subscription.unsubscribe());

        bus.publish(Topics.AGENT_LOG, "ignored");

        assertThat(Files.exists(tempDir.resolve(TranscriptLog.AGENT_LOG))).isFalse();
    }

    @Test
    void shouldKeepLinesWholeWhenPublishersRunConcurrently() throws Exception {
        InMemoryEventBus bus = new InMemoryEventBus();
        TranscriptLog log = new TranscriptLog(tempDir, clock);
        log.attach(bus);
        int writers = 6;
        int linesPerWriter = 200;
        String padding = "x".repeat(512);

        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int writer = 0; writer < writers; writer++) {
                int id = writer;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < linesPerWriter; i++) {
                        bus.publish(Topics.AGENT_LOG, "writer-" + id + " line-" + i + " " + padding);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<String> lines = Files.readAllLines(tempDir.resolve(TranscriptLog.AGENT_LOG));
        assertThat(lines).hasSize(writers * linesPerWriter);
        assertThat(lines).allMatch(line -> line.matches("2024-03-05 14:07:09: writer-\\d+ line-\\d+ x{512}"));
        assertThat(lines).doesNotHaveDuplicates();
    }
}
