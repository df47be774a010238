package com.streamity.telemetry.scenarios;

import com.streamity.telemetry.ingest.ErrorIngestionService;
import com.streamity.telemetry.metrics.MetricsRegistry;
import com.streamity.telemetry.store.LogCategory;
import com.streamity.telemetry.store.LogEntryReader;
import com.streamity.telemetry.store.LogStore;
import com.streamity.telemetry.store.ParsedLogEntry;
import com.streamity.telemetry.testutil.MutableClock;
import com.streamity.telemetry.testutil.TestFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.streamity.telemetry.testutil.TestFactory.BASE;

public class TestLogRotation {

    @TempDir
    Path dir;

    @Test
    public void testOversizeLogIsRotatedOnceAndNothingIsLost() throws Exception {
        MutableClock clock = new MutableClock(BASE);
        MetricsRegistry metrics = new MetricsRegistry();
        LogStore store = TestFactory.logStore(dir, 1024, clock, metrics);
        ErrorIngestionService service = TestFactory.ingestionService(
                store, TestFactory.rateLimiter(clock, 100), clock, metrics, false);

        Path active = store.activeFile(LogCategory.APPLICATION);
        int sent = 0;
        while (!Files.exists(active) || Files.size(active) <= 1024) {
            Assertions.assertTrue(service.ingest(TestFactory.report("fill " + sent, "app.js", "rotation"), "10.0.0.1")
                    .isAccepted());
            sent++;
        }
        Assertions.assertEquals(0, metrics.snapshot().logRotations());

        Assertions.assertTrue(service.ingest(TestFactory.report("after", "app.js", "rotation"), "10.0.0.1")
                .isAccepted());
        sent++;

        Assertions.assertEquals(1, metrics.snapshot().logRotations(), "exactly one rotation");

        List<Path> rotated;
        try (Stream<Path> files = Files.list(dir)) {
            rotated = files.filter(p -> p.getFileName().toString().endsWith(".old")).collect(Collectors.toList());
        }
        Assertions.assertEquals(1, rotated.size());

        List<ParsedLogEntry> old = LogEntryReader.read(rotated.get(0));
        List<ParsedLogEntry> current = LogEntryReader.read(active);

        Assertions.assertEquals("INFO", current.get(0).level());
        Assertions.assertTrue(current.get(0).message().startsWith("Log file rotated to: "));
        Assertions.assertEquals("after", current.get(1).field("Message"));

        long clientEntries = Stream.concat(old.stream(), current.stream()).filter(ParsedLogEntry::isClientError).count();
        Assertions.assertEquals(sent, clientEntries, "every accepted report is in exactly one file");
    }
}
