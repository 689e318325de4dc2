package logfanout.dispatch;

import logfanout.Await;
import logfanout.CountingMetrics;
import logfanout.LogEntry;
import logfanout.LogLevel;
import logfanout.RecordingOutput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchHookTest {

    private final CountingMetrics metrics = new CountingMetrics();
    private final DispatchHook hook = new DispatchHook(metrics);
    private final List<QueuedOutput> opened = new ArrayList<>();

    @AfterEach
    void closeOutputs() throws IOException {
        for (QueuedOutput output : opened) {
            output.close();
        }
    }

    private OutputRoute route(String id, RecordingOutput output, LogLevel filter) {
        QueuedOutput queued = new QueuedOutput(id, output, 100, 1000, metrics, hook);
        opened.add(queued);
        return new OutputRoute(id, id, queued, filter);
    }

    @Test
    void emptySnapshotDropsNothingAndCountsNothing() {
        hook.fire(LogEntry.of(LogLevel.ERROR, "nobody listens", null));
        assertEquals(0, metrics.enqueued.get());
        assertEquals(0, metrics.dropped.get());
    }

    @Test
    void routesByFilterLevel() {
        RecordingOutput all = new RecordingOutput();
        RecordingOutput errors = new RecordingOutput();
        hook.updateSnapshot(DispatchSnapshot.of(List.of(
                route("all", all, LogLevel.DEBUG),
                route("errors", errors, LogLevel.ERROR))));

        hook.fire(LogEntry.of(LogLevel.INFO, "info", null));
        hook.fire(LogEntry.of(LogLevel.FATAL, "fatal", null));

        Await.until(() -> all.entries().size() == 2 && errors.entries().size() == 1, 5000,
                "routed entries");
        assertEquals("fatal", errors.entries().get(0).message());
        assertEquals(3, metrics.enqueued.get());
    }

    @Test
    void sameEntryInstanceIsSharedAcrossOutputs() {
        RecordingOutput a = new RecordingOutput();
        RecordingOutput b = new RecordingOutput();
        hook.updateSnapshot(DispatchSnapshot.of(List.of(
                route("a", a, LogLevel.DEBUG), route("b", b, LogLevel.DEBUG))));

        LogEntry entry = LogEntry.of(LogLevel.INFO, "shared", Map.of("k", "v"));
        hook.fire(entry);

        Await.until(() -> a.entries().size() == 1 && b.entries().size() == 1, 5000, "delivery");
        assertSame(entry, a.entries().get(0));
        assertSame(entry, b.entries().get(0));
    }

    @Test
    void publishConvertsJulRecords() {
        RecordingOutput out = new RecordingOutput();
        hook.updateSnapshot(DispatchSnapshot.of(List.of(route("t", out, LogLevel.DEBUG))));

        LogRecord record = new LogRecord(Level.WARNING, "bucket {0} over quota");
        record.setLoggerName("storage.Quota");
        record.setParameters(new Object[] {Map.of("bucket", "photos")});
        record.setThrown(new IllegalStateException("quota"));
        hook.publish(record);

        Await.until(() -> out.entries().size() == 1, 5000, "published record");
        LogEntry entry = out.entries().get(0);
        assertEquals(LogLevel.WARN, entry.level());
        assertEquals("photos", entry.fields().get("bucket"));
        assertEquals("storage.Quota", entry.fields().get("logger"));
        assertEquals("java.lang.IllegalStateException: quota", entry.fields().get("error"));
        assertEquals(record.getInstant(), entry.timestamp());
        assertTrue(entry.message().startsWith("bucket "));
    }

    @Test
    void outputLoggersAreNotForwarded() {
        RecordingOutput out = new RecordingOutput();
        hook.updateSnapshot(DispatchSnapshot.of(List.of(route("t", out, LogLevel.DEBUG))));

        LogRecord internal = new LogRecord(Level.SEVERE, "send failed");
        internal.setLoggerName("logfanout.output.HttpOutput");
        hook.publish(internal);
        hook.publish(new LogRecord(Level.INFO, "visible"));

        Await.until(() -> out.entries().size() == 1, 5000, "visible record");
        assertEquals("visible", out.entries().get(0).message());
    }

    @Test
    void closeDetachesAllRoutes() {
        RecordingOutput out = new RecordingOutput();
        hook.updateSnapshot(DispatchSnapshot.of(List.of(route("t", out, LogLevel.DEBUG))));
        hook.close();

        assertTrue(hook.snapshot().isEmpty());
        hook.fire(LogEntry.of(LogLevel.ERROR, "after close", null));
        assertEquals(0, metrics.enqueued.get());
    }

    @Test
    void snapshotIsOrderedByName() {
        OutputRoute b = route("2", new RecordingOutput(), LogLevel.DEBUG);
        OutputRoute a = new OutputRoute("1", "alpha", b.output(), LogLevel.DEBUG);
        OutputRoute z = new OutputRoute("3", "zulu", b.output(), LogLevel.DEBUG);
        DispatchSnapshot snapshot = DispatchSnapshot.of(List.of(z, a));
        assertEquals("alpha", snapshot.routes().get(0).targetName());
        assertEquals(2, snapshot.size());
    }
}
