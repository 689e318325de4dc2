package logfanout;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Output that keeps every entry in memory and counts close calls.
 */
public final class RecordingOutput implements Output {
    private final List<LogEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile IOException failure;

    public void failWith(IOException failure) {
        this.failure = failure;
    }

    @Override
    public void write(LogEntry entry) throws IOException {
        if (failure != null) {
            throw failure;
        }
        entries.add(entry);
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public List<LogEntry> entries() {
        return entries;
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    public int closeCount() {
        return closeCount.get();
    }
}
