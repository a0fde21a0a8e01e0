package com.eainde.forecast.context;

import com.eainde.forecast.model.TraceEntry;
import com.eainde.forecast.model.TraceEntryType;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only, thread-safe trace of one run.
 */
public class ConversationTrace {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final List<TraceEntry> entries = new ArrayList<>();

    public ConversationTrace(Clock clock) {
        this.clock = clock;
    }

    public TraceEntry append(TraceEntryType type, String step, int attempt, String outcome, String detail) {
        synchronized (entries) {
            TraceEntry entry = new TraceEntry(sequence.incrementAndGet(), clock.instant(), type, step,
                    attempt, outcome, detail);
            entries.add(entry);
            return entry;
        }
    }

    public TraceEntry append(TraceEntryType type, String step, String outcome, String detail) {
        return append(type, step, 0, outcome, detail);
    }

    public List<TraceEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public List<TraceEntry> entries(TraceEntryType type) {
        synchronized (entries) {
            return entries.stream().filter(e -> e.type() == type).toList();
        }
    }

    public long count(TraceEntryType type) {
        synchronized (entries) {
            return entries.stream().filter(e -> e.type() == type).count();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
