package io.certregistry.core.event;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, sequence-numbered tail of recent events for external observers.
 * Sequence numbers start at 1 and never repeat; old entries fall off the front.
 */
public final class EventJournal implements RegistryEventListener {

    public record Entry(long sequence, long recordedAt, RegistryEvent event) {}

    private final Deque<Entry> entries = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;
    private long lastSequence;

    public EventJournal(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public EventJournal(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Journal capacity must be > 0");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    @Override
    public synchronized void onEvent(RegistryEvent event) {
        entries.addLast(new Entry(++lastSequence, clock.millis(), event));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /** Entries with a sequence greater than {@code after}, oldest first. */
    public synchronized List<Entry> since(long after) {
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.sequence() > after) {
                out.add(e);
            }
        }
        return out;
    }

    public synchronized long lastSequence() {
        return lastSequence;
    }

    public synchronized int size() {
        return entries.size();
    }
}
