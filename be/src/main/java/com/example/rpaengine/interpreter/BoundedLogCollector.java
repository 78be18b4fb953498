package com.example.rpaengine.interpreter;

import com.example.rpaengine.graph.LogLevel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent {@code capacity} events of a run; older ones are dropped.
 * Safe to read from another thread while the run is writing.
 */
public class BoundedLogCollector implements ExecutionListener {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<LogEvent> events = new ArrayDeque<>();
    private long total;

    public BoundedLogCollector() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedLogCollector(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void onLog(LogEvent event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
        total++;
    }

    public synchronized List<LogEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Messages of the retained events produced by Log activities at any level.
     */
    public synchronized List<String> logMessages() {
        return events.stream().filter(e -> "LOG".equals(e.activity())).map(LogEvent::message).toList();
    }

    public synchronized List<LogEvent> atLevel(LogLevel level) {
        return events.stream().filter(e -> e.level() == level).toList();
    }

    public synchronized long total() {
        return total;
    }
}
