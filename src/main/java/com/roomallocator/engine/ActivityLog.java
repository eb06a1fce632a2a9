package com.roomallocator.engine;

import com.roomallocator.model.ActivityEntry;
import com.roomallocator.model.LogCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, append-only record of what the engine did. Once the capacity is
 * reached the oldest entry is dropped for every new one.
 * Every entry is also written to the application log.
 */
public class ActivityLog {
    private static final Logger logger = LoggerFactory.getLogger(ActivityLog.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Clock clock;
    // Oldest entry first
    private final Deque<ActivityEntry> entries = new ArrayDeque<>();

    public ActivityLog() {
        this(DEFAULT_CAPACITY, Clock.systemDefaultZone());
    }

    public ActivityLog(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Activity log capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void info(String message) {
        record(LogCategory.INFO, message);
    }

    public void success(String message) {
        record(LogCategory.SUCCESS, message);
    }

    public void error(String message) {
        record(LogCategory.ERROR, message);
    }

    public synchronized ActivityEntry record(LogCategory category, String message) {
        ActivityEntry entry = new ActivityEntry(category, message, LocalDateTime.now(clock));
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        if (category == LogCategory.ERROR) {
            logger.warn("{}", message);
        } else {
            logger.info("[{}] {}", category.getLabel(), message);
        }
        return entry;
    }

    /**
     * @return all entries, most recent first
     */
    public synchronized List<ActivityEntry> readAll() {
        List<ActivityEntry> result = new ArrayList<>(entries.size());
        Iterator<ActivityEntry> it = entries.descendingIterator();
        while (it.hasNext()) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * @return entries of one category, most recent first
     */
    public synchronized List<ActivityEntry> readAll(LogCategory category) {
        List<ActivityEntry> result = new ArrayList<>();
        Iterator<ActivityEntry> it = entries.descendingIterator();
        while (it.hasNext()) {
            ActivityEntry entry = it.next();
            if (entry.getCategory() == category) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Drops every entry, then records that the log was cleared.
     */
    public synchronized void clear() {
        entries.clear();
        info("Activity log cleared");
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
