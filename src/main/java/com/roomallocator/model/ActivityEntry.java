package com.roomallocator.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One line of the activity log.
 */
public final class ActivityEntry {
    private final LogCategory category;
    private final String message;
    private final LocalDateTime timestamp;

    public ActivityEntry(LogCategory category, String message, LocalDateTime timestamp) {
        this.category = Objects.requireNonNull(category, "category");
        this.message = Objects.requireNonNull(message, "message");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public LogCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "[" + timestamp + "] [" + category.getLabel().toUpperCase() + "] " + message;
    }
}
