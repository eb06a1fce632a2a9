package com.roomallocator.model;

/**
 * Category of an activity log entry.
 */
public enum LogCategory {
    INFO("info"),
    SUCCESS("success"),
    ERROR("error");

    private final String label;

    LogCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static LogCategory fromString(String text) {
        for (LogCategory c : LogCategory.values()) {
            if (c.label.equalsIgnoreCase(text)) {
                return c;
            }
        }
        throw new InvalidRequestException("Unknown log category: " + text);
    }
}
