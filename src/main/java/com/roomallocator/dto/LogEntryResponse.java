package com.roomallocator.dto;

public class LogEntryResponse {
    private final String type;
    private final String message;
    private final String timestamp;

    public LogEntryResponse(String type, String message, String timestamp) {
        this.type = type;
        this.message = message;
        this.timestamp = timestamp;
    }

    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
