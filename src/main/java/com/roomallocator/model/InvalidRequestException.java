package com.roomallocator.model;

/**
 * Thrown when a request value cannot be built from the supplied fields
 * (missing course name, end time before start time, unknown facility, ...).
 */
public class InvalidRequestException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
