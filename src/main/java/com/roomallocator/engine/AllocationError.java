package com.roomallocator.engine;

/**
 * Business failures an engine operation can report instead of a value.
 */
public enum AllocationError {
    /** A room with the same id is already registered. */
    DUPLICATE_ROOM,
    /** No room with the requested id exists. */
    ROOM_NOT_FOUND,
    /** No room passes the capacity, building, facility and availability filters. */
    NO_AVAILABLE_ROOM,
    /** The request is missing required fields or carries malformed ones. */
    INVALID_REQUEST
}
