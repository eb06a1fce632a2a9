package com.roomallocator.server;

import com.roomallocator.model.InvalidRequestException;

/**
 * Operations the allocation server understands.
 */
public enum RequestAction {
    HEALTH,
    LIST_ROOMS,
    GET_ROOM,
    ADD_ROOM,
    ALLOCATE,
    SCHEDULE,
    ALTERNATIVES,
    CONFLICTS,
    LOGS,
    CLEAR_LOGS,
    STATISTICS,
    RESET;

    public static RequestAction fromString(String text) {
        if (text == null) {
            throw new InvalidRequestException("Missing action");
        }
        for (RequestAction action : values()) {
            if (action.name().equalsIgnoreCase(text.trim())) {
                return action;
            }
        }
        throw new InvalidRequestException("Unknown action: " + text);
    }
}
