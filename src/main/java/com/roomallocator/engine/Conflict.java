package com.roomallocator.engine;

import com.roomallocator.model.Booking;

/**
 * Two bookings of the same room whose slots overlap.
 * {@code first} never starts after {@code second}.
 */
public final class Conflict {
    private final String roomId;
    private final Booking first;
    private final Booking second;

    public Conflict(String roomId, Booking first, Booking second) {
        this.roomId = roomId;
        this.first = first;
        this.second = second;
    }

    public String getRoomId() {
        return roomId;
    }

    public Booking getFirst() {
        return first;
    }

    public Booking getSecond() {
        return second;
    }

    @Override
    public String toString() {
        return "Conflict{" + roomId + ": " + first.getBookingId() + " " + first.getSlot()
                + " <> " + second.getBookingId() + " " + second.getSlot() + '}';
    }
}
