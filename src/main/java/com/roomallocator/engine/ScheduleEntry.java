package com.roomallocator.engine;

import com.roomallocator.model.Booking;
import com.roomallocator.model.RoomSummary;

/**
 * One booking together with the room it belongs to.
 */
public final class ScheduleEntry {
    private final RoomSummary room;
    private final Booking booking;

    public ScheduleEntry(RoomSummary room, Booking booking) {
        this.room = room;
        this.booking = booking;
    }

    public RoomSummary getRoom() {
        return room;
    }

    public Booking getBooking() {
        return booking;
    }
}
