package com.roomallocator.engine;

import com.roomallocator.model.Booking;
import com.roomallocator.model.RoomSummary;

/**
 * A successful allocation: the chosen room as it looked right after booking,
 * and the booking that was written.
 */
public final class Allocation {
    private final RoomSummary room;
    private final Booking booking;

    public Allocation(RoomSummary room, Booking booking) {
        this.room = room;
        this.booking = booking;
    }

    public RoomSummary getRoom() {
        return room;
    }

    public Booking getBooking() {
        return booking;
    }

    public String getBookingId() {
        return booking.getBookingId();
    }
}
