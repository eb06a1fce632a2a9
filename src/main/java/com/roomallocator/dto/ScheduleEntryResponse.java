package com.roomallocator.dto;

public class ScheduleEntryResponse {
    private final RoomResponse room;
    private final BookingResponse booking;

    public ScheduleEntryResponse(RoomResponse room, BookingResponse booking) {
        this.room = room;
        this.booking = booking;
    }

    public RoomResponse getRoom() {
        return room;
    }

    public BookingResponse getBooking() {
        return booking;
    }
}
