package com.roomallocator.dto;

public class AllocationResponse {
    private final RoomResponse room;
    private final String bookingId;
    private final BookingResponse booking;

    public AllocationResponse(RoomResponse room, String bookingId, BookingResponse booking) {
        this.room = room;
        this.bookingId = bookingId;
        this.booking = booking;
    }

    public RoomResponse getRoom() {
        return room;
    }

    public String getBookingId() {
        return bookingId;
    }

    public BookingResponse getBooking() {
        return booking;
    }
}
