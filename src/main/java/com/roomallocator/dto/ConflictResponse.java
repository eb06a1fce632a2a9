package com.roomallocator.dto;

public class ConflictResponse {
    private final String roomId;
    private final BookingResponse booking1;
    private final BookingResponse booking2;

    public ConflictResponse(String roomId, BookingResponse booking1, BookingResponse booking2) {
        this.roomId = roomId;
        this.booking1 = booking1;
        this.booking2 = booking2;
    }

    public String getRoomId() {
        return roomId;
    }

    public BookingResponse getBooking1() {
        return booking1;
    }

    public BookingResponse getBooking2() {
        return booking2;
    }
}
