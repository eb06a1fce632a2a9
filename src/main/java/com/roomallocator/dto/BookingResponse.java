package com.roomallocator.dto;

/** Full booking record, as returned by schedule and conflict queries. */
public class BookingResponse {
    private final String bookingId;
    private final String roomId;
    private final String date;
    private final String startTime;
    private final String endTime;
    private final String courseName;
    private final String instructor;
    private final String timestamp;

    public BookingResponse(String bookingId, String roomId, String date, String startTime, String endTime,
                           String courseName, String instructor, String timestamp) {
        this.bookingId = bookingId;
        this.roomId = roomId;
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.courseName = courseName;
        this.instructor = instructor;
        this.timestamp = timestamp;
    }

    public String getBookingId() {
        return bookingId;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getDate() {
        return date;
    }

    public String getStartTime() {
        return startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    public String getCourseName() {
        return courseName;
    }

    public String getInstructor() {
        return instructor;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
