package com.roomallocator.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A confirmed reservation of one room for one time slot.
 * Bookings are immutable and are never removed from their room.
 */
public final class Booking {
    private final String bookingId;
    private final String roomId;
    private final TimeSlot slot;
    private final String courseName;
    private final String instructor;
    private final LocalDateTime createdAt;

    /**
     * Creates a booking.
     *
     * @param bookingId  system-wide unique id
     * @param roomId     id of the owning room
     * @param slot       the reserved interval
     * @param courseName course the room is reserved for
     * @param instructor optional instructor, stored as "" when absent
     * @param createdAt  creation timestamp
     */
    public Booking(String bookingId, String roomId, TimeSlot slot,
                   String courseName, String instructor, LocalDateTime createdAt) {
        if (bookingId == null || bookingId.isBlank()) {
            throw new InvalidRequestException("Booking ID cannot be null or empty");
        }
        if (roomId == null || roomId.isBlank()) {
            throw new InvalidRequestException("Room ID cannot be null or empty");
        }
        if (courseName == null || courseName.isBlank()) {
            throw new InvalidRequestException("Course name cannot be null or empty");
        }
        this.bookingId = bookingId;
        this.roomId = roomId;
        this.slot = Objects.requireNonNull(slot, "slot");
        this.courseName = courseName;
        this.instructor = instructor == null ? "" : instructor;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getBookingId() {
        return bookingId;
    }

    public String getRoomId() {
        return roomId;
    }

    public TimeSlot getSlot() {
        return slot;
    }

    public String getCourseName() {
        return courseName;
    }

    public String getInstructor() {
        return instructor;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Booking{" +
                "bookingId='" + bookingId + '\'' +
                ", roomId='" + roomId + '\'' +
                ", slot=" + slot +
                ", courseName='" + courseName + '\'' +
                '}';
    }
}
