package com.roomallocator.model;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The bookings of one room in insertion order.
 * Backed by a copy-on-write list: readers iterate the last committed state
 * while a writer appends.
 */
public class BookingCalendar {
    private final String roomId;
    private final List<Booking> bookings = new CopyOnWriteArrayList<>();

    public BookingCalendar(String roomId) {
        this.roomId = roomId;
    }

    /**
     * Checks whether no booking on the slot's date overlaps the slot.
     * A booking ending exactly when the slot starts (or the reverse) does not block it.
     */
    public boolean isAvailable(TimeSlot slot) {
        for (Booking booking : bookings) {
            if (booking.getSlot().overlaps(slot)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Appends a new booking with a generated id. Availability is the caller's
     * concern; the allocation engine checks it under the same lock.
     *
     * @return the stored booking
     */
    public Booking book(TimeSlot slot, String courseName, String instructor, BookingIdGenerator ids) {
        Booking booking = new Booking(ids.next(), roomId, slot, courseName, instructor, ids.now());
        bookings.add(booking);
        return booking;
    }

    /**
     * Appends an already formed booking without any availability check.
     * Used when restoring pre-existing bookings from a dataset.
     */
    public void importBooking(Booking booking) {
        if (!roomId.equals(booking.getRoomId())) {
            throw new IllegalArgumentException("Booking " + booking.getBookingId()
                    + " belongs to room " + booking.getRoomId() + ", not " + roomId);
        }
        bookings.add(booking);
    }

    /**
     * @return an unmodifiable snapshot in insertion order
     */
    public List<Booking> getBookings() {
        return List.copyOf(bookings);
    }

    public int size() {
        return bookings.size();
    }

    public boolean isEmpty() {
        return bookings.isEmpty();
    }
}
