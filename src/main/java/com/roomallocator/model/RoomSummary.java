package com.roomallocator.model;

import java.util.List;
import java.util.Set;

/**
 * Read-only snapshot of a room as shown in listings: attributes, adjacency
 * and the number of bookings, without the booking records themselves.
 */
public final class RoomSummary {
    private final String roomId;
    private final String building;
    private final int capacity;
    private final int floor;
    private final Set<Facility> facilities;
    private final List<String> adjacentRoomIds;
    private final int bookingCount;

    private RoomSummary(Room room) {
        this.roomId = room.getRoomId();
        this.building = room.getBuilding();
        this.capacity = room.getCapacity();
        this.floor = room.getFloor();
        this.facilities = room.getFacilities();
        this.adjacentRoomIds = room.getAdjacentRoomIds();
        this.bookingCount = room.getCalendar().size();
    }

    public static RoomSummary of(Room room) {
        return new RoomSummary(room);
    }

    public String getRoomId() {
        return roomId;
    }

    public String getBuilding() {
        return building;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getFloor() {
        return floor;
    }

    public Set<Facility> getFacilities() {
        return facilities;
    }

    public List<String> getAdjacentRoomIds() {
        return adjacentRoomIds;
    }

    public int getBookingCount() {
        return bookingCount;
    }

    @Override
    public String toString() {
        return "RoomSummary{" +
                "roomId='" + roomId + '\'' +
                ", building='" + building + '\'' +
                ", capacity=" + capacity +
                ", bookingCount=" + bookingCount +
                '}';
    }
}
