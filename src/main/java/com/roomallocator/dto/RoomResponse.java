package com.roomallocator.dto;

import java.util.List;
import java.util.Map;

/** Room as listed on the wire; bookings are only counted. */
public class RoomResponse {
    private final String roomId;
    private final String building;
    private final int capacity;
    private final int floor;
    private final Map<String, Boolean> facilities;
    private final List<String> adjacentRooms;
    private final int bookingsCount;

    public RoomResponse(String roomId, String building, int capacity, int floor,
                        Map<String, Boolean> facilities, List<String> adjacentRooms, int bookingsCount) {
        this.roomId = roomId;
        this.building = building;
        this.capacity = capacity;
        this.floor = floor;
        this.facilities = facilities;
        this.adjacentRooms = adjacentRooms;
        this.bookingsCount = bookingsCount;
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

    public Map<String, Boolean> getFacilities() {
        return facilities;
    }

    public List<String> getAdjacentRooms() {
        return adjacentRooms;
    }

    public int getBookingsCount() {
        return bookingsCount;
    }
}
