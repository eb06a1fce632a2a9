package com.roomallocator.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * A bookable room with its immutable attributes, its similarity links to
 * other rooms and its booking calendar.
 * Uses copy-on-write collections so listings can read while bookings and
 * adjacency entries are appended.
 */
public class Room {
    // Unique identifier, e.g. "101" or "LAB-A"
    private final String roomId;
    // Building the room belongs to
    private final String building;
    // Number of seats
    private final int capacity;
    private final int floor;
    private final Set<Facility> facilities;
    // Ids of similar rooms, in the order the links were created
    private final Set<String> adjacentRoomIds = new CopyOnWriteArraySet<>();
    private final BookingCalendar calendar;

    /**
     * Creates a new room.
     *
     * @param roomId     unique identifier
     * @param building   building name
     * @param capacity   number of seats, must be positive
     * @param floor      floor number
     * @param facilities facilities present in the room
     */
    public Room(String roomId, String building, int capacity, int floor, Set<Facility> facilities) {
        if (roomId == null || roomId.isBlank()) {
            throw new InvalidRequestException("Room ID cannot be null or empty");
        }
        if (building == null || building.isBlank()) {
            throw new InvalidRequestException("Building cannot be null or empty");
        }
        if (capacity <= 0) {
            throw new InvalidRequestException("Capacity must be positive");
        }

        this.roomId = roomId;
        this.building = building;
        this.capacity = capacity;
        this.floor = floor;
        EnumSet<Facility> copy = EnumSet.noneOf(Facility.class);
        if (facilities != null) {
            copy.addAll(facilities);
        }
        this.facilities = Collections.unmodifiableSet(copy);
        this.calendar = new BookingCalendar(roomId);
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

    /**
     * Checks whether the room offers every facility in {@code required}.
     */
    public boolean hasFacilities(Set<Facility> required) {
        return facilities.containsAll(required);
    }

    /**
     * Links this room to another one. Adding an existing link or a link to
     * itself changes nothing.
     *
     * @return true if the link is new
     */
    public boolean addAdjacent(String otherRoomId) {
        if (roomId.equals(otherRoomId)) {
            return false;
        }
        return adjacentRoomIds.add(otherRoomId);
    }

    public boolean isAdjacentTo(String otherRoomId) {
        return adjacentRoomIds.contains(otherRoomId);
    }

    /**
     * @return adjacent room ids in link-creation order
     */
    public List<String> getAdjacentRoomIds() {
        return List.copyOf(adjacentRoomIds);
    }

    public BookingCalendar getCalendar() {
        return calendar;
    }

    public boolean isAvailable(TimeSlot slot) {
        return calendar.isAvailable(slot);
    }

    @Override
    public String toString() {
        return building + " " + roomId + " (" + capacity + " seats)";
    }
}
