package com.roomallocator.dto;

import java.util.Map;

/** Payload of ADD_ROOM. */
public class RoomRequest {
    private String roomId;
    private String building;
    private Integer capacity;
    private Integer floor;
    private Map<String, Boolean> facilities;

    // Required for Gson deserialization
    public RoomRequest() {
    }

    public RoomRequest(String roomId, String building, Integer capacity, Integer floor,
                       Map<String, Boolean> facilities) {
        this.roomId = roomId;
        this.building = building;
        this.capacity = capacity;
        this.floor = floor;
        this.facilities = facilities;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getBuilding() {
        return building;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public Integer getFloor() {
        return floor;
    }

    public Map<String, Boolean> getFacilities() {
        return facilities;
    }
}
