package com.roomallocator.dto;

/**
 * Payload of GET_ROOM, SCHEDULE, ALTERNATIVES and LOGS. Which fields are read
 * depends on the action.
 */
public class SlotQuery {
    private String roomId;
    private String date;
    private String startTime;
    private String endTime;
    private String category;
    private String building;

    // Required for Gson deserialization
    public SlotQuery() {
    }

    public SlotQuery(String roomId, String date, String startTime, String endTime) {
        this.roomId = roomId;
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
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

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getBuilding() {
        return building;
    }

    public void setBuilding(String building) {
        this.building = building;
    }
}
