package com.roomallocator.dto;

import java.util.Map;

/**
 * Payload of ALLOCATE. Dates are {@code yyyy-MM-dd}, times {@code HH:mm}.
 * {@code building} and {@code roomId} are optional filters.
 */
public class AllocateRequest {
    private String courseName;
    private String instructor;
    private String date;
    private String startTime;
    private String endTime;
    private Integer capacity;
    private String building;
    private String roomId;
    private Map<String, Boolean> facilities;

    // Required for Gson deserialization
    public AllocateRequest() {
    }

    public AllocateRequest(String courseName, String instructor, String date, String startTime,
                           String endTime, Integer capacity, String building, String roomId,
                           Map<String, Boolean> facilities) {
        this.courseName = courseName;
        this.instructor = instructor;
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.capacity = capacity;
        this.building = building;
        this.roomId = roomId;
        this.facilities = facilities;
    }

    public String getCourseName() {
        return courseName;
    }

    public String getInstructor() {
        return instructor;
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

    public Integer getCapacity() {
        return capacity;
    }

    public String getBuilding() {
        return building;
    }

    public String getRoomId() {
        return roomId;
    }

    public Map<String, Boolean> getFacilities() {
        return facilities;
    }
}
