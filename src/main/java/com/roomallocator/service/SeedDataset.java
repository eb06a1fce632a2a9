package com.roomallocator.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Initial rooms and, optionally, bookings that already exist when the engine
 * starts. Read from JSON with Jackson.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeedDataset {
    @JsonProperty("rooms")
    private List<SeedRoom> rooms = new ArrayList<>();

    @JsonProperty("bookings")
    private List<SeedBooking> bookings = new ArrayList<>();

    // Default constructor for JSON deserialization
    public SeedDataset() {}

    public SeedDataset(List<SeedRoom> rooms, List<SeedBooking> bookings) {
        this.rooms = rooms;
        this.bookings = bookings;
    }

    public List<SeedRoom> getRooms() {
        return rooms == null ? List.of() : rooms;
    }

    public List<SeedBooking> getBookings() {
        return bookings == null ? List.of() : bookings;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedRoom {
        @JsonProperty("roomId")
        private String roomId;

        @JsonProperty("building")
        private String building;

        @JsonProperty("capacity")
        private int capacity;

        @JsonProperty("floor")
        private int floor;

        @JsonProperty("facilities")
        private Map<String, Boolean> facilities = new LinkedHashMap<>();

        public SeedRoom() {}

        public SeedRoom(String roomId, String building, int capacity, int floor, Map<String, Boolean> facilities) {
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

        public int getCapacity() {
            return capacity;
        }

        public int getFloor() {
            return floor;
        }

        public Map<String, Boolean> getFacilities() {
            return facilities;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedBooking {
        // Optional; generated when absent
        @JsonProperty("bookingId")
        private String bookingId;

        @JsonProperty("roomId")
        private String roomId;

        @JsonProperty("date")
        private String date;

        @JsonProperty("startTime")
        private String startTime;

        @JsonProperty("endTime")
        private String endTime;

        @JsonProperty("courseName")
        private String courseName;

        @JsonProperty("instructor")
        private String instructor;

        public SeedBooking() {}

        public SeedBooking(String bookingId, String roomId, String date, String startTime,
                           String endTime, String courseName, String instructor) {
            this.bookingId = bookingId;
            this.roomId = roomId;
            this.date = date;
            this.startTime = startTime;
            this.endTime = endTime;
            this.courseName = courseName;
            this.instructor = instructor;
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
    }
}
