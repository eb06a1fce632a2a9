package com.roomallocator.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What a course needs: a slot, a minimum number of seats, optionally a
 * building or one specific room, and a set of required facilities.
 */
public final class AllocationRequest {
    private final String courseName;
    private final String instructor;
    private final TimeSlot slot;
    private final int capacity;
    private final String building;
    private final String roomId;
    private final Set<Facility> requiredFacilities;

    private AllocationRequest(Builder builder) {
        if (builder.courseName == null || builder.courseName.isBlank()) {
            throw new InvalidRequestException("Course name is required");
        }
        if (builder.slot == null) {
            throw new InvalidRequestException("Time slot is required");
        }
        if (builder.capacity <= 0) {
            throw new InvalidRequestException("Capacity must be positive");
        }
        this.courseName = builder.courseName;
        this.instructor = builder.instructor == null ? "" : builder.instructor;
        this.slot = builder.slot;
        this.capacity = builder.capacity;
        this.building = blankToNull(builder.building);
        this.roomId = blankToNull(builder.roomId);
        this.requiredFacilities = Set.copyOf(builder.requiredFacilities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCourseName() {
        return courseName;
    }

    public String getInstructor() {
        return instructor;
    }

    public TimeSlot getSlot() {
        return slot;
    }

    public int getCapacity() {
        return capacity;
    }

    public Optional<String> getBuilding() {
        return Optional.ofNullable(building);
    }

    public Optional<String> getRoomId() {
        return Optional.ofNullable(roomId);
    }

    public Set<Facility> getRequiredFacilities() {
        return requiredFacilities;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "AllocationRequest{" +
                "courseName='" + courseName + '\'' +
                ", slot=" + slot +
                ", capacity=" + capacity +
                ", building=" + building +
                ", roomId=" + roomId +
                ", requiredFacilities=" + requiredFacilities +
                '}';
    }

    public static final class Builder {
        private String courseName;
        private String instructor;
        private TimeSlot slot;
        private int capacity;
        private String building;
        private String roomId;
        private final Set<Facility> requiredFacilities = EnumSet.noneOf(Facility.class);

        private Builder() {
        }

        public Builder courseName(String courseName) {
            this.courseName = courseName;
            return this;
        }

        public Builder instructor(String instructor) {
            this.instructor = instructor;
            return this;
        }

        public Builder slot(TimeSlot slot) {
            this.slot = slot;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder building(String building) {
            this.building = building;
            return this;
        }

        public Builder roomId(String roomId) {
            this.roomId = roomId;
            return this;
        }

        public Builder require(Facility facility) {
            this.requiredFacilities.add(Objects.requireNonNull(facility));
            return this;
        }

        public Builder requireAll(Set<Facility> facilities) {
            this.requiredFacilities.addAll(facilities);
            return this;
        }

        public AllocationRequest build() {
            return new AllocationRequest(this);
        }
    }
}
