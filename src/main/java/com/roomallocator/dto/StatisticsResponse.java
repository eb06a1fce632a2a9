package com.roomallocator.dto;

public class StatisticsResponse {
    private final int totalRooms;
    private final int totalBookings;
    private final int utilizedRooms;
    private final double utilizationRate;
    private final int conflicts;

    public StatisticsResponse(int totalRooms, int totalBookings, int utilizedRooms,
                              double utilizationRate, int conflicts) {
        this.totalRooms = totalRooms;
        this.totalBookings = totalBookings;
        this.utilizedRooms = utilizedRooms;
        this.utilizationRate = utilizationRate;
        this.conflicts = conflicts;
    }

    public int getTotalRooms() {
        return totalRooms;
    }

    public int getTotalBookings() {
        return totalBookings;
    }

    public int getUtilizedRooms() {
        return utilizedRooms;
    }

    public double getUtilizationRate() {
        return utilizationRate;
    }

    public int getConflicts() {
        return conflicts;
    }
}
