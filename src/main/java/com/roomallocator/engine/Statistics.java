package com.roomallocator.engine;

/**
 * Point-in-time figures about rooms, bookings and conflicts.
 */
public final class Statistics {
    private final int totalRooms;
    private final int totalBookings;
    private final int utilizedRooms;
    // Percentage of rooms with at least one booking, two decimals
    private final double utilizationRate;
    private final int conflicts;

    public Statistics(int totalRooms, int totalBookings, int utilizedRooms, double utilizationRate, int conflicts) {
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

    @Override
    public String toString() {
        return "Statistics{" +
                "totalRooms=" + totalRooms +
                ", totalBookings=" + totalBookings +
                ", utilizedRooms=" + utilizedRooms +
                ", utilizationRate=" + utilizationRate +
                ", conflicts=" + conflicts +
                '}';
    }
}
