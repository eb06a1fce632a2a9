package com.roomallocator.engine;

import com.roomallocator.model.Room;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Computes {@link Statistics} on demand. The conflict count comes from a fresh
 * audit on every call.
 */
public class StatisticsReporter {
    private final RoomRegistry registry;
    private final ConflictAuditor auditor;

    public StatisticsReporter(RoomRegistry registry, ConflictAuditor auditor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.auditor = Objects.requireNonNull(auditor, "auditor");
    }

    public Statistics compute() {
        List<Room> rooms = registry.rooms();
        int totalBookings = 0;
        int utilizedRooms = 0;
        for (Room room : rooms) {
            int count = room.getCalendar().size();
            totalBookings += count;
            if (count > 0) {
                utilizedRooms++;
            }
        }
        return new Statistics(rooms.size(), totalBookings, utilizedRooms,
                utilizationRate(utilizedRooms, rooms.size()), auditor.detectConflicts().size());
    }

    static double utilizationRate(int utilizedRooms, int totalRooms) {
        if (totalRooms == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(utilizedRooms * 100.0 / totalRooms)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
