package com.roomallocator.engine;

import com.roomallocator.model.Booking;
import com.roomallocator.model.Room;
import com.roomallocator.model.TimeSlot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds overlapping bookings room by room. Nothing is cached; every call
 * scans the current calendars.
 */
public class ConflictAuditor {
    private static final Comparator<Booking> BY_SLOT =
            Comparator.comparing(Booking::getSlot, TimeSlot.CHRONOLOGICAL);

    private final RoomRegistry registry;

    public ConflictAuditor(RoomRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return every overlapping pair, grouped by room in registration order
     */
    public List<Conflict> detectConflicts() {
        List<Conflict> conflicts = new ArrayList<>();
        for (Room room : registry.rooms()) {
            conflicts.addAll(detectConflicts(room));
        }
        return conflicts;
    }

    /**
     * Sorts the room's bookings by date and start time, then compares each
     * booking with the ones after it until a later booking can no longer
     * overlap (another date, or starting at or after this one's end).
     */
    public static List<Conflict> detectConflicts(Room room) {
        List<Booking> sorted = new ArrayList<>(room.getCalendar().getBookings());
        sorted.sort(BY_SLOT);

        List<Conflict> conflicts = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            TimeSlot current = sorted.get(i).getSlot();
            for (int j = i + 1; j < sorted.size(); j++) {
                TimeSlot later = sorted.get(j).getSlot();
                if (!later.getDate().equals(current.getDate()) || !later.getStart().isBefore(current.getEnd())) {
                    break;
                }
                if (current.overlaps(later)) {
                    conflicts.add(new Conflict(room.getRoomId(), sorted.get(i), sorted.get(j)));
                }
            }
        }
        return conflicts;
    }
}
