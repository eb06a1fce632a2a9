package com.roomallocator.engine;

import com.roomallocator.model.ActivityEntry;
import com.roomallocator.model.AllocationRequest;
import com.roomallocator.model.Booking;
import com.roomallocator.model.BookingIdGenerator;
import com.roomallocator.model.Facility;
import com.roomallocator.model.InvalidRequestException;
import com.roomallocator.model.LogCategory;
import com.roomallocator.model.Room;
import com.roomallocator.model.RoomSummary;
import com.roomallocator.model.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One complete engine state: registry, adjacency, calendars, activity log and
 * the components reading them. Everything the outside world can do with the
 * engine goes through this class; callers hold an instance rather than a
 * global, and a reset simply replaces the instance.
 */
public class ClassroomAllocator {
    private static final Logger logger = LoggerFactory.getLogger(ClassroomAllocator.class);
    private static final Comparator<ScheduleEntry> BY_SLOT =
            Comparator.comparing(e -> e.getBooking().getSlot(), TimeSlot.CHRONOLOGICAL);

    private final ActivityLog activityLog;
    private final BookingIdGenerator bookingIds;
    private final RoomRegistry registry;
    private final AllocationEngine allocationEngine;
    private final ConflictAuditor conflictAuditor;
    private final AlternativeFinder alternativeFinder;
    private final StatisticsReporter statisticsReporter;

    public ClassroomAllocator() {
        this(new ActivityLog(), new BookingIdGenerator());
    }

    public ClassroomAllocator(ActivityLog activityLog, BookingIdGenerator bookingIds) {
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog");
        this.bookingIds = Objects.requireNonNull(bookingIds, "bookingIds");
        this.registry = new RoomRegistry(new AdjacencyGraph(), activityLog);
        this.allocationEngine = new AllocationEngine(registry, bookingIds, activityLog);
        this.conflictAuditor = new ConflictAuditor(registry);
        this.alternativeFinder = new AlternativeFinder(registry);
        this.statisticsReporter = new StatisticsReporter(registry, conflictAuditor);
    }

    public Result<RoomSummary> registerRoom(String roomId, String building, int capacity,
                                            int floor, Set<Facility> facilities) {
        try {
            return registry.register(roomId, building, capacity, floor, facilities);
        } catch (InvalidRequestException e) {
            logger.debug("Invalid room {}: {}", roomId, e.getMessage());
            return Result.failure(AllocationError.INVALID_REQUEST, e.getMessage());
        }
    }

    public Result<RoomSummary> getRoom(String roomId) {
        return registry.lookup(roomId).map(RoomSummary::of);
    }

    /**
     * @return restartable view of all rooms in registration order
     */
    public Iterable<RoomSummary> listRooms() {
        return registry.listAll();
    }

    public Result<Allocation> allocate(AllocationRequest request) {
        return allocationEngine.allocate(request);
    }

    /**
     * Restores a booking made elsewhere, without checking availability.
     * Overlaps introduced this way show up in {@link #detectConflicts()}.
     *
     * @param bookingId id to keep, or null to generate one
     */
    public Result<Booking> importBooking(String roomId, String bookingId, TimeSlot slot,
                                         String courseName, String instructor, LocalDateTime createdAt) {
        synchronized (registry) {
            Optional<Room> room = registry.find(roomId);
            if (room.isEmpty()) {
                return Result.failure(AllocationError.ROOM_NOT_FOUND, "Room " + roomId + " not found");
            }
            boolean generated = bookingId == null || bookingId.isBlank();
            String id = generated ? bookingIds.next() : bookingId;
            Booking booking;
            try {
                booking = new Booking(id, roomId, slot, courseName, instructor,
                        createdAt == null ? bookingIds.now() : createdAt);
            } catch (InvalidRequestException e) {
                return Result.failure(AllocationError.INVALID_REQUEST, e.getMessage());
            }
            // only a valid booking claims its id
            if (!generated && !bookingIds.reserve(id)) {
                return Result.failure(AllocationError.INVALID_REQUEST, "Booking " + id + " already exists");
            }
            room.get().getCalendar().importBooking(booking);
            return Result.success(booking);
        }
    }

    /**
     * Bookings with their rooms, optionally limited to one room.
     *
     * @see #getSchedule(String, LocalDate, String)
     */
    public List<ScheduleEntry> getSchedule(String roomId) {
        return getSchedule(roomId, null, null);
    }

    /**
     * Bookings with their rooms, sorted by date and start time. Bookings
     * starting together keep room registration order.
     *
     * @param roomId   restricts the schedule to one room when not null; an
     *                 unknown id gives an empty schedule
     * @param date     restricts it to one day when not null
     * @param building restricts it to one building when not null
     */
    public List<ScheduleEntry> getSchedule(String roomId, LocalDate date, String building) {
        List<Room> rooms;
        if (roomId == null || roomId.isBlank()) {
            rooms = registry.rooms();
        } else {
            rooms = registry.find(roomId).map(List::of).orElse(List.of());
        }
        boolean anyBuilding = building == null || building.isBlank();

        List<ScheduleEntry> schedule = new ArrayList<>();
        for (Room room : rooms) {
            if (!anyBuilding && !room.getBuilding().equals(building.trim())) {
                continue;
            }
            RoomSummary summary = RoomSummary.of(room);
            for (Booking booking : room.getCalendar().getBookings()) {
                if (date == null || booking.getSlot().getDate().equals(date)) {
                    schedule.add(new ScheduleEntry(summary, booking));
                }
            }
        }
        schedule.sort(BY_SLOT);
        return schedule;
    }

    public List<RoomSummary> findAlternatives(String roomId, TimeSlot slot) {
        return alternativeFinder.findAlternatives(roomId, slot);
    }

    public List<Conflict> detectConflicts() {
        return conflictAuditor.detectConflicts();
    }

    public List<ActivityEntry> getLogs() {
        return activityLog.readAll();
    }

    public List<ActivityEntry> getLogs(LogCategory category) {
        return activityLog.readAll(category);
    }

    public void clearLogs() {
        activityLog.clear();
    }

    public Statistics getStatistics() {
        return statisticsReporter.compute();
    }

    public int getEdgeCount() {
        return AdjacencyGraph.countEdges(registry.rooms());
    }

    public ActivityLog getActivityLog() {
        return activityLog;
    }
}
