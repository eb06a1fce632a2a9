package com.roomallocator.engine;

import com.roomallocator.model.AllocationRequest;
import com.roomallocator.model.Booking;
import com.roomallocator.model.BookingIdGenerator;
import com.roomallocator.model.Room;
import com.roomallocator.model.RoomSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Matches an allocation request to a single room and books it.
 * <p>
 * Candidates must seat at least the requested capacity, match the building
 * and room filters when given, offer every required facility and be free for
 * the slot. The winner is the candidate whose capacity is closest to the
 * request; on a tie the room registered first wins.
 */
public class AllocationEngine {
    private static final Logger logger = LoggerFactory.getLogger(AllocationEngine.class);

    private final RoomRegistry registry;
    private final BookingIdGenerator bookingIds;
    private final ActivityLog activityLog;

    public AllocationEngine(RoomRegistry registry, BookingIdGenerator bookingIds, ActivityLog activityLog) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.bookingIds = Objects.requireNonNull(bookingIds, "bookingIds");
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog");
    }

    /**
     * Selects and books a room.
     *
     * @return the allocation, {@link AllocationError#NO_AVAILABLE_ROOM} when no
     *         room qualifies, or {@link AllocationError#ROOM_NOT_FOUND} when the
     *         request names a room that does not exist
     */
    public Result<Allocation> allocate(AllocationRequest request) {
        Objects.requireNonNull(request, "request");
        activityLog.info("Processing allocation for " + request.getCourseName());

        if (request.getRoomId().isPresent() && registry.find(request.getRoomId().get()).isEmpty()) {
            String message = "Room " + request.getRoomId().get() + " not found";
            activityLog.error("Cannot allocate " + request.getCourseName() + ": " + message);
            return Result.failure(AllocationError.ROOM_NOT_FOUND, message);
        }

        Room best;
        Booking booking;
        // check and write under the registry lock so two requests cannot take the same slot
        synchronized (registry) {
            best = null;
            int bestDistance = Integer.MAX_VALUE;
            for (Room room : registry.rooms()) {
                if (!isCandidate(room, request)) {
                    continue;
                }
                int distance = Math.abs(room.getCapacity() - request.getCapacity());
                // strict comparison keeps the earliest registered room on ties
                if (distance < bestDistance) {
                    best = room;
                    bestDistance = distance;
                }
            }
            if (best == null) {
                activityLog.error("No suitable rooms for " + request.getCourseName());
                logger.debug("No candidate for {}", request);
                return Result.failure(AllocationError.NO_AVAILABLE_ROOM,
                        "No rooms match requirements or are available");
            }
            booking = best.getCalendar().book(request.getSlot(), request.getCourseName(),
                    request.getInstructor(), bookingIds);
        }

        activityLog.success("Allocated " + best.getBuilding() + " " + best.getRoomId()
                + " for " + request.getCourseName() + " (ID: " + booking.getBookingId() + ")");
        return Result.success(new Allocation(RoomSummary.of(best), booking));
    }

    private static boolean isCandidate(Room room, AllocationRequest request) {
        if (room.getCapacity() < request.getCapacity()) {
            return false;
        }
        if (request.getBuilding().isPresent() && !room.getBuilding().equals(request.getBuilding().get())) {
            return false;
        }
        if (request.getRoomId().isPresent() && !room.getRoomId().equals(request.getRoomId().get())) {
            return false;
        }
        if (!room.hasFacilities(request.getRequiredFacilities())) {
            return false;
        }
        return room.isAvailable(request.getSlot());
    }
}
