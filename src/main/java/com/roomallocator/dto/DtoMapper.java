package com.roomallocator.dto;

import com.roomallocator.engine.Allocation;
import com.roomallocator.engine.Conflict;
import com.roomallocator.engine.ScheduleEntry;
import com.roomallocator.engine.Statistics;
import com.roomallocator.model.ActivityEntry;
import com.roomallocator.model.Booking;
import com.roomallocator.model.Facility;
import com.roomallocator.model.RoomSummary;
import com.roomallocator.model.TimeSlot;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts engine values into wire objects. Dates and timestamps become ISO
 * strings and times {@code HH:mm}, so Gson never reflects into java.time.
 */
public final class DtoMapper {

    private DtoMapper() {
    }

    public static RoomResponse toRoomResponse(RoomSummary room) {
        return new RoomResponse(
                room.getRoomId(),
                room.getBuilding(),
                room.getCapacity(),
                room.getFloor(),
                Facility.toFlags(room.getFacilities()),
                room.getAdjacentRoomIds(),
                room.getBookingCount());
    }

    public static List<RoomResponse> toRoomResponses(Iterable<RoomSummary> rooms) {
        List<RoomResponse> result = new ArrayList<>();
        for (RoomSummary room : rooms) {
            result.add(toRoomResponse(room));
        }
        return result;
    }

    public static BookingResponse toBookingResponse(Booking booking) {
        TimeSlot slot = booking.getSlot();
        return new BookingResponse(
                booking.getBookingId(),
                booking.getRoomId(),
                slot.getDate().toString(),
                slot.getStart().format(TimeSlot.TIME_FORMAT),
                slot.getEnd().format(TimeSlot.TIME_FORMAT),
                booking.getCourseName(),
                booking.getInstructor(),
                booking.getCreatedAt().toString());
    }

    public static AllocationResponse toAllocationResponse(Allocation allocation) {
        return new AllocationResponse(
                toRoomResponse(allocation.getRoom()),
                allocation.getBookingId(),
                toBookingResponse(allocation.getBooking()));
    }

    public static List<ScheduleEntryResponse> toScheduleResponses(List<ScheduleEntry> schedule) {
        List<ScheduleEntryResponse> result = new ArrayList<>(schedule.size());
        for (ScheduleEntry entry : schedule) {
            result.add(new ScheduleEntryResponse(toRoomResponse(entry.getRoom()),
                    toBookingResponse(entry.getBooking())));
        }
        return result;
    }

    public static List<ConflictResponse> toConflictResponses(List<Conflict> conflicts) {
        List<ConflictResponse> result = new ArrayList<>(conflicts.size());
        for (Conflict conflict : conflicts) {
            result.add(new ConflictResponse(conflict.getRoomId(),
                    toBookingResponse(conflict.getFirst()),
                    toBookingResponse(conflict.getSecond())));
        }
        return result;
    }

    public static List<LogEntryResponse> toLogResponses(List<ActivityEntry> entries) {
        List<LogEntryResponse> result = new ArrayList<>(entries.size());
        for (ActivityEntry entry : entries) {
            result.add(new LogEntryResponse(entry.getCategory().getLabel(), entry.getMessage(),
                    entry.getTimestamp().toString()));
        }
        return result;
    }

    public static StatisticsResponse toStatisticsResponse(Statistics statistics) {
        return new StatisticsResponse(
                statistics.getTotalRooms(),
                statistics.getTotalBookings(),
                statistics.getUtilizedRooms(),
                statistics.getUtilizationRate(),
                statistics.getConflicts());
    }
}
