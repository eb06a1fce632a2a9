package com.roomallocator.engine;

import com.roomallocator.model.AllocationRequest;
import com.roomallocator.model.RoomSummary;
import com.roomallocator.model.TimeSlot;
import com.roomallocator.support.TestRooms;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlternativeFinderTest {
    private static final TimeSlot SLOT = TimeSlot.parse("2024-01-10", "09:00", "10:00");

    private static List<String> ids(List<RoomSummary> rooms) {
        return rooms.stream().map(RoomSummary::getRoomId).collect(Collectors.toList());
    }

    @Test
    void testWalksWholeComponentInBreadthFirstOrder() {
        // campus links: 101-102, 101-201, 102-201, 102-LAB-A, 201-LAB-A
        ClassroomAllocator allocator = TestRooms.campus();

        List<String> found = ids(allocator.findAlternatives("101", SLOT));

        assertEquals(List.of("101", "102", "201", "LAB-A"), found);
    }

    @Test
    void testBusyRoomsAreSkippedButStillTraversed() {
        ClassroomAllocator allocator = TestRooms.campus();
        allocator.allocate(AllocationRequest.builder().courseName("Busy").slot(SLOT).capacity(1)
                .roomId("101").build());
        allocator.allocate(AllocationRequest.builder().courseName("Busy").slot(SLOT).capacity(1)
                .roomId("102").build());

        List<String> found = ids(allocator.findAlternatives("101", SLOT));

        assertEquals(List.of("201", "LAB-A"), found);
    }

    @Test
    void testUnreachableRoomsAreNotReturned() {
        ClassroomAllocator allocator = TestRooms.emptyAllocator();
        allocator.registerRoom("A", "Main", 100, 1, Set.of());
        allocator.registerRoom("B", "Main", 90, 1, Set.of());
        allocator.registerRoom("C", "North", 10, 1, Set.of());

        assertEquals(List.of("A", "B"), ids(allocator.findAlternatives("A", SLOT)));
        assertEquals(List.of("C"), ids(allocator.findAlternatives("C", SLOT)));
    }

    @Test
    void testUnknownStartGivesNothing() {
        ClassroomAllocator allocator = TestRooms.campus();

        assertTrue(allocator.findAlternatives("999", SLOT).isEmpty());
    }

    @Test
    void testOtherSlotsDoNotBlock() {
        ClassroomAllocator allocator = TestRooms.campus();
        allocator.allocate(AllocationRequest.builder().courseName("Early").capacity(1).roomId("101")
                .slot(TimeSlot.parse("2024-01-10", "08:00", "09:00")).build());

        assertEquals(4, allocator.findAlternatives("101", SLOT).size());
    }
}
