package com.roomallocator.engine;

import com.roomallocator.model.ActivityEntry;
import com.roomallocator.model.LogCategory;
import com.roomallocator.support.TestRooms;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityLogTest {

    @Test
    void testEntriesAreReturnedMostRecentFirst() {
        ActivityLog log = new ActivityLog(10, TestRooms.CLOCK);
        log.info("first");
        log.success("second");
        log.error("third");

        List<ActivityEntry> entries = log.readAll();

        assertEquals(3, entries.size());
        assertEquals("third", entries.get(0).getMessage());
        assertEquals(LogCategory.ERROR, entries.get(0).getCategory());
        assertEquals("first", entries.get(2).getMessage());
        assertEquals(LocalDateTime.of(2024, 1, 1, 8, 0), entries.get(2).getTimestamp());
    }

    @Test
    void testOldestEntriesAreEvicted() {
        ActivityLog log = new ActivityLog(ActivityLog.DEFAULT_CAPACITY, TestRooms.CLOCK);
        for (int i = 0; i < 150; i++) {
            log.info("entry " + i);
        }

        List<ActivityEntry> entries = log.readAll();

        assertEquals(100, entries.size());
        assertEquals("entry 149", entries.get(0).getMessage());
        assertEquals("entry 50", entries.get(99).getMessage());
    }

    @Test
    void testFilterByCategory() {
        ActivityLog log = new ActivityLog(10, TestRooms.CLOCK);
        log.info("a");
        log.error("b");
        log.info("c");

        List<ActivityEntry> infos = log.readAll(LogCategory.INFO);

        assertEquals(2, infos.size());
        assertEquals("c", infos.get(0).getMessage());
        assertTrue(log.readAll(LogCategory.SUCCESS).isEmpty());
    }

    @Test
    void testClearLeavesSingleNotice() {
        ActivityLog log = new ActivityLog(10, TestRooms.CLOCK);
        log.info("a");
        log.error("b");

        log.clear();

        assertEquals(1, log.size());
        assertEquals("Activity log cleared", log.readAll().get(0).getMessage());
    }

    @Test
    void testReadAllReturnsCopy() {
        ActivityLog log = new ActivityLog(10, TestRooms.CLOCK);
        log.info("a");
        List<ActivityEntry> snapshot = log.readAll();
        log.info("b");

        assertEquals(1, snapshot.size());
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ActivityLog(0, TestRooms.CLOCK));
    }
}
