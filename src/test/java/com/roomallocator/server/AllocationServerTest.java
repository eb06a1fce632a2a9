package com.roomallocator.server;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.roomallocator.dto.AllocateRequest;
import com.roomallocator.dto.ApiResponse;
import com.roomallocator.engine.ActivityLog;
import com.roomallocator.engine.ClassroomAllocator;
import com.roomallocator.model.AllocationRequest;
import com.roomallocator.model.BookingIdGenerator;
import com.roomallocator.service.AllocationService;
import com.roomallocator.support.TestRooms;
import com.roomallocator.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request handling without the socket: documents in, reply documents out.
 */
class AllocationServerTest {
    private AllocationServer server;

    @BeforeEach
    void setUp() {
        AllocationService service = AllocationService.seededFrom("dataset/default-rooms.json", 100);
        server = new AllocationServer(service, "tcp://*:5599");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private JsonObject call(String json) {
        return JsonUtil.parseObject(JsonUtil.toJson(server.handle(json)));
    }

    private JsonObject call(String action, String payload) {
        return call("{\"action\":\"" + action + "\",\"payload\":" + payload + "}");
    }

    private static String allocation(String course, int capacity, String start, String end, String extra) {
        return "{\"courseName\":\"" + course + "\",\"date\":\"2024-01-10\",\"startTime\":\"" + start
                + "\",\"endTime\":\"" + end + "\",\"capacity\":" + capacity + extra + "}";
    }

    private static void assertFailure(JsonObject reply, String error) {
        assertFalse(reply.get("success").getAsBoolean(), reply.toString());
        assertEquals(error, reply.get("error").getAsString());
        assertTrue(reply.get("data").isJsonNull());
    }

    @Test
    void testHealth() {
        JsonObject reply = call("HEALTH", "null");

        assertTrue(reply.get("success").getAsBoolean());
        assertTrue(reply.get("error").isJsonNull());
        assertEquals("healthy", reply.getAsJsonObject("data").get("status").getAsString());
    }

    @Test
    void testListRooms() {
        JsonArray rooms = call("list_rooms", "null").getAsJsonArray("data");

        assertEquals(7, rooms.size());
        JsonObject first = rooms.get(0).getAsJsonObject();
        assertEquals("101", first.get("roomId").getAsString());
        assertEquals(6, first.getAsJsonObject("facilities").size());
        assertFalse(first.getAsJsonObject("facilities").get("lab").getAsBoolean());
        assertEquals(0, first.get("bookingsCount").getAsInt());
    }

    @Test
    void testGetUnknownRoom() {
        assertFailure(call("GET_ROOM", "{\"roomId\":\"999\"}"), "ROOM_NOT_FOUND");
    }

    @Test
    void testAddRoom() {
        JsonObject reply = call("ADD_ROOM",
                "{\"roomId\":\"501\",\"building\":\"Main\",\"capacity\":45,\"floor\":5,\"facilities\":{\"audio\":true}}");

        assertTrue(reply.get("success").getAsBoolean());
        assertEquals("Room added successfully", reply.get("message").getAsString());
        JsonObject room = reply.getAsJsonObject("data");
        assertTrue(room.getAsJsonObject("facilities").get("audio").getAsBoolean());
        assertTrue(room.getAsJsonArray("adjacentRooms").size() > 0);

        assertFailure(call("ADD_ROOM", "{\"roomId\":\"501\",\"building\":\"Main\",\"capacity\":45}"), "DUPLICATE_ROOM");
        assertFailure(call("ADD_ROOM", "{\"roomId\":\"502\",\"building\":\"Main\"}"), "INVALID_REQUEST");
        assertFailure(call("ADD_ROOM", "{\"roomId\":\"503\",\"building\":\"Main\",\"capacity\":-1}"), "INVALID_REQUEST");
    }

    @Test
    void testAllocateLab() {
        JsonObject reply = call("ALLOCATE", allocation("Chemistry", 40, "09:00", "10:00",
                ",\"facilities\":{\"lab\":true}"));

        assertTrue(reply.get("success").getAsBoolean(), reply.toString());
        JsonObject data = reply.getAsJsonObject("data");
        assertEquals("201", data.getAsJsonObject("room").get("roomId").getAsString());
        assertEquals(data.get("bookingId").getAsString(), data.getAsJsonObject("booking").get("bookingId").getAsString());
        assertEquals("09:00", data.getAsJsonObject("booking").get("startTime").getAsString());
    }

    @Test
    void testAllocateSpecificRoomTwice() {
        String extra = ",\"roomId\":\"201\"";
        assertTrue(call("ALLOCATE", allocation("A", 30, "09:00", "10:00", extra)).get("success").getAsBoolean());

        assertFailure(call("ALLOCATE", allocation("B", 30, "09:30", "10:30", extra)), "NO_AVAILABLE_ROOM");
        assertTrue(call("ALLOCATE", allocation("C", 30, "10:00", "11:00", extra)).get("success").getAsBoolean());
    }

    @Test
    void testAllocateRejectsBadInput() {
        assertFailure(call("ALLOCATE", allocation("A", 30, "25:00", "26:00", "")), "INVALID_REQUEST");
        assertFailure(call("ALLOCATE", allocation("A", 30, "10:00", "09:00", "")), "INVALID_REQUEST");
        assertFailure(call("ALLOCATE", allocation("A", 0, "09:00", "10:00", "")), "INVALID_REQUEST");
        assertFailure(call("ALLOCATE", allocation("", 30, "09:00", "10:00", "")), "INVALID_REQUEST");
        assertFailure(call("ALLOCATE", allocation("A", 30, "09:00", "10:00", ",\"facilities\":{\"pool\":true}")),
                "INVALID_REQUEST");
        assertFailure(call("ALLOCATE", "null"), "INVALID_REQUEST");
    }

    @Test
    void testMalformedEnvelopes() {
        assertFailure(call("{not json"), "INVALID_REQUEST");
        assertFailure(call(""), "INVALID_REQUEST");
        assertFailure(call("{\"payload\":{}}"), "INVALID_REQUEST");
        assertFailure(call("TELEPORT", "{}"), "INVALID_REQUEST");
    }

    @Test
    void testScheduleAndAlternatives() {
        call("ALLOCATE", allocation("A", 40, "09:00", "10:00", ",\"roomId\":\"201\""));

        JsonArray all = call("SCHEDULE", "null").getAsJsonArray("data");
        assertEquals(1, all.size());
        assertEquals("201", all.get(0).getAsJsonObject().getAsJsonObject("room").get("roomId").getAsString());
        assertEquals(0, call("SCHEDULE", "{\"roomId\":\"101\"}").getAsJsonArray("data").size());

        JsonArray alternatives = call("ALTERNATIVES",
                "{\"roomId\":\"201\",\"date\":\"2024-01-10\",\"startTime\":\"09:30\",\"endTime\":\"10:30\"}")
                .getAsJsonArray("data");
        // AUD-1 has no similar room, so the walk from 201 never reaches it
        assertEquals(5, alternatives.size());
        alternatives.forEach(r -> {
            String roomId = r.getAsJsonObject().get("roomId").getAsString();
            assertNotEquals("201", roomId);
            assertNotEquals("AUD-1", roomId);
        });
    }

    @Test
    void testScheduleFilters() {
        call("ALLOCATE", allocation("Late", 40, "11:00", "12:00", ",\"roomId\":\"201\""));
        call("ALLOCATE", allocation("Early", 50, "08:00", "09:00", ",\"roomId\":\"101\""));

        JsonArray all = call("SCHEDULE", "{}").getAsJsonArray("data");
        assertEquals(2, all.size());
        assertEquals("Early", all.get(0).getAsJsonObject().getAsJsonObject("booking").get("courseName").getAsString());

        JsonArray science = call("SCHEDULE", "{\"building\":\"Science\",\"date\":\"2024-01-10\"}")
                .getAsJsonArray("data");
        assertEquals(1, science.size());
        assertEquals("201", science.get(0).getAsJsonObject().getAsJsonObject("room").get("roomId").getAsString());
        assertEquals(0, call("SCHEDULE", "{\"date\":\"2024-01-11\"}").getAsJsonArray("data").size());

        assertFailure(call("SCHEDULE", "{\"date\":\"tomorrow\"}"), "INVALID_REQUEST");
    }

    @Test
    void testMalformedPayloadIsInvalidRequest() {
        assertFailure(call("ALLOCATE", "{\"courseName\":\"A\",\"capacity\":\"lots\"}"), "INVALID_REQUEST");
    }

    @Test
    void testEngineFailureIsInternalError() {
        // every draw collides once the first id is taken
        Random stuck = new Random() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        };
        AllocationService service = new AllocationService(() -> {
            ClassroomAllocator allocator = new ClassroomAllocator(
                    new ActivityLog(ActivityLog.DEFAULT_CAPACITY, TestRooms.CLOCK),
                    new BookingIdGenerator(TestRooms.CLOCK, stuck));
            allocator.registerRoom("R1", "Main", 30, 1, Set.of());
            return allocator;
        });

        try (AllocationServer stuckServer = new AllocationServer(service, "tcp://*:5598")) {
            String first = "{\"action\":\"ALLOCATE\",\"payload\":" + allocation("A", 10, "09:00", "10:00", "") + "}";
            String second = "{\"action\":\"ALLOCATE\",\"payload\":" + allocation("B", 10, "10:00", "11:00", "") + "}";
            assertTrue(stuckServer.handle(first).isSuccess());

            ApiResponse reply = stuckServer.handle(second);

            assertFalse(reply.isSuccess());
            assertEquals(AllocationServer.INTERNAL_ERROR, reply.getError());
        }
    }

    @Test
    void testConflictsAndStatistics() {
        assertEquals(0, call("CONFLICTS", "null").getAsJsonArray("data").size());

        JsonObject stats = call("STATISTICS", "null").getAsJsonObject("data");
        assertEquals(7, stats.get("totalRooms").getAsInt());
        assertEquals(0, stats.get("totalBookings").getAsInt());
        assertEquals(0.0, stats.get("utilizationRate").getAsDouble());
    }

    @Test
    void testLogsByCategoryAndClear() {
        call("ALLOCATE", allocation("Huge", 5000, "09:00", "10:00", ""));

        JsonArray errors = call("LOGS", "{\"category\":\"error\"}").getAsJsonArray("data");
        assertEquals(1, errors.size());
        assertEquals("error", errors.get(0).getAsJsonObject().get("type").getAsString());
        assertEquals("No suitable rooms for Huge", errors.get(0).getAsJsonObject().get("message").getAsString());
        assertFailure(call("LOGS", "{\"category\":\"debug\"}"), "INVALID_REQUEST");

        assertTrue(call("CLEAR_LOGS", "null").get("success").getAsBoolean());
        assertEquals(1, call("LOGS", "null").getAsJsonArray("data").size());
    }

    @Test
    void testResetRestoresSeed() {
        call("ADD_ROOM", "{\"roomId\":\"501\",\"building\":\"Main\",\"capacity\":45}");
        call("ALLOCATE", allocation("A", 40, "09:00", "10:00", ""));

        JsonObject reply = call("RESET", "null");

        assertEquals("System reset with sample data", reply.get("message").getAsString());
        assertEquals(7, reply.getAsJsonObject("data").get("totalRooms").getAsInt());
        assertEquals(0, reply.getAsJsonObject("data").get("totalBookings").getAsInt());
        assertFailure(call("GET_ROOM", "{\"roomId\":\"501\"}"), "ROOM_NOT_FOUND");
    }

    @Test
    void testToAllocationRequestDefaultsFacilities() {
        AllocationRequest request = AllocationServer.toAllocationRequest(
                JsonUtil.fromJson(allocation("A", 10, "09:00", "10:00", ""), AllocateRequest.class));

        assertTrue(request.getRequiredFacilities().isEmpty());
        assertTrue(request.getBuilding().isEmpty());
    }
}
