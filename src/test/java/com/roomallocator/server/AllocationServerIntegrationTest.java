package com.roomallocator.server;

import com.google.gson.JsonObject;
import com.roomallocator.dto.ApiRequest;
import com.roomallocator.network.ZeroMQClient;
import com.roomallocator.service.AllocationService;
import com.roomallocator.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trips through a running server and a DEALER client.
 */
class AllocationServerIntegrationTest {
    private static final String BIND_ENDPOINT = "tcp://*:15572";
    private static final String CONNECT_ENDPOINT = "tcp://localhost:15572";

    private AllocationServer server;
    private ZeroMQClient client;

    @BeforeEach
    void setUp() {
        server = new AllocationServer(AllocationService.seededFrom("dataset/default-rooms.json", 100), BIND_ENDPOINT);
        server.start();
        client = new ZeroMQClient(CONNECT_ENDPOINT, SocketType.DEALER);
        client.connect();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    private JsonObject request(String action, JsonObject payload) {
        assertTrue(client.send(JsonUtil.toJson(new ApiRequest(action, payload))));
        Optional<ZeroMQClient.Frame> reply = client.receive(5000);
        assertTrue(reply.isPresent(), "No reply to " + action);
        return JsonUtil.parseObject(reply.get().body());
    }

    @Test
    @Timeout(20)
    void testAllocateOverTheWire() {
        JsonObject payload = new JsonObject();
        payload.addProperty("courseName", "Data Structures");
        payload.addProperty("instructor", "Dr. Smith");
        payload.addProperty("date", "2024-01-10");
        payload.addProperty("startTime", "09:00");
        payload.addProperty("endTime", "10:30");
        payload.addProperty("capacity", 45);
        payload.addProperty("building", "Main");

        JsonObject reply = request("ALLOCATE", payload);

        assertTrue(reply.get("success").getAsBoolean(), reply.toString());
        JsonObject data = reply.getAsJsonObject("data");
        assertEquals("101", data.getAsJsonObject("room").get("roomId").getAsString());
        assertEquals("Dr. Smith", data.getAsJsonObject("booking").get("instructor").getAsString());

        JsonObject stats = request("STATISTICS", null).getAsJsonObject("data");
        assertEquals(1, stats.get("totalBookings").getAsInt());
    }

    @Test
    @Timeout(20)
    void testClientsWithoutIdentityGetReplies() {
        int clients = 5;
        try (ZContext context = new ZContext()) {
            List<ZMQ.Socket> sockets = new ArrayList<>();
            for (int i = 0; i < clients; i++) {
                ZMQ.Socket socket = context.createSocket(SocketType.DEALER);
                socket.setReceiveTimeOut(5000);
                socket.connect(CONNECT_ENDPOINT);
                sockets.add(socket);
            }
            for (ZMQ.Socket socket : sockets) {
                socket.sendMore("");
                socket.send("{\"action\":\"HEALTH\"}");
            }

            for (ZMQ.Socket socket : sockets) {
                byte[] delimiter = socket.recv(0);
                assertNotNull(delimiter, "Every client should get its own reply");
                JsonObject body = JsonUtil.parseObject(socket.recvStr(0));
                assertTrue(body.get("success").getAsBoolean());
                assertEquals("healthy", body.getAsJsonObject("data").get("status").getAsString());
            }
        }
    }

    @Test
    @Timeout(20)
    void testMalformedRequestGetsErrorReply() {
        assertTrue(client.send("definitely not json"));
        Optional<ZeroMQClient.Frame> reply = client.receive(5000);

        assertTrue(reply.isPresent());
        JsonObject body = JsonUtil.parseObject(reply.get().body());
        assertFalse(body.get("success").getAsBoolean());
        assertEquals("INVALID_REQUEST", body.get("error").getAsString());

        // the server keeps serving
        assertTrue(request("HEALTH", null).get("success").getAsBoolean());
    }
}
