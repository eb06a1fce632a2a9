package com.roomallocator.server;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.roomallocator.dto.AllocateRequest;
import com.roomallocator.dto.ApiRequest;
import com.roomallocator.dto.ApiResponse;
import com.roomallocator.dto.DtoMapper;
import com.roomallocator.dto.RoomRequest;
import com.roomallocator.dto.SlotQuery;
import com.roomallocator.engine.AllocationError;
import com.roomallocator.engine.ClassroomAllocator;
import com.roomallocator.engine.Result;
import com.roomallocator.model.AllocationRequest;
import com.roomallocator.model.Facility;
import com.roomallocator.model.InvalidRequestException;
import com.roomallocator.model.LogCategory;
import com.roomallocator.model.TimeSlot;
import com.roomallocator.network.ZeroMQClient;
import com.roomallocator.service.AllocationService;
import com.roomallocator.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Serves the allocation engine over a ZeroMQ ROUTER socket.
 * <p>
 * Each request is a JSON {@link ApiRequest}; each reply a JSON
 * {@link ApiResponse} routed back to the sender. Requests are handled one at
 * a time on the socket's listener thread, which is also the only thread
 * writing to the socket.
 */
public final class AllocationServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AllocationServer.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final AllocationService service;
    private final ZeroMQClient frontEnd;
    private volatile boolean running;
    private volatile boolean closed;

    public AllocationServer(AllocationService service, String bindEndpoint) {
        this.service = Objects.requireNonNull(service, "service");
        this.frontEnd = new ZeroMQClient(bindEndpoint, SocketType.ROUTER);
    }

    public void start() {
        if (closed)
            throw new IllegalStateException("Server is closed");
        if (running)
            return;
        running = true;

        frontEnd.bind();
        frontEnd.listen(this::onMessage);
        logger.info("AllocationServer ready on {}", frontEnd.getEndpoint());
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        running = false;
        frontEnd.close();
        logger.info("AllocationServer stopped");
    }

    private void onMessage(ZeroMQClient.Frame frame) {
        ApiResponse response = handle(frame.body());
        boolean sent = frontEnd.reply(frame.identity(), JsonUtil.toJson(response));
        if (!sent) {
            logger.error("Failed to send reply to {}", frame.peer());
        }
    }

    /**
     * Decodes, executes and answers one request document. Never throws.
     */
    ApiResponse handle(String json) {
        ApiRequest request;
        try {
            request = JsonUtil.fromJson(json, ApiRequest.class);
        } catch (JsonParseException | IllegalStateException e) {
            logger.warn("Malformed request {}: {}", json, e.getMessage());
            return invalid("Malformed request: " + e.getMessage());
        }
        if (request == null) {
            return invalid("Empty request");
        }

        RequestAction action = null;
        try {
            action = RequestAction.fromString(request.getAction());
            logger.debug("Handling {}", action);
            return dispatch(action, request.getPayload());
        } catch (InvalidRequestException e) {
            logger.debug("Rejected {} request: {}", action, e.getMessage());
            return invalid(e.getMessage());
        } catch (JsonParseException e) {
            logger.debug("Malformed {} payload: {}", action, e.getMessage());
            return invalid("Malformed payload: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling {}", action, e);
            return ApiResponse.failure(INTERNAL_ERROR, e.getMessage());
        }
    }

    private ApiResponse dispatch(RequestAction action, JsonObject payload) {
        ClassroomAllocator allocator = service.current();
        switch (action) {
            case HEALTH:
                return ApiResponse.ok("Classroom allocation system is running", Map.of("status", "healthy"));
            case LIST_ROOMS:
                return ApiResponse.ok(DtoMapper.toRoomResponses(allocator.listRooms()));
            case GET_ROOM: {
                SlotQuery query = require(payload, SlotQuery.class);
                return toResponse(allocator.getRoom(query.getRoomId()).map(DtoMapper::toRoomResponse));
            }
            case ADD_ROOM:
                return addRoom(allocator, require(payload, RoomRequest.class));
            case ALLOCATE:
                return toResponse(allocator.allocate(toAllocationRequest(require(payload, AllocateRequest.class)))
                        .map(DtoMapper::toAllocationResponse));
            case SCHEDULE: {
                SlotQuery query = JsonUtil.fromJson(payload, SlotQuery.class);
                if (query == null) {
                    return ApiResponse.ok(DtoMapper.toScheduleResponses(allocator.getSchedule(null)));
                }
                return ApiResponse.ok(DtoMapper.toScheduleResponses(allocator.getSchedule(
                        query.getRoomId(), parseDate(query.getDate()), query.getBuilding())));
            }
            case ALTERNATIVES: {
                SlotQuery query = require(payload, SlotQuery.class);
                TimeSlot slot = TimeSlot.parse(query.getDate(), query.getStartTime(), query.getEndTime());
                return ApiResponse.ok(DtoMapper.toRoomResponses(allocator.findAlternatives(query.getRoomId(), slot)));
            }
            case CONFLICTS:
                return ApiResponse.ok(DtoMapper.toConflictResponses(allocator.detectConflicts()));
            case LOGS: {
                SlotQuery query = JsonUtil.fromJson(payload, SlotQuery.class);
                if (query == null || query.getCategory() == null || query.getCategory().isBlank()) {
                    return ApiResponse.ok(DtoMapper.toLogResponses(allocator.getLogs()));
                }
                LogCategory category = LogCategory.fromString(query.getCategory());
                return ApiResponse.ok(DtoMapper.toLogResponses(allocator.getLogs(category)));
            }
            case CLEAR_LOGS:
                allocator.clearLogs();
                return ApiResponse.ok("Logs cleared", null);
            case STATISTICS:
                return ApiResponse.ok(DtoMapper.toStatisticsResponse(allocator.getStatistics()));
            case RESET: {
                ClassroomAllocator fresh = service.reset();
                return ApiResponse.ok("System reset with sample data",
                        DtoMapper.toStatisticsResponse(fresh.getStatistics()));
            }
            default:
                return invalid("Unsupported action: " + action);
        }
    }

    private ApiResponse addRoom(ClassroomAllocator allocator, RoomRequest request) {
        if (request.getCapacity() == null) {
            throw new InvalidRequestException("Capacity is required");
        }
        int floor = request.getFloor() == null ? 0 : request.getFloor();
        Result<?> result = allocator.registerRoom(request.getRoomId(), request.getBuilding(),
                request.getCapacity(), floor, Facility.fromFlags(request.getFacilities()))
                .map(DtoMapper::toRoomResponse);
        if (result.isSuccess()) {
            return ApiResponse.ok("Room added successfully", result.getValue());
        }
        return toResponse(result);
    }

    static AllocationRequest toAllocationRequest(AllocateRequest request) {
        if (request.getCapacity() == null) {
            throw new InvalidRequestException("Capacity is required");
        }
        return AllocationRequest.builder()
                .courseName(request.getCourseName())
                .instructor(request.getInstructor())
                .slot(TimeSlot.parse(request.getDate(), request.getStartTime(), request.getEndTime()))
                .capacity(request.getCapacity())
                .building(request.getBuilding())
                .roomId(request.getRoomId())
                .requireAll(Facility.fromFlags(request.getFacilities()))
                .build();
    }

    private static LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Malformed date: " + date, e);
        }
    }

    private static <T> T require(JsonObject payload, Class<T> type) {
        T value = JsonUtil.fromJson(payload, type);
        if (value == null) {
            throw new InvalidRequestException("Missing payload");
        }
        return value;
    }

    private static ApiResponse toResponse(Result<?> result) {
        if (result.isSuccess()) {
            return ApiResponse.ok(result.getValue());
        }
        return ApiResponse.failure(result.getError().name(), result.getMessage());
    }

    private static ApiResponse invalid(String message) {
        return ApiResponse.failure(AllocationError.INVALID_REQUEST.name(), message);
    }
}
