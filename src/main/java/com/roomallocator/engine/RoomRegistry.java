package com.roomallocator.engine;

import com.roomallocator.model.Facility;
import com.roomallocator.model.Room;
import com.roomallocator.model.RoomSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns every registered room, in registration order.
 * <p>
 * The registry's monitor is the engine's write lock: registration holds it,
 * and the allocation engine holds it across its availability check and
 * booking write. Readers never take it; they see the last committed state.
 */
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    // Registration order, used for listings and allocation tie-breaks
    private final List<Room> rooms = new CopyOnWriteArrayList<>();
    private final Map<String, Room> roomsById = new ConcurrentHashMap<>();
    private final AdjacencyGraph graph;
    private final ActivityLog activityLog;

    public RoomRegistry(AdjacencyGraph graph, ActivityLog activityLog) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog");
    }

    /**
     * Registers a new room and links it to every similar existing room.
     *
     * @return the new room's summary, or {@link AllocationError#DUPLICATE_ROOM}
     * @throws com.roomallocator.model.InvalidRequestException if the attributes are malformed
     */
    public synchronized Result<RoomSummary> register(String roomId, String building, int capacity,
                                                     int floor, Set<Facility> facilities) {
        if (roomId != null && roomsById.containsKey(roomId)) {
            logger.debug("Rejected duplicate room {}", roomId);
            return Result.failure(AllocationError.DUPLICATE_ROOM, "Room " + roomId + " already exists");
        }
        Room room = new Room(roomId, building, capacity, floor, facilities);
        int edges = graph.connect(room, rooms);
        rooms.add(room);
        roomsById.put(room.getRoomId(), room);

        activityLog.info("Added room " + building + " " + roomId + " to system");
        logger.debug("Registered {} with {} adjacent rooms", room, edges);
        return Result.success(RoomSummary.of(room));
    }

    /**
     * @return the room, or {@link AllocationError#ROOM_NOT_FOUND}
     */
    public Result<Room> lookup(String roomId) {
        return find(roomId)
                .map(Result::success)
                .orElseGet(() -> Result.failure(AllocationError.ROOM_NOT_FOUND, "Room " + roomId + " not found"));
    }

    public Optional<Room> find(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(roomsById.get(roomId));
    }

    /**
     * @return snapshot of all rooms in registration order
     */
    public List<Room> rooms() {
        return List.copyOf(rooms);
    }

    /**
     * Lazy view of room summaries in registration order. Each iteration starts
     * over and walks the rooms committed at the moment it starts.
     */
    public Iterable<RoomSummary> listAll() {
        return () -> new Iterator<>() {
            private final Iterator<Room> delegate = rooms.iterator();

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public RoomSummary next() {
                return RoomSummary.of(delegate.next());
            }
        };
    }

    public int size() {
        return rooms.size();
    }
}
