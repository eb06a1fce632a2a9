package com.roomallocator.engine;

import com.roomallocator.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Derives the similarity links between rooms. The graph itself lives in the
 * rooms' adjacency sets; this class only decides and writes the edges.
 * <p>
 * Two rooms are linked when they are in the same building or when their
 * capacities differ by at most 25% of the larger one. Edges are never removed.
 * Linking a new room costs one comparison per existing room.
 */
public class AdjacencyGraph {
    private static final Logger logger = LoggerFactory.getLogger(AdjacencyGraph.class);

    public static final double CAPACITY_TOLERANCE = 0.25;

    /**
     * Edge rule between two distinct rooms.
     */
    public static boolean isSimilar(Room a, Room b) {
        if (a.getBuilding().equals(b.getBuilding())) {
            return true;
        }
        int difference = Math.abs(a.getCapacity() - b.getCapacity());
        int larger = Math.max(a.getCapacity(), b.getCapacity());
        return (double) difference / larger <= CAPACITY_TOLERANCE;
    }

    /**
     * Links a newly registered room with every matching existing room, in both directions.
     *
     * @param newRoom  the room being registered
     * @param existing rooms registered before it, in registration order
     * @return number of edges created
     */
    public int connect(Room newRoom, Collection<Room> existing) {
        int created = 0;
        for (Room other : existing) {
            if (other.getRoomId().equals(newRoom.getRoomId())) {
                continue;
            }
            if (isSimilar(newRoom, other)) {
                boolean added = newRoom.addAdjacent(other.getRoomId());
                other.addAdjacent(newRoom.getRoomId());
                if (added) {
                    created++;
                }
            }
        }
        logger.debug("Room {} linked to {} existing rooms", newRoom.getRoomId(), created);
        return created;
    }

    /**
     * Counts undirected edges among the given rooms.
     */
    public static int countEdges(Collection<Room> rooms) {
        int endpoints = 0;
        for (Room room : rooms) {
            endpoints += room.getAdjacentRoomIds().size();
        }
        return endpoints / 2;
    }
}
