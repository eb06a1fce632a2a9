package com.roomallocator.engine;

import com.roomallocator.model.Room;
import com.roomallocator.model.RoomSummary;
import com.roomallocator.model.TimeSlot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Breadth-first search over the adjacency links for rooms that are free in a
 * given slot. Used when the room someone asked for is taken.
 */
public class AlternativeFinder {
    private final RoomRegistry registry;

    public AlternativeFinder(RoomRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Walks the whole component reachable from {@code startRoomId}, visiting
     * each room once, and keeps the rooms free for {@code slot}. The start
     * room itself is included when it is free.
     *
     * @return free rooms in discovery order; empty when the start room is unknown
     */
    public List<RoomSummary> findAlternatives(String startRoomId, TimeSlot slot) {
        Objects.requireNonNull(slot, "slot");
        List<RoomSummary> alternatives = new ArrayList<>();
        if (registry.find(startRoomId).isEmpty()) {
            return alternatives;
        }

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startRoomId);
        visited.add(startRoomId);

        while (!queue.isEmpty()) {
            String currentId = queue.poll();
            Optional<Room> current = registry.find(currentId);
            if (current.isEmpty()) {
                continue;
            }
            Room room = current.get();
            if (room.isAvailable(slot)) {
                alternatives.add(RoomSummary.of(room));
            }
            for (String adjacentId : room.getAdjacentRoomIds()) {
                if (visited.add(adjacentId)) {
                    queue.add(adjacentId);
                }
            }
        }
        return alternatives;
    }
}
