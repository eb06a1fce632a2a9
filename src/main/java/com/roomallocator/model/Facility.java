package com.roomallocator.model;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed vocabulary of room capabilities.
 * On the wire a facility set travels as a map of name to boolean; only the
 * entries flagged {@code true} end up in the set.
 */
public enum Facility {
    PROJECTOR("projector"),
    LAB("lab"),
    ACCESSIBLE("accessible"),
    WHITEBOARD("whiteboard"),
    AUDIO("audio"),
    SMARTBOARD("smartboard");

    private final String key;

    Facility(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Facility fromString(String text) {
        for (Facility f : Facility.values()) {
            if (f.key.equalsIgnoreCase(text)) {
                return f;
            }
        }
        throw new InvalidRequestException("Unknown facility: " + text);
    }

    /**
     * Collects the facilities whose flag is {@code true}. A {@code null} map
     * yields an empty set.
     */
    public static Set<Facility> fromFlags(Map<String, Boolean> flags) {
        EnumSet<Facility> result = EnumSet.noneOf(Facility.class);
        if (flags == null) {
            return result;
        }
        for (Map.Entry<String, Boolean> entry : flags.entrySet()) {
            Facility facility = fromString(entry.getKey());
            if (Boolean.TRUE.equals(entry.getValue())) {
                result.add(facility);
            }
        }
        return result;
    }

    /**
     * Expands a facility set to the full flag map, every vocabulary entry present.
     */
    public static Map<String, Boolean> toFlags(Set<Facility> facilities) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (Facility f : Facility.values()) {
            flags.put(f.key, facilities.contains(f));
        }
        return flags;
    }
}
