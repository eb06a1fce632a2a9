package com.roomallocator.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FacilityTest {

    @Test
    void testOnlyTrueFlagsAreRequired() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put("lab", true);
        flags.put("projector", false);
        flags.put("audio", null);

        assertEquals(EnumSet.of(Facility.LAB), Facility.fromFlags(flags));
    }

    @Test
    void testNullFlagsMeanNoFacilities() {
        assertTrue(Facility.fromFlags(null).isEmpty());
    }

    @Test
    void testUnknownFacilityIsRejected() {
        assertThrows(InvalidRequestException.class, () -> Facility.fromFlags(Map.of("jacuzzi", true)));
    }

    @Test
    void testNamesAreCaseInsensitive() {
        assertEquals(Facility.SMARTBOARD, Facility.fromString("SmartBoard"));
    }

    @Test
    void testToFlagsListsWholeVocabulary() {
        Map<String, Boolean> flags = Facility.toFlags(Set.of(Facility.WHITEBOARD));

        assertEquals(Facility.values().length, flags.size());
        assertTrue(flags.get("whiteboard"));
        assertFalse(flags.get("lab"));
    }
}
