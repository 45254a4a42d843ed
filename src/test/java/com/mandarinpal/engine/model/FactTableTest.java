package com.mandarinpal.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class FactTableTest {

    @Test
    void testWith_DoesNotMutate() {
        // Given
        FactTable unknown = FactTable.unknown();

        // When
        FactTable updated = unknown.with(FactKey.HAS_PET, FactState.ASSERTED_ABSENT);

        // Then
        assertEquals(FactState.UNKNOWN, unknown.get(FactKey.HAS_PET));
        assertEquals(FactState.ASSERTED_ABSENT, updated.get(FactKey.HAS_PET));
        assertEquals(List.of(FactKey.HAS_PET), updated.absentKeys());
        assertFalse(updated.allSiblingsAbsent());
    }

    @Test
    void testSerialize_WireNames() throws Exception {
        // Given
        FactTable facts = FactTable.unknown()
            .with(FactKey.HAS_OLDER_SISTER, FactState.ASSERTED_PRESENT)
            .with(FactKey.HAS_PET, FactState.ASSERTED_ABSENT);

        // When
        JsonNode json = new ObjectMapper().valueToTree(facts);

        // Then
        assertEquals("asserted_present", json.get("has_older_sister").asText());
        assertEquals("asserted_absent", json.get("has_pet").asText());
        assertEquals("unknown", json.get("has_older_brother").asText());
        assertEquals(5, json.size());
    }

    @Test
    void testTurnRole_FromWire() {
        assertEquals(TurnRole.STUDENT, TurnRole.fromWire("user"));
        assertEquals(TurnRole.STUDENT, TurnRole.fromWire("Student"));
        assertEquals(TurnRole.PARTNER, TurnRole.fromWire("assistant"));
        assertNull(TurnRole.fromWire("system"));
        assertNull(TurnRole.fromWire(null));
    }

    @Test
    void testTurnRole_FromWireIgnoresDefaultLocale() {
        // Given
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // When & Then
            assertEquals(TurnRole.PARTNER, TurnRole.fromWire("ASSISTANT"));
            assertEquals(TurnRole.STUDENT, TurnRole.fromWire("USER"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testFactKey_SiblingsInDeclarationOrder() {
        assertEquals(List.of(FactKey.HAS_OLDER_BROTHER, FactKey.HAS_YOUNGER_BROTHER,
            FactKey.HAS_OLDER_SISTER, FactKey.HAS_YOUNGER_SISTER), FactKey.siblings());
        assertFalse(FactKey.siblings().contains(FactKey.HAS_PET));
    }
}
