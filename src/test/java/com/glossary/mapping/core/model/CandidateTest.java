package com.glossary.mapping.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CandidateTest {

    private static ReferenceEntity entity(String id) {
        return ReferenceEntity.of(id, Map.of("name", id));
    }

    @Test
    @DisplayName("Score must be within [0, 1]")
    void scoreRange() {
        assertThrows(IllegalArgumentException.class, () -> new Candidate(entity("RDG-1"), 1.5, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Candidate(entity("RDG-1"), -0.5, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Candidate(entity("RDG-1"), Double.NaN, List.of()));
    }

    @Test
    @DisplayName("Entity is required")
    void entityRequired() {
        assertThrows(NullPointerException.class, () -> new Candidate(null, 0.5, List.of()));
    }

    @Test
    @DisplayName("Exact candidates score 1.0")
    void exactFactory() {
        Candidate exact = Candidate.exact(entity("RDG-1"), List.of("name"));

        assertTrue(exact.isExact());
        assertEquals("RDG-1", exact.entityId());
        assertEquals(List.of("name"), exact.matchedOn());
        assertFalse(new Candidate(entity("RDG-2"), 0.999, null).isExact());
    }

    @Test
    @DisplayName("Ranking orders by score descending then id ascending")
    void ranking() {
        List<Candidate> candidates = new ArrayList<>(List.of(
                new Candidate(entity("RDG-3"), 0.90, List.of()),
                new Candidate(entity("RDG-2"), 0.95, List.of()),
                new Candidate(entity("RDG-1"), 0.90, List.of())));

        candidates.sort(Candidate.RANKING);

        assertEquals(List.of("RDG-2", "RDG-1", "RDG-3"),
                candidates.stream().map(Candidate::entityId).toList());
    }
}
