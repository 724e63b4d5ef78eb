package com.agentme.api.trust;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EndorsementGraphTest {

    private final EndorsementGraph graph = new EndorsementGraph(3, 0.9);

    private double factor(Map<String, List<String>> endorsers, Map<String, Double> reputations) {
        return graph.endorsementFactor("subject",
                did -> endorsers.getOrDefault(did, List.of()),
                did -> reputations.getOrDefault(did, 0.0));
    }

    @Test
    void directEndorser_weightedByOneHop() {
        double factor = factor(Map.of("subject", List.of("a")), Map.of("a", 0.5));

        assertEquals(0.45, factor, 1e-12);
    }

    @Test
    void transitiveEndorsers_decayPerHop() {
        double factor = factor(
                Map.of("subject", List.of("a"), "a", List.of("b"), "b", List.of("c"), "c", List.of("d")),
                Map.of("a", 0.1, "b", 0.1, "c", 0.1, "d", 1.0));

        // d sits at hop 4 and is not reached
        assertEquals(0.1 * 0.9 + 0.1 * 0.81 + 0.1 * 0.729, factor, 1e-12);
    }

    @Test
    void cycles_countEachAgentOnce() {
        double factor = factor(
                Map.of("subject", List.of("a"), "a", List.of("b", "subject"), "b", List.of("a")),
                Map.of("a", 0.2, "b", 0.2, "subject", 1.0));

        assertEquals(0.2 * 0.9 + 0.2 * 0.81, factor, 1e-12);
    }

    @Test
    void total_isCappedAtOne() {
        double factor = factor(
                Map.of("subject", List.of("a", "b", "c")),
                Map.of("a", 1.0, "b", 1.0, "c", 1.0));

        assertEquals(1.0, factor);
    }
}
