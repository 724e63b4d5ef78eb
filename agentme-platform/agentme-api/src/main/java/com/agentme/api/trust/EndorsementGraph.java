package com.agentme.api.trust;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Bounded breadth-first walk over incoming endorsements.
 * <p>
 * An endorser found at hop {@code h} contributes {@code reputation * decay^h}. Each agent is
 * counted once per traversal, so cycles terminate; the sum is capped at 1.
 */
public final class EndorsementGraph {

    private final int maxHops;
    private final double hopDecay;

    public EndorsementGraph(int maxHops, double hopDecay) {
        if (maxHops < 1) {
            throw new IllegalArgumentException("maxHops must be at least 1");
        }
        this.maxHops = maxHops;
        this.hopDecay = hopDecay;
    }

    /**
     * @param endorsersOf  active endorsers of an agent, already limited to the most recent ones
     * @param reputationOf reputation in [0, 1] of an endorser
     */
    public double endorsementFactor(
            String subject,
            Function<String, List<String>> endorsersOf,
            ToDoubleFunction<String> reputationOf) {

        Set<String> visited = new HashSet<>();
        visited.add(subject);
        List<String> frontier = List.of(subject);
        double total = 0.0;

        for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
            double weight = Math.pow(hopDecay, hop);
            List<String> next = new ArrayList<>();
            for (String node : frontier) {
                for (String endorser : endorsersOf.apply(node)) {
                    if (visited.add(endorser)) {
                        total += reputationOf.applyAsDouble(endorser) * weight;
                        next.add(endorser);
                    }
                }
            }
            if (total >= 1.0) {
                return 1.0;
            }
            frontier = next;
        }
        return Math.min(1.0, total);
    }
}
