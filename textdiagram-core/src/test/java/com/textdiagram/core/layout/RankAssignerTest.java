package com.textdiagram.core.layout;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RankAssigner}.
 */
class RankAssignerTest {

    @Test
    void assign_chain_increasesAlongEdges() {
        Map<String, Integer> ranks = RankAssigner.assign(
            List.of("A", "B", "C"),
            List.of(Map.entry("A", "B"), Map.entry("B", "C")));

        assertThat(ranks).containsExactly(Map.entry("A", 0), Map.entry("B", 1), Map.entry("C", 2));
    }

    @Test
    void assign_usesLongestPathFromASource() {
        Map<String, Integer> ranks = RankAssigner.assign(
            List.of("A", "B", "C"),
            List.of(Map.entry("A", "B"), Map.entry("B", "C"), Map.entry("A", "C")));

        assertThat(ranks.get("C")).isEqualTo(2);
    }

    @Test
    void assign_everyEdgePointsToAHigherRank() {
        List<Map.Entry<String, String>> edges = List.of(
            Map.entry("root", "left"), Map.entry("root", "right"),
            Map.entry("left", "leaf"), Map.entry("right", "leaf"), Map.entry("other", "leaf"));

        Map<String, Integer> ranks = RankAssigner.assign(List.of(), edges);

        for (Map.Entry<String, String> edge : edges) {
            assertThat(ranks.get(edge.getValue())).isGreaterThan(ranks.get(edge.getKey()));
        }
        assertThat(ranks.get("root")).isZero();
        assertThat(ranks.get("other")).isZero();
    }

    @Test
    void assign_isolatedNodesAndSelfEdges_stayAtRankZero() {
        Map<String, Integer> ranks = RankAssigner.assign(
            List.of("A", "B"),
            List.of(Map.entry("A", "A")));

        assertThat(ranks).containsEntry("A", 0).containsEntry("B", 0);
    }

    @Test
    void assign_cycle_terminatesWithFallbackRank() {
        Map<String, Integer> ranks = RankAssigner.assign(
            List.of("A", "B"),
            List.of(Map.entry("A", "B"), Map.entry("B", "A")));

        // A's predecessor B is ranked while A is in progress, so A counts as rank 0 on that path
        assertThat(ranks).containsEntry("B", 1).containsEntry("A", 2);
    }

    @Test
    void assign_keepsDeclarationOrderThenEdgeOnlyNodes() {
        Map<String, Integer> ranks = RankAssigner.assign(
            List.of("Z", "Y"),
            List.of(Map.entry("X", "Z")));

        assertThat(ranks.keySet()).containsExactly("Z", "Y", "X");
    }

    @Test
    void assign_longChainResolvedFromItsEnd_doesNotOverflow() {
        int length = 10_000;
        List<String> nodes = new ArrayList<>();
        List<Map.Entry<String, String>> edges = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            nodes.add("n" + i);
            if (i > 0) {
                edges.add(Map.entry("n" + (i - 1), "n" + i));
            }
        }
        Collections.reverse(nodes);

        Map<String, Integer> ranks = RankAssigner.assign(nodes, edges);

        assertThat(ranks).hasSize(length);
        assertThat(ranks.get("n0")).isZero();
        assertThat(ranks.get("n" + (length - 1))).isEqualTo(length - 1);
        assertThat(ranks.keySet()).first().isEqualTo("n" + (length - 1));
    }
}
