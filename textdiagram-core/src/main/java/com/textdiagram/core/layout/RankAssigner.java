package com.textdiagram.core.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Longest-path layering of a directed graph of named nodes.
 *
 * <p>A node without predecessors has rank 0; any other node sits one rank below its
 * deepest predecessor. Ranks are memoized, so each node is resolved once. Predecessors are
 * walked depth first on an explicit stack, so long chains do not exhaust the call stack.
 *
 * <p>Self-edges are ignored. Cycles are not rejected: a predecessor that is still on the
 * walk stack counts as rank 0, which breaks the cycle at the edge that closes it. Nodes
 * that only occur as edge endpoints are ranked as well.
 */
public final class RankAssigner {

    private static final Logger log = LoggerFactory.getLogger(RankAssigner.class);

    private final Map<String, List<String>> predecessors = new LinkedHashMap<>();
    private final Map<String, Integer> ranks = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    private RankAssigner() {
    }

    /**
     * Assigns a rank to every node.
     *
     * @param nodes node names in declaration order
     * @param edges directed edges as (from, to) pairs
     * @return ranks keyed by node name, in declaration order followed by edge-only nodes
     */
    public static Map<String, Integer> assign(List<String> nodes, List<Map.Entry<String, String>> edges) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");

        RankAssigner assigner = new RankAssigner();
        for (String node : nodes) {
            assigner.predecessors.computeIfAbsent(node, k -> new ArrayList<>());
        }
        for (Map.Entry<String, String> edge : edges) {
            assigner.predecessors.computeIfAbsent(edge.getKey(), k -> new ArrayList<>());
            List<String> preds = assigner.predecessors.computeIfAbsent(edge.getValue(), k -> new ArrayList<>());
            if (!edge.getKey().equals(edge.getValue())) {
                preds.add(edge.getKey());
            }
        }

        Map<String, Integer> result = new LinkedHashMap<>();
        for (String node : assigner.predecessors.keySet()) {
            result.put(node, assigner.rank(node));
        }
        return result;
    }

    private int rank(String node) {
        Integer known = ranks.get(node);
        if (known != null) {
            return known;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(open(node));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.predecessors.size()) {
                String pred = frame.predecessors.get(frame.next++);
                Integer predRank = ranks.get(pred);
                if (predRank != null) {
                    frame.rank = Math.max(frame.rank, predRank + 1);
                } else if (inProgress.contains(pred)) {
                    log.debug("Cycle detected at node '{}', treating it as rank 0 for this path", pred);
                    frame.rank = Math.max(frame.rank, 1);
                } else {
                    stack.push(open(pred));
                }
                continue;
            }

            stack.pop();
            inProgress.remove(frame.node);
            ranks.put(frame.node, frame.rank);
            Frame parent = stack.peek();
            if (parent != null) {
                parent.rank = Math.max(parent.rank, frame.rank + 1);
            }
        }
        return ranks.get(node);
    }

    private Frame open(String node) {
        inProgress.add(node);
        return new Frame(node, predecessors.getOrDefault(node, List.of()));
    }

    /** A node whose predecessors are being walked. */
    private static final class Frame {
        private final String node;
        private final List<String> predecessors;
        private int next;
        private int rank;

        private Frame(String node, List<String> predecessors) {
            this.node = node;
            this.predecessors = predecessors;
        }
    }
}
