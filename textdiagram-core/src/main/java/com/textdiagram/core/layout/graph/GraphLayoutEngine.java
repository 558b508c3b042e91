package com.textdiagram.core.layout.graph;

import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.layout.RankAssigner;
import com.textdiagram.core.model.graph.Direction;
import com.textdiagram.core.model.graph.Edge;
import com.textdiagram.core.model.graph.GraphDiagram;
import com.textdiagram.core.model.graph.NodeDecl;
import com.textdiagram.core.model.graph.NodeShape;
import com.textdiagram.core.model.graph.Subgraph;
import com.textdiagram.core.util.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Computes {@link GraphLayout}s from parsed flowcharts.
 *
 * <p>Nodes are ranked by longest path. Top-down layouts stack ranks vertically and center
 * each rank horizontally against the widest one; left-to-right layouts place ranks side by
 * side and center each rank vertically.
 *
 * <p>Every subgraph is laid out on its own from its member nodes and the edges between them,
 * then framed by a titled border. Nodes outside all subgraphs form one more group. Groups are
 * stacked along the layout direction, {@link #GROUP_GAP} apart.
 *
 * <p>Edge labels get room of their own. A top-down label sits under its source, or above
 * its target when the source branches out to several children; each node is given a slot
 * wide enough for the labels centered on it, and a rank gap carrying labels gets an extra
 * row. A left-to-right label sits one row above its line, inside the gap right of the
 * source's rank, which is widened to hold it. Labels are never shortened to fit a width.
 *
 * <p>Edges pointing back to an earlier rank are routed around the content through lanes,
 * one per edge, with their labels next to the lanes.
 */
public class GraphLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphLayoutEngine.class);

    /** Columns added to a label's width to get its box width. */
    public static final int BOX_PADDING = 4;

    /** Extra columns for circles, on top of {@link #BOX_PADDING}. */
    public static final int CIRCLE_PADDING = 4;

    /** Rows between ranks in top-down layouts. */
    public static final int TD_RANK_GAP = 2;

    /** Columns between nodes of one rank in top-down layouts. */
    public static final int TD_NODE_GAP = 3;

    /** Smallest number of columns between ranks in left-to-right layouts. */
    public static final int LR_MIN_RANK_GAP = 5;

    /** Columns a left-to-right gap needs for an edge that turns: run in, corner, arrow. */
    public static final int LR_TURN_GAP = 3;

    /** Rows between nodes of one rank in left-to-right layouts. */
    public static final int LR_NODE_GAP = 2;

    /** Distance between subgraph groups along the layout direction. */
    public static final int GROUP_GAP = 2;

    /** Blank columns between a subgraph border and its content. */
    static final int SUBGRAPH_PAD_X = 2;

    /** Blank rows between a subgraph border and its content. */
    static final int SUBGRAPH_PAD_Y = 1;

    private static final int NO_CAP = Integer.MAX_VALUE;
    private static final int WIDEST_GAP = Math.max(TD_NODE_GAP, LR_MIN_RANK_GAP);

    /**
     * Lays out a flowchart without a width limit.
     *
     * @param diagram parsed flowchart
     * @return the layout
     * @throws LayoutException if the diagram has no nodes
     */
    public GraphLayout compute(GraphDiagram diagram) throws LayoutException {
        requireNodes(diagram);
        return layout(diagram, NO_CAP);
    }

    /**
     * Lays out a flowchart so that it fits into {@code maxWidth} columns by trying ever
     * smaller gaps, down to one column. Gaps never shrink below what their labels and
     * turning edges need.
     *
     * <p>Diagrams with subgraphs are not compacted; they either fit at their natural width
     * or fail with {@link LayoutException.Reason#UNSUPPORTED_SHAPE}.
     *
     * @param diagram parsed flowchart
     * @param maxWidth column budget
     * @return a layout no wider than {@code maxWidth}
     * @throws LayoutException if the diagram has no nodes or cannot be made to fit
     */
    public GraphLayout computeWithMaxWidth(GraphDiagram diagram, int maxWidth) throws LayoutException {
        requireNodes(diagram);

        if (!diagram.subgraphs().isEmpty()) {
            GraphLayout layout = layout(diagram, NO_CAP);
            if (layout.width() > maxWidth) {
                throw new LayoutException(LayoutException.Reason.UNSUPPORTED_SHAPE,
                    "diagram with subgraphs too wide: " + layout.width() + " columns, max is " + maxWidth,
                    layout.width());
            }
            return layout;
        }

        int narrowest = Integer.MAX_VALUE;
        for (int cap = WIDEST_GAP; cap >= 1; cap--) {
            GraphLayout layout = layout(diagram, cap);
            if (layout.width() <= maxWidth) {
                return layout;
            }
            log.debug("Gap limit {} gives width {}, over {}", cap, layout.width(), maxWidth);
            narrowest = Math.min(narrowest, layout.width());
        }
        throw LayoutException.tooWide(narrowest, maxWidth);
    }

    private static void requireNodes(GraphDiagram diagram) throws LayoutException {
        Objects.requireNonNull(diagram, "diagram must not be null");
        if (diagram.nodes().isEmpty()) {
            throw LayoutException.empty("nodes");
        }
    }

    private static GraphLayout layout(GraphDiagram diagram, int gapCap) {
        List<Edge> edges = diagram.edges().stream().filter(e -> !e.from().equals(e.to())).toList();
        List<Group> groups = groups(diagram, edges);

        Map<String, Integer> groupOf = new HashMap<>();
        Map<String, Integer> rankOf = new HashMap<>();
        for (int g = 0; g < groups.size(); g++) {
            List<List<NodeDecl>> ranks = groups.get(g).ranks();
            for (int r = 0; r < ranks.size(); r++) {
                for (NodeDecl node : ranks.get(r)) {
                    groupOf.put(node.id(), g);
                    rankOf.put(node.id(), r);
                }
            }
        }
        LabelAnchors anchors = anchorLabels(edges, groupOf, rankOf);

        List<Placed> placed = new ArrayList<>();
        for (Group group : groups) {
            placed.add(placeGroup(group, diagram.direction(), anchors, gapCap));
        }

        boolean topDown = diagram.direction() == Direction.TOP_DOWN;
        int across = 0;
        for (Placed p : placed) {
            across = Math.max(across, topDown ? p.width() : p.height());
        }

        List<NodeLayout> nodes = new ArrayList<>();
        List<SubgraphLayout> subgraphs = new ArrayList<>();
        int offset = 0;
        int width = 0;
        int height = 0;
        for (Placed p : placed) {
            int dx = topDown ? (across - p.width()) / 2 : offset;
            int dy = topDown ? offset : (across - p.height()) / 2;
            p.nodes().forEach(n -> nodes.add(n.moved(dx, dy)));
            if (p.border() != null) {
                SubgraphLayout b = p.border();
                subgraphs.add(new SubgraphLayout(b.id(), b.label(), b.nodeIds(),
                    b.x() + dx, b.y() + dy, b.width(), b.height()));
            }
            width = Math.max(width, dx + p.width());
            height = Math.max(height, dy + p.height());
            offset += (topDown ? p.height() : p.width()) + GROUP_GAP;
        }

        List<EdgeLayout> routed = edges.stream().map(e -> new EdgeLayout(e, EdgeLayout.NO_LANE)).toList();
        GraphLayout draft = new GraphLayout(diagram.direction(), nodes, routed, subgraphs, List.of(), width, height);
        return routeBackEdges(placeLabels(draft, anchors));
    }

    private static List<Group> groups(GraphDiagram diagram, List<Edge> edges) {
        Map<String, NodeDecl> byId = new LinkedHashMap<>();
        diagram.nodes().forEach(n -> byId.put(n.id(), n));

        List<Group> groups = new ArrayList<>();
        Set<String> assigned = new HashSet<>();
        for (Subgraph subgraph : diagram.subgraphs()) {
            List<NodeDecl> members = new ArrayList<>();
            for (String id : subgraph.nodeIds()) {
                if (byId.containsKey(id) && assigned.add(id)) {
                    members.add(byId.get(id));
                }
            }
            groups.add(group(subgraph, members, edges));
        }
        List<NodeDecl> bare = diagram.nodes().stream().filter(n -> !assigned.contains(n.id())).toList();
        if (!bare.isEmpty()) {
            groups.add(group(null, bare, edges));
        }
        return groups;
    }

    private static Group group(Subgraph subgraph, List<NodeDecl> members, List<Edge> edges) {
        Set<String> ids = new HashSet<>();
        members.forEach(n -> ids.add(n.id()));
        List<Edge> internal = edges.stream()
            .filter(e -> ids.contains(e.from()) && ids.contains(e.to()))
            .toList();
        return new Group(subgraph, members, ranks(members, internal), internal);
    }

    /**
     * Decides where each edge label goes. An edge is forward if it leads into a later group,
     * or into a later rank of its own group; those are the edges drawn along the layout
     * direction.
     */
    private static LabelAnchors anchorLabels(List<Edge> edges, Map<String, Integer> groupOf,
                                             Map<String, Integer> rankOf) {
        List<Edge> forward = new ArrayList<>();
        Map<String, Integer> degree = new HashMap<>();
        for (Edge edge : edges) {
            int fromGroup = groupOf.get(edge.from());
            int toGroup = groupOf.get(edge.to());
            boolean isForward = fromGroup != toGroup
                ? toGroup > fromGroup
                : rankOf.get(edge.to()) > rankOf.get(edge.from());
            if (isForward) {
                forward.add(edge);
                degree.merge(edge.from(), 1, Integer::sum);
            }
        }

        Map<String, Edge> belowSource = new LinkedHashMap<>();
        Map<String, List<Edge>> aboveTarget = new LinkedHashMap<>();
        for (Edge edge : forward) {
            if (!edge.hasLabel()) {
                continue;
            }
            if (degree.get(edge.from()) > 1) {
                aboveTarget.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
            } else {
                belowSource.put(edge.from(), edge);
            }
        }
        return new LabelAnchors(belowSource, aboveTarget);
    }

    private static Placed placeGroup(Group group, Direction direction, LabelAnchors anchors, int gapCap) {
        Placed content = direction == Direction.TOP_DOWN
            ? layoutTopDown(group, anchors, Math.min(TD_NODE_GAP, gapCap))
            : layoutLeftRight(group, anchors, gapCap);
        if (group.subgraph() == null) {
            return content;
        }

        Subgraph subgraph = group.subgraph();
        int insetX = 1 + SUBGRAPH_PAD_X;
        int insetY = 1 + SUBGRAPH_PAD_Y;
        int width = Math.max(content.width() + 2 * insetX, TextMetrics.displayWidth(subgraph.label()) + 6);
        int height = content.height() + 2 * insetY;
        List<NodeLayout> nodes = content.nodes().stream().map(n -> n.moved(insetX, insetY)).toList();
        List<String> memberIds = group.members().stream().map(NodeDecl::id).toList();
        SubgraphLayout border = new SubgraphLayout(subgraph.id(), subgraph.label(), memberIds, 0, 0, width, height);
        return new Placed(nodes, border, width, height);
    }

    private static Placed layoutTopDown(Group group, LabelAnchors anchors, int nodeGap) {
        List<List<NodeDecl>> ranks = group.ranks();
        Map<String, Integer> rankOf = rankIndex(ranks);

        Map<String, Integer> slots = new HashMap<>();
        int[] rankWidths = new int[ranks.size()];
        int maxWidth = 0;
        for (int r = 0; r < ranks.size(); r++) {
            int w = nodeGap * (ranks.get(r).size() - 1);
            for (NodeDecl node : ranks.get(r)) {
                int slot = nodeWidth(node);
                if (anchors.belowSource().containsKey(node.id())) {
                    slot = Math.max(slot, TextMetrics.displayWidth(labelText(anchors.belowSource().get(node.id()))) + 2);
                }
                if (anchors.aboveTarget().containsKey(node.id())) {
                    slot = Math.max(slot, TextMetrics.displayWidth(anchors.aboveText(node.id())) + 2);
                }
                slots.put(node.id(), slot);
                w += slot;
            }
            rankWidths[r] = w;
            maxWidth = Math.max(maxWidth, w);
        }

        Map<String, Integer> xs = new HashMap<>();
        for (int r = 0; r < ranks.size(); r++) {
            int x = (maxWidth - rankWidths[r]) / 2;
            for (NodeDecl node : ranks.get(r)) {
                int slot = slots.get(node.id());
                xs.put(node.id(), x + (slot - nodeWidth(node)) / 2);
                x += slot + nodeGap;
            }
        }

        // a gap carries a label row when a label sits under its upper rank or above its lower one
        boolean[] labelRow = new boolean[ranks.size()];
        anchors.belowSource().keySet().stream()
            .filter(rankOf::containsKey)
            .forEach(id -> labelRow[rankOf.get(id)] = true);
        anchors.aboveTarget().keySet().stream()
            .filter(id -> rankOf.containsKey(id) && rankOf.get(id) > 0)
            .forEach(id -> labelRow[rankOf.get(id) - 1] = true);

        List<NodeLayout> nodes = new ArrayList<>();
        int y = 0;
        for (int r = 0; r < ranks.size(); r++) {
            int rankHeight = 0;
            for (NodeDecl node : ranks.get(r)) {
                NodeLayout placed = new NodeLayout(node.id(), node.label(), node.shape(),
                    xs.get(node.id()), y, nodeWidth(node), nodeHeight(node));
                nodes.add(placed);
                rankHeight = Math.max(rankHeight, placed.height());
            }
            y += rankHeight;
            if (r < ranks.size() - 1) {
                y += TD_RANK_GAP + (labelRow[r] ? 1 : 0);
            }
        }
        return new Placed(nodes, null, maxWidth, y);
    }

    private static Placed layoutLeftRight(Group group, LabelAnchors anchors, int gapCap) {
        List<List<NodeDecl>> ranks = group.ranks();
        Map<String, Integer> rankOf = rankIndex(ranks);

        int[] rankHeights = new int[ranks.size()];
        int maxHeight = 0;
        for (int r = 0; r < ranks.size(); r++) {
            int h = LR_NODE_GAP * (ranks.get(r).size() - 1);
            for (NodeDecl node : ranks.get(r)) {
                h += nodeHeight(node);
            }
            rankHeights[r] = h;
            maxHeight = Math.max(maxHeight, h);
        }

        Map<String, Integer> ys = new HashMap<>();
        Map<String, Integer> centers = new HashMap<>();
        for (int r = 0; r < ranks.size(); r++) {
            int y = (maxHeight - rankHeights[r]) / 2;
            for (NodeDecl node : ranks.get(r)) {
                ys.put(node.id(), y);
                centers.put(node.id(), y + nodeHeight(node) / 2);
                y += nodeHeight(node) + LR_NODE_GAP;
            }
        }

        int[] demand = new int[ranks.size()];
        for (Edge edge : group.internal()) {
            int from = rankOf.get(edge.from());
            if (rankOf.get(edge.to()) <= from) {
                continue;
            }
            boolean turns = !centers.get(edge.from()).equals(centers.get(edge.to()));
            int need = turns ? LR_TURN_GAP : 0;
            if (edge.equals(anchors.belowSource().get(edge.from()))) {
                int w = TextMetrics.displayWidth(labelText(edge));
                need = Math.max(need, turns ? 2 * w + 4 : w + 2);
            } else if (edge.hasLabel() && anchors.aboveTarget().containsKey(edge.to())) {
                need = Math.max(need, 2 * TextMetrics.displayWidth(anchors.aboveText(edge.to())) + 4);
            }
            demand[from] = Math.max(demand[from], need);
        }

        List<NodeLayout> nodes = new ArrayList<>();
        int x = 0;
        for (int r = 0; r < ranks.size(); r++) {
            int rankWidth = 0;
            for (NodeDecl node : ranks.get(r)) {
                NodeLayout placed = new NodeLayout(node.id(), node.label(), node.shape(),
                    x, ys.get(node.id()), nodeWidth(node), nodeHeight(node));
                nodes.add(placed);
                rankWidth = Math.max(rankWidth, placed.width());
            }
            x += rankWidth;
            if (r < ranks.size() - 1) {
                x += Math.max(demand[r], Math.min(gapCap, LR_MIN_RANK_GAP));
            }
        }
        return new Placed(nodes, null, x, maxHeight);
    }

    /**
     * Positions the labels of forward edges, then widens the layout, or shifts it right, so
     * that every label lies inside it.
     */
    private static GraphLayout placeLabels(GraphLayout draft, LabelAnchors anchors) {
        boolean topDown = draft.direction() == Direction.TOP_DOWN;
        List<LabelLayout> labels = new ArrayList<>();
        anchors.belowSource().forEach((id, edge) -> {
            NodeLayout from = draft.node(id);
            NodeLayout to = draft.node(edge.to());
            String text = labelText(edge);
            if (topDown) {
                labels.add(new LabelLayout(text, draft.exitRow(from),
                    from.centerX() - TextMetrics.displayWidth(text) / 2));
            } else {
                int end = from.centerY() == to.centerY()
                    ? draft.nextRankColumn(from) - 1
                    : draft.turnColumn(from) - 1;
                labels.add(centered(text, from.centerY() - 1, from.right() + 1, end));
            }
        });
        anchors.aboveTarget().forEach((id, edges) -> {
            NodeLayout to = draft.node(id);
            String text = anchors.aboveText(id);
            if (topDown) {
                labels.add(new LabelLayout(text, Math.max(0, to.y() - 2),
                    to.centerX() - TextMetrics.displayWidth(text) / 2));
            } else {
                NodeLayout from = draft.node(edges.get(0).from());
                labels.add(centered(text, to.centerY() - 1, draft.turnColumn(from) + 1,
                    draft.nextRankColumn(from) - 1));
            }
        });
        if (labels.isEmpty()) {
            return draft;
        }

        int dx = Math.max(0, -labels.stream().mapToInt(LabelLayout::col).min().orElse(0));
        int width = draft.width() + dx;
        for (LabelLayout label : labels) {
            width = Math.max(width, label.right() + dx + 1);
        }
        List<NodeLayout> nodes = draft.nodes().stream().map(n -> n.moved(dx, 0)).toList();
        List<SubgraphLayout> subgraphs = draft.subgraphs().stream()
            .map(s -> new SubgraphLayout(s.id(), s.label(), s.nodeIds(), s.x() + dx, s.y(), s.width(), s.height()))
            .toList();
        List<LabelLayout> moved = labels.stream()
            .map(l -> new LabelLayout(l.text(), l.row(), l.col() + dx))
            .toList();
        return new GraphLayout(draft.direction(), nodes, draft.edges(), subgraphs, moved, width, draft.height());
    }

    private static LabelLayout centered(String text, int row, int start, int end) {
        int span = end - start + 1;
        return new LabelLayout(text, row, start + Math.max(0, (span - TextMetrics.displayWidth(text)) / 2));
    }

    /**
     * Gives every back edge a lane outside the content, innermost for the shortest edge,
     * and places back edge labels beside the lanes.
     */
    private static GraphLayout routeBackEdges(GraphLayout layout) {
        boolean topDown = layout.direction() == Direction.TOP_DOWN;
        List<EdgeLayout> edges = layout.edges();
        List<Integer> back = IntStream.range(0, edges.size())
            .filter(i -> layout.isBackward(edges.get(i)))
            .boxed()
            .sorted(Comparator.comparingInt(i -> span(layout, edges.get(i))))
            .toList();
        if (back.isEmpty()) {
            return layout;
        }
        log.debug("Routing {} back edge(s) around the content", back.size());

        int base = (topDown ? layout.width() : layout.height()) + 1;
        List<EdgeLayout> routed = new ArrayList<>(edges);
        for (int i = 0; i < back.size(); i++) {
            routed.set(back.get(i), new EdgeLayout(edges.get(back.get(i)).edge(), base + i));
        }

        int width = topDown ? base + back.size() : layout.width();
        int height = topDown ? layout.height() : base + back.size();
        List<LabelLayout> labels = new ArrayList<>(layout.labels());
        Set<Integer> usedRows = new HashSet<>();
        List<List<LabelLayout>> strips = new ArrayList<>();
        for (int index : back) {
            Edge edge = edges.get(index).edge();
            if (!edge.hasLabel()) {
                continue;
            }
            NodeLayout from = layout.node(edge.from());
            NodeLayout to = layout.node(edge.to());
            String text = labelText(edge);
            int w = TextMetrics.displayWidth(text);
            LabelLayout label;
            if (topDown) {
                label = new LabelLayout(text, freeRow(usedRows, from.centerY(), to.centerY()), base + back.size() + 1);
            } else {
                int col = Math.max(0, (from.centerX() + to.centerX()) / 2 - w / 2);
                label = stripLabel(strips, text, base + back.size(), col);
            }
            labels.add(label);
            width = Math.max(width, label.right() + 1);
            height = Math.max(height, label.row() + 1);
        }
        return new GraphLayout(layout.direction(), layout.nodes(), routed, layout.subgraphs(), labels, width, height);
    }

    private static int span(GraphLayout layout, EdgeLayout edge) {
        NodeLayout from = layout.node(edge.from());
        NodeLayout to = layout.node(edge.to());
        return layout.direction() == Direction.TOP_DOWN
            ? from.centerY() - to.centerY()
            : from.centerX() - to.centerX();
    }

    /**
     * Picks the first row not yet holding a back edge label: the source's row, then rows
     * up to the target's, then rows below the source.
     */
    private static int freeRow(Set<Integer> used, int sourceRow, int targetRow) {
        for (int row = sourceRow; row >= targetRow; row--) {
            if (used.add(row)) {
                return row;
            }
        }
        int row = sourceRow + 1;
        while (!used.add(row)) {
            row++;
        }
        return row;
    }

    /**
     * Puts a label into the first strip row below the lanes where it does not touch another
     * label.
     */
    private static LabelLayout stripLabel(List<List<LabelLayout>> strips, String text, int firstRow, int col) {
        for (int k = 0; ; k++) {
            if (k == strips.size()) {
                strips.add(new ArrayList<>());
            }
            LabelLayout label = new LabelLayout(text, firstRow + k, col);
            boolean clear = strips.get(k).stream()
                .allMatch(other -> label.right() + 1 < other.col() || other.right() + 1 < label.col());
            if (clear) {
                strips.get(k).add(label);
                return label;
            }
        }
    }

    /**
     * Groups nodes by rank, keeping declaration order within a rank. Empty ranks, which
     * the cycle fallback can leave behind, are dropped.
     */
    private static List<List<NodeDecl>> ranks(List<NodeDecl> members, List<Edge> edges) {
        List<String> ids = members.stream().map(NodeDecl::id).toList();
        List<Map.Entry<String, String>> pairs = edges.stream()
            .<Map.Entry<String, String>>map(e -> new AbstractMap.SimpleImmutableEntry<>(e.from(), e.to()))
            .toList();
        Map<String, Integer> assigned = RankAssigner.assign(ids, pairs);

        TreeMap<Integer, List<NodeDecl>> byRank = new TreeMap<>();
        for (NodeDecl node : members) {
            byRank.computeIfAbsent(assigned.get(node.id()), k -> new ArrayList<>()).add(node);
        }
        return new ArrayList<>(byRank.values());
    }

    private static Map<String, Integer> rankIndex(List<List<NodeDecl>> ranks) {
        Map<String, Integer> index = new HashMap<>();
        for (int r = 0; r < ranks.size(); r++) {
            for (NodeDecl node : ranks.get(r)) {
                index.put(node.id(), r);
            }
        }
        return index;
    }

    /** Edge label on one line; line breaks become spaces. */
    static String labelText(Edge edge) {
        return String.join(" ", TextMetrics.splitLines(edge.label()));
    }

    static int nodeWidth(NodeDecl node) {
        int width = TextMetrics.multilineWidth(node.label()) + BOX_PADDING;
        return node.shape() == NodeShape.CIRCLE ? width + CIRCLE_PADDING : width;
    }

    static int nodeHeight(NodeDecl node) {
        return 2 + TextMetrics.lineCount(node.label());
    }

    private record Group(Subgraph subgraph, List<NodeDecl> members, List<List<NodeDecl>> ranks, List<Edge> internal) {
    }

    /** A laid out group, relative to its own top-left corner. */
    private record Placed(List<NodeLayout> nodes, SubgraphLayout border, int width, int height) {
    }

    /**
     * Label positions by anchor: under the source of an edge that is its source's only
     * forward edge, or above the target of an edge whose source branches out.
     */
    private record LabelAnchors(Map<String, Edge> belowSource, Map<String, List<Edge>> aboveTarget) {

        String aboveText(String id) {
            return String.join(", ", aboveTarget.get(id).stream().map(GraphLayoutEngine::labelText).distinct().toList());
        }
    }
}
