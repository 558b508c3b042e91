package com.textdiagram.core.renderer.impl;

import com.textdiagram.core.canvas.BoxGlyphs;
import com.textdiagram.core.canvas.Canvas;
import com.textdiagram.core.layout.graph.EdgeLayout;
import com.textdiagram.core.layout.graph.GraphLayout;
import com.textdiagram.core.layout.graph.LabelLayout;
import com.textdiagram.core.layout.graph.NodeLayout;
import com.textdiagram.core.layout.graph.SubgraphLayout;
import com.textdiagram.core.model.graph.Direction;
import com.textdiagram.core.model.graph.EdgeType;
import com.textdiagram.core.renderer.Boxes;
import com.textdiagram.core.renderer.DiagramRenderer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Renders flowcharts.
 *
 * <p>Top-down edges leave through the bottom border and enter through the top border. A node
 * with several children gets one bar under it that branches down to each child; several
 * parents of one node share one bar above it. Left-to-right edges run straight between the
 * side borders, or turn in the column the layout reserves for the gap after the source's
 * rank, so that edges leaving one rank join into one bar.
 *
 * <p>Edges pointing back against the layout direction run through the lanes the layout
 * gives them, outside the content.
 *
 * <p>Drawing order: subgraph borders, edge lines, nodes, then arrowheads and border tees,
 * subgraph titles and finally the labels placed by the layout. Nodes are drawn over the
 * lines, so an edge passing behind a node never erases its text.
 */
public class GraphRenderer implements DiagramRenderer<GraphLayout> {

    static final char ARROW_DOWN = '▼';
    static final char ARROW_UP = '▲';
    static final char ARROW_RIGHT = '>';
    static final char ARROW_LEFT = '<';

    @Override
    public String render(GraphLayout layout) {
        Canvas canvas = new Canvas(layout.width(), layout.height());
        for (SubgraphLayout subgraph : layout.subgraphs()) {
            Boxes.border(canvas, subgraph.x(), subgraph.y(), subgraph.width(), subgraph.height(), Boxes.SQUARE);
        }

        Routes routes = new Routes(canvas, layout);
        if (layout.direction() == Direction.TOP_DOWN) {
            routes.topDown();
        } else {
            routes.leftRight();
        }

        for (NodeLayout node : layout.nodes()) {
            drawNode(canvas, node);
        }
        routes.finish();

        for (SubgraphLayout subgraph : layout.subgraphs()) {
            canvas.write(subgraph.y(), subgraph.x() + 2, " " + subgraph.label() + " ");
        }
        for (LabelLayout label : layout.labels()) {
            canvas.write(label.row(), label.col(), label.text());
        }
        return canvas.render();
    }

    private static void drawNode(Canvas canvas, NodeLayout node) {
        switch (node.shape()) {
            case BOX -> Boxes.labeled(canvas, node.x(), node.y(), node.width(), node.height(), node.label(),
                Boxes.SQUARE);
            case ROUND, CIRCLE -> Boxes.centered(canvas, node.x(), node.y(), node.width(), node.height(),
                node.label(), Boxes.ROUND);
            case DIAMOND -> Boxes.labeled(canvas, node.x(), node.y(), node.width(), node.height(), node.label(),
                Boxes.DIAMOND);
        }
    }

    /**
     * Edge routing for one render. Lines go onto the canvas right away; arrowheads and the
     * tees on node borders are kept until {@link #finish()}, after the nodes are drawn.
     */
    private static final class Routes {

        private final Canvas canvas;
        private final GraphLayout layout;
        private final List<Consumer<Canvas>> overNodes = new ArrayList<>();

        Routes(Canvas canvas, GraphLayout layout) {
            this.canvas = canvas;
            this.layout = layout;
        }

        void finish() {
            overNodes.forEach(step -> step.accept(canvas));
        }

        // ---------------------------------------------------------------------------------
        // Top-down

        void topDown() {
            List<EdgeLayout> forward = new ArrayList<>();
            for (EdgeLayout edge : layout.edges()) {
                if (edge.hasLane()) {
                    rightLane(edge);
                } else if (layout.isForward(edge)) {
                    forward.add(edge);
                } else {
                    sideBySide(edge);
                }
            }

            Map<String, List<EdgeLayout>> outgoing = forward.stream()
                .collect(Collectors.groupingBy(EdgeLayout::from, LinkedHashMap::new, Collectors.toList()));
            List<EdgeLayout> remaining = new ArrayList<>();
            for (Map.Entry<String, List<EdgeLayout>> entry : outgoing.entrySet()) {
                if (entry.getValue().size() > 1) {
                    fanOut(layout.node(entry.getKey()), entry.getValue());
                } else {
                    remaining.addAll(entry.getValue());
                }
            }

            Map<String, List<EdgeLayout>> incoming = remaining.stream()
                .collect(Collectors.groupingBy(EdgeLayout::to, LinkedHashMap::new, Collectors.toList()));
            for (Map.Entry<String, List<EdgeLayout>> entry : incoming.entrySet()) {
                if (entry.getValue().size() > 1) {
                    fanIn(layout.node(entry.getKey()), entry.getValue());
                } else {
                    downwards(entry.getValue().get(0));
                }
            }
        }

        private void downwards(EdgeLayout edge) {
            NodeLayout from = layout.node(edge.from());
            NodeLayout to = layout.node(edge.to());
            int headRow = to.y() - 1;
            char vertical = vertical(edge.type());
            bottomTee(from);

            if (from.centerX() == to.centerX()) {
                verticalRun(from.centerX(), from.bottom() + 1, headRow - 1, vertical);
            } else {
                // a label under the source takes the exit row, so the turn goes one lower
                int exit = layout.exitRow(from);
                int bendRow = Math.min(edge.edge().hasLabel() ? exit + 1 : exit, headRow - 1);
                verticalRun(from.centerX(), from.bottom() + 1, bendRow - 1, vertical);
                bar(bendRow, List.of(from.centerX()), List.of(to.centerX()), style(edge.type()));
                verticalRun(to.centerX(), bendRow + 1, headRow - 1, vertical);
            }
            head(headRow, to.centerX(), edge.type().hasArrowHead(), vertical, ARROW_DOWN);
        }

        private void fanOut(NodeLayout from, List<EdgeLayout> edges) {
            bottomTee(from);
            int barRow = layout.exitRow(from);
            EdgeType first = edges.get(0).type();
            verticalRun(from.centerX(), from.bottom() + 1, barRow - 1, vertical(first));

            List<Integer> children = new ArrayList<>();
            for (EdgeLayout edge : edges) {
                children.add(layout.node(edge.to()).centerX());
            }
            bar(barRow, List.of(from.centerX()), children, style(first));

            for (EdgeLayout edge : edges) {
                NodeLayout to = layout.node(edge.to());
                char vertical = vertical(edge.type());
                verticalRun(to.centerX(), barRow + 1, to.y() - 2, vertical);
                head(to.y() - 1, to.centerX(), edge.type().hasArrowHead(), vertical, ARROW_DOWN);
            }
        }

        private void fanIn(NodeLayout to, List<EdgeLayout> edges) {
            List<NodeLayout> parents = edges.stream().map(e -> layout.node(e.from())).toList();
            int barRow = fanInRow(to, parents);
            boolean arrowHead = false;
            List<Integer> columns = new ArrayList<>();
            for (EdgeLayout edge : edges) {
                NodeLayout from = layout.node(edge.from());
                bottomTee(from);
                verticalRun(from.centerX(), from.bottom() + 1, barRow - 1, vertical(edge.type()));
                columns.add(from.centerX());
                arrowHead |= edge.type().hasArrowHead();
            }

            EdgeType first = edges.get(0).type();
            bar(barRow, columns, List.of(to.centerX()), style(first));
            verticalRun(to.centerX(), barRow + 1, to.y() - 2, vertical(first));
            head(to.y() - 1, to.centerX(), arrowHead, vertical(first), ARROW_DOWN);
        }

        /**
         * Row of the bar joining several parents: two rows above the target, or right under
         * the parents when that row is the top border of the target's subgraph.
         */
        private int fanInRow(NodeLayout to, List<NodeLayout> parents) {
            int row = to.y() - 2;
            boolean onBorder = layout.subgraphs().stream().anyMatch(s -> s.y() == row && s.contains(to));
            if (!onBorder) {
                return row;
            }
            int exit = 0;
            for (NodeLayout parent : parents) {
                exit = Math.max(exit, layout.exitRow(parent));
            }
            return Math.min(exit, row);
        }

        /**
         * Back edge of a top-down layout: out of the source's right side, up its lane and
         * into the target's right side.
         */
        private void rightLane(EdgeLayout edge) {
            NodeLayout from = layout.node(edge.from());
            NodeLayout to = layout.node(edge.to());
            int lane = edge.lane();
            BoxGlyphs.Style style = style(edge.type());
            char horizontal = horizontal(edge.type());

            horizontalRun(from.centerY(), from.right() + 1, lane - 1, horizontal);
            canvas.connect(from.centerY(), lane, BoxGlyphs.LEFT | BoxGlyphs.UP, style);
            verticalRun(lane, to.centerY() + 1, from.centerY() - 1, vertical(edge.type()));
            canvas.connect(to.centerY(), lane, BoxGlyphs.LEFT | BoxGlyphs.DOWN, style);
            horizontalRun(to.centerY(), to.right() + 1, lane - 1, horizontal);
            if (edge.type().hasArrowHead()) {
                overNodes.add(c -> c.set(to.centerY(), to.right() + 1, ARROW_LEFT));
            }
        }

        // ---------------------------------------------------------------------------------
        // Left-to-right

        void leftRight() {
            for (EdgeLayout edge : layout.edges()) {
                if (edge.hasLane()) {
                    lowerLane(edge);
                } else if (layout.isForward(edge)) {
                    NodeLayout from = layout.node(edge.from());
                    NodeLayout to = layout.node(edge.to());
                    if (from.centerY() == to.centerY()) {
                        sideBySide(edge);
                    } else {
                        elbow(edge, from, to);
                    }
                } else {
                    stacked(edge);
                }
            }
        }

        /**
         * L-shaped connector turning in the column shared by every edge leaving the source's
         * rank.
         */
        private void elbow(EdgeLayout edge, NodeLayout from, NodeLayout to) {
            int turn = layout.turnColumn(from);
            int end = to.x() - 1;
            int fromRow = from.centerY();
            int toRow = to.centerY();
            boolean down = toRow > fromRow;
            BoxGlyphs.Style style = style(edge.type());
            char horizontal = horizontal(edge.type());

            horizontalRun(fromRow, from.right() + 1, turn - 1, horizontal);
            canvas.connect(fromRow, turn, BoxGlyphs.LEFT | (down ? BoxGlyphs.DOWN : BoxGlyphs.UP), style);
            verticalRun(turn, Math.min(fromRow, toRow) + 1, Math.max(fromRow, toRow) - 1, vertical(edge.type()));
            canvas.connect(toRow, turn, BoxGlyphs.RIGHT | (down ? BoxGlyphs.UP : BoxGlyphs.DOWN), style);
            horizontalRun(toRow, turn + 1, end, horizontal);
            if (edge.type().hasArrowHead()) {
                overNodes.add(c -> c.set(toRow, end, ARROW_RIGHT));
            }
        }

        /**
         * Back edge of a left-to-right layout: down out of the source, left along its lane
         * and up into the target.
         */
        private void lowerLane(EdgeLayout edge) {
            NodeLayout from = layout.node(edge.from());
            NodeLayout to = layout.node(edge.to());
            int lane = edge.lane();
            BoxGlyphs.Style style = style(edge.type());
            char vertical = vertical(edge.type());

            bottomTee(from);
            verticalRun(from.centerX(), from.bottom() + 1, lane - 1, vertical);
            canvas.connect(lane, from.centerX(), BoxGlyphs.UP | BoxGlyphs.LEFT, style);
            horizontalRun(lane, to.centerX() + 1, from.centerX() - 1, horizontal(edge.type()));
            canvas.connect(lane, to.centerX(), BoxGlyphs.UP | BoxGlyphs.RIGHT, style);
            verticalRun(to.centerX(), to.bottom() + 1, lane - 1, vertical);
            if (edge.type().hasArrowHead()) {
                overNodes.add(c -> c.set(to.bottom() + 1, to.centerX(), ARROW_UP));
            }
        }

        /**
         * Vertical connector between two nodes that share columns, e.g. within one rank.
         */
        private void stacked(EdgeLayout edge) {
            NodeLayout from = layout.node(edge.from());
            NodeLayout to = layout.node(edge.to());
            int col = sharedColumn(from, to);
            boolean downwards = to.y() > from.bottom();
            int start = downwards ? from.bottom() + 1 : to.bottom() + 1;
            int end = downwards ? to.y() - 1 : from.y() - 1;
            verticalRun(col, start, end, vertical(edge.type()));
            if (edge.type().hasArrowHead() && end >= start) {
                overNodes.add(c -> c.set(downwards ? end : start, col, downwards ? ARROW_DOWN : ARROW_UP));
            }
        }

        // ---------------------------------------------------------------------------------
        // Shared

        /**
         * Straight horizontal connector on the source's center row.
         */
        private void sideBySide(EdgeLayout edge) {
            NodeLayout from = layout.node(edge.from());
            NodeLayout to = layout.node(edge.to());
            int row = from.centerY();
            boolean rightwards = to.x() > from.right();
            int start = rightwards ? from.right() + 1 : to.right() + 1;
            int end = rightwards ? to.x() - 1 : from.x() - 1;
            horizontalRun(row, start, end, horizontal(edge.type()));
            if (edge.type().hasArrowHead() && end >= start) {
                overNodes.add(c -> c.set(row, rightwards ? end : start, rightwards ? ARROW_RIGHT : ARROW_LEFT));
            }
        }

        /**
         * Draws a horizontal bar joining columns entering from above to columns leaving below.
         */
        private void bar(int row, List<Integer> fromAbove, List<Integer> toBelow, BoxGlyphs.Style style) {
            int min = Integer.MAX_VALUE;
            int max = Integer.MIN_VALUE;
            for (int c : fromAbove) {
                min = Math.min(min, c);
                max = Math.max(max, c);
            }
            for (int c : toBelow) {
                min = Math.min(min, c);
                max = Math.max(max, c);
            }
            for (int c = min; c <= max; c++) {
                int mask = 0;
                if (c > min) {
                    mask |= BoxGlyphs.LEFT;
                }
                if (c < max) {
                    mask |= BoxGlyphs.RIGHT;
                }
                if (fromAbove.contains(c)) {
                    mask |= BoxGlyphs.UP;
                }
                if (toBelow.contains(c)) {
                    mask |= BoxGlyphs.DOWN;
                }
                canvas.connect(row, c, mask, style);
            }
        }

        private void head(int row, int col, boolean arrowHead, char vertical, char arrow) {
            if (arrowHead) {
                overNodes.add(c -> c.set(row, col, arrow));
            } else {
                canvas.merge(row, col, vertical);
            }
        }

        private void bottomTee(NodeLayout node) {
            overNodes.add(c -> c.connect(node.bottom(), node.centerX(), BoxGlyphs.DOWN));
        }

        private void verticalRun(int col, int fromRow, int toRow, char glyph) {
            for (int r = fromRow; r <= toRow; r++) {
                canvas.merge(r, col, glyph);
            }
        }

        private void horizontalRun(int row, int fromCol, int toCol, char glyph) {
            for (int c = fromCol; c <= toCol; c++) {
                canvas.merge(row, c, glyph);
            }
        }
    }

    /**
     * Picks a column inside both nodes' interiors, or the source's center if they share none.
     */
    private static int sharedColumn(NodeLayout from, NodeLayout to) {
        int lo = Math.max(from.x(), to.x()) + 1;
        int hi = Math.min(from.right(), to.right()) - 1;
        return lo <= hi ? (lo + hi) / 2 : from.centerX();
    }

    private static BoxGlyphs.Style style(EdgeType type) {
        return switch (type.weight()) {
            case NORMAL -> BoxGlyphs.Style.LIGHT;
            case DOTTED -> BoxGlyphs.Style.DASHED;
            case THICK -> BoxGlyphs.Style.DOUBLE;
        };
    }

    private static char vertical(EdgeType type) {
        return switch (type.weight()) {
            case NORMAL -> BoxGlyphs.VERTICAL;
            case DOTTED -> BoxGlyphs.DASHED_VERTICAL;
            case THICK -> BoxGlyphs.DOUBLE_VERTICAL;
        };
    }

    private static char horizontal(EdgeType type) {
        return switch (type.weight()) {
            case NORMAL -> BoxGlyphs.HORIZONTAL;
            case DOTTED -> BoxGlyphs.DASHED_HORIZONTAL;
            case THICK -> BoxGlyphs.DOUBLE_HORIZONTAL;
        };
    }
}
