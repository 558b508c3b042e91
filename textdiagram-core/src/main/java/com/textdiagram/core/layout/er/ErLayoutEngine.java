package com.textdiagram.core.layout.er;

import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.layout.RankAssigner;
import com.textdiagram.core.model.er.Entity;
import com.textdiagram.core.model.er.EntityAttribute;
import com.textdiagram.core.model.er.ErDiagram;
import com.textdiagram.core.model.er.Relationship;
import com.textdiagram.core.util.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes {@link ErLayout}s. Entities are ranked left to right by the relationship graph and
 * stacked top-aligned within a rank, one row apart.
 *
 * <p>Each relationship attaches to its entities on a row of its own, starting at the name
 * row and going down; an entity with more relationships on one side than interior rows is
 * made taller. Lines whose two rows differ turn in a column of their own inside the gap
 * after the left entity's rank, and the gap is widened so that their labels fit before the
 * turn.
 */
public class ErLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(ErLayoutEngine.class);

    /** Columns added to the widest text line to get the box width. */
    public static final int BOX_PADDING = 4;

    /** Smallest number of columns between ranks. */
    public static final int MIN_RANK_GAP = 6;

    /** Columns around a relationship label: both cardinality symbols plus two dashes on each side. */
    public static final int LABEL_MARGIN = 8;

    /** Columns around a relationship label in a narrowed gap: both symbols and one dash on each side. */
    public static final int FITTED_LABEL_MARGIN = 6;

    /** Rows between entities of one rank. */
    public static final int ENTITY_GAP = 1;

    /** Gap fitting stops here for gaps no relationship runs through. */
    static final int MIN_FITTED_GAP = 2;

    /** Columns of a cardinality symbol. */
    static final int SYMBOL_WIDTH = 2;

    private static final int NO_CAP = Integer.MAX_VALUE;

    public ErLayout compute(ErDiagram diagram) throws LayoutException {
        requireEntities(diagram);
        return new Plan(diagram).layout(NO_CAP);
    }

    /**
     * Lays out a diagram within {@code maxWidth} columns by narrowing rank gaps. A gap never
     * gets narrower than its labels with a dash on each side and the cardinality symbols, so
     * a fitted diagram shows the same text as the natural one.
     *
     * @param diagram parsed diagram
     * @param maxWidth column budget
     * @return a layout no wider than {@code maxWidth}
     * @throws LayoutException if the diagram has no entities or cannot be made to fit
     */
    public ErLayout computeWithMaxWidth(ErDiagram diagram, int maxWidth) throws LayoutException {
        requireEntities(diagram);
        Plan plan = new Plan(diagram);
        ErLayout layout = plan.layout(NO_CAP);
        if (layout.width() <= maxWidth) {
            return layout;
        }
        int narrowest = layout.width();
        for (int cap = plan.widestGap() - 1; cap >= MIN_FITTED_GAP; cap--) {
            layout = plan.layout(cap);
            if (layout.width() <= maxWidth) {
                return layout;
            }
            log.debug("Rank gap limit {} gives width {}, over {}", cap, layout.width(), maxWidth);
            narrowest = Math.min(narrowest, layout.width());
        }
        throw LayoutException.tooWide(narrowest, maxWidth);
    }

    private static void requireEntities(ErDiagram diagram) throws LayoutException {
        Objects.requireNonNull(diagram, "diagram must not be null");
        if (diagram.entities().isEmpty()) {
            throw LayoutException.empty("entities");
        }
    }

    static int entityWidth(Entity entity) {
        int widest = TextMetrics.displayWidth(entity.name());
        for (EntityAttribute attribute : entity.attributes()) {
            widest = Math.max(widest, TextMetrics.displayWidth(attribute.text()));
        }
        return widest + BOX_PADDING;
    }

    static int entityHeight(Entity entity) {
        return entity.attributes().isEmpty() ? 3 : 3 + entity.attributes().size() + 1;
    }

    /**
     * The part of a layout that does not depend on the gap limit: ranks, rows, entity
     * heights, which lines turn, and how wide each gap wants to be.
     */
    private static final class Plan {

        private final List<List<Entity>> ranks;
        private final Map<String, Integer> rankOf = new HashMap<>();
        private final Map<String, Integer> heights = new HashMap<>();
        private final Map<String, Integer> ys = new HashMap<>();
        private final List<Line> lines = new ArrayList<>();
        private final int[] natural;
        private final int[] floor;
        private final int[] turnLabelWidth;
        private final int height;

        Plan(ErDiagram diagram) {
            ranks = ranks(diagram);
            for (int r = 0; r < ranks.size(); r++) {
                for (Entity entity : ranks.get(r)) {
                    rankOf.put(entity.name(), r);
                }
            }

            Map<String, List<Line>> rightSide = new LinkedHashMap<>();
            Map<String, List<Line>> leftSide = new LinkedHashMap<>();
            for (Relationship relationship : diagram.relationships()) {
                if (relationship.from().equals(relationship.to())) {
                    log.debug("Skipping relationship of '{}' with itself", relationship.from());
                    continue;
                }
                int from = rankOf.get(relationship.from());
                int to = rankOf.get(relationship.to());
                if (from == to) {
                    lines.add(new Line(relationship, relationship.from(), relationship.to(), true));
                    continue;
                }
                String left = from < to ? relationship.from() : relationship.to();
                String right = from < to ? relationship.to() : relationship.from();
                Line line = new Line(relationship, left, right, false);
                lines.add(line);
                rightSide.computeIfAbsent(left, k -> new ArrayList<>()).add(line);
                leftSide.computeIfAbsent(right, k -> new ArrayList<>()).add(line);
            }

            int bottom = 0;
            for (List<Entity> rank : ranks) {
                int y = 0;
                for (Entity entity : rank) {
                    int attached = Math.max(rightSide.getOrDefault(entity.name(), List.of()).size(),
                        leftSide.getOrDefault(entity.name(), List.of()).size());
                    int h = Math.max(entityHeight(entity), attached + 2);
                    heights.put(entity.name(), h);
                    ys.put(entity.name(), y);
                    y += h + ENTITY_GAP;
                    bottom = Math.max(bottom, y - ENTITY_GAP);
                }
            }
            height = bottom;

            // rows in the order of the entities at the other end, to keep lines from crossing
            rightSide.forEach((name, side) -> {
                side.sort(Comparator.comparingInt(line -> ys.get(line.right)));
                for (int k = 0; k < side.size(); k++) {
                    side.get(k).leftRow = ys.get(name) + 1 + k;
                }
            });
            leftSide.forEach((name, side) -> {
                side.sort(Comparator.comparingInt(line -> ys.get(line.left)));
                for (int k = 0; k < side.size(); k++) {
                    side.get(k).rightRow = ys.get(name) + 1 + k;
                }
            });

            natural = new int[ranks.size()];
            floor = new int[ranks.size()];
            turnLabelWidth = new int[ranks.size()];
            int[] turns = new int[ranks.size()];
            Arrays.fill(natural, MIN_RANK_GAP);
            Arrays.fill(floor, MIN_FITTED_GAP);
            for (Line line : lines) {
                if (line.stacked) {
                    if (ys.get(line.left) > ys.get(line.right)) {
                        line.swap();
                    }
                    continue;
                }
                int boundary = rankOf.get(line.left);
                int w = TextMetrics.displayWidth(line.relationship.label());
                if (line.leftRow == line.rightRow) {
                    natural[boundary] = Math.max(natural[boundary], w + LABEL_MARGIN);
                    floor[boundary] = Math.max(floor[boundary], w + FITTED_LABEL_MARGIN);
                } else {
                    line.turnIndex = turns[boundary]++;
                    turnLabelWidth[boundary] = Math.max(turnLabelWidth[boundary], w);
                }
            }
            for (int b = 0; b < ranks.size(); b++) {
                if (turns[b] > 0) {
                    // symbol, dash, label, dash, one column per turn, dash, symbol
                    int need = SYMBOL_WIDTH + 1 + turnLabelWidth[b] + 1 + turns[b] + 1 + SYMBOL_WIDTH;
                    natural[b] = Math.max(natural[b], need);
                    floor[b] = Math.max(floor[b], need);
                }
            }
        }

        int widestGap() {
            return Arrays.stream(natural).max().orElse(MIN_RANK_GAP);
        }

        ErLayout layout(int gapCap) {
            List<EntityLayout> entities = new ArrayList<>();
            Map<String, EntityLayout> byName = new HashMap<>();
            int[] rankX = new int[ranks.size()];
            int[] rankRight = new int[ranks.size()];
            int x = 0;
            for (int r = 0; r < ranks.size(); r++) {
                rankX[r] = x;
                int rankWidth = 0;
                for (Entity entity : ranks.get(r)) {
                    EntityLayout placed = new EntityLayout(entity.name(), entity.attributes(), x,
                        ys.get(entity.name()), entityWidth(entity), heights.get(entity.name()));
                    entities.add(placed);
                    byName.put(placed.name(), placed);
                    rankWidth = Math.max(rankWidth, placed.width());
                }
                rankRight[r] = x + rankWidth - 1;
                x += rankWidth;
                if (r < ranks.size() - 1) {
                    x += Math.max(floor[r], Math.min(natural[r], gapCap));
                }
            }

            List<RelationshipLayout> routed = new ArrayList<>();
            for (Line line : lines) {
                EntityLayout left = byName.get(line.left);
                EntityLayout right = byName.get(line.right);
                String label = line.relationship.label();
                int w = TextMetrics.displayWidth(label);
                if (line.stacked) {
                    int col = left.x() + 2;
                    routed.add(new RelationshipLayout(line.relationship, RelationshipLayout.Route.STACKED,
                        line.left, line.right, left.bottom(), right.y(), col, left.bottom() + 1, col + 2));
                    continue;
                }

                int boundary = rankOf.get(line.left);
                int start = left.right() + 1;
                if (line.leftRow == line.rightRow) {
                    int span = rankX[boundary + 1] - start;
                    routed.add(new RelationshipLayout(line.relationship, RelationshipLayout.Route.STRAIGHT,
                        line.left, line.right, line.leftRow, line.rightRow, RelationshipLayout.NO_TURN,
                        line.leftRow, start + Math.max(0, (span - w) / 2)));
                } else {
                    int turn = rankRight[boundary] + 1 + SYMBOL_WIDTH + 1 + turnLabelWidth[boundary] + 1
                        + line.turnIndex;
                    routed.add(new RelationshipLayout(line.relationship, RelationshipLayout.Route.ELBOW,
                        line.left, line.right, line.leftRow, line.rightRow, turn,
                        line.leftRow, start + SYMBOL_WIDTH + (turn - start - SYMBOL_WIDTH - w) / 2));
                }
            }
            return new ErLayout(entities, routed, x, height);
        }

        private static List<List<Entity>> ranks(ErDiagram diagram) {
            List<String> names = diagram.entities().stream().map(Entity::name).toList();
            List<Map.Entry<String, String>> pairs = diagram.relationships().stream()
                .<Map.Entry<String, String>>map(r -> new AbstractMap.SimpleImmutableEntry<>(r.from(), r.to()))
                .toList();
            Map<String, Integer> assigned = RankAssigner.assign(names, pairs);

            TreeMap<Integer, List<Entity>> byRank = new TreeMap<>();
            for (Entity entity : diagram.entities()) {
                byRank.computeIfAbsent(assigned.get(entity.name()), k -> new ArrayList<>()).add(entity);
            }
            return new ArrayList<>(byRank.values());
        }
    }

    /** A relationship line before columns are known. */
    private static final class Line {
        private final Relationship relationship;
        private final boolean stacked;
        private String left;
        private String right;
        private int leftRow;
        private int rightRow;
        private int turnIndex;

        private Line(Relationship relationship, String left, String right, boolean stacked) {
            this.relationship = relationship;
            this.left = left;
            this.right = right;
            this.stacked = stacked;
        }

        private void swap() {
            String upper = right;
            right = left;
            left = upper;
        }
    }
}
