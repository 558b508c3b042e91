package com.textdiagram.core.layout.sequence;

import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.model.sequence.Activate;
import com.textdiagram.core.model.sequence.AutoNumber;
import com.textdiagram.core.model.sequence.Block;
import com.textdiagram.core.model.sequence.Branch;
import com.textdiagram.core.model.sequence.Deactivate;
import com.textdiagram.core.model.sequence.Destroy;
import com.textdiagram.core.model.sequence.Message;
import com.textdiagram.core.model.sequence.Note;
import com.textdiagram.core.model.sequence.ParticipantDecl;
import com.textdiagram.core.model.sequence.SequenceDiagram;
import com.textdiagram.core.model.sequence.Statement;
import com.textdiagram.core.util.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link SequenceLayout}s from parsed sequence diagrams.
 *
 * <p>The statement tree is flattened depth first (block bodies and branch bodies in source
 * order). Gaps between adjacent lifelines start at {@link #MIN_GAP} and are raised by the
 * messages and notes that need room between them, then by the structural minimum that keeps
 * neighbouring boxes apart. Rows are emitted in flattened order together with one activation
 * snapshot each.
 *
 * <p>{@link #computeWithMaxWidth} fits the result into a column budget: gaps shrink toward
 * their structural minimum first, then the longest participant name is shortened one column
 * at a time.
 */
public class SequenceLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(SequenceLayoutEngine.class);

    /** Smallest distance between two adjacent lifelines. */
    public static final int MIN_GAP = 10;

    /** Columns added to a label's width to get its box width. */
    public static final int BOX_PADDING = 4;

    /** Names are not truncated below this many columns. */
    static final int MIN_NAME_WIDTH = 2;

    /**
     * Lays out a diagram without a width limit.
     *
     * @param diagram parsed diagram
     * @return the layout
     * @throws LayoutException if the diagram has no participants
     */
    public SequenceLayout compute(SequenceDiagram diagram) throws LayoutException {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Roster roster = Roster.of(diagram);
        List<Step> steps = flatten(diagram);
        return build(roster, steps, demandGaps(roster, steps));
    }

    /**
     * Lays out a diagram so that it fits into {@code maxWidth} columns.
     *
     * @param diagram parsed diagram
     * @param maxWidth column budget
     * @return a layout no wider than {@code maxWidth}
     * @throws LayoutException if the diagram has no participants, or with
     *         {@link LayoutException.Reason#INFEASIBLE_WIDTH} if no names are left to shorten
     */
    public SequenceLayout computeWithMaxWidth(SequenceDiagram diagram, int maxWidth) throws LayoutException {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Roster roster = Roster.of(diagram);
        List<Step> steps = flatten(diagram);
        int narrowest = Integer.MAX_VALUE;

        while (true) {
            int[] gaps = demandGaps(roster, steps);
            int[] minimum = structuralGaps(roster);
            SequenceLayout layout = build(roster, steps, gaps);
            while (layout.totalWidth() > maxWidth && shrink(gaps, minimum, layout.totalWidth() - maxWidth)) {
                layout = build(roster, steps, gaps);
                log.debug("Shrunk gaps to {}, width now {}", Arrays.toString(gaps), layout.totalWidth());
            }
            narrowest = Math.min(narrowest, layout.totalWidth());
            if (layout.totalWidth() <= maxWidth) {
                return layout;
            }

            int longest = roster.longestName();
            String name = roster.name(longest);
            if (TextMetrics.multilineWidth(name) <= MIN_NAME_WIDTH) {
                log.debug("Cannot shorten names any further, narrowest layout is {} columns", narrowest);
                throw LayoutException.tooWide(narrowest, maxWidth);
            }
            String shortened = TextMetrics.truncateByOne(name);
            log.debug("Layout is {} columns, over {}; shortening '{}' to '{}'",
                layout.totalWidth(), maxWidth, name, shortened);
            roster = roster.withName(longest, shortened);
        }
    }

    private static SequenceLayout build(Roster roster, List<Step> steps, int[] gaps) {
        List<ParticipantLayout> participants = place(roster, gaps);
        Map<Integer, int[]> frames = frameBounds(roster, steps, participants);

        List<SequenceRow> rows = new ArrayList<>();
        List<ActivationSnapshot> snapshots = new ArrayList<>();
        int[] depth = new int[roster.size()];
        boolean[] destroyed = new boolean[roster.size()];

        for (Step step : steps) {
            if (step instanceof MessageStep messageStep) {
                Message message = messageStep.message();
                if (message.activateTarget()) {
                    depth[roster.index(message.to())]++;
                }
                rows.add(messageRow(roster, participants, messageStep));
                snapshots.add(snapshot(depth));
                if (message.deactivateSource()) {
                    deactivate(depth, roster.index(message.from()));
                }
            } else if (step instanceof FrameStep frame) {
                int[] bounds = frames.get(frame.frameId());
                rows.add(new FrameRow(frame.frameId(), frame.border(), bounds[0], bounds[1], frame.label()));
                snapshots.add(snapshot(depth));
            } else if (step instanceof StatementStep statementStep) {
                Statement statement = statementStep.statement();
                if (statement instanceof Note note) {
                    rows.add(noteRow(roster, participants, note));
                    snapshots.add(snapshot(depth));
                } else if (statement instanceof Activate activate) {
                    depth[roster.index(activate.id())]++;
                } else if (statement instanceof Deactivate deactivate) {
                    deactivate(depth, roster.index(deactivate.id()));
                } else if (statement instanceof Destroy destroy) {
                    int index = roster.index(destroy.id());
                    rows.add(new DestroyRow(index, participants.get(index).centerCol()));
                    snapshots.add(snapshot(depth));
                    destroyed[index] = true;
                }
            }
        }

        // notes and frames may reach left of the first box
        int leftmost = 0;
        for (SequenceRow row : rows) {
            if (row instanceof NoteRow note) {
                leftmost = Math.min(leftmost, note.boxLeft());
            } else if (row instanceof FrameRow frame) {
                leftmost = Math.min(leftmost, frame.frameLeft());
            }
        }
        int shift = -leftmost;
        if (shift > 0) {
            participants = participants.stream().map(p -> p.shifted(shift)).toList();
            rows = rows.stream().map(r -> r.shifted(shift)).toList();
        }

        int totalWidth = 0;
        for (ParticipantLayout participant : participants) {
            totalWidth = Math.max(totalWidth, participant.boxRight() + 1);
        }
        for (SequenceRow row : rows) {
            totalWidth = Math.max(totalWidth, row.rightExtent() + 1);
        }

        List<Boolean> destroyedFlags = new ArrayList<>();
        for (boolean flag : destroyed) {
            destroyedFlags.add(flag);
        }
        return new SequenceLayout(participants, rows, snapshots, destroyedFlags, boxHeight(roster), totalWidth);
    }

    private static List<ParticipantLayout> place(Roster roster, int[] gaps) {
        List<ParticipantLayout> placed = new ArrayList<>();
        int center = 0;
        for (int i = 0; i < roster.size(); i++) {
            String name = roster.name(i);
            int width = boxWidth(name);
            center = i == 0 ? width / 2 : center + gaps[i - 1];
            placed.add(new ParticipantLayout(roster.ids().get(i), name, center,
                center - width / 2, center + (width - 1) / 2));
        }
        return placed;
    }

    /**
     * Resolves the horizontal extent of every block frame.
     *
     * <p>A frame spans the boxes of the participants referenced inside it plus one column,
     * every note and self-message loop inside it, and every nested frame plus one column.
     */
    private static Map<Integer, int[]> frameBounds(Roster roster, List<Step> steps,
                                                   List<ParticipantLayout> participants) {
        Map<Integer, int[]> bounds = new HashMap<>();
        Deque<FrameExtent> open = new ArrayDeque<>();
        for (Step step : steps) {
            if (step instanceof FrameStep frame) {
                switch (frame.border()) {
                    case START -> open.push(new FrameExtent(TextMetrics.displayWidth(frame.label())));
                    case DIVIDER -> open.peek().fitLabel(TextMetrics.displayWidth(frame.label()));
                    case END -> {
                        FrameExtent extent = open.pop();
                        int[] resolved = extent.resolve(participants);
                        bounds.put(frame.frameId(), resolved);
                        if (!open.isEmpty()) {
                            open.peek().includeFrame(extent, resolved);
                        }
                    }
                }
                continue;
            }
            if (open.isEmpty()) {
                continue;
            }
            FrameExtent innermost = open.peek();
            if (step instanceof MessageStep messageStep) {
                MessageRow row = messageRow(roster, participants, messageStep);
                innermost.includeParticipant(row.fromIndex());
                innermost.includeParticipant(row.toIndex());
                innermost.includeColumns(row.leftCol(), row.rightExtent());
            } else if (step instanceof StatementStep statementStep) {
                Statement statement = statementStep.statement();
                if (statement instanceof Note note) {
                    NoteRow row = noteRow(roster, participants, note);
                    note.participants().forEach(id -> innermost.includeParticipant(roster.index(id)));
                    innermost.includeColumns(row.boxLeft(), row.boxRight());
                } else {
                    innermost.includeParticipant(roster.index(participantOf(statement)));
                }
            }
        }
        return bounds;
    }

    private static MessageRow messageRow(Roster roster, List<ParticipantLayout> participants, MessageStep step) {
        Message message = step.message();
        int from = roster.index(message.from());
        int to = roster.index(message.to());
        MessageDirection direction = from <= to ? MessageDirection.LEFT_TO_RIGHT : MessageDirection.RIGHT_TO_LEFT;
        return new MessageRow(from, to, participants.get(from).centerCol(), participants.get(to).centerCol(),
            step.text(), message.arrow(), direction);
    }

    private static NoteRow noteRow(Roster roster, List<ParticipantLayout> participants, Note note) {
        int width = noteWidth(note.text());
        int first = roster.index(note.participants().get(0));
        int center = participants.get(first).centerCol();
        int last = note.participants().size() > 1 ? roster.index(note.participants().get(1)) : first;

        return switch (note.placement()) {
            case RIGHT_OF -> new NoteRow(center + 2, center + 1 + width, note.text());
            case LEFT_OF -> new NoteRow(center - 1 - width, center - 2, note.text());
            case OVER -> {
                if (last == first) {
                    int left = center - width / 2;
                    yield new NoteRow(left, left + width - 1, note.text());
                }
                int left = participants.get(Math.min(first, last)).centerCol() - 2;
                int right = participants.get(Math.max(first, last)).centerCol() + 2;
                yield new NoteRow(left, Math.max(right, left + width - 1), note.text());
            }
        };
    }

    private static int[] demandGaps(Roster roster, List<Step> steps) {
        int[] gaps = new int[Math.max(roster.size() - 1, 0)];
        Arrays.fill(gaps, MIN_GAP);

        for (Step step : steps) {
            if (step instanceof MessageStep messageStep) {
                int from = roster.index(messageStep.message().from());
                int to = roster.index(messageStep.message().to());
                int textWidth = TextMetrics.multilineWidth(messageStep.text());
                if (from == to) {
                    charge(gaps, from, Math.max(textWidth + 2, MessageRow.SELF_LOOP_ARM) + 3);
                } else {
                    spread(gaps, Math.min(from, to), Math.max(from, to), textWidth + 4);
                }
            } else if (step instanceof StatementStep statementStep && statementStep.statement() instanceof Note note) {
                int width = noteWidth(note.text());
                int first = roster.index(note.participants().get(0));
                int last = note.participants().size() > 1 ? roster.index(note.participants().get(1)) : first;
                switch (note.placement()) {
                    case RIGHT_OF -> charge(gaps, first, width + 3);
                    case LEFT_OF -> charge(gaps, first - 1, width + 3);
                    case OVER -> {
                        if (first == last) {
                            int half = divideRoundingUp(width, 2) + 2;
                            charge(gaps, first - 1, half);
                            charge(gaps, first, half);
                        } else {
                            spread(gaps, Math.min(first, last), Math.max(first, last), width - 4);
                        }
                    }
                }
            }
        }

        int[] minimum = structuralGaps(roster);
        for (int i = 0; i < gaps.length; i++) {
            gaps[i] = Math.max(gaps[i], minimum[i]);
        }
        return gaps;
    }

    private static int[] structuralGaps(Roster roster) {
        int[] minimum = new int[Math.max(roster.size() - 1, 0)];
        for (int i = 0; i < minimum.length; i++) {
            minimum[i] = halfWidth(roster.name(i)) + halfWidth(roster.name(i + 1)) + 2;
        }
        return minimum;
    }

    /**
     * Shrinks gaps toward their minimum, each in proportion to its slack.
     *
     * @return false if no gap could shrink
     */
    private static boolean shrink(int[] gaps, int[] minimum, int excess) {
        int slack = 0;
        for (int i = 0; i < gaps.length; i++) {
            slack += gaps[i] - minimum[i];
        }
        if (slack <= 0 || excess <= 0) {
            return false;
        }
        int target = Math.min(excess, slack);
        int[] cuts = new int[gaps.length];
        int cut = 0;
        for (int i = 0; i < gaps.length; i++) {
            cuts[i] = (int) ((long) target * (gaps[i] - minimum[i]) / slack);
            cut += cuts[i];
        }
        // rounding leftovers go to the gaps with the most remaining slack
        while (cut < target) {
            int best = -1;
            for (int i = 0; i < gaps.length; i++) {
                int remaining = gaps[i] - minimum[i] - cuts[i];
                if (remaining > 0 && (best < 0 || remaining > gaps[best] - minimum[best] - cuts[best])) {
                    best = i;
                }
            }
            cuts[best]++;
            cut++;
        }
        for (int i = 0; i < gaps.length; i++) {
            gaps[i] -= cuts[i];
        }
        return true;
    }

    private static void charge(int[] gaps, int index, int demand) {
        if (index >= 0 && index < gaps.length) {
            gaps[index] = Math.max(gaps[index], demand);
        }
    }

    private static void spread(int[] gaps, int lo, int hi, int required) {
        if (required <= 0 || hi <= lo) {
            return;
        }
        int perGap = divideRoundingUp(required, hi - lo);
        for (int i = lo; i < hi; i++) {
            charge(gaps, i, perGap);
        }
    }

    private static int divideRoundingUp(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }

    private static void deactivate(int[] depth, int index) {
        depth[index] = Math.max(0, depth[index] - 1);
    }

    private static ActivationSnapshot snapshot(int[] depth) {
        List<Boolean> active = new ArrayList<>(depth.length);
        for (int d : depth) {
            active.add(d > 0);
        }
        return new ActivationSnapshot(active);
    }

    static int boxWidth(String name) {
        return TextMetrics.multilineWidth(name) + BOX_PADDING;
    }

    static int noteWidth(String text) {
        return TextMetrics.multilineWidth(text) + BOX_PADDING;
    }

    private static int halfWidth(String name) {
        return TextMetrics.multilineWidth(name) / 2 + 2;
    }

    private static int boxHeight(Roster roster) {
        int lines = 1;
        for (int i = 0; i < roster.size(); i++) {
            lines = Math.max(lines, TextMetrics.lineCount(roster.name(i)));
        }
        return 2 + lines;
    }

    private static String participantOf(Statement statement) {
        if (statement instanceof Activate activate) {
            return activate.id();
        }
        if (statement instanceof Deactivate deactivate) {
            return deactivate.id();
        }
        if (statement instanceof Destroy destroy) {
            return destroy.id();
        }
        throw new IllegalArgumentException("Statement has no single participant: " + statement);
    }

    // -------------------------------------------------------------------------------------
    // Flattening

    private static List<Step> flatten(SequenceDiagram diagram) {
        List<Step> steps = new ArrayList<>();
        flatten(diagram.statements(), new Counters(hasAutoNumber(diagram.statements())), steps);
        return steps;
    }

    private static void flatten(List<Statement> statements, Counters counters, List<Step> into) {
        for (Statement statement : statements) {
            if (statement instanceof Block block) {
                int frameId = counters.nextFrameId++;
                into.add(new FrameStep(frameId, FrameBorder.START, block.title()));
                flatten(block.body(), counters, into);
                for (Branch branch : block.branches()) {
                    into.add(new FrameStep(frameId, FrameBorder.DIVIDER, block.dividerTitle(branch)));
                    flatten(branch.body(), counters, into);
                }
                into.add(new FrameStep(frameId, FrameBorder.END, ""));
            } else if (statement instanceof Message message) {
                String text = counters.numbered
                    ? ++counters.messageNumber + ". " + message.text()
                    : message.text();
                into.add(new MessageStep(message, text));
            } else if (!(statement instanceof ParticipantDecl) && !(statement instanceof AutoNumber)) {
                into.add(new StatementStep(statement));
            }
        }
    }

    private static boolean hasAutoNumber(List<Statement> statements) {
        for (Statement statement : statements) {
            if (statement instanceof AutoNumber) {
                return true;
            }
            if (statement instanceof Block block) {
                if (hasAutoNumber(block.body())) {
                    return true;
                }
                for (Branch branch : block.branches()) {
                    if (hasAutoNumber(branch.body())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private interface Step {
    }

    private record MessageStep(Message message, String text) implements Step {
    }

    private record FrameStep(int frameId, FrameBorder border, String label) implements Step {
    }

    private record StatementStep(Statement statement) implements Step {
    }

    /** Running counters threaded through one flattening walk. */
    private static final class Counters {

        private final boolean numbered;
        private int messageNumber;
        private int nextFrameId;

        Counters(boolean numbered) {
            this.numbered = numbered;
        }
    }

    /** Accumulates what one open frame has to contain. */
    private static final class FrameExtent {

        private int labelWidth;
        private int lo = -1;
        private int hi = -1;
        private int minCol = Integer.MAX_VALUE;
        private int maxCol = Integer.MIN_VALUE;

        FrameExtent(int labelWidth) {
            this.labelWidth = labelWidth;
        }

        void fitLabel(int width) {
            labelWidth = Math.max(labelWidth, width);
        }

        void includeParticipant(int index) {
            lo = lo < 0 ? index : Math.min(lo, index);
            hi = Math.max(hi, index);
        }

        void includeColumns(int left, int right) {
            minCol = Math.min(minCol, left);
            maxCol = Math.max(maxCol, right);
        }

        void includeFrame(FrameExtent nested, int[] bounds) {
            if (nested.lo >= 0) {
                includeParticipant(nested.lo);
                includeParticipant(nested.hi);
            }
            includeColumns(bounds[0], bounds[1]);
        }

        int[] resolve(List<ParticipantLayout> participants) {
            int first = lo < 0 ? 0 : lo;
            int last = lo < 0 ? participants.size() - 1 : hi;
            int left = participants.get(first).boxLeft() - 1;
            int right = participants.get(last).boxRight() + 1;
            if (minCol != Integer.MAX_VALUE) {
                left = Math.min(left, minCol - 1);
                right = Math.max(right, maxCol + 1);
            }
            right = Math.max(right, left + labelWidth + 4);
            return new int[] {left, right};
        }
    }

    /** Participant order and display names, read by every layout step. */
    private record Roster(List<String> ids, Map<String, String> names, Map<String, Integer> indexes) {

        static Roster of(SequenceDiagram diagram) throws LayoutException {
            Map<String, String> names = new LinkedHashMap<>();
            collect(diagram.statements(), names);
            if (names.isEmpty()) {
                throw LayoutException.empty("participants");
            }
            return create(names);
        }

        private static Roster create(Map<String, String> names) {
            List<String> ids = List.copyOf(names.keySet());
            Map<String, Integer> indexes = new HashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                indexes.put(ids.get(i), i);
            }
            return new Roster(ids, Map.copyOf(names), indexes);
        }

        private static void collect(List<Statement> statements, Map<String, String> names) {
            for (Statement statement : statements) {
                if (statement instanceof ParticipantDecl decl) {
                    names.putIfAbsent(decl.id(), decl.displayName());
                } else if (statement instanceof Message message) {
                    names.putIfAbsent(message.from(), message.from());
                    names.putIfAbsent(message.to(), message.to());
                } else if (statement instanceof Note note) {
                    note.participants().forEach(id -> names.putIfAbsent(id, id));
                } else if (statement instanceof Block block) {
                    collect(block.body(), names);
                    block.branches().forEach(branch -> collect(branch.body(), names));
                } else if (!(statement instanceof AutoNumber)) {
                    String id = participantOf(statement);
                    names.putIfAbsent(id, id);
                }
            }
        }

        int size() {
            return ids.size();
        }

        int index(String id) {
            return indexes.get(id);
        }

        String name(int index) {
            return names.get(ids.get(index));
        }

        int longestName() {
            int longest = 0;
            for (int i = 1; i < size(); i++) {
                if (TextMetrics.multilineWidth(name(i)) > TextMetrics.multilineWidth(name(longest))) {
                    longest = i;
                }
            }
            return longest;
        }

        Roster withName(int index, String name) {
            Map<String, String> renamed = new LinkedHashMap<>();
            for (String id : ids) {
                renamed.put(id, names.get(id));
            }
            renamed.put(ids.get(index), name);
            return create(renamed);
        }
    }
}
