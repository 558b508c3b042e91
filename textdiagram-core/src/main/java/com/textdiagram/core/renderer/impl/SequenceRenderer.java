package com.textdiagram.core.renderer.impl;

import com.textdiagram.core.canvas.BoxGlyphs;
import com.textdiagram.core.canvas.Canvas;
import com.textdiagram.core.layout.sequence.ActivationSnapshot;
import com.textdiagram.core.layout.sequence.DestroyRow;
import com.textdiagram.core.layout.sequence.FrameBorder;
import com.textdiagram.core.layout.sequence.FrameRow;
import com.textdiagram.core.layout.sequence.MessageDirection;
import com.textdiagram.core.layout.sequence.MessageRow;
import com.textdiagram.core.layout.sequence.NoteRow;
import com.textdiagram.core.layout.sequence.ParticipantLayout;
import com.textdiagram.core.layout.sequence.SequenceLayout;
import com.textdiagram.core.layout.sequence.SequenceRow;
import com.textdiagram.core.model.sequence.ArrowHead;
import com.textdiagram.core.model.sequence.LineStyle;
import com.textdiagram.core.renderer.Boxes;
import com.textdiagram.core.renderer.DiagramRenderer;
import com.textdiagram.core.util.TextMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders sequence diagrams.
 *
 * <p>Participant boxes are drawn at the top and again at the bottom, joined by lifelines.
 * Each body row first draws the lifelines (heavy where the participant is active) and the
 * sides of enclosing frames, then its own content on top.
 */
public class SequenceRenderer implements DiagramRenderer<SequenceLayout> {

    static final char DESTROY_MARKER = '●';

    @Override
    public String render(SequenceLayout layout) {
        Canvas canvas = new Canvas(layout.totalWidth(), layout.totalHeight());
        List<ParticipantLayout> participants = layout.participants();
        int boxHeight = layout.boxHeight();

        for (ParticipantLayout p : participants) {
            Boxes.labeled(canvas, p.boxLeft(), 0, p.width(), boxHeight, p.name(), Boxes.SQUARE);
            canvas.set(boxHeight - 1, p.centerCol(), BoxGlyphs.TEE_DOWN);
        }

        boolean[] ended = new boolean[participants.size()];
        Map<Integer, FrameRow> openFrames = new LinkedHashMap<>();
        int top = boxHeight;

        for (int k = 0; k < layout.rows().size(); k++) {
            SequenceRow row = layout.rows().get(k);
            ActivationSnapshot snapshot = layout.activations().get(k);

            for (int r = top; r < top + row.height(); r++) {
                for (int i = 0; i < participants.size(); i++) {
                    if (!ended[i]) {
                        canvas.set(r, participants.get(i).centerCol(),
                            snapshot.isActive(i) ? BoxGlyphs.HEAVY_VERTICAL : BoxGlyphs.VERTICAL);
                    }
                }
                for (FrameRow frame : openFrames.values()) {
                    if (!(row instanceof FrameRow own && own.frameId() == frame.frameId())) {
                        canvas.set(r, frame.frameLeft(), BoxGlyphs.VERTICAL);
                        canvas.set(r, frame.frameRight(), BoxGlyphs.VERTICAL);
                    }
                }
            }

            if (row instanceof MessageRow message) {
                if (message.isSelf()) {
                    drawSelfMessage(canvas, top, message);
                } else {
                    drawMessage(canvas, top, message);
                }
            } else if (row instanceof NoteRow note) {
                Boxes.labeled(canvas, note.boxLeft(), top, note.boxRight() - note.boxLeft() + 1, note.height(),
                    note.text(), Boxes.SQUARE);
            } else if (row instanceof FrameRow frame) {
                drawFrameBorder(canvas, top, frame, participants, ended);
                if (frame.border() == FrameBorder.START) {
                    openFrames.put(frame.frameId(), frame);
                } else if (frame.border() == FrameBorder.END) {
                    openFrames.remove(frame.frameId());
                }
            } else if (row instanceof DestroyRow destroy) {
                canvas.set(top, destroy.col(), DESTROY_MARKER);
                ended[destroy.participantIndex()] = true;
            }
            top += row.height();
        }

        for (int i = 0; i < participants.size(); i++) {
            if (layout.destroyed().get(i)) {
                continue;
            }
            ParticipantLayout p = participants.get(i);
            Boxes.labeled(canvas, p.boxLeft(), top, p.width(), boxHeight, p.name(), Boxes.SQUARE);
            canvas.set(top, p.centerCol(), BoxGlyphs.TEE_UP);
        }
        return canvas.render();
    }

    private static void drawMessage(Canvas canvas, int top, MessageRow message) {
        List<String> lines = TextMetrics.splitLines(message.text());
        for (int i = 0; i < lines.size(); i++) {
            canvas.write(top + i, message.leftCol() + 2, lines.get(i));
        }

        int arrowRow = top + lines.size();
        int left = message.leftCol();
        int right = message.rightCol();
        drawLine(canvas, arrowRow, left + 1, right - 1, message.arrow().lineStyle());

        ArrowHead head = message.arrow().head();
        if (head == ArrowHead.NONE) {
            return;
        }
        if (message.direction() == MessageDirection.LEFT_TO_RIGHT) {
            canvas.set(arrowRow, right - 1, headGlyph(head, true));
        } else {
            canvas.set(arrowRow, left + 1, headGlyph(head, false));
            canvas.set(arrowRow, right - 1, BoxGlyphs.HORIZONTAL);
        }
    }

    private static void drawSelfMessage(Canvas canvas, int top, MessageRow message) {
        int center = message.fromCol();
        List<String> lines = TextMetrics.splitLines(message.text());
        for (int i = 0; i < lines.size(); i++) {
            canvas.write(top + i, center + 2, lines.get(i));
        }

        int arm = center + MessageRow.SELF_LOOP_ARM;
        int outRow = top + lines.size();
        int backRow = outRow + 1;
        LineStyle style = message.arrow().lineStyle();
        drawLine(canvas, outRow, center + 1, arm - 1, style);
        canvas.set(outRow, arm, BoxGlyphs.TOP_RIGHT);
        drawLine(canvas, backRow, center + 1, arm - 1, style);
        canvas.set(backRow, arm, BoxGlyphs.BOTTOM_RIGHT);
        if (message.arrow().head() != ArrowHead.NONE) {
            canvas.set(backRow, center + 1, headGlyph(message.arrow().head(), false));
        }
    }

    /** Solid lines are continuous; dotted lines alternate dash and gap, starting with a dash. */
    private static void drawLine(Canvas canvas, int row, int from, int to, LineStyle style) {
        for (int c = from; c <= to; c++) {
            boolean gap = style == LineStyle.DOTTED && (c - from) % 2 == 1;
            canvas.set(row, c, gap ? ' ' : BoxGlyphs.HORIZONTAL);
        }
    }

    private static char headGlyph(ArrowHead head, boolean pointsRight) {
        return switch (head) {
            case ARROWHEAD -> pointsRight ? '>' : '<';
            case CROSS -> 'x';
            case OPEN -> pointsRight ? ')' : '(';
            case NONE -> BoxGlyphs.HORIZONTAL;
        };
    }

    private static void drawFrameBorder(Canvas canvas, int row, FrameRow frame,
                                        List<ParticipantLayout> participants, boolean[] ended) {
        int left = frame.frameLeft();
        int right = frame.frameRight();
        for (int c = left + 1; c < right; c++) {
            canvas.set(row, c, BoxGlyphs.HORIZONTAL);
        }
        switch (frame.border()) {
            case START -> {
                canvas.set(row, left, BoxGlyphs.TOP_LEFT);
                canvas.set(row, right, BoxGlyphs.TOP_RIGHT);
            }
            case DIVIDER -> {
                canvas.set(row, left, BoxGlyphs.TEE_RIGHT);
                canvas.set(row, right, BoxGlyphs.TEE_LEFT);
            }
            case END -> {
                canvas.set(row, left, BoxGlyphs.BOTTOM_LEFT);
                canvas.set(row, right, BoxGlyphs.BOTTOM_RIGHT);
            }
        }

        int labelEnd = left + 1;
        if (!frame.label().isEmpty()) {
            canvas.write(row, left + 2, frame.label());
            labelEnd = left + 1 + TextMetrics.displayWidth(frame.label());
        }
        for (int i = 0; i < participants.size(); i++) {
            int center = participants.get(i).centerCol();
            if (!ended[i] && center > labelEnd && center > left && center < right) {
                canvas.set(row, center, BoxGlyphs.CROSS);
            }
        }
    }
}
