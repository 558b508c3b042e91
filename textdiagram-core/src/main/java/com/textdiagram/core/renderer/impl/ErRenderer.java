package com.textdiagram.core.renderer.impl;

import com.textdiagram.core.canvas.BoxGlyphs;
import com.textdiagram.core.canvas.Canvas;
import com.textdiagram.core.layout.er.EntityLayout;
import com.textdiagram.core.layout.er.ErLayout;
import com.textdiagram.core.layout.er.RelationshipLayout;
import com.textdiagram.core.model.er.EntityAttribute;
import com.textdiagram.core.renderer.Boxes;
import com.textdiagram.core.renderer.DiagramRenderer;

/**
 * Renders entity-relationship diagrams.
 *
 * <p>A relationship is a line from the right border of the left entity to the left border of
 * the right entity, on the rows the layout assigned, with each end's cardinality written next
 * to its entity. Lines are drawn before the entities and all text after them, so no line is
 * ever drawn over text.
 */
public class ErRenderer implements DiagramRenderer<ErLayout> {

    @Override
    public String render(ErLayout layout) {
        Canvas canvas = new Canvas(layout.width(), layout.height());
        for (RelationshipLayout relationship : layout.relationships()) {
            drawLine(canvas, relationship, layout.entity(relationship.left()), layout.entity(relationship.right()));
        }
        for (EntityLayout entity : layout.entities()) {
            drawEntity(canvas, entity);
        }
        for (RelationshipLayout relationship : layout.relationships()) {
            drawText(canvas, relationship, layout.entity(relationship.left()), layout.entity(relationship.right()));
        }
        return canvas.render();
    }

    private static void drawEntity(Canvas canvas, EntityLayout entity) {
        Boxes.outline(canvas, entity.x(), entity.y(), entity.width(), entity.height(), Boxes.SQUARE);
        canvas.write(entity.y() + 1, entity.x() + 2, entity.name());
        if (entity.attributes().isEmpty()) {
            return;
        }
        int separator = entity.y() + 2;
        canvas.set(separator, entity.x(), BoxGlyphs.TEE_RIGHT);
        for (int c = entity.x() + 1; c < entity.right(); c++) {
            canvas.set(separator, c, BoxGlyphs.HORIZONTAL);
        }
        canvas.set(separator, entity.right(), BoxGlyphs.TEE_LEFT);
        int row = separator + 1;
        for (EntityAttribute attribute : entity.attributes()) {
            canvas.write(row++, entity.x() + 2, attribute.text());
        }
    }

    private static void drawLine(Canvas canvas, RelationshipLayout relationship, EntityLayout left,
                                 EntityLayout right) {
        int start = left.right() + 1;
        int end = right.x() - 1;
        int fromRow = relationship.leftRow();
        int toRow = relationship.rightRow();
        switch (relationship.route()) {
            case STRAIGHT -> horizontal(canvas, fromRow, start, end);
            case ELBOW -> {
                int turn = relationship.turnColumn();
                boolean down = toRow > fromRow;
                horizontal(canvas, fromRow, start, turn - 1);
                canvas.connect(fromRow, turn, BoxGlyphs.LEFT | (down ? BoxGlyphs.DOWN : BoxGlyphs.UP));
                for (int r = Math.min(fromRow, toRow) + 1; r < Math.max(fromRow, toRow); r++) {
                    canvas.merge(r, turn, BoxGlyphs.VERTICAL);
                }
                canvas.connect(toRow, turn, BoxGlyphs.RIGHT | (down ? BoxGlyphs.UP : BoxGlyphs.DOWN));
                horizontal(canvas, toRow, turn + 1, end);
            }
            case STACKED -> {
                for (int r = left.bottom() + 1; r < right.y(); r++) {
                    canvas.merge(r, relationship.turnColumn(), BoxGlyphs.VERTICAL);
                }
            }
        }
    }

    /**
     * Cardinality symbols and label of one relationship. Entities of one rank get a tee on each
     * border instead of symbols.
     */
    private static void drawText(Canvas canvas, RelationshipLayout relationship, EntityLayout left,
                                 EntityLayout right) {
        if (relationship.route() == RelationshipLayout.Route.STACKED) {
            canvas.connect(left.bottom(), relationship.turnColumn(), BoxGlyphs.DOWN);
            canvas.connect(right.y(), relationship.turnColumn(), BoxGlyphs.UP);
        } else {
            canvas.write(relationship.leftRow(), left.right() + 1, relationship.leftSymbol());
            canvas.write(relationship.rightRow(), right.x() - 2, relationship.rightSymbol());
        }
        String label = relationship.relationship().label();
        if (!label.isEmpty()) {
            canvas.write(relationship.labelRow(), relationship.labelColumn(), label);
        }
    }

    private static void horizontal(Canvas canvas, int row, int fromCol, int toCol) {
        for (int c = fromCol; c <= toCol; c++) {
            canvas.merge(row, c, BoxGlyphs.HORIZONTAL);
        }
    }
}
