package com.textdiagram.core.layout.er;

import com.textdiagram.core.model.er.EntityAttribute;

import java.util.List;
import java.util.Objects;

/**
 * Positioned entity box: a name row and, when attributes exist, a separator and one row per
 * attribute.
 *
 * @param name entity name
 * @param attributes attribute rows
 * @param x left column
 * @param y top row
 * @param width total width including borders
 * @param height total height including borders
 */
public record EntityLayout(String name, List<EntityAttribute> attributes, int x, int y, int width, int height) {

    public EntityLayout {
        Objects.requireNonNull(name, "name must not be null");
        attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes must not be null"));
    }

    public int right() {
        return x + width - 1;
    }

    public int bottom() {
        return y + height - 1;
    }

    /** Row of the name line, where the first relationship on each side attaches. */
    public int centerY() {
        return y + 1;
    }
}
