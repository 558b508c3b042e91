package com.textdiagram.core.model.er;

import java.util.Objects;

/**
 * Attribute line of an entity block.
 *
 * @param type attribute type
 * @param name attribute name
 * @param key key marker such as {@code PK}, or null
 */
public record EntityAttribute(String type, String name, String key) {

    public EntityAttribute {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the row text drawn inside the entity box.
     *
     * @return {@code type name} or {@code type name key}
     */
    public String text() {
        return key == null ? type + " " + name : type + " " + name + " " + key;
    }
}
