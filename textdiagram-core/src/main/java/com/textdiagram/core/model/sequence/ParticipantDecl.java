package com.textdiagram.core.model.sequence;

import java.util.Objects;

/**
 * Explicit participant declaration ({@code participant A as Alice}).
 *
 * @param id identifier used by messages
 * @param alias display name, or null to display the id
 * @param kind declaration keyword
 */
public record ParticipantDecl(String id, String alias, ParticipantKind kind) implements Statement {

    public ParticipantDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public String displayName() {
        return alias != null ? alias : id;
    }
}
