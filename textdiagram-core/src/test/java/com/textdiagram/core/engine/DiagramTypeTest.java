package com.textdiagram.core.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DiagramType}.
 */
class DiagramTypeTest {

    static Stream<Arguments> sources() {
        return Stream.of(
            Arguments.of("sequenceDiagram\nA->>B: hi", DiagramType.SEQUENCE),
            Arguments.of("graph TD\nA --> B", DiagramType.FLOWCHART),
            Arguments.of("flowchart LR\nA --> B", DiagramType.FLOWCHART),
            Arguments.of("Graph TD", DiagramType.FLOWCHART),
            Arguments.of("erDiagram\nA ||--o{ B : has", DiagramType.ER),
            Arguments.of("\n\n%% leading comment\n  erDiagram", DiagramType.ER),
            Arguments.of("classDiagram", DiagramType.SEQUENCE),
            Arguments.of("", DiagramType.SEQUENCE)
        );
    }

    @ParameterizedTest
    @MethodSource("sources")
    void detect_usesFirstMeaningfulKeyword(String source, DiagramType expected) {
        assertThat(DiagramType.detect(source)).isEqualTo(expected);
    }

    @Test
    void detect_nullSource_throws() {
        assertThatThrownBy(() -> DiagramType.detect(null)).isInstanceOf(NullPointerException.class);
    }
}
