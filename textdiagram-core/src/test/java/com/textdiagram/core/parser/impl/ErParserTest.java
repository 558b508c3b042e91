package com.textdiagram.core.parser.impl;

import com.textdiagram.core.model.er.Cardinality;
import com.textdiagram.core.model.er.EntityAttribute;
import com.textdiagram.core.model.er.ErDiagram;
import com.textdiagram.core.model.er.Relationship;
import com.textdiagram.core.parser.DiagramParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ErParser}.
 */
class ErParserTest {

    private final ErParser parser = new ErParser();

    @Test
    void parse_relationship_readsBothCardinalities() throws DiagramParseException {
        ErDiagram diagram = parser.parse("erDiagram\n    CUSTOMER ||--o{ ORDER : places\n");

        assertThat(diagram.entities()).extracting(e -> e.name()).containsExactly("CUSTOMER", "ORDER");
        assertThat(diagram.relationships()).containsExactly(new Relationship(
            "CUSTOMER", "ORDER", Cardinality.EXACTLY_ONE, Cardinality.ZERO_OR_MANY, "places"));
    }

    @Test
    void parse_allCardinalities() throws DiagramParseException {
        ErDiagram diagram = parser.parse("""
            erDiagram
                A o|--|o B : one
                C }|..|{ D : two
                E }o--|| F : "billing address"
            """);

        assertThat(diagram.relationships()).extracting(Relationship::leftCardinality)
            .containsExactly(Cardinality.ZERO_OR_ONE, Cardinality.ONE_OR_MANY, Cardinality.ZERO_OR_MANY);
        assertThat(diagram.relationships()).extracting(Relationship::rightCardinality)
            .containsExactly(Cardinality.ZERO_OR_ONE, Cardinality.ONE_OR_MANY, Cardinality.EXACTLY_ONE);
        assertThat(diagram.relationships().get(2).label()).isEqualTo("billing address");
    }

    @Test
    void parse_attributeBlock() throws DiagramParseException {
        ErDiagram diagram = parser.parse("""
            erDiagram
                LINE-ITEM {
                    string sku PK
                    int quantity
                    string order_id FK "the order"
                }
            """);

        assertThat(diagram.entities()).hasSize(1);
        assertThat(diagram.entities().get(0).name()).isEqualTo("LINE-ITEM");
        assertThat(diagram.entities().get(0).attributes()).containsExactly(
            new EntityAttribute("string", "sku", "PK"),
            new EntityAttribute("int", "quantity", null),
            new EntityAttribute("string", "order_id", "FK"));
        assertThat(diagram.entities().get(0).attributes().get(0).text()).isEqualTo("string sku PK");
    }

    @Test
    void parse_emptyDiagram_hasNoEntities() throws DiagramParseException {
        assertThat(parser.parse("erDiagram\n").entities()).isEmpty();
    }

    @Test
    void parse_unterminatedAttributeBlock_throws() {
        assertThatThrownBy(() -> parser.parse("erDiagram\nA {\nint id\n"))
            .isInstanceOf(DiagramParseException.class)
            .hasMessageContaining("unterminated attribute block of 'A'");
    }
}
