package com.textdiagram.core.renderer.impl;

import com.textdiagram.core.DiagramException;
import com.textdiagram.core.layout.er.ErLayoutEngine;
import com.textdiagram.core.parser.impl.ErParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ErRenderer}.
 */
class ErRendererTest {

    private static String render(String source) throws DiagramException {
        return new ErRenderer().render(new ErLayoutEngine().compute(new ErParser().parse(source)));
    }

    @Test
    void render_singleRelationship() throws DiagramException {
        assertThat(render("erDiagram\n    CUSTOMER ||--o{ ORDER : places\n")).isEqualTo("""
            ┌──────────┐              ┌───────┐
            │ CUSTOMER │||──places──o{│ ORDER │
            └──────────┘              └───────┘""");
    }

    @Test
    void render_chain_showsEveryEntityAndLabel() throws DiagramException {
        String output = render("""
            erDiagram
                CUSTOMER ||--o{ ORDER : places
                ORDER ||--|{ LINE-ITEM : contains
            """);

        assertThat(output).contains("CUSTOMER", "ORDER", "LINE-ITEM", "places", "contains");
    }

    @Test
    void render_cardinalitySymbols() throws DiagramException {
        assertThat(render("erDiagram\n    CUSTOMER }o--|| ADDRESS : billing address\n"))
            .contains("billing address", "}o", "||");
        assertThat(render("erDiagram\n    A o|--|o B : rel\n")).contains("o|", "|o");
        assertThat(render("erDiagram\n    A }|--|{ B : rel\n")).contains("}|", "|{");
    }

    @Test
    void render_attributes_belowSeparator() throws DiagramException {
        String output = render("""
            erDiagram
                ORDER {
                    int id PK
                    string status
                }
            """);

        assertThat(output).isEqualTo("""
            ┌───────────────┐
            │ ORDER         │
            ├───────────────┤
            │ int id PK     │
            │ string status │
            └───────────────┘""");
    }

    @Test
    void render_targetsInOneRank_areStackedAndLinked() throws DiagramException {
        String output = render("""
            erDiagram
                A ||--o{ B : has
                A ||--o{ C : owns
            """);

        assertThat(output).isEqualTo("""
            ┌───┐            ┌───┐
            │ A │||──has───o{│ B │
            │   │||─owns─┐   └───┘
            └───┘        │
                         │   ┌───┐
                         └─o{│ C │
                             └───┘""");
    }

    @Test
    void render_severalRelationshipsOfOneEntity_keepEverySymbolAndLabel() throws DiagramException {
        String output = render("""
            erDiagram
                CUSTOMER ||--o{ ORDER : places
                ORDER ||--|{ LINE-ITEM : contains
                CUSTOMER }|..|{ DELIVERY-ADDRESS : uses
            """);

        assertThat(output).contains("places", "contains", "uses", "│ DELIVERY-ADDRESS │");
        assertThat(output).contains("│ CUSTOMER │||──", "│          │}|─", "o{│ ORDER │||", "|{│ LINE-ITEM │");
    }

    @Test
    void render_narrowestFittedGap_keepsLabelBetweenSymbols() throws DiagramException {
        String output = new ErRenderer().render(new ErLayoutEngine()
            .computeWithMaxWidth(new ErParser().parse("erDiagram\n    CUSTOMER ||--o{ ORDER : places\n"), 33));

        assertThat(output).contains("│ CUSTOMER │||─places─o{│ ORDER │");
    }
}
