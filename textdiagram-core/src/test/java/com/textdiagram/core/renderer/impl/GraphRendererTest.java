package com.textdiagram.core.renderer.impl;

import com.textdiagram.core.DiagramException;
import com.textdiagram.core.layout.graph.GraphLayoutEngine;
import com.textdiagram.core.parser.impl.GraphParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GraphRenderer}.
 */
class GraphRendererTest {

    private static String render(String source) throws DiagramException {
        return new GraphRenderer().render(new GraphLayoutEngine().compute(new GraphParser().parse(source)));
    }

    @Test
    void render_topDownChain() throws DiagramException {
        assertThat(render("graph TD\n    A[Start] --> B[End]\n")).isEqualTo("""
            ┌───────┐
            │ Start │
            └───┬───┘
                │
                ▼
             ┌─────┐
             │ End │
             └─────┘""");
    }

    @Test
    void render_leftRightChain() throws DiagramException {
        assertThat(render("graph LR\n    A[Start] --> B[End]\n")).isEqualTo("""
            ┌───────┐     ┌─────┐
            │ Start │────>│ End │
            └───────┘     └─────┘""");
    }

    @Test
    void render_fanOut_sharesOneBar() throws DiagramException {
        assertThat(render("graph TD\n    A --> B\n    A --> C\n")).isEqualTo("""
                ┌───┐
                │ A │
                └─┬─┘
              ┌───┴───┐
              ▼       ▼
            ┌───┐   ┌───┐
            │ B │   │ C │
            └───┘   └───┘""");
    }

    @Test
    void render_fanIn_sharesOneBar() throws DiagramException {
        assertThat(render("graph TD\n    A --> C\n    B --> C\n")).isEqualTo("""
            ┌───┐   ┌───┐
            │ A │   │ B │
            └─┬─┘   └─┬─┘
              └───┬───┘
                  ▼
                ┌───┐
                │ C │
                └───┘""");
    }

    @Test
    void render_topDownOpenLink_hasNoArrowHead() throws DiagramException {
        assertThat(render("graph TD\n    A --- B\n")).isEqualTo("""
            ┌───┐
            │ A │
            └─┬─┘
              │
              │
            ┌───┐
            │ B │
            └───┘""");
    }

    @Test
    void render_leftRightOpenLink_hasNoArrowHead() throws DiagramException {
        assertThat(render("graph LR\n    A --- B\n")).isEqualTo("""
            ┌───┐     ┌───┐
            │ A │─────│ B │
            └───┘     └───┘""");
    }

    @Test
    void render_flowchartKeyword_behavesLikeGraph() throws DiagramException {
        assertThat(render("flowchart TD\n    A[Start] --> B[End]\n"))
            .isEqualTo(render("graph TD\n    A[Start] --> B[End]\n"));
    }

    @Test
    void render_chain_keepsRankOrder() throws DiagramException {
        String output = render("graph TD\n    A --> B\n    B --> C\n");

        assertThat(output).contains("│ A │", "│ B │", "│ C │");
        assertThat(output.indexOf("│ A │")).isLessThan(output.indexOf("│ B │"));
        assertThat(output.indexOf("│ B │")).isLessThan(output.indexOf("│ C │"));
    }

    @Test
    void render_edgeLabel_isShown() throws DiagramException {
        assertThat(render("graph LR\n    A -->|yes| B\n")).contains("yes", ">│ B │");
        assertThat(render("graph TD\n    A[Hello World] -- ok --> B[Goodbye]\n"))
            .contains("Hello World", "Goodbye", "ok");
    }

    @Test
    void render_dottedAndThickEdges_useTheirGlyphs() throws DiagramException {
        assertThat(render("graph LR\n    A -.-> B\n")).contains("╌");
        assertThat(render("graph LR\n    A ==> B\n")).contains("═");
    }

    @Test
    void render_subgraph_drawsTitledBorder() throws DiagramException {
        String output = render("""
            graph TD
                subgraph backend [Back End]
                    API --> DB
                end
            """);

        assertThat(output).startsWith("┌─ Back End ─");
        assertThat(output).contains("│ API │", "│ DB │");
    }

    @Test
    void render_edgeSkippingARank_keepsTheNodeItPassesIntact() throws DiagramException {
        String output = render("graph TD\n    A --> B\n    B --> C\n    A --> C\n");

        assertThat(output).contains("│ A │", "│ B │", "│ C │");
        assertThat(output).doesNotContain("┼");
    }

    @Test
    void render_topDownBackEdge_runsThroughLaneOnTheRight() throws DiagramException {
        assertThat(render("graph TD\n    A --> B\n    B --> A\n")).isEqualTo("""
            ┌───┐
            │ B │<┐
            └─┬─┘ │
              │   │
              ▼   │
            ┌───┐ │
            │ A │─┘
            └───┘""");
    }

    @Test
    void render_leftRightBackEdge_runsThroughLaneBelow() throws DiagramException {
        assertThat(render("graph LR\n    A --> B\n    B --> A\n")).isEqualTo("""
            ┌───┐     ┌───┐
            │ B │────>│ A │
            └───┘     └─┬─┘
              ▲         │
              └─────────┘""");
    }

    @Test
    void render_leftRightCycle_keepsEveryNodeAndLabel() throws DiagramException {
        String output = render("graph LR\n    A -->|label| B\n    B -.-> C\n    C ==> A\n");

        assertThat(output).contains("│ A │", "│ B │", "│ C │", "label");
    }

    @Test
    void render_topDownFanOutLabels_areShownInFull() throws DiagramException {
        String output = render("graph TD\n    A -->|yes| B\n    A -->|no| C\n    B --> D\n    C --> D\n");

        assertThat(output).contains(" yes ", " no", "│ D │");
        assertThat(output.lines().filter(line -> line.contains("yes")).findFirst().orElseThrow())
            .contains("no");
    }

    @Test
    void render_leftRightSourcesOfUnequalWidth_joinInOneTurnColumn() throws DiagramException {
        String output = render("graph LR\n    A --> D\n    BBBBBBB --> D\n    C --> D\n");

        assertThat(output).contains("┌─────────┐", "│ BBBBBBB │──┼─>│ D │", "└─────────┘");
    }

    @Test
    void render_edgeLeavingSubgraph_keepsItsLabel() throws DiagramException {
        String output = render("""
            graph TD
                subgraph one
                    A --> B
                end
                B -->|next| C
            """);

        assertThat(output).contains("│ A │", "│ B │", "│ C │", "next");
    }

    @Test
    void render_thickBackEdge_keepsDoubleCorners() throws DiagramException {
        assertThat(render("graph TD\n    A ==> B\n    B --> A\n")).contains("║", "╗", "╝");
    }
}
