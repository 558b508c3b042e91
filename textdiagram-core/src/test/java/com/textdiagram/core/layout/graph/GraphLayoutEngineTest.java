package com.textdiagram.core.layout.graph;

import com.textdiagram.core.DiagramException;
import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.model.graph.Direction;
import com.textdiagram.core.model.graph.GraphDiagram;
import com.textdiagram.core.parser.impl.GraphParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GraphLayoutEngine}.
 */
class GraphLayoutEngineTest {

    private final GraphLayoutEngine engine = new GraphLayoutEngine();

    private static GraphDiagram parse(String source) throws DiagramException {
        return new GraphParser().parse(source);
    }

    @Test
    void compute_topDownChain_centersNarrowerNode() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nStart --> End"));

        NodeLayout start = layout.node("Start");
        NodeLayout end = layout.node("End");
        assertThat(start.x()).isZero();
        assertThat(start.width()).isEqualTo(9);
        assertThat(start.height()).isEqualTo(3);
        assertThat(end.x()).isEqualTo(1);
        assertThat(end.y()).isEqualTo(3 + GraphLayoutEngine.TD_RANK_GAP);
        assertThat(layout.width()).isEqualTo(9);
        assertThat(layout.height()).isEqualTo(8);
    }

    @Test
    void compute_leftRightChain_usesMinimumRankGap() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph LR\nStart --> End"));

        assertThat(layout.direction()).isEqualTo(Direction.LEFT_RIGHT);
        assertThat(layout.node("Start").right()).isEqualTo(8);
        assertThat(layout.node("End").x()).isEqualTo(14);
        assertThat(layout.width()).isEqualTo(21);
        assertThat(layout.height()).isEqualTo(3);
    }

    @Test
    void compute_leftRightLabelledEdge_widensGap() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph LR\nA -->|a long label| B"));

        int gap = layout.node("B").x() - layout.node("A").right() - 1;
        assertThat(gap).isEqualTo("a long label".length() + 2);
    }

    @Test
    void compute_topDownLabelUnderSource_addsLabelRow() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nA -->|go| B"));

        assertThat(layout.node("B").y()).isEqualTo(3 + GraphLayoutEngine.TD_RANK_GAP + 1);
        assertThat(layout.labels()).containsExactly(new LabelLayout("go", 3, 1));
    }

    @Test
    void compute_topDownFanOutLabels_getSlotsAboveTheirTargets() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nA -->|approved| B\nA -->|rejected| C"));

        assertThat(layout.node("B").y()).isEqualTo(6);
        assertThat(layout.labels()).containsExactly(
            new LabelLayout("approved", 4, 0),
            new LabelLayout("rejected", 4, 13));
        assertThat(layout.width()).isEqualTo(23);
    }

    @Test
    void compute_leftRightTurningEdges_shareOneTurnColumn() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph LR\nA --> D\nBBBBBBB --> D\nC --> D"));

        int turn = layout.turnColumn(layout.node("A"));
        assertThat(turn).isEqualTo(layout.turnColumn(layout.node("C")));
        assertThat(turn).isGreaterThan(layout.node("BBBBBBB").right());
        assertThat(turn).isLessThan(layout.node("D").x() - 1);
    }

    @Test
    void compute_topDownBackEdge_getsLaneRightOfContent() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nA --> B\nB --> A"));

        EdgeLayout back = layout.edges().stream().filter(e -> e.from().equals("A")).findFirst().orElseThrow();
        EdgeLayout down = layout.edges().stream().filter(e -> e.from().equals("B")).findFirst().orElseThrow();
        assertThat(layout.node("B").y()).isZero();
        assertThat(back.lane()).isEqualTo(6);
        assertThat(down.hasLane()).isFalse();
        assertThat(layout.width()).isEqualTo(7);
    }

    @Test
    void compute_leftRightBackEdge_getsLaneBelowContent() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph LR\nA --> B\nB --> A"));

        EdgeLayout back = layout.edges().stream().filter(e -> e.from().equals("A")).findFirst().orElseThrow();
        assertThat(back.lane()).isEqualTo(4);
        assertThat(layout.height()).isEqualTo(5);
        assertThat(layout.width()).isEqualTo(15);
    }

    @Test
    void compute_backEdgeLabel_sitsBesideTheLanes() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nA -->|retry| B\nB --> A"));

        EdgeLayout back = layout.edges().stream().filter(EdgeLayout::hasLane).findFirst().orElseThrow();
        LabelLayout label = layout.labels().get(0);
        assertThat(label.text()).isEqualTo("retry");
        assertThat(label.col()).isGreaterThan(back.lane());
        assertThat(label.right()).isLessThan(layout.width());
    }

    @Test
    void compute_shapesAndMultilineLabels_sizeBoxes() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nA((Hi))\nB[one<br/>two]\nC{Yes}"));

        assertThat(layout.node("A").width()).isEqualTo(2 + GraphLayoutEngine.BOX_PADDING + GraphLayoutEngine.CIRCLE_PADDING);
        assertThat(layout.node("B").width()).isEqualTo(3 + GraphLayoutEngine.BOX_PADDING);
        assertThat(layout.node("B").height()).isEqualTo(4);
        assertThat(layout.node("C").width()).isEqualTo(7);
    }

    @Test
    void compute_fanOut_placesChildrenSideBySide() throws DiagramException {
        GraphLayout layout = engine.compute(parse("graph TD\nA --> B\nA --> C"));

        NodeLayout b = layout.node("B");
        NodeLayout c = layout.node("C");
        assertThat(b.y()).isEqualTo(c.y());
        assertThat(c.x() - b.right() - 1).isEqualTo(GraphLayoutEngine.TD_NODE_GAP);
        assertThat(layout.width()).isEqualTo(13);
        assertThat(layout.node("A").x()).isEqualTo(4);
    }

    @Test
    void compute_nodesNeverOverlap() throws DiagramException {
        GraphLayout layout = engine.compute(parse("""
            graph TD
                A --> B & C & D
                B --> E
                C --> E
                D --> F
            """));

        List<NodeLayout> nodes = layout.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                NodeLayout a = nodes.get(i);
                NodeLayout b = nodes.get(j);
                boolean apart = a.right() < b.x() || b.right() < a.x() || a.bottom() < b.y() || b.bottom() < a.y();
                assertThat(apart).as("%s and %s overlap", a.id(), b.id()).isTrue();
            }
        }
        assertThat(nodes).allMatch(n -> n.right() < layout.width() && n.bottom() < layout.height());
    }

    @Test
    void compute_subgraph_containsItsMembersAndKeepsOthersOutside() throws DiagramException {
        GraphLayout layout = engine.compute(parse("""
            graph TD
                subgraph one
                    A --> B
                end
                C
            """));

        assertThat(layout.subgraphs()).hasSize(1);
        SubgraphLayout border = layout.subgraphs().get(0);
        assertThat(border.contains(layout.node("A"))).isTrue();
        assertThat(border.contains(layout.node("B"))).isTrue();
        assertThat(layout.node("C").y()).isGreaterThan(border.bottom());
        assertThat(border.right()).isLessThan(layout.width());
        assertThat(border.bottom()).isLessThan(layout.height());
    }

    @Test
    void compute_noNodes_throws() {
        GraphDiagram empty = new GraphDiagram(Direction.TOP_DOWN, List.of(), List.of(), List.of());

        assertThatThrownBy(() -> engine.compute(empty))
            .isInstanceOf(LayoutException.class)
            .hasMessage("no nodes found")
            .extracting(e -> ((LayoutException) e).getReason())
            .isEqualTo(LayoutException.Reason.EMPTY_DIAGRAM);
    }

    @Test
    void computeWithMaxWidth_enoughRoom_matchesNaturalLayout() throws DiagramException {
        GraphDiagram diagram = parse("graph LR\nStart --> End");

        assertThat(engine.computeWithMaxWidth(diagram, 80)).isEqualTo(engine.compute(diagram));
    }

    @Test
    void computeWithMaxWidth_shrinksRankGap() throws DiagramException {
        GraphLayout layout = engine.computeWithMaxWidth(parse("graph LR\nStart --> End"), 19);

        assertThat(layout.width()).isEqualTo(19);
        assertThat(layout.node("End").x()).isEqualTo(12);
    }

    @Test
    void computeWithMaxWidth_shrinksNodeGapInTopDown() throws DiagramException {
        GraphLayout layout = engine.computeWithMaxWidth(parse("graph TD\nA --> B\nA --> C"), 12);

        assertThat(layout.width()).isEqualTo(12);
        assertThat(layout.node("C").x() - layout.node("B").right() - 1).isEqualTo(2);
    }

    @Test
    void computeWithMaxWidth_tooNarrow_reportsNarrowestWidth() throws DiagramException {
        GraphDiagram diagram = parse("graph LR\nStart --> End");

        assertThatThrownBy(() -> engine.computeWithMaxWidth(diagram, 16))
            .isInstanceOf(LayoutException.class)
            .satisfies(e -> {
                LayoutException layoutException = (LayoutException) e;
                assertThat(layoutException.getReason()).isEqualTo(LayoutException.Reason.INFEASIBLE_WIDTH);
                assertThat(layoutException.getMinimumWidth()).hasValue(17);
            });
    }

    @Test
    void computeWithMaxWidth_labelledGap_neverShrinksBelowItsLabel() throws DiagramException {
        GraphDiagram diagram = parse("graph LR\nA -->|a long label| B");

        assertThatThrownBy(() -> engine.computeWithMaxWidth(diagram, 20))
            .isInstanceOf(LayoutException.class)
            .hasMessage("diagram too wide: needs at least 24 columns, max is 20");
    }

    @Test
    void computeWithMaxWidth_subgraphs_areNotCompacted() throws DiagramException {
        GraphDiagram diagram = parse("graph TD\nsubgraph one\nA --> B\nend");
        int natural = engine.compute(diagram).width();

        assertThat(engine.computeWithMaxWidth(diagram, natural).width()).isEqualTo(natural);
        assertThatThrownBy(() -> engine.computeWithMaxWidth(diagram, natural - 1))
            .isInstanceOf(LayoutException.class)
            .extracting(e -> ((LayoutException) e).getReason())
            .isEqualTo(LayoutException.Reason.UNSUPPORTED_SHAPE);
    }
}
