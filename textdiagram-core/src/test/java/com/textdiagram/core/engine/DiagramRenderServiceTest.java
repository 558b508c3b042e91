package com.textdiagram.core.engine;

import com.textdiagram.core.DiagramException;
import com.textdiagram.core.engine.impl.ErEngine;
import com.textdiagram.core.engine.impl.FlowchartEngine;
import com.textdiagram.core.engine.impl.SequenceEngine;
import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.parser.DiagramParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DiagramRenderService} and engine discovery.
 */
class DiagramRenderServiceTest {

    private final DiagramRenderService service = new DiagramRenderService();

    @Test
    void discoverEngines_findsAllBuiltInEngines() {
        List<DiagramEngine> engines = DiagramRenderService.discoverEngines();

        assertThat(engines).extracting(DiagramEngine::getId)
            .containsExactlyInAnyOrder("sequence", "flowchart", "er");
        assertThat(engines).allSatisfy(engine -> {
            assertThat(engine.getDisplayName()).isNotBlank();
            assertThat(engine.getDiagramType()).isNotNull();
        });
    }

    @Test
    void engines_areOrderedByDiagramType() {
        assertThat(service.engines()).extracting(DiagramEngine::getDiagramType)
            .containsExactly(DiagramType.SEQUENCE, DiagramType.FLOWCHART, DiagramType.ER);
    }

    @Test
    void supports_matchesHeader() {
        assertThat(new FlowchartEngine().supports("graph LR\nA --> B")).isTrue();
        assertThat(new FlowchartEngine().supports("erDiagram")).isFalse();
        assertThat(new ErEngine().supports("erDiagram")).isTrue();
        assertThat(new SequenceEngine().supports("sequenceDiagram")).isTrue();
    }

    @Test
    void render_dispatchesOnHeader() throws DiagramException {
        RenderedDiagram sequence = service.render("sequenceDiagram\nAlice->>Bob: Hello");
        RenderedDiagram graph = service.render("graph LR\nStart --> End");
        RenderedDiagram er = service.render("erDiagram\nCUSTOMER ||--o{ ORDER : places");

        assertThat(sequence.type()).isEqualTo(DiagramType.SEQUENCE);
        assertThat(sequence.width()).isEqualTo(18);
        assertThat(graph.type()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(graph.lines()).containsExactly(
            "┌───────┐     ┌─────┐",
            "│ Start │────>│ End │",
            "└───────┘     └─────┘");
        assertThat(er.type()).isEqualTo(DiagramType.ER);
        assertThat(er.content()).contains("│ CUSTOMER │||──places──o{│ ORDER │");
        assertThat(er.height()).isEqualTo(3);
    }

    @Test
    void render_leadingCommentsAndBlankLines_areSkipped() throws DiagramException {
        RenderedDiagram rendered = service.render("\n%% flow\n\ngraph TD\nA --> B");

        assertThat(rendered.type()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(rendered.content()).doesNotContain("flow");
    }

    @Test
    void render_nullWidth_usesNaturalWidth() throws DiagramException {
        String source = "sequenceDiagram\nAlice->>Bob: Hello";

        assertThat(service.render(source, (Integer) null)).isEqualTo(service.render(source));
    }

    @Test
    void render_maxWidth_shrinksThenTruncates() throws DiagramException {
        String source = "sequenceDiagram\nAlice->>Bob: Hello";

        RenderedDiagram narrower = service.render(source, 17);
        assertThat(narrower.width()).isEqualTo(17);
        assertThat(narrower.content()).contains("Alice", "Bob");

        RenderedDiagram truncated = service.render(source, 14);
        assertThat(truncated.width()).isEqualTo(14);
        assertThat(truncated.content()).contains("A…", "B…").doesNotContain("Alice");
    }

    @Test
    void render_maxWidthTooSmall_throwsWithMinimum() {
        assertThatThrownBy(() -> service.render("sequenceDiagram\nAlice->>Bob: Hello", 13))
            .isInstanceOf(LayoutException.class)
            .hasMessage("diagram too wide: needs at least 14 columns, max is 13");
    }

    @Test
    void render_everyRowFitsWithinMaxWidth() throws DiagramException {
        String source = """
            graph TD
                A[Load config] --> B[Parse source]
                A --> C[Measure]
                B --> D[Render]
                C --> D
            """;
        int natural = service.render(source).width();

        RenderedDiagram fitted = service.render(source, natural - 2);
        assertThat(fitted.width()).isLessThanOrEqualTo(natural - 2);
    }

    @Test
    void render_syntaxError_propagatesParseException() {
        assertThatThrownBy(() -> service.render("sequenceDiagram\nAlice->>Bob: Hello\nthis is not valid"))
            .isInstanceOf(DiagramParseException.class)
            .hasMessageStartingWith("syntax error at line 3");
    }

    @Test
    void render_emptyDiagrams_fail() {
        assertThatThrownBy(() -> service.render("erDiagram\n"))
            .isInstanceOf(LayoutException.class)
            .hasMessage("no entities found");
        assertThatThrownBy(() -> service.render("sequenceDiagram\n"))
            .isInstanceOf(LayoutException.class)
            .hasMessage("no participants found");
    }

    @Test
    void render_unregisteredType_throws() {
        DiagramRenderService sequenceOnly = new DiagramRenderService(List.of(new SequenceEngine()));

        assertThatThrownBy(() -> sequenceOnly.render("graph TD\nA --> B"))
            .isInstanceOf(DiagramException.class)
            .hasMessage("no engine registered for flowchart diagrams");
    }

    @Test
    void constructor_duplicateEngine_keepsFirst() {
        SequenceEngine first = new SequenceEngine();
        DiagramRenderService duplicated = new DiagramRenderService(List.of(first, new SequenceEngine()));

        assertThat(duplicated.engines()).containsExactly(first);
    }

    @Test
    void renderOptions_nonPositiveWidth_throws() {
        assertThatThrownBy(() -> RenderOptions.withMaxWidth(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(RenderOptions.defaults().maxWidthLimit()).isEmpty();
    }
}
