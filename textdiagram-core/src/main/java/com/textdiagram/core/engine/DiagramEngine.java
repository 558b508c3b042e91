package com.textdiagram.core.engine;

import com.textdiagram.core.DiagramException;

/**
 * Interface for engines that turn diagram source into box-drawing text.
 *
 * <p>An engine owns one {@link DiagramType}: it parses the source into that type's AST, lays
 * it out on a character grid and draws the result. Engines are discovered via Java Service
 * Provider Interface (SPI) and selected by {@link DiagramRenderService} from the header of
 * the source.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FlowchartEngine implements DiagramEngine {
 *     @Override
 *     public String getId() {
 *         return "flowchart";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Flowchart Renderer";
 *     }
 *
 *     @Override
 *     public DiagramType getDiagramType() {
 *         return DiagramType.FLOWCHART;
 *     }
 *
 *     @Override
 *     public RenderedDiagram render(String source, RenderOptions options) throws DiagramException {
 *         GraphDiagram diagram = new GraphParser().parse(source);
 *         GraphLayout layout = new GraphLayoutEngine().compute(diagram);
 *         return RenderedDiagram.of(DiagramType.FLOWCHART, new GraphRenderer().render(layout));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.textdiagram.core.engine.DiagramEngine}
 *
 * @see DiagramType
 * @see RenderOptions
 * @see RenderedDiagram
 */
public interface DiagramEngine {

    /**
     * Returns unique identifier for this engine.
     *
     * <p>Lowercase, used in CLI output and logs (e.g., "sequence", "flowchart", "er").
     *
     * @return unique engine identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this engine.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the diagram type this engine draws.
     *
     * @return diagram type
     */
    DiagramType getDiagramType();

    /**
     * Checks whether the source is a diagram of this engine's type.
     *
     * <p>The default implementation compares {@link DiagramType#detect(String)} with
     * {@link #getDiagramType()}.
     *
     * @param source diagram source
     * @return true if this engine should render the source
     */
    default boolean supports(String source) {
        return DiagramType.detect(source) == getDiagramType();
    }

    /**
     * Renders a diagram.
     *
     * <p>With a width budget in {@code options} the engine shrinks the layout until every row
     * fits, or fails; it never returns output wider than the budget.
     *
     * @param source diagram source
     * @param options render options
     * @return rendered diagram
     * @throws DiagramException if the source does not parse, the diagram is empty, or it
     *                          cannot be fitted into the width budget
     */
    RenderedDiagram render(String source, RenderOptions options) throws DiagramException;
}
