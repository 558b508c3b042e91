package com.textdiagram.core.engine;

import com.textdiagram.core.DiagramException;
import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.parser.DiagramParser;
import com.textdiagram.core.renderer.DiagramRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Abstract base class for engines built from a parser, a layout step and a renderer.
 *
 * <p>Subclasses supply the three stages; this class runs them in order and picks the
 * natural or the width-limited layout from the {@link RenderOptions}.
 *
 * @param <D> AST type
 * @param <L> layout type
 */
public abstract class AbstractDiagramEngine<D, L> implements DiagramEngine {

    /**
     * Logger instance for this engine.
     * Automatically initialized with the concrete engine class name.
     */
    protected final Logger log;

    protected AbstractDiagramEngine() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final RenderedDiagram render(String source, RenderOptions options) throws DiagramException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");

        D diagram = parser().parse(source);
        OptionalInt maxWidth = options.maxWidthLimit();
        L layout = maxWidth.isPresent()
            ? layoutWithMaxWidth(diagram, maxWidth.getAsInt())
            : layout(diagram);
        RenderedDiagram rendered = RenderedDiagram.of(getDiagramType(), renderer().render(layout));
        log.debug("Rendered {} diagram: {}x{}", getId(), rendered.width(), rendered.height());
        return rendered;
    }

    /**
     * Returns the parser for this engine's grammar.
     *
     * @return parser
     */
    protected abstract DiagramParser<D> parser();

    /**
     * Lays out a diagram at its natural width.
     *
     * @param diagram parsed diagram
     * @return layout
     * @throws LayoutException if the diagram has nothing to draw
     */
    protected abstract L layout(D diagram) throws LayoutException;

    /**
     * Lays out a diagram within a column budget.
     *
     * @param diagram parsed diagram
     * @param maxWidth column budget
     * @return layout no wider than {@code maxWidth}
     * @throws LayoutException if the diagram is empty or cannot be fitted
     */
    protected abstract L layoutWithMaxWidth(D diagram, int maxWidth) throws LayoutException;

    /**
     * Returns the renderer that draws this engine's layouts.
     *
     * @return renderer
     */
    protected abstract DiagramRenderer<L> renderer();
}
