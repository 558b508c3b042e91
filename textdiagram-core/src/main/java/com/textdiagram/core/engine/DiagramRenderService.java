package com.textdiagram.core.engine;

import com.textdiagram.core.DiagramException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Entry point for rendering diagram source to text.
 *
 * <p>Engines are discovered with {@link ServiceLoader}; the first engine registered for a
 * {@link DiagramType} wins. The type is taken from the header of the source, see
 * {@link DiagramType#detect(String)}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramRenderService service = new DiagramRenderService();
 * String text = service.render("graph TD\nA --> B").content();
 * String narrow = service.render(source, 60).content();
 * }</pre>
 */
public class DiagramRenderService {

    private static final Logger log = LoggerFactory.getLogger(DiagramRenderService.class);

    private final Map<DiagramType, DiagramEngine> engines;

    /**
     * Creates a service backed by the engines registered on the class path.
     */
    public DiagramRenderService() {
        this(discoverEngines());
    }

    /**
     * Creates a service backed by the given engines.
     *
     * @param engines engines to dispatch to
     */
    public DiagramRenderService(List<DiagramEngine> engines) {
        Objects.requireNonNull(engines, "engines must not be null");
        this.engines = new EnumMap<>(DiagramType.class);
        for (DiagramEngine engine : engines) {
            DiagramEngine existing = this.engines.putIfAbsent(engine.getDiagramType(), engine);
            if (existing != null) {
                log.warn("Ignoring engine {}: {} diagrams are already handled by {}",
                    engine.getId(), engine.getDiagramType(), existing.getId());
            }
        }
    }

    /**
     * Discovers all engines registered via SPI.
     *
     * @return engines in class path order
     */
    public static List<DiagramEngine> discoverEngines() {
        ServiceLoader<DiagramEngine> loader = ServiceLoader.load(DiagramEngine.class);
        List<DiagramEngine> engines = new ArrayList<>();
        loader.forEach(engines::add);

        log.debug("Discovered {} diagram engines", engines.size());
        engines.forEach(e -> log.debug("  - {} ({})", e.getId(), e.getDisplayName()));
        return engines;
    }

    /**
     * Returns the engines this service dispatches to.
     *
     * @return engines ordered by diagram type
     */
    public List<DiagramEngine> engines() {
        return List.copyOf(engines.values());
    }

    /**
     * Renders a diagram at its natural width.
     *
     * @param source diagram source
     * @return rendered diagram
     * @throws DiagramException if the source cannot be parsed or laid out
     */
    public RenderedDiagram render(String source) throws DiagramException {
        return render(source, RenderOptions.defaults());
    }

    /**
     * Renders a diagram no wider than {@code maxWidth} columns.
     *
     * @param source diagram source
     * @param maxWidth column budget, or null for the natural width
     * @return rendered diagram
     * @throws DiagramException if the source cannot be parsed or laid out, or does not fit
     */
    public RenderedDiagram render(String source, Integer maxWidth) throws DiagramException {
        return render(source, new RenderOptions(maxWidth));
    }

    /**
     * Renders a diagram with explicit options.
     *
     * @param source diagram source
     * @param options render options
     * @return rendered diagram
     * @throws DiagramException if the source cannot be parsed or laid out, or does not fit
     */
    public RenderedDiagram render(String source, RenderOptions options) throws DiagramException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        DiagramType type = DiagramType.detect(source);
        DiagramEngine engine = engines.get(type);
        if (engine == null) {
            throw new DiagramException("no engine registered for " + type.keyword() + " diagrams");
        }
        log.debug("Rendering {} diagram with engine {}", type, engine.getId());
        return engine.render(source, options);
    }
}
