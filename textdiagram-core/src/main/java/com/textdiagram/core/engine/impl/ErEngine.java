package com.textdiagram.core.engine.impl;

import com.textdiagram.core.engine.AbstractDiagramEngine;
import com.textdiagram.core.engine.DiagramType;
import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.layout.er.ErLayout;
import com.textdiagram.core.layout.er.ErLayoutEngine;
import com.textdiagram.core.model.er.ErDiagram;
import com.textdiagram.core.parser.DiagramParser;
import com.textdiagram.core.parser.impl.ErParser;
import com.textdiagram.core.renderer.DiagramRenderer;
import com.textdiagram.core.renderer.impl.ErRenderer;

public class ErEngine extends AbstractDiagramEngine<ErDiagram, ErLayout> {

    private final ErParser parser = new ErParser();
    private final ErLayoutEngine layoutEngine = new ErLayoutEngine();
    private final ErRenderer renderer = new ErRenderer();

    @Override
    public String getId() {
        return "er";
    }

    @Override
    public String getDisplayName() {
        return "Entity-Relationship Diagram Renderer";
    }

    @Override
    public DiagramType getDiagramType() {
        return DiagramType.ER;
    }

    @Override
    protected DiagramParser<ErDiagram> parser() {
        return parser;
    }

    @Override
    protected ErLayout layout(ErDiagram diagram) throws LayoutException {
        return layoutEngine.compute(diagram);
    }

    @Override
    protected ErLayout layoutWithMaxWidth(ErDiagram diagram, int maxWidth) throws LayoutException {
        return layoutEngine.computeWithMaxWidth(diagram, maxWidth);
    }

    @Override
    protected DiagramRenderer<ErLayout> renderer() {
        return renderer;
    }
}
