package com.textdiagram.core.engine.impl;

import com.textdiagram.core.engine.AbstractDiagramEngine;
import com.textdiagram.core.engine.DiagramType;
import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.layout.graph.GraphLayout;
import com.textdiagram.core.layout.graph.GraphLayoutEngine;
import com.textdiagram.core.model.graph.GraphDiagram;
import com.textdiagram.core.parser.DiagramParser;
import com.textdiagram.core.parser.impl.GraphParser;
import com.textdiagram.core.renderer.DiagramRenderer;
import com.textdiagram.core.renderer.impl.GraphRenderer;

public class FlowchartEngine extends AbstractDiagramEngine<GraphDiagram, GraphLayout> {

    private final GraphParser parser = new GraphParser();
    private final GraphLayoutEngine layoutEngine = new GraphLayoutEngine();
    private final GraphRenderer renderer = new GraphRenderer();

    @Override
    public String getId() {
        return "flowchart";
    }

    @Override
    public String getDisplayName() {
        return "Flowchart Renderer";
    }

    @Override
    public DiagramType getDiagramType() {
        return DiagramType.FLOWCHART;
    }

    @Override
    protected DiagramParser<GraphDiagram> parser() {
        return parser;
    }

    @Override
    protected GraphLayout layout(GraphDiagram diagram) throws LayoutException {
        return layoutEngine.compute(diagram);
    }

    @Override
    protected GraphLayout layoutWithMaxWidth(GraphDiagram diagram, int maxWidth) throws LayoutException {
        return layoutEngine.computeWithMaxWidth(diagram, maxWidth);
    }

    @Override
    protected DiagramRenderer<GraphLayout> renderer() {
        return renderer;
    }
}
