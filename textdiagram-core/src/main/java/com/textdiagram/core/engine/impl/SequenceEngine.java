package com.textdiagram.core.engine.impl;

import com.textdiagram.core.engine.AbstractDiagramEngine;
import com.textdiagram.core.engine.DiagramType;
import com.textdiagram.core.layout.LayoutException;
import com.textdiagram.core.layout.sequence.SequenceLayout;
import com.textdiagram.core.layout.sequence.SequenceLayoutEngine;
import com.textdiagram.core.model.sequence.SequenceDiagram;
import com.textdiagram.core.parser.DiagramParser;
import com.textdiagram.core.parser.impl.SequenceParser;
import com.textdiagram.core.renderer.DiagramRenderer;
import com.textdiagram.core.renderer.impl.SequenceRenderer;

public class SequenceEngine extends AbstractDiagramEngine<SequenceDiagram, SequenceLayout> {

    private final SequenceParser parser = new SequenceParser();
    private final SequenceLayoutEngine layoutEngine = new SequenceLayoutEngine();
    private final SequenceRenderer renderer = new SequenceRenderer();

    @Override
    public String getId() {
        return "sequence";
    }

    @Override
    public String getDisplayName() {
        return "Sequence Diagram Renderer";
    }

    @Override
    public DiagramType getDiagramType() {
        return DiagramType.SEQUENCE;
    }

    @Override
    protected DiagramParser<SequenceDiagram> parser() {
        return parser;
    }

    @Override
    protected SequenceLayout layout(SequenceDiagram diagram) throws LayoutException {
        return layoutEngine.compute(diagram);
    }

    @Override
    protected SequenceLayout layoutWithMaxWidth(SequenceDiagram diagram, int maxWidth) throws LayoutException {
        return layoutEngine.computeWithMaxWidth(diagram, maxWidth);
    }

    @Override
    protected DiagramRenderer<SequenceLayout> renderer() {
        return renderer;
    }
}
