package com.textdiagram.core.parser.impl;

import com.textdiagram.core.model.graph.Direction;
import com.textdiagram.core.model.graph.Edge;
import com.textdiagram.core.model.graph.EdgeType;
import com.textdiagram.core.model.graph.GraphDiagram;
import com.textdiagram.core.model.graph.NodeDecl;
import com.textdiagram.core.model.graph.NodeShape;
import com.textdiagram.core.model.graph.Subgraph;
import com.textdiagram.core.parser.AbstractLineParser;
import com.textdiagram.core.parser.DiagramParseException;
import com.textdiagram.core.parser.LineCursor;
import com.textdiagram.core.parser.SourceLine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code graph} and {@code flowchart} sources.
 *
 * <p>A statement line is a chain of node references joined by edge operators:
 * <pre>
 * A[Start] --> B{Check} -->|yes| C(Done)
 * A -- label --> B
 * A --> B &amp; C
 * A((Circle))
 * </pre>
 * Edge operators: {@code -->}, {@code ---}, {@code -.->}, {@code -.-}, {@code ==>},
 * {@code ===}. Nodes are deduplicated by id; a reference with a shape or label replaces an
 * earlier bare reference, otherwise the first declaration wins.
 */
public class GraphParser extends AbstractLineParser<GraphDiagram> {

    private static final Pattern HEADER = Pattern.compile("(graph|flowchart)(?:\\s+(TD|TB|LR))?\\s*;?");

    private static final Pattern SUBGRAPH = Pattern.compile("subgraph\\s+(.+)");
    private static final Pattern SUBGRAPH_WITH_ID = Pattern.compile("(" + ID + ")\\s*\\[(.+)]");
    private static final Pattern END = Pattern.compile("end");

    private static final Pattern NODE_ID = Pattern.compile(ID);
    private static final Pattern CIRCLE = Pattern.compile("\\(\\((\"[^\"]*\"|[^)]*)\\)\\)");
    private static final Pattern ROUND = Pattern.compile("\\((\"[^\"]*\"|[^)]*)\\)");
    private static final Pattern DIAMOND = Pattern.compile("\\{(\"[^\"]*\"|[^}]*)}");
    private static final Pattern BOX = Pattern.compile("\\[(\"[^\"]*\"|[^\\]]*)]");

    private static final Pattern EDGE = Pattern.compile("\\s*(-\\.->|-\\.-|==>|===|-->|---)(?:\\|([^|]*)\\|)?\\s*");
    private static final Pattern TEXT_EDGE = Pattern.compile("\\s*(--|==)\\s+(.+?)\\s+(-->|---|==>|===)\\s*");
    private static final Pattern AMPERSAND = Pattern.compile("\\s*&\\s*");

    @Override
    protected Pattern headerPattern() {
        return HEADER;
    }

    @Override
    protected GraphDiagram parseBody(Matcher header, LineCursor cursor) throws DiagramParseException {
        Direction direction = "LR".equals(header.group(2)) ? Direction.LEFT_RIGHT : Direction.TOP_DOWN;
        Collector collector = new Collector();
        parseLines(cursor, collector, null);
        return new GraphDiagram(direction, List.copyOf(collector.nodes.values()), collector.edges, collector.subgraphs);
    }

    private void parseLines(LineCursor cursor, Collector collector, List<String> members) throws DiagramParseException {
        while (cursor.hasNext()) {
            SourceLine line = cursor.next();
            if (matchLine(END, line) != null) {
                if (members == null) {
                    throw new DiagramParseException(line.number(), line.text(), "'end' without 'subgraph'");
                }
                return;
            }
            Matcher sub = matchLine(SUBGRAPH, line);
            if (sub != null) {
                parseSubgraph(sub.group(1).trim(), cursor, collector);
                continue;
            }
            List<String> referenced = parseStatement(line, collector);
            if (members != null) {
                for (String id : referenced) {
                    if (!members.contains(id)) {
                        members.add(id);
                    }
                }
            }
        }
        if (members != null) {
            throw new DiagramParseException(cursor.lastLineNumber(), "", "unterminated 'subgraph', expected 'end'");
        }
    }

    private void parseSubgraph(String title, LineCursor cursor, Collector collector) throws DiagramParseException {
        String id;
        String label;
        Matcher withId = SUBGRAPH_WITH_ID.matcher(title);
        if (withId.matches()) {
            id = withId.group(1);
            label = unquote(withId.group(2));
        } else {
            label = unquote(title);
            id = label.replace(' ', '_').toLowerCase(Locale.ROOT);
        }
        List<String> members = new ArrayList<>();
        parseLines(cursor, collector, members);
        collector.subgraphs.add(new Subgraph(id, label, members));
    }

    /**
     * Parses one chain statement and records its nodes and edges.
     *
     * @return ids of all nodes referenced on the line, in order
     */
    private List<String> parseStatement(SourceLine line, Collector collector) throws DiagramParseException {
        String text = line.text().endsWith(";") ? line.text().substring(0, line.text().length() - 1) : line.text();
        Scanner scanner = new Scanner(text);

        List<String> referenced = new ArrayList<>();
        List<NodeDecl> sources = parseNodeGroup(scanner, line);
        sources.forEach(n -> referenced.add(collector.addNode(n)));

        while (!scanner.atEnd()) {
            EdgeType type;
            String label;
            Matcher m;
            if ((m = scanner.consume(EDGE)) != null) {
                type = edgeType(m.group(1));
                label = m.group(2) != null ? unquote(m.group(2)) : null;
            } else if ((m = scanner.consume(TEXT_EDGE)) != null) {
                type = edgeType(m.group(3));
                label = unquote(m.group(2));
            } else {
                throw new DiagramParseException(line.number(), line.text());
            }
            List<NodeDecl> targets = parseNodeGroup(scanner, line);
            for (NodeDecl target : targets) {
                referenced.add(collector.addNode(target));
            }
            for (NodeDecl source : sources) {
                for (NodeDecl target : targets) {
                    collector.edges.add(new Edge(source.id(), target.id(), type, label == null || label.isEmpty() ? null : label));
                }
            }
            sources = targets;
        }
        return referenced;
    }

    private List<NodeDecl> parseNodeGroup(Scanner scanner, SourceLine line) throws DiagramParseException {
        List<NodeDecl> group = new ArrayList<>();
        group.add(parseNodeRef(scanner, line));
        while (scanner.consume(AMPERSAND) != null) {
            group.add(parseNodeRef(scanner, line));
        }
        return group;
    }

    private NodeDecl parseNodeRef(Scanner scanner, SourceLine line) throws DiagramParseException {
        Matcher id = scanner.consume(NODE_ID);
        if (id == null) {
            throw new DiagramParseException(line.number(), line.text());
        }
        String nodeId = id.group();
        Matcher m;
        if ((m = scanner.consume(CIRCLE)) != null) {
            return new NodeDecl(nodeId, unquote(m.group(1)), NodeShape.CIRCLE);
        }
        if ((m = scanner.consume(ROUND)) != null) {
            return new NodeDecl(nodeId, unquote(m.group(1)), NodeShape.ROUND);
        }
        if ((m = scanner.consume(DIAMOND)) != null) {
            return new NodeDecl(nodeId, unquote(m.group(1)), NodeShape.DIAMOND);
        }
        if ((m = scanner.consume(BOX)) != null) {
            return new NodeDecl(nodeId, unquote(m.group(1)), NodeShape.BOX);
        }
        return bareNode(nodeId);
    }

    private static NodeDecl bareNode(String id) {
        return new NodeDecl(id, id, NodeShape.BOX);
    }

    private static EdgeType edgeType(String operator) {
        return switch (operator) {
            case "-.->" -> EdgeType.DOTTED_ARROW;
            case "-.-" -> EdgeType.DOTTED_LINK;
            case "==>" -> EdgeType.THICK_ARROW;
            case "===" -> EdgeType.THICK_LINK;
            case "---" -> EdgeType.OPEN_LINK;
            default -> EdgeType.ARROW;
        };
    }

    /** Regex tokenizer over one statement. */
    private static final class Scanner {

        private final String text;
        private int position;

        Scanner(String text) {
            this.text = text;
        }

        Matcher consume(Pattern pattern) {
            Matcher m = pattern.matcher(text);
            m.region(position, text.length());
            if (m.lookingAt()) {
                position = m.end();
                return m;
            }
            return null;
        }

        boolean atEnd() {
            return text.substring(position).isBlank();
        }
    }

    /** Accumulates nodes, edges and subgraphs across nested subgraph blocks. */
    private static final class Collector {

        private final Map<String, NodeDecl> nodes = new LinkedHashMap<>();
        private final Map<String, Boolean> explicit = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<Subgraph> subgraphs = new ArrayList<>();

        String addNode(NodeDecl node) {
            boolean isExplicit = !node.equals(bareNode(node.id()));
            if (!nodes.containsKey(node.id()) || (isExplicit && !explicit.get(node.id()))) {
                nodes.put(node.id(), node);
                explicit.put(node.id(), isExplicit);
            }
            return node.id();
        }
    }
}
