package com.textdiagram.core.parser.impl;

import com.textdiagram.core.model.er.Cardinality;
import com.textdiagram.core.model.er.Entity;
import com.textdiagram.core.model.er.EntityAttribute;
import com.textdiagram.core.model.er.ErDiagram;
import com.textdiagram.core.model.er.Relationship;
import com.textdiagram.core.parser.AbstractLineParser;
import com.textdiagram.core.parser.DiagramParseException;
import com.textdiagram.core.parser.LineCursor;
import com.textdiagram.core.parser.SourceLine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code erDiagram} sources.
 *
 * <pre>
 * CUSTOMER ||--o{ ORDER : places
 * ORDER {
 *     string id PK
 *     date created
 * }
 * </pre>
 * Entity names may contain hyphens. Entities are deduplicated by name; an attribute block
 * attaches to an entity that a relationship already introduced.
 */
public class ErParser extends AbstractLineParser<ErDiagram> {

    private static final String ENTITY = "[\\p{L}\\p{N}_-]+";

    private static final Pattern HEADER = Pattern.compile("erDiagram");

    private static final Pattern RELATIONSHIP = Pattern.compile(
        "(" + ENTITY + ")\\s+([|o}][|o])(?:--|\\.\\.)([|o][|o{])\\s+(" + ENTITY + ")\\s*:\\s*(.+)");

    private static final Pattern BLOCK_START = Pattern.compile("(" + ENTITY + ")\\s*\\{");
    private static final Pattern EMPTY_BLOCK = Pattern.compile("(" + ENTITY + ")\\s*\\{\\s*}");
    private static final Pattern BLOCK_END = Pattern.compile("}");
    private static final Pattern BARE_ENTITY = Pattern.compile(ENTITY);

    private static final Pattern ATTRIBUTE = Pattern.compile(
        "(\\S+)\\s+(" + ENTITY + ")(?:\\s+([A-Za-z]{2}(?:\\s*,\\s*[A-Za-z]{2})*))?(?:\\s+\"[^\"]*\")?");

    @Override
    protected Pattern headerPattern() {
        return HEADER;
    }

    @Override
    protected ErDiagram parseBody(Matcher header, LineCursor cursor) throws DiagramParseException {
        Map<String, List<EntityAttribute>> entities = new LinkedHashMap<>();
        List<Relationship> relationships = new ArrayList<>();

        while (cursor.hasNext()) {
            SourceLine line = cursor.next();
            Matcher m;
            if ((m = matchLine(RELATIONSHIP, line)) != null) {
                entities.putIfAbsent(m.group(1), new ArrayList<>());
                entities.putIfAbsent(m.group(4), new ArrayList<>());
                relationships.add(new Relationship(m.group(1), m.group(4),
                    leftCardinality(m.group(2)), rightCardinality(m.group(3)), unquote(m.group(5))));
            } else if ((m = matchLine(EMPTY_BLOCK, line)) != null) {
                entities.putIfAbsent(m.group(1), new ArrayList<>());
            } else if ((m = matchLine(BLOCK_START, line)) != null) {
                List<EntityAttribute> attributes = entities.computeIfAbsent(m.group(1), k -> new ArrayList<>());
                attributes.clear();
                attributes.addAll(parseAttributes(cursor, m.group(1)));
            } else if ((m = matchLine(BARE_ENTITY, line)) != null) {
                entities.putIfAbsent(m.group(), new ArrayList<>());
            } else {
                throw new DiagramParseException(line.number(), line.text());
            }
        }

        List<Entity> result = new ArrayList<>();
        entities.forEach((name, attributes) -> result.add(new Entity(name, attributes)));
        return new ErDiagram(result, relationships);
    }

    private List<EntityAttribute> parseAttributes(LineCursor cursor, String entity) throws DiagramParseException {
        List<EntityAttribute> attributes = new ArrayList<>();
        while (cursor.hasNext()) {
            SourceLine line = cursor.next();
            if (matchLine(BLOCK_END, line) != null) {
                return attributes;
            }
            Matcher m = matchLine(ATTRIBUTE, line);
            if (m == null) {
                throw new DiagramParseException(line.number(), line.text());
            }
            String key = m.group(3) != null ? m.group(3).replaceAll("\\s+", "") : null;
            attributes.add(new EntityAttribute(m.group(1), m.group(2), key));
        }
        throw new DiagramParseException(cursor.lastLineNumber(), "",
            "unterminated attribute block of '" + entity + "', expected '}'");
    }

    private static Cardinality leftCardinality(String symbol) {
        Cardinality c = Cardinality.fromLeft(symbol);
        if (c == null) {
            c = Cardinality.fromRight(symbol);
        }
        return c != null ? c : Cardinality.EXACTLY_ONE;
    }

    private static Cardinality rightCardinality(String symbol) {
        Cardinality c = Cardinality.fromRight(symbol);
        if (c == null) {
            c = Cardinality.fromLeft(symbol);
        }
        return c != null ? c : Cardinality.EXACTLY_ONE;
    }
}
