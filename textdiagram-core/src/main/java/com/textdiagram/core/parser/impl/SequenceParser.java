package com.textdiagram.core.parser.impl;

import com.textdiagram.core.model.sequence.Activate;
import com.textdiagram.core.model.sequence.Arrow;
import com.textdiagram.core.model.sequence.ArrowHead;
import com.textdiagram.core.model.sequence.AutoNumber;
import com.textdiagram.core.model.sequence.Block;
import com.textdiagram.core.model.sequence.BlockKind;
import com.textdiagram.core.model.sequence.Branch;
import com.textdiagram.core.model.sequence.Deactivate;
import com.textdiagram.core.model.sequence.Destroy;
import com.textdiagram.core.model.sequence.LineStyle;
import com.textdiagram.core.model.sequence.Message;
import com.textdiagram.core.model.sequence.Note;
import com.textdiagram.core.model.sequence.NotePlacement;
import com.textdiagram.core.model.sequence.ParticipantDecl;
import com.textdiagram.core.model.sequence.ParticipantKind;
import com.textdiagram.core.model.sequence.SequenceDiagram;
import com.textdiagram.core.model.sequence.Statement;
import com.textdiagram.core.parser.AbstractLineParser;
import com.textdiagram.core.parser.DiagramParseException;
import com.textdiagram.core.parser.LineCursor;
import com.textdiagram.core.parser.SourceLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code sequenceDiagram} sources.
 *
 * <p>Supported statements:
 * <pre>
 * participant|actor ID [as Display Name]
 * create participant|actor ID [as Display Name]
 * A->B, A->>B, A-xB, A-)B  (and the dotted -- variants), optional +/- after the arrow
 * Note right of|left of|over A[,B]: text
 * activate|deactivate|destroy ID
 * autonumber
 * loop|opt|break|rect [label] ... end
 * alt|par|critical label ... else|and|option [label] ... end
 * </pre>
 */
public class SequenceParser extends AbstractLineParser<SequenceDiagram> {

    private static final Pattern HEADER = Pattern.compile("sequenceDiagram");

    private static final Pattern PARTICIPANT = Pattern.compile(
        "(?:create\\s+)?(participant|actor)\\s+(" + ID + ")(?:\\s+as\\s+(.+))?");

    private static final Pattern MESSAGE = Pattern.compile(
        "(" + ID + ")\\s*(--|-)(>>|>|x|\\))([+-]?)\\s*(" + ID + ")\\s*(?::(.*))?");

    private static final Pattern NOTE = Pattern.compile(
        "note\\s+(right\\s+of|left\\s+of|over)\\s+(" + ID + ")(?:\\s*,\\s*(" + ID + "))?\\s*:(.*)",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern LIFECYCLE = Pattern.compile("(activate|deactivate|destroy)\\s+(" + ID + ")");

    private static final Pattern AUTONUMBER = Pattern.compile("autonumber(?:\\s+.*)?");

    private static final Pattern BLOCK_START = Pattern.compile(
        "(loop|opt|break|rect|alt|par|critical)(?:\\s+(.*))?");

    private static final Pattern DIVIDER = Pattern.compile("(else|and|option)(?:\\s+(.*))?");

    private static final Pattern END = Pattern.compile("end");

    @Override
    protected Pattern headerPattern() {
        return HEADER;
    }

    @Override
    protected SequenceDiagram parseBody(Matcher header, LineCursor cursor) throws DiagramParseException {
        List<Statement> statements = new ArrayList<>();
        parseStatements(cursor, null, statements);
        if (cursor.hasNext()) {
            SourceLine stray = cursor.next();
            throw new DiagramParseException(stray.number(), stray.text());
        }
        return new SequenceDiagram(statements);
    }

    /**
     * Parses statements until the end of input, or until the {@code end} or divider line
     * that belongs to {@code enclosing}. The terminating line is left unconsumed.
     */
    private void parseStatements(LineCursor cursor, BlockKind enclosing, List<Statement> into)
            throws DiagramParseException {
        while (cursor.hasNext()) {
            SourceLine line = cursor.peek();
            if (enclosing != null && isTerminator(line, enclosing)) {
                return;
            }
            cursor.next();
            into.add(parseStatement(line, cursor));
        }
        if (enclosing != null) {
            throw new DiagramParseException(cursor.lastLineNumber(), "",
                "unterminated '" + enclosing.keyword() + "' block, expected 'end'");
        }
    }

    private boolean isTerminator(SourceLine line, BlockKind enclosing) {
        if (matchLine(END, line) != null) {
            return true;
        }
        Matcher divider = matchLine(DIVIDER, line);
        return divider != null && divider.group(1).equals(enclosing.dividerKeyword());
    }

    private Statement parseStatement(SourceLine line, LineCursor cursor) throws DiagramParseException {
        Matcher m;
        if ((m = matchLine(PARTICIPANT, line)) != null) {
            ParticipantKind kind = m.group(1).equals("actor") ? ParticipantKind.ACTOR : ParticipantKind.PARTICIPANT;
            String alias = m.group(3) != null ? m.group(3).trim() : null;
            return new ParticipantDecl(m.group(2), alias, kind);
        }
        if ((m = matchLine(NOTE, line)) != null) {
            return parseNote(m);
        }
        if ((m = matchLine(LIFECYCLE, line)) != null) {
            return switch (m.group(1)) {
                case "activate" -> new Activate(m.group(2));
                case "deactivate" -> new Deactivate(m.group(2));
                default -> new Destroy(m.group(2));
            };
        }
        if (matchLine(AUTONUMBER, line) != null) {
            return new AutoNumber();
        }
        if ((m = matchLine(BLOCK_START, line)) != null) {
            return parseBlock(m, cursor);
        }
        if ((m = matchLine(MESSAGE, line)) != null) {
            return parseMessage(m);
        }
        throw new DiagramParseException(line.number(), line.text());
    }

    private Note parseNote(Matcher m) {
        String placementText = m.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        NotePlacement placement = switch (placementText) {
            case "right of" -> NotePlacement.RIGHT_OF;
            case "left of" -> NotePlacement.LEFT_OF;
            default -> NotePlacement.OVER;
        };
        List<String> anchors = new ArrayList<>();
        anchors.add(m.group(2));
        if (m.group(3) != null && placement == NotePlacement.OVER) {
            anchors.add(m.group(3));
        }
        return new Note(placement, anchors, m.group(4).trim());
    }

    private Block parseBlock(Matcher m, LineCursor cursor) throws DiagramParseException {
        BlockKind kind = BlockKind.valueOf(m.group(1).toUpperCase(Locale.ROOT));
        String label = m.group(2) != null ? m.group(2).trim() : "";

        List<Statement> body = new ArrayList<>();
        parseStatements(cursor, kind, body);

        List<Branch> branches = new ArrayList<>();
        SourceLine terminator = cursor.next();
        Matcher divider;
        while ((divider = matchLine(DIVIDER, terminator)) != null) {
            String branchLabel = divider.group(2) != null ? divider.group(2).trim() : "";
            List<Statement> branchBody = new ArrayList<>();
            parseStatements(cursor, kind, branchBody);
            branches.add(new Branch(branchLabel, branchBody));
            terminator = cursor.next();
        }
        return new Block(kind, label, body, branches);
    }

    private Message parseMessage(Matcher m) {
        LineStyle style = m.group(2).equals("--") ? LineStyle.DOTTED : LineStyle.SOLID;
        ArrowHead head = switch (m.group(3)) {
            case ">>" -> ArrowHead.ARROWHEAD;
            case "x" -> ArrowHead.CROSS;
            case ")" -> ArrowHead.OPEN;
            default -> ArrowHead.NONE;
        };
        String modifier = m.group(4);
        String text = m.group(6) != null ? m.group(6).trim() : "";
        return new Message(m.group(1), m.group(5), new Arrow(style, head), text,
            modifier.equals("+"), modifier.equals("-"));
    }
}
