package org.dxworks.wikiframe.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.wikiframe.model.Position;
import org.dxworks.wikiframe.parser.GrammarException;
import org.dxworks.wikiframe.source.SourceIndex;
import org.dxworks.wikiframe.source.SourceLine;

import java.util.ArrayList;
import java.util.List;

/**
 * The grammar could not continue at {@code position}. Carries the source lines around the
 * failing line for display.
 */
public class ParseError extends MWError {

    /** Number of lines shown before and after the failing line. */
    public static final int ERROR_CONTEXT_LINES = 5;

    public Position position = Position.any();
    public List<String> expected = new ArrayList<>();
    public List<String> context = new ArrayList<>();
    @JsonProperty("context_start")
    public int contextStart;
    @JsonProperty("context_end")
    public int contextEnd;

    public ParseError() {
    }

    public static ParseError from(GrammarException err, String input) {
        return from(err, input, ERROR_CONTEXT_LINES);
    }

    public static ParseError from(GrammarException err, String input, int contextLines) {
        SourceIndex index = SourceIndex.of(input);
        List<SourceLine> lines = index.getLines();
        int lineCount = lines.size();

        // zero-based failing line, clamped to the document
        int line = Math.max(0, Math.min(err.getLine(), lineCount) - 1);
        int start = line < contextLines ? 0 : line - contextLines;
        int end = line + contextLines >= lineCount ? lineCount - 1 : line + contextLines;

        ParseError error = new ParseError();
        error.position = index.position(err.getOffset());
        error.expected = new ArrayList<>(err.getExpected());
        for (SourceLine sourceLine : lines.subList(start, end + 1)) {
            error.context.add(sourceLine.getContent());
        }
        error.contextStart = start;
        error.contextEnd = end;
        return error;
    }

    @Override
    public String render(Ansi ansi, int width) {
        StringBuilder sb = new StringBuilder();
        sb.append(ansi.redBold(String.format(
                "ERROR in line %d at column %d: Could not continue to parse, expected one of: ",
                position.line, position.col)));

        List<String> tokens = new ArrayList<>();
        for (String token : expected) {
            tokens.add(TextUtils.isWhitespace(token) ? TextUtils.quote(token) : token);
        }
        sb.append(ansi.blueBold(String.join(", ", tokens))).append('\n');

        for (int i = 0; i < context.size(); i++) {
            int lineNumber = contextStart + i + 1;
            String lineno = lineNumber + " |";
            String content = context.get(i);
            if (lineNumber == position.line) {
                sb.append(ansi.redBold(lineno)).append(' ').append(ansi.red(content));
            } else {
                sb.append(ansi.blueBold(lineno)).append(' ').append(TextUtils.shorten(content, width));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String describe() {
        return "Could not continue to parse, because no rules could be matched.";
    }
}
