package org.dxworks.wikiframe.parser;

import java.util.Collections;
import java.util.List;

/**
 * Raised by a grammar when no rule matches. {@code offset} is a UTF-8 byte offset,
 * {@code line} is 1-based.
 */
public class GrammarException extends Exception {
    private final int offset;
    private final int line;
    private final List<String> expected;

    public GrammarException(int offset, int line, List<String> expected) {
        super("expected one of " + expected + " at line " + line);
        this.offset = offset;
        this.line = line;
        this.expected = Collections.unmodifiableList(expected);
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public List<String> getExpected() {
        return expected;
    }
}
