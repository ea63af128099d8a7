package org.dxworks.wikiframe.source;

/**
 * One line of the source document. {@code start} and {@code end} are UTF-8 byte offsets, where
 * {@code end} is the start of the following line.
 */
public final class SourceLine {
    private final int start;
    private final int end;
    private final int charStart;
    private final String content;

    SourceLine(int start, int end, int charStart, String content) {
        this.start = start;
        this.end = end;
        this.charStart = charStart;
        this.content = content;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /** Index of the first character of this line in the Java source string. */
    public int getCharStart() {
        return charStart;
    }

    public String getContent() {
        return content;
    }
}
