package org.dxworks.wikiframe.source;

import org.dxworks.wikiframe.model.Position;
import org.dxworks.wikiframe.model.Span;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Start and end offsets of every source line, used to turn byte offsets into line and column
 * positions.
 */
public final class SourceIndex {
    private final List<SourceLine> lines;

    private SourceIndex(List<SourceLine> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static SourceIndex of(String source) {
        List<SourceLine> lines = new ArrayList<>();
        int pos = 0;
        int charPos = 0;
        // split with a negative limit keeps the trailing empty line
        for (String line : source.split("\n", -1)) {
            int byteLength = utf8Length(line, 0, line.length());
            lines.add(new SourceLine(pos, pos + byteLength + 1, charPos, line));
            pos += byteLength + 1;
            charPos += line.length() + 1;
        }
        return new SourceIndex(lines);
    }

    public List<SourceLine> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    /**
     * Maps a byte offset to a position. Offsets past the last line map to line
     * {@code size() + 1}, column 0.
     */
    public Position position(int offset) {
        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (offset >= line.getStart() && offset < line.getEnd()) {
                return new Position(offset, i + 1, columnOf(line.getContent(), offset - line.getStart()));
            }
        }
        return new Position(offset, lines.size() + 1, 0);
    }

    public Span span(int startOffset, int endOffset) {
        return new Span(position(startOffset), position(endOffset));
    }

    /** Span of the characters {@code [startChar, endChar)} of the source string. */
    public Span charSpan(int startChar, int endChar) {
        return span(byteOffset(startChar), byteOffset(endChar));
    }

    public boolean startsLine(int offset) {
        for (SourceLine line : lines) {
            if (line.getStart() == offset) {
                return true;
            }
        }
        return false;
    }

    /** Converts an index into the Java source string to a UTF-8 byte offset. */
    public int byteOffset(int charIndex) {
        int low = 0;
        int high = lines.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lines.get(mid).getCharStart() <= charIndex) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        SourceLine line = lines.get(low);
        String content = line.getContent();
        int within = charIndex - line.getCharStart();
        if (within > content.length()) {
            // the newline terminating the line, or the end of the document
            return line.getStart() + utf8Length(content, 0, content.length()) + (within - content.length());
        }
        return line.getStart() + utf8Length(content, 0, within);
    }

    // 1-based count of code points starting before the byte offset within the line
    private static int columnOf(String content, int byteOffset) {
        int bytes = 0;
        int column = 1;
        int i = 0;
        while (i < content.length() && bytes < byteOffset) {
            int codePoint = content.codePointAt(i);
            bytes += utf8Length(codePoint);
            i += Character.charCount(codePoint);
            column++;
        }
        return column;
    }

    static int utf8Length(String s, int from, int to) {
        return s.substring(from, to).getBytes(StandardCharsets.UTF_8).length;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }
}
