package org.dxworks.wikiframe.parser;

import org.dxworks.wikiframe.model.*;
import org.dxworks.wikiframe.source.SourceIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for MediaWiki markup. Produces the raw tree: headings are flat
 * siblings holding the blocks of their section, list items are flat children of their list, and
 * every source line is its own paragraph. {@link org.dxworks.wikiframe.transform.TransformationPipeline}
 * turns this into the final structure.
 *
 * <p>The parser is strict: running out of input inside a construct that needs a closing token
 * raises a {@link GrammarException} listing the tokens that would have been accepted.</p>
 */
public class WikitextParser implements WikitextGrammar {

    private static final String LIST_MARKERS = "*#:;";
    // characters that may start a construct or end an enclosing one
    private static final String SPECIAL = "<{}[]'|!\n";
    private static final String[] URL_PREFIXES = {"http://", "https://", "ftp://", "mailto:", "//"};
    private static final Set<String> VOID_TAGS = Set.of("br", "hr", "wbr", "img");
    private static final Set<String> RAW_TAGS = Set.of("nowiki", "math", "pre");
    // html elements and extension tags; any other "<name>" is plain text
    private static final Set<String> HTML_TAGS = Set.of(
            "abbr", "b", "bdi", "big", "blockquote", "br", "caption", "categorytree", "center", "chem", "cite",
            "dd", "div", "dl", "dt", "em", "font", "h1", "h2", "h3", "h4", "h5", "h6", "hr", "i", "img",
            "includeonly", "inputbox", "kbd", "li", "mapframe", "maplink", "mark", "noinclude", "ol",
            "onlyinclude", "p", "poem", "q", "rb", "ref", "references", "rp", "rt", "ruby", "samp", "score",
            "section", "small", "source", "span", "strong", "sub", "sup", "syntaxhighlight", "table",
            "td", "templatedata", "th", "time", "timeline", "tr", "tt", "ul", "var", "wbr");
    private static final Pattern OPEN_TAG = Pattern.compile("<([a-zA-Z][a-zA-Z0-9]*)((?:\\s[^<>]*?)?)(/?)>");
    private static final Pattern GALLERY_START = Pattern.compile("(?i)<gallery[\\s/>]");

    @Override
    public Element parse(String source, SourceIndex index) throws GrammarException {
        return new Run(source, index).document();
    }

    /** Tells whether an enclosing construct ends at the given position. */
    @FunctionalInterface
    private interface Stop {
        boolean at(int position);
    }

    private static final class Run {
        private final String src;
        private final SourceIndex index;
        private final int len;
        private int pos;

        Run(String src, SourceIndex index) {
            this.src = src;
            this.index = index;
            this.len = src.length();
        }

        // ---- blocks ----

        Document document() throws GrammarException {
            List<Element> content = new ArrayList<>();
            Heading section = null;
            while (pos < len) {
                Heading heading = headingLine();
                if (heading != null) {
                    content.add(heading);
                    section = heading;
                    continue;
                }
                Element block = block();
                if (section == null) {
                    content.add(block);
                } else {
                    section.content.add(block);
                    section.position.end = block.position.end;
                }
            }
            return new Document(index.charSpan(0, len), content);
        }

        private Heading headingLine() throws GrammarException {
            int eol = lineEnd(pos);
            String line = src.substring(pos, eol).stripTrailing();
            int lead = 0;
            while (lead < line.length() && line.charAt(lead) == '=') {
                lead++;
            }
            int trail = 0;
            while (trail < line.length() && line.charAt(line.length() - 1 - trail) == '=') {
                trail++;
            }
            if (lead == 0 || trail == 0) {
                return null;
            }
            int depth = Math.min(6, Math.min(lead, trail));
            if (line.length() <= 2 * depth) {
                return null;
            }

            int start = pos;
            int captionEnd = pos + line.length() - depth;
            pos += depth;
            List<Element> caption = inline(p -> p >= captionEnd);
            pos = pos <= captionEnd ? eol : lineEnd(pos);
            Heading heading = new Heading(index.charSpan(start, pos), depth, caption, new ArrayList<>());
            newline();
            return heading;
        }

        private Element block() throws GrammarException {
            if (startsWith("{|", pos)) {
                return table();
            }
            if (LIST_MARKERS.indexOf(src.charAt(pos)) >= 0) {
                return list();
            }
            if (GALLERY_START.matcher(src).region(pos, len).lookingAt()) {
                Element gallery = tag();
                if (gallery != null) {
                    skipBlankRest();
                    return gallery;
                }
            }
            return paragraph();
        }

        private Paragraph paragraph() throws GrammarException {
            int start = pos;
            List<Element> content = inline(this::atNewline);
            Paragraph paragraph = new Paragraph(index.charSpan(start, pos), content);
            newline();
            return paragraph;
        }

        private ListElement list() throws GrammarException {
            int start = pos;
            int end = pos;
            List<Element> items = new ArrayList<>();
            while (pos < len && LIST_MARKERS.indexOf(src.charAt(pos)) >= 0) {
                int itemStart = pos;
                while (pos < len && LIST_MARKERS.indexOf(src.charAt(pos)) >= 0) {
                    pos++;
                }
                int depth = pos - itemStart;
                ListItemKind kind = ListItemKind.byMarker(src.charAt(pos - 1));
                pos = skipBlanks(pos);
                List<Element> content = inline(this::atNewline);
                items.add(new ListItem(index.charSpan(itemStart, pos), depth, kind, content));
                end = pos;
                newline();
            }
            return new ListElement(index.charSpan(start, end), items);
        }

        private Table table() throws GrammarException {
            int start = pos;
            int eol = lineEnd(pos);
            List<TagAttribute> attributes = AttributeParser.parse(src, pos + 2, eol, index);
            pos = eol;
            newline();

            Table table = new Table(index.charSpan(start, eol), attributes, new ArrayList<>(), new ArrayList<>(),
                    new ArrayList<>());
            TableRow row = null;
            TableCell cell = null;

            while (true) {
                if (pos >= len) {
                    throw fail("|}");
                }
                int lineStart = pos;
                int p = skipBlanks(pos);

                if (startsWith("|}", p)) {
                    addRow(table, row);
                    pos = p + 2;
                    table.position = index.charSpan(start, pos);
                    skipBlankRest();
                    return table;
                }

                if (startsWith("|-", p)) {
                    addRow(table, row);
                    int rowEol = lineEnd(p);
                    row = new TableRow(index.charSpan(lineStart, rowEol),
                            AttributeParser.parse(src, p + 2, rowEol, index), new ArrayList<>());
                    cell = null;
                    pos = rowEol;
                    newline();
                    continue;
                }

                if (startsWith("|+", p)) {
                    pos = p + 2;
                    int separator = attributeSeparator(pos, false);
                    if (separator >= 0) {
                        table.captionAttributes = AttributeParser.parse(src, pos, separator, index);
                        pos = separator + 1;
                    }
                    table.caption.addAll(inline(this::atNewline));
                    newline();
                    continue;
                }

                if (startsWith("|", p) || startsWith("!", p)) {
                    boolean header = src.charAt(p) == '!';
                    if (row == null) {
                        row = new TableRow(index.charSpan(lineStart, lineStart), new ArrayList<>(), new ArrayList<>());
                    }
                    int cellStart = p;
                    pos = p + 1;
                    while (true) {
                        cell = cell(cellStart, header);
                        row.cells.add(cell);
                        row.position.end = cell.position.end;
                        if (startsWith("||", pos) || (header && startsWith("!!", pos))) {
                            cellStart = pos;
                            pos += 2;
                            continue;
                        }
                        break;
                    }
                    newline();
                    continue;
                }

                // a line continuing the content of the previous cell
                if (cell == null) {
                    if (isBlank(pos, lineEnd(pos))) {
                        pos = lineEnd(pos);
                        newline();
                        continue;
                    }
                    if (row == null) {
                        row = new TableRow(index.charSpan(lineStart, lineStart), new ArrayList<>(), new ArrayList<>());
                    }
                    cell = new TableCell(index.charSpan(lineStart, lineStart), false, new ArrayList<>(),
                            new ArrayList<>());
                    row.cells.add(cell);
                }
                if (startsWith("{|", p)) {
                    pos = p;
                }
                Element block = block();
                cell.content.add(block);
                cell.position.end = block.position.end;
                row.position.end = block.position.end;
            }
        }

        private void addRow(Table table, TableRow row) {
            if (row != null) {
                table.rows.add(row);
            }
        }

        private TableCell cell(int cellStart, boolean header) throws GrammarException {
            List<TagAttribute> attributes = new ArrayList<>();
            int separator = attributeSeparator(pos, header);
            if (separator >= 0) {
                attributes = AttributeParser.parse(src, pos, separator, index);
                pos = separator + 1;
            }
            List<Element> content = inline(p -> atNewline(p)
                    || startsWith("||", p)
                    || (header && startsWith("!!", p)));
            return new TableCell(index.charSpan(cellStart, pos), header, attributes, content);
        }

        // position of a single '|' separating cell attributes from cell content, or -1
        private int attributeSeparator(int from, boolean header) {
            for (int i = from; i < len; i++) {
                char c = src.charAt(i);
                if (c == '\n' || c == '<' || startsWith("{{", i) || startsWith("[[", i)
                        || (header && startsWith("!!", i))) {
                    return -1;
                }
                if (c == '|') {
                    return startsWith("||", i) ? -1 : i;
                }
            }
            return -1;
        }

        // ---- inline ----

        private List<Element> inline(Stop stop) throws GrammarException {
            List<Element> result = new ArrayList<>();
            while (pos < len && !stop.at(pos)) {
                result.add(inlineElement(stop));
            }
            return result;
        }

        private Element inlineElement(Stop stop) throws GrammarException {
            if (startsWith("<!--", pos)) {
                return comment();
            }
            if (startsWith("{{", pos)) {
                return template();
            }
            if (startsWith("[[", pos)) {
                return internalReference();
            }
            if (src.charAt(pos) == '[' && isUrl(pos + 1)) {
                return externalReference();
            }
            if (startsWith("''", pos)) {
                return formatted(stop);
            }
            if (src.charAt(pos) == '<') {
                Element tag = tag();
                if (tag != null) {
                    return tag;
                }
            }
            return text(stop);
        }

        private Text text(Stop stop) {
            int start = pos;
            pos++;
            if (SPECIAL.indexOf(src.charAt(start)) < 0) {
                while (pos < len && SPECIAL.indexOf(src.charAt(pos)) < 0 && !stop.at(pos)) {
                    pos++;
                }
            }
            return new Text(index.charSpan(start, pos), src.substring(start, pos));
        }

        private Comment comment() throws GrammarException {
            int start = pos;
            int close = src.indexOf("-->", pos + 4);
            if (close < 0) {
                pos = len;
                throw fail("-->");
            }
            pos = close + 3;
            return new Comment(index.charSpan(start, pos), src.substring(start + 4, close));
        }

        private Template template() throws GrammarException {
            int start = pos;
            pos += 2;
            Stop argumentEnd = p -> startsWith("|", p) || startsWith("}}", p);
            List<Element> name = inline(argumentEnd);
            List<Element> arguments = new ArrayList<>();
            while (startsWith("|", pos)) {
                int argumentStart = pos;
                pos++;
                String key = argumentName();
                List<Element> value = inline(argumentEnd);
                arguments.add(new TemplateArgument(index.charSpan(argumentStart, pos), key, value));
            }
            if (!startsWith("}}", pos)) {
                throw fail("|", "}}");
            }
            pos += 2;
            return new Template(index.charSpan(start, pos), name, arguments);
        }

        // consumes "name =" if the argument is named; anonymous arguments get an empty name
        private String argumentName() {
            for (int i = pos; i < len; i++) {
                char c = src.charAt(i);
                if (c == '=') {
                    String key = src.substring(pos, i).strip();
                    if (key.isEmpty()) {
                        return "";
                    }
                    pos = i + 1;
                    return key;
                }
                if (c == '|' || c == '<' || startsWith("}}", i) || startsWith("{{", i) || startsWith("[[", i)) {
                    break;
                }
            }
            return "";
        }

        private InternalReference internalReference() throws GrammarException {
            int start = pos;
            pos += 2;
            Stop segmentEnd = p -> startsWith("|", p) || startsWith("]]", p);
            List<Element> target = inline(segmentEnd);
            List<List<Element>> segments = new ArrayList<>();
            while (startsWith("|", pos)) {
                pos++;
                segments.add(inline(segmentEnd));
            }
            if (!startsWith("]]", pos)) {
                throw fail("|", "]]");
            }
            pos += 2;
            List<Element> caption = segments.isEmpty() ? new ArrayList<>() : segments.remove(segments.size() - 1);
            return new InternalReference(index.charSpan(start, pos), target, segments, caption);
        }

        private ExternalReference externalReference() throws GrammarException {
            int start = pos;
            pos++;
            int targetStart = pos;
            while (pos < len && !Character.isWhitespace(src.charAt(pos)) && src.charAt(pos) != ']') {
                pos++;
            }
            String target = src.substring(targetStart, pos);
            pos = skipBlanks(pos);
            List<Element> caption = inline(p -> startsWith("]", p) || atNewline(p));
            if (!startsWith("]", pos)) {
                throw fail("]");
            }
            pos++;
            return new ExternalReference(index.charSpan(start, pos), target, caption);
        }

        private Formatted formatted(Stop outer) throws GrammarException {
            int start = pos;
            boolean bold = startsWith("'''", pos);
            int width = bold ? 3 : 2;
            pos += width;
            Stop own = bold ? p -> startsWith("'''", p) : this::closesItalic;
            // unclosed formatting ends with the line
            List<Element> content = inline(p -> own.at(p) || atNewline(p) || outer.at(p));
            if (own.at(pos)) {
                pos += width;
            }
            return new Formatted(index.charSpan(start, pos), bold ? MarkupType.BOLD : MarkupType.ITALIC, content);
        }

        // "''" closes italic, unless it opens bold; "'''''" closes italic first, then bold
        private boolean closesItalic(int p) {
            return startsWith("''", p) && (!startsWith("'''", p) || startsWith("'''''", p));
        }

        private Element tag() throws GrammarException {
            Matcher m = OPEN_TAG.matcher(src).region(pos, len);
            if (!m.lookingAt()) {
                return null;
            }
            String name = m.group(1).toLowerCase(Locale.ROOT);
            if (!"gallery".equals(name) && !MarkupType.isMarkupTag(name) && !HTML_TAGS.contains(name)) {
                return null;
            }
            int start = pos;
            List<TagAttribute> attributes = AttributeParser.parse(src, m.start(2), m.end(2), index);
            boolean selfClosing = !m.group(3).isEmpty() || VOID_TAGS.contains(name);
            pos = m.end();

            if ("gallery".equals(name)) {
                if (selfClosing) {
                    return new Gallery(index.charSpan(start, pos), attributes, new ArrayList<>());
                }
                return gallery(start, attributes);
            }
            if (selfClosing) {
                return markupOrTag(name, start, attributes, new ArrayList<>());
            }

            String close = "</" + name + ">";
            List<Element> content;
            if (RAW_TAGS.contains(name)) {
                int end = indexOfIgnoreCase(close, pos);
                if (end < 0) {
                    pos = len;
                    throw fail(close);
                }
                content = new ArrayList<>();
                if (end > pos) {
                    content.add(new Text(index.charSpan(pos, end), src.substring(pos, end)));
                }
                pos = end;
            } else {
                content = inline(p -> startsWithIgnoreCase(close, p));
                if (!startsWithIgnoreCase(close, pos)) {
                    throw fail(close);
                }
            }
            pos += close.length();
            return markupOrTag(name, start, attributes, content);
        }

        private Element markupOrTag(String name, int start, List<TagAttribute> attributes, List<Element> content) {
            if (MarkupType.isMarkupTag(name)) {
                return new Formatted(index.charSpan(start, pos), MarkupType.byTagName(name), content);
            }
            return new HtmlTag(index.charSpan(start, pos), name, attributes, content);
        }

        private Gallery gallery(int start, List<TagAttribute> attributes) throws GrammarException {
            String close = "</gallery>";
            Stop segmentEnd = p -> startsWith("|", p) || atNewline(p) || startsWithIgnoreCase(close, p);
            List<Element> content = new ArrayList<>();
            while (true) {
                if (pos >= len) {
                    throw fail(close);
                }
                if (startsWithIgnoreCase(close, pos)) {
                    break;
                }
                if (atNewline(pos)) {
                    pos++;
                    continue;
                }
                int lineStart = skipBlanks(pos);
                if (lineStart >= len || atNewline(lineStart) || startsWithIgnoreCase(close, lineStart)) {
                    pos = lineStart;
                    continue;
                }
                pos = lineStart;
                List<Element> target = inline(segmentEnd);
                List<List<Element>> segments = new ArrayList<>();
                while (startsWith("|", pos)) {
                    pos++;
                    segments.add(inline(segmentEnd));
                }
                List<Element> caption = segments.isEmpty() ? new ArrayList<>() : segments.remove(segments.size() - 1);
                content.add(new InternalReference(index.charSpan(lineStart, pos), target, segments, caption));
            }
            pos += close.length();
            return new Gallery(index.charSpan(start, pos), attributes, content);
        }

        // ---- helpers ----

        private boolean isUrl(int p) {
            for (String prefix : URL_PREFIXES) {
                if (src.regionMatches(true, p, prefix, 0, prefix.length())) {
                    return true;
                }
            }
            return false;
        }

        private boolean atNewline(int p) {
            return p < len && src.charAt(p) == '\n';
        }

        private boolean startsWith(String token, int p) {
            return src.startsWith(token, p);
        }

        private boolean startsWithIgnoreCase(String token, int p) {
            return src.regionMatches(true, p, token, 0, token.length());
        }

        private int indexOfIgnoreCase(String token, int from) {
            for (int i = from; i + token.length() <= len; i++) {
                if (startsWithIgnoreCase(token, i)) {
                    return i;
                }
            }
            return -1;
        }

        private int lineEnd(int p) {
            int newline = src.indexOf('\n', p);
            return newline < 0 ? len : newline;
        }

        private int skipBlanks(int p) {
            while (p < len && (src.charAt(p) == ' ' || src.charAt(p) == '\t')) {
                p++;
            }
            return p;
        }

        private boolean isBlank(int from, int to) {
            return src.substring(from, to).isBlank();
        }

        private void newline() {
            if (atNewline(pos)) {
                pos++;
            }
        }

        // after a block that may be followed by text on its last line
        private void skipBlankRest() {
            int eol = lineEnd(pos);
            if (isBlank(pos, eol)) {
                pos = eol;
                newline();
            }
        }

        private GrammarException fail(String... expected) {
            int offset = index.byteOffset(pos);
            return new GrammarException(offset, index.position(offset).line, new ArrayList<>(Arrays.asList(expected)));
        }
    }
}
