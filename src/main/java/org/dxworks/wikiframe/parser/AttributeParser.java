package org.dxworks.wikiframe.parser;

import org.dxworks.wikiframe.model.TagAttribute;
import org.dxworks.wikiframe.source.SourceIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code key="value"} style attribute lists of html tags, tables, rows and cells.
 */
final class AttributeParser {

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "([^\\s=\"'<>/]+)(?:\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s\"'>]+)))?");

    private AttributeParser() {
        // utility class
    }

    /** Attributes found in {@code source[from, to)}; values are unquoted, keys without a value get "". */
    static List<TagAttribute> parse(String source, int from, int to, SourceIndex index) {
        List<TagAttribute> result = new ArrayList<>();
        if (from >= to) {
            return result;
        }
        Matcher m = ATTRIBUTE.matcher(source).region(from, to);
        while (m.find()) {
            String value;
            if (m.group(2) != null) {
                value = m.group(2);
            } else if (m.group(3) != null) {
                value = m.group(3);
            } else if (m.group(4) != null) {
                value = m.group(4);
            } else {
                value = "";
            }
            result.add(new TagAttribute(index.charSpan(m.start(), m.end()), m.group(1), value));
        }
        return result;
    }
}
