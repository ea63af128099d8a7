package org.dxworks.wikiframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.wikiframe.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.fail;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectMapper TREE_MAPPER = TreeMapper.json(true).getMapper();

    /**
     * Asserts that both trees have the same shape and values. An all-zero position on either side
     * matches any position.
     */
    public static void assertTreeMatches(Element expected, Element actual) {
        JsonNode expectedNode = TREE_MAPPER.valueToTree(expected);
        JsonNode actualNode = TREE_MAPPER.valueToTree(actual);
        String mismatch = mismatch(expectedNode, actualNode, "$");
        if (mismatch != null) {
            fail("trees differ at " + mismatch + "\nexpected: " + pretty(expectedNode) + "\nactual: " + pretty(actualNode));
        }
    }

    /** Serialized form of a tree, for comparing trees exactly. */
    public static String json(Object value) {
        try {
            return APPROVAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String mismatch(JsonNode expected, JsonNode actual, String path) {
        if (isWildcard(expected) || isWildcard(actual)) {
            return null;
        }
        if (expected.isObject()) {
            if (!actual.isObject()) {
                return path;
            }
            Set<String> names = new LinkedHashSet<>();
            expected.fieldNames().forEachRemaining(names::add);
            actual.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode e = expected.get(name);
                JsonNode a = actual.get(name);
                if (e == null || a == null) {
                    return path + "." + name;
                }
                String inner = mismatch(e, a, path + "." + name);
                if (inner != null) {
                    return inner;
                }
            }
            return null;
        }
        if (expected.isArray()) {
            if (!actual.isArray() || actual.size() != expected.size()) {
                return path;
            }
            for (int i = 0; i < expected.size(); i++) {
                String inner = mismatch(expected.get(i), actual.get(i), path + "[" + i + "]");
                if (inner != null) {
                    return inner;
                }
            }
            return null;
        }
        return expected.equals(actual) ? null : path;
    }

    private static boolean isWildcard(JsonNode node) {
        if (!node.isObject() || node.size() != 3) {
            return false;
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!Set.of("offset", "line", "col").contains(name) || node.get(name).asInt() != 0) {
                return false;
            }
        }
        return true;
    }

    private static String pretty(JsonNode node) {
        try {
            return APPROVAL_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    // ---- tree builders, all positions are wildcards ----

    public static List<Element> list(Element... elements) {
        return new ArrayList<>(Arrays.asList(elements));
    }

    public static Text text(String text) {
        return new Text(Span.any(), text);
    }

    public static Paragraph paragraph(Element... content) {
        return new Paragraph(Span.any(), list(content));
    }

    public static Heading heading(int depth, String caption, Element... content) {
        return new Heading(Span.any(), depth, list(text(caption)), list(content));
    }

    public static ListItem item(int depth, String text) {
        return new ListItem(Span.any(), depth, ListItemKind.UNORDERED, list(text(text)));
    }

    public static ListElement listOf(Element... items) {
        return new ListElement(Span.any(), list(items));
    }

    public static Document document(Element... content) {
        return new Document(Span.any(), list(content));
    }

    public static TemplateArgument argument(String name, String value) {
        return new TemplateArgument(Span.any(), name, list(text(value)));
    }

    public static Template template(String name, Element... arguments) {
        return new Template(Span.any(), list(text(name)), list(arguments));
    }
}
