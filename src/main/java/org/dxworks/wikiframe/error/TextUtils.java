package org.dxworks.wikiframe.error;

/**
 * String helpers shared by the diagnostics and the transformations.
 */
public final class TextUtils {

    /** Display width used when no configuration overrides it. */
    public static final int TERMINAL_WIDTH = 80;

    private static final String FILLER = " .. ";

    private TextUtils() {
        // utility class
    }

    /** True if the string is empty or consists of whitespace only. */
    public static boolean isWhitespace(String input) {
        int i = 0;
        while (i < input.length()) {
            int codePoint = input.codePointAt(i);
            if (!isWhitespace(codePoint)) {
                return false;
            }
            i += Character.charCount(codePoint);
        }
        return true;
    }

    // the Unicode White_Space property: tab to carriage return, NEL, and the space separators
    public static boolean isWhitespace(int codePoint) {
        return (codePoint >= 0x09 && codePoint <= 0x0D) || codePoint == 0x85 || Character.isSpaceChar(codePoint);
    }

    /**
     * Shortens a line to fit into {@code width} columns by eliding its middle.
     */
    public static String shorten(String input, int width) {
        int length = input.codePointCount(0, input.length());
        if (length < width) {
            return input;
        }

        int half = (width - FILLER.length()) / 2;
        StringBuilder result = new StringBuilder();
        int index = 0;
        int i = 0;
        while (i < input.length()) {
            int codePoint = input.codePointAt(i);
            if (index < half) {
                result.appendCodePoint(codePoint);
            }
            if (index == half) {
                result.append(FILLER);
            }
            if (index >= length - half) {
                result.appendCodePoint(codePoint);
            }
            i += Character.charCount(codePoint);
            index++;
        }
        return result.toString();
    }

    /** Quotes and escapes a string so that whitespace becomes visible. */
    public static String quote(String input) {
        StringBuilder result = new StringBuilder("\"");
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '\n':
                    result.append("\\n");
                    break;
                case '\r':
                    result.append("\\r");
                    break;
                case '\t':
                    result.append("\\t");
                    break;
                case '"':
                    result.append("\\\"");
                    break;
                case '\\':
                    result.append("\\\\");
                    break;
                default:
                    result.append(c);
            }
        }
        return result.append('"').toString();
    }
}
