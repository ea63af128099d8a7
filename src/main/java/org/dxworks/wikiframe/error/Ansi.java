package org.dxworks.wikiframe.error;

/**
 * Minimal ANSI styling for terminal diagnostics. A disabled instance returns text unchanged, so
 * the same rendering code produces plain output when color is unsupported.
 */
public final class Ansi {
    private static final String ESC = "\u001B[";
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "1";
    private static final String RED = "31";
    private static final String BLUE = "34";

    private static final Ansi PLAIN = new Ansi(false);
    private static final Ansi COLORED = new Ansi(true);

    private final boolean enabled;

    private Ansi(boolean enabled) {
        this.enabled = enabled;
    }

    public static Ansi plain() {
        return PLAIN;
    }

    public static Ansi colored() {
        return COLORED;
    }

    /** Colored when attached to a terminal, unless {@code NO_COLOR} is set or the terminal is dumb. */
    public static Ansi detect() {
        boolean terminal = System.console() != null;
        boolean noColor = System.getenv("NO_COLOR") != null;
        boolean dumb = "dumb".equals(System.getenv("TERM"));
        return terminal && !noColor && !dumb ? COLORED : PLAIN;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String red(String text) {
        return style(text, RED);
    }

    public String redBold(String text) {
        return style(text, BOLD, RED);
    }

    public String blueBold(String text) {
        return style(text, BOLD, BLUE);
    }

    private String style(String text, String... codes) {
        if (!enabled) {
            return text;
        }
        return ESC + String.join(";", codes) + "m" + text + RESET;
    }
}
