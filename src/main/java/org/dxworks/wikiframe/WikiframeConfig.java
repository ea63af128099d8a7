package org.dxworks.wikiframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.wikiframe.error.Ansi;
import org.dxworks.wikiframe.error.ParseError;
import org.dxworks.wikiframe.error.TextUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class WikiframeConfig {

    private static final Logger LOG = LogManager.getLogger(WikiframeConfig.class);

    private static final String CONFIG_FILE_NAME = "wikiframe-config.yml";
    private static final int DEFAULT_TERMINAL_WIDTH = TextUtils.TERMINAL_WIDTH;
    private static final int DEFAULT_ERROR_CONTEXT_LINES = ParseError.ERROR_CONTEXT_LINES;
    private static final ColorMode DEFAULT_COLOR = ColorMode.AUTO;

    public enum ColorMode {
        AUTO, ALWAYS, NEVER;

        public Ansi ansi() {
            switch (this) {
                case ALWAYS:
                    return Ansi.colored();
                case NEVER:
                    return Ansi.plain();
                default:
                    return Ansi.detect();
            }
        }
    }

    private final int terminalWidth;
    private final int errorContextLines;
    private final ColorMode color;

    private WikiframeConfig(int terminalWidth, int errorContextLines, ColorMode color) {
        this.terminalWidth = terminalWidth;
        this.errorContextLines = errorContextLines;
        this.color = color;
    }

    public int getTerminalWidth() {
        return terminalWidth;
    }

    public int getErrorContextLines() {
        return errorContextLines;
    }

    public ColorMode getColor() {
        return color;
    }

    public static WikiframeConfig defaults() {
        return new WikiframeConfig(DEFAULT_TERMINAL_WIDTH, DEFAULT_ERROR_CONTEXT_LINES, DEFAULT_COLOR);
    }

    public static WikiframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static WikiframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int terminalWidth = yamlConfig.terminalWidth != null ? yamlConfig.terminalWidth : DEFAULT_TERMINAL_WIDTH;
                int contextLines = yamlConfig.errorContextLines != null
                        ? yamlConfig.errorContextLines
                        : DEFAULT_ERROR_CONTEXT_LINES;
                return with(terminalWidth, contextLines, colorMode(yamlConfig.color));
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static WikiframeConfig with(int terminalWidth, int errorContextLines, ColorMode color) {
        int effectiveWidth = terminalWidth > 0 ? terminalWidth : DEFAULT_TERMINAL_WIDTH;
        int effectiveContextLines = errorContextLines >= 0 ? errorContextLines : DEFAULT_ERROR_CONTEXT_LINES;
        return new WikiframeConfig(effectiveWidth, effectiveContextLines, color != null ? color : DEFAULT_COLOR);
    }

    private static ColorMode colorMode(String value) {
        if (value == null) {
            return DEFAULT_COLOR;
        }
        try {
            return ColorMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown color mode '{}', expected auto, always or never", value);
            return DEFAULT_COLOR;
        }
    }

    private static class YamlConfig {
        public Integer terminalWidth;
        public Integer errorContextLines;
        public String color;
    }
}
