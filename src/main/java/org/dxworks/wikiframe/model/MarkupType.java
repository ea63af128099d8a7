package org.dxworks.wikiframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Types of markup a section of text may have.
 */
public enum MarkupType {
    NO_WIKI("nowiki"),
    BOLD("bold"),
    ITALIC("italic"),
    MATH("math"),
    STRIKE_THROUGH("strikethrough"),
    UNDERLINE("underline"),
    CODE("code"),
    BLOCKQUOTE("blockquote"),
    PREFORMATTED("preformatted");

    private final String name;

    MarkupType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static MarkupType fromName(String name) {
        for (MarkupType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown markup type: " + name);
    }

    /**
     * Maps an html tag name to its markup type. The table is fixed, so a name outside of it is a
     * bug in the caller rather than bad input.
     */
    public static MarkupType byTagName(String tag) {
        switch (tag.toLowerCase(Locale.ROOT)) {
            case "math":
                return MATH;
            case "del":
            case "s":
                return STRIKE_THROUGH;
            case "nowiki":
                return NO_WIKI;
            case "u":
            case "ins":
                return UNDERLINE;
            case "code":
                return CODE;
            case "blockquote":
                return BLOCKQUOTE;
            case "pre":
                return PREFORMATTED;
            default:
                throw new IllegalArgumentException("markup type lookup not implemented for " + tag + "!");
        }
    }

    public static boolean isMarkupTag(String tag) {
        switch (tag.toLowerCase(Locale.ROOT)) {
            case "math":
            case "del":
            case "s":
            case "nowiki":
            case "u":
            case "ins":
            case "code":
            case "blockquote":
            case "pre":
                return true;
            default:
                return false;
        }
    }
}
