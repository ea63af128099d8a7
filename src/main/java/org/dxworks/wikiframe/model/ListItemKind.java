package org.dxworks.wikiframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ListItemKind {
    UNORDERED("unordered", '*'),
    DEFINITION("definition", ':'),
    DEFINITION_TERM("definitionterm", ';'),
    ORDERED("ordered", '#');

    private final String name;
    private final char marker;

    ListItemKind(String name, char marker) {
        this.name = name;
        this.marker = marker;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public char getMarker() {
        return marker;
    }

    @JsonCreator
    public static ListItemKind fromName(String name) {
        for (ListItemKind kind : values()) {
            if (kind.name.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown list item kind: " + name);
    }

    public static ListItemKind byMarker(char marker) {
        for (ListItemKind kind : values()) {
            if (kind.marker == marker) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Not a list item marker: " + marker);
    }
}
