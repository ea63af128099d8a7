package org.dxworks.wikiframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A point in the source document. {@code offset} is a UTF-8 byte offset, {@code line} and
 * {@code col} are 1-based, with the column counted in Unicode scalar values.
 *
 * <p>The all-zero position is a wildcard used by fixtures that do not care about coordinates.
 * {@link #equals(Object)} is strict; use {@link #equalOrDontCare(Position, Position)} where the
 * wildcard should match anything.</p>
 */
public final class Position {
    private static final Position ANY = new Position(0, 0, 0);

    public final int offset;
    public final int line;
    public final int col;

    @JsonCreator
    public Position(@JsonProperty("offset") int offset,
                    @JsonProperty("line") int line,
                    @JsonProperty("col") int col) {
        this.offset = offset;
        this.line = line;
        this.col = col;
    }

    public static Position any() {
        return ANY;
    }

    @JsonIgnore
    public boolean isWildcard() {
        return offset == 0 && line == 0 && col == 0;
    }

    public static boolean equalOrDontCare(Position a, Position b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.isWildcard() || b.isWildcard() || a.equals(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return offset == other.offset && line == other.line && col == other.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, line, col);
    }

    @Override
    public String toString() {
        return line + ":" + col + "@" + offset;
    }
}
