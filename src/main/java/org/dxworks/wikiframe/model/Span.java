package org.dxworks.wikiframe.model;

import java.util.Objects;

/**
 * Start and end position of an element in the source document.
 */
public class Span {
    public Position start = Position.any();
    public Position end = Position.any();

    public Span() {
    }

    public Span(Position start, Position end) {
        this.start = start;
        this.end = end;
    }

    /** A span whose endpoints are both wildcards, used for synthetic nodes. */
    public static Span any() {
        return new Span();
    }

    public Span copy() {
        return new Span(start, end);
    }

    public static boolean equalOrDontCare(Span a, Span b) {
        if (a == null || b == null) {
            return a == b;
        }
        return Position.equalOrDontCare(a.start, b.start) && Position.equalOrDontCare(a.end, b.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span other = (Span) o;
        return Objects.equals(start, other.start) && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
