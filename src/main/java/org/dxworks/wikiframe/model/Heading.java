package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A section heading. Before heading folding the content holds the blocks following the heading
 * line; afterwards it also holds the deeper sub-headings.
 */
public class Heading extends Element {
    public int depth;
    public List<Element> caption = new ArrayList<>();
    public List<Element> content = new ArrayList<>();

    public Heading() {
    }

    public Heading(Span position, int depth, List<Element> caption, List<Element> content) {
        super(position);
        this.depth = depth;
        this.caption = caption;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitHeading(this);
    }

    @Override
    public String variantName() {
        return "Heading";
    }
}
