package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

public class Formatted extends Element {
    public MarkupType markup;
    public List<Element> content = new ArrayList<>();

    public Formatted() {
    }

    public Formatted(Span position, MarkupType markup, List<Element> content) {
        super(position);
        this.markup = markup;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitFormatted(this);
    }

    @Override
    public String variantName() {
        return "Formatted";
    }
}
