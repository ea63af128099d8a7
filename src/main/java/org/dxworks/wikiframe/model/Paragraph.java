package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

public class Paragraph extends Element {
    public List<Element> content = new ArrayList<>();

    public Paragraph() {
    }

    public Paragraph(Span position, List<Element> content) {
        super(position);
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitParagraph(this);
    }

    @Override
    public String variantName() {
        return "Paragraph";
    }
}
