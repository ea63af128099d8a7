package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed document.
 */
public class Document extends Element {
    public List<Element> content = new ArrayList<>();

    public Document() {
    }

    public Document(Span position, List<Element> content) {
        super(position);
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitDocument(this);
    }

    @Override
    public String variantName() {
        return "Document";
    }
}
