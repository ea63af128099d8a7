package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

public class ExternalReference extends Element {
    public String target;
    public List<Element> caption = new ArrayList<>();

    public ExternalReference() {
    }

    public ExternalReference(Span position, String target, List<Element> caption) {
        super(position);
        this.target = target;
        this.caption = caption;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitExternalReference(this);
    }

    @Override
    public String variantName() {
        return "ExternalReference";
    }
}
