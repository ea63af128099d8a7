package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A wiki link {@code [[target|option|...|caption]]}.
 */
public class InternalReference extends Element {
    public List<Element> target = new ArrayList<>();
    public List<List<Element>> options = new ArrayList<>();
    public List<Element> caption = new ArrayList<>();

    public InternalReference() {
    }

    public InternalReference(Span position, List<Element> target, List<List<Element>> options,
                             List<Element> caption) {
        super(position);
        this.target = target;
        this.options = options;
        this.caption = caption;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitInternalReference(this);
    }

    @Override
    public String variantName() {
        return "InternalReference";
    }
}
