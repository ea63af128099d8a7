package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A list of {@link ListItem}s. Serialized with type tag {@code list}.
 */
public class ListElement extends Element {
    public List<Element> content = new ArrayList<>();

    public ListElement() {
    }

    public ListElement(Span position, List<Element> content) {
        super(position);
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitList(this);
    }

    @Override
    public String variantName() {
        return "List";
    }
}
