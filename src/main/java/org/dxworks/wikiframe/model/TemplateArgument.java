package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A template argument. Anonymous arguments have an empty name until they are numbered.
 */
public class TemplateArgument extends Element {
    public String name;
    public List<Element> value = new ArrayList<>();

    public TemplateArgument() {
    }

    public TemplateArgument(Span position, String name, List<Element> value) {
        super(position);
        this.name = name;
        this.value = value;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitTemplateArgument(this);
    }

    @Override
    public String variantName() {
        return "TemplateArgument";
    }
}
