package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A template transclusion. {@code content} holds the {@link TemplateArgument}s.
 */
public class Template extends Element {
    public List<Element> name = new ArrayList<>();
    public List<Element> content = new ArrayList<>();

    public Template() {
    }

    public Template(Span position, List<Element> name, List<Element> content) {
        super(position);
        this.name = name;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitTemplate(this);
    }

    @Override
    public String variantName() {
        return "Template";
    }
}
