package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An html tag that has no dedicated markup type.
 */
public class HtmlTag extends Element {
    public String name;
    public List<TagAttribute> attributes = new ArrayList<>();
    public List<Element> content = new ArrayList<>();

    public HtmlTag() {
    }

    public HtmlTag(Span position, String name, List<TagAttribute> attributes, List<Element> content) {
        super(position);
        this.name = name;
        this.attributes = attributes;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitHtmlTag(this);
    }

    @Override
    public String variantName() {
        return "HtmlTag";
    }
}
