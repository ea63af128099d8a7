package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code <gallery>} block; its content holds one {@link InternalReference} per image line.
 */
public class Gallery extends Element {
    public List<TagAttribute> attributes = new ArrayList<>();
    public List<Element> content = new ArrayList<>();

    public Gallery() {
    }

    public Gallery(Span position, List<TagAttribute> attributes, List<Element> content) {
        super(position);
        this.attributes = attributes;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitGallery(this);
    }

    @Override
    public String variantName() {
        return "Gallery";
    }
}
