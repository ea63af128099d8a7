package org.dxworks.wikiframe.model;

public class Comment extends Element {
    public String text;

    public Comment() {
    }

    public Comment(Span position, String text) {
        super(position);
        this.text = text;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitComment(this);
    }

    @Override
    public String variantName() {
        return "Comment";
    }
}
