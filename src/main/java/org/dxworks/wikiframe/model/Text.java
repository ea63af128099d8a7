package org.dxworks.wikiframe.model;

public class Text extends Element {
    public String text;

    public Text() {
    }

    public Text(Span position, String text) {
        super(position);
        this.text = text;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitText(this);
    }

    @Override
    public String variantName() {
        return "Text";
    }
}
