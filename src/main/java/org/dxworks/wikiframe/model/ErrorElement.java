package org.dxworks.wikiframe.model;

/**
 * Marks a region of the document the grammar could only recover from.
 * Serialized with type tag {@code error}.
 */
public class ErrorElement extends Element {
    public String message;

    public ErrorElement() {
    }

    public ErrorElement(Span position, String message) {
        super(position);
        this.message = message;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitError(this);
    }

    @Override
    public String variantName() {
        return "Error";
    }
}
