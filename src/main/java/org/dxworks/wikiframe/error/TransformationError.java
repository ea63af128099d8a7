package org.dxworks.wikiframe.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.wikiframe.model.Element;
import org.dxworks.wikiframe.model.Span;

/**
 * Error raised by a tree transformation. {@code tree} is a copy of the offending subtree.
 */
public class TransformationError extends MWError {
    public String cause;
    public Span position = Span.any();
    @JsonProperty("transformation_name")
    public String transformationName;
    public Element tree;

    public TransformationError() {
    }

    public TransformationError(String cause, Span position, String transformationName, Element tree) {
        this.cause = cause;
        this.position = position;
        this.transformationName = transformationName;
        this.tree = tree;
    }

    @Override
    public String render(Ansi ansi, int width) {
        String message = String.format("ERROR applying transformation \"%s\" to Element at %d:%d to %d:%d: %s",
                transformationName,
                position.start.line,
                position.start.col,
                position.end.line,
                position.end.col,
                cause);
        return ansi.redBold(message) + "\n";
    }

    @Override
    public String describe() {
        return cause;
    }
}
