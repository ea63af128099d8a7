package org.dxworks.wikiframe.error;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Unified error of the parser: either the grammar could not continue, or a transformation found
 * a structural problem in the tree. Serialized as a single-key object naming the kind.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ParseError.class, name = "parseerror"),
        @JsonSubTypes.Type(value = TransformationError.class, name = "transformationerror")
})
public abstract class MWError {

    /** Human-readable report, styled with {@code ansi}; lines are shortened to {@code width}. */
    public abstract String render(Ansi ansi, int width);

    /** One-line description, used as exception message. */
    public abstract String describe();
}
