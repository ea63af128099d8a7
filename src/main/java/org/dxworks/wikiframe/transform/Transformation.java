package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.Element;

/**
 * A transformation that takes ownership of a subtree and returns it, possibly mutated or
 * replaced.
 *
 * @param <S> read-only settings threaded through every call
 */
@FunctionalInterface
public interface Transformation<S> {
    Element apply(Element root, S settings) throws TransformationException;
}
