package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.Element;

import java.util.List;

/**
 * A transformation that reads its input and builds an independent output tree. {@code path}
 * holds the ancestors of {@code root}, outermost first; it must not be modified.
 */
@FunctionalInterface
public interface CloningTransformation<S> {
    Element apply(Element root, List<Element> path, S settings) throws TransformationException;
}
