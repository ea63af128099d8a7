package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.Element;

import java.util.List;

/**
 * Rebuilds one child list of a node during recursion. The default is
 * {@link Recursion#applyAll}; passes that restructure a level supply their own handler and
 * finish by handing the produced list to {@code applyAll}.
 */
@FunctionalInterface
public interface ContentHandler<S> {
    List<Element> handle(Transformation<S> transformation, List<Element> content, S settings)
            throws TransformationException;
}
