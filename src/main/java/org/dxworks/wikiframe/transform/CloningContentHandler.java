package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.Element;

import java.util.List;

@FunctionalInterface
public interface CloningContentHandler<S> {
    List<Element> handle(CloningTransformation<S> transformation, List<Element> content,
                         List<Element> path, S settings) throws TransformationException;
}
