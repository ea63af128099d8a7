package org.dxworks.wikiframe.parser;

import org.dxworks.wikiframe.model.Element;
import org.dxworks.wikiframe.source.SourceIndex;

/**
 * Turns wikitext into the raw, unfolded document tree.
 */
@FunctionalInterface
public interface WikitextGrammar {
    Element parse(String source, SourceIndex index) throws GrammarException;
}
