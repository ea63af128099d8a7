package org.dxworks.wikiframe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.wikiframe.error.ParseError;
import org.dxworks.wikiframe.error.WikiframeException;
import org.dxworks.wikiframe.model.Element;
import org.dxworks.wikiframe.parser.GrammarException;
import org.dxworks.wikiframe.parser.WikitextGrammar;
import org.dxworks.wikiframe.parser.WikitextParser;
import org.dxworks.wikiframe.source.SourceIndex;
import org.dxworks.wikiframe.transform.TransformationPipeline;

/**
 * Entry point of the library: parses wikitext and normalizes the resulting tree.
 */
public final class Wikiframe {

    private static final Logger LOG = LogManager.getLogger(Wikiframe.class);
    private static final WikitextGrammar GRAMMAR = new WikitextParser();

    private Wikiframe() {
    }

    public static Element parse(String text) throws WikiframeException {
        return parse(text, GRAMMAR, ParseError.ERROR_CONTEXT_LINES);
    }

    public static Element parse(String text, WikiframeConfig config) throws WikiframeException {
        return parse(text, GRAMMAR, config.getErrorContextLines());
    }

    /**
     * Runs {@code grammar} over {@code text} and applies the transformation pipeline to its tree.
     *
     * @throws WikiframeException holding a {@link ParseError} when the grammar fails, or a
     *                            {@link org.dxworks.wikiframe.error.TransformationError} when a pass rejects the tree
     */
    public static Element parse(String text, WikitextGrammar grammar, int contextLines) throws WikiframeException {
        SourceIndex index = SourceIndex.of(text);
        Element raw;
        try {
            raw = grammar.parse(text, index);
        } catch (GrammarException e) {
            LOG.debug("Grammar failed at byte {} (line {}), expected {}", e.getOffset(), e.getLine(), e.getExpected());
            throw new WikiframeException(ParseError.from(e, text, contextLines));
        }
        return TransformationPipeline.run(raw);
    }
}
