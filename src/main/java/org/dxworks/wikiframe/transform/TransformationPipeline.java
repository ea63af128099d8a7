package org.dxworks.wikiframe.transform;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the general transformations over a raw document tree, in a fixed order. The first
 * failing pass aborts the pipeline.
 */
public final class TransformationPipeline {
    private static final Logger logger = LogManager.getLogger(TransformationPipeline.class);

    private static final Map<String, Transformation<GeneralSettings>> PASSES = new LinkedHashMap<>();

    static {
        PASSES.put(GeneralTransformations.FOLD_HEADINGS, GeneralTransformations::foldHeadings);
        PASSES.put(GeneralTransformations.FOLD_LISTS, GeneralTransformations::foldLists);
        PASSES.put(GeneralTransformations.WHITESPACE_PARAGRAPHS_TO_EMPTY, GeneralTransformations::whitespaceParagraphsToEmpty);
        PASSES.put(GeneralTransformations.COLLAPSE_PARAGRAPHS, GeneralTransformations::collapseParagraphs);
        PASSES.put(GeneralTransformations.COLLAPSE_CONSECUTIVE_TEXT, GeneralTransformations::collapseConsecutiveText);
        PASSES.put(GeneralTransformations.ENUMERATE_ANON_ARGS, GeneralTransformations::enumerateAnonArgs);
    }

    private TransformationPipeline() {
    }

    /** Names of the passes, in the order they run. */
    public static List<String> passNames() {
        return new ArrayList<>(PASSES.keySet());
    }

    public static Element run(Element root) throws TransformationException {
        return run(root, GeneralSettings.DEFAULT);
    }

    public static Element run(Element root, GeneralSettings settings) throws TransformationException {
        Element result = root;
        for (Map.Entry<String, Transformation<GeneralSettings>> pass : PASSES.entrySet()) {
            logger.debug("Applying {}", pass.getKey());
            try {
                result = pass.getValue().apply(result, settings);
            } catch (TransformationException e) {
                logger.debug("{} failed: {}", pass.getKey(), e.getMessage());
                throw e;
            }
        }
        return result;
    }

    /**
     * Runs cloning transformations one after another; the input tree is left untouched.
     */
    @SafeVarargs
    public static <S> Element runCloning(Element root, S settings, CloningTransformation<S>... passes)
            throws TransformationException {
        Element result = root;
        for (CloningTransformation<S> pass : passes) {
            result = pass.apply(result, new ArrayList<>(), settings);
        }
        return result;
    }
}
