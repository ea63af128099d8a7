package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TextUtils;
import org.dxworks.wikiframe.error.TransformationError;
import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The structural passes applied to every parsed document, see {@link TransformationPipeline}
 * for their order.
 */
public final class GeneralTransformations {

    public static final String FOLD_HEADINGS = "fold_headings_transformation";
    public static final String FOLD_LISTS = "fold_lists_transformation";
    public static final String WHITESPACE_PARAGRAPHS_TO_EMPTY = "whitespace_paragraphs_to_empty";
    public static final String COLLAPSE_PARAGRAPHS = "collapse_paragraphs";
    public static final String COLLAPSE_CONSECUTIVE_TEXT = "collapse_consecutive_text";
    public static final String ENUMERATE_ANON_ARGS = "enumerate_anon_args";

    private GeneralTransformations() {
        // utility class
    }

    // ---- fold_headings ----

    /**
     * Moves flat headings into a hierarchical structure based on their depth.
     */
    public static Element foldHeadings(Element root, GeneralSettings settings) throws TransformationException {
        return Recursion.recurseWith(GeneralTransformations::foldHeadings, root, settings,
                GeneralTransformations::moveDeeperHeadings);
    }

    private static List<Element> moveDeeperHeadings(Transformation<GeneralSettings> trans,
                                                    List<Element> rootContent,
                                                    GeneralSettings settings) throws TransformationException {
        List<Element> result = new ArrayList<>();
        int currentHeadingIndex = 0;
        // every heading deeper than this is moved into the current reference heading
        int currentDepth = Integer.MAX_VALUE;

        for (Element child : rootContent) {
            if (child instanceof Heading) {
                Heading heading = (Heading) child;
                if (heading.depth > currentDepth) {
                    Heading reference = (Heading) result.get(currentHeadingIndex);
                    reference.content = append(reference.content, heading);
                } else {
                    currentHeadingIndex = result.size();
                    currentDepth = heading.depth;
                    result.add(heading);
                }
            } else {
                if (currentDepth < Integer.MAX_VALUE) {
                    throw error("a non-heading element was found after a heading. This should not happen.",
                            child, FOLD_HEADINGS);
                }
                result.add(child);
            }
        }

        return Recursion.applyAll(trans, result, settings);
    }

    // ---- fold_lists ----

    /**
     * Moves list items of higher depth into separate sub-lists. A list starting with a deeper
     * item still gets folded: a placeholder item at the lowest depth hosts the sub-list, although
     * such input should later be reported by a linter.
     */
    public static Element foldLists(Element root, GeneralSettings settings) throws TransformationException {
        if (root instanceof ListElement) {
            return Recursion.recurseWith(GeneralTransformations::foldLists, root, settings,
                    GeneralTransformations::moveDeeperItems);
        }
        return Recursion.recurseWith(GeneralTransformations::foldLists, root, settings,
                GeneralTransformations::rejectStrayItems);
    }

    private static List<Element> moveDeeperItems(Transformation<GeneralSettings> trans,
                                                 List<Element> rootContent,
                                                 GeneralSettings settings) throws TransformationException {
        int lowestDepth = Integer.MAX_VALUE;
        for (Element child : rootContent) {
            if (!(child instanceof ListItem)) {
                throw error("A list should not contain non-listitems.", child, FOLD_LISTS);
            }
            lowestDepth = Math.min(lowestDepth, ((ListItem) child).depth);
        }

        List<Element> result = new ArrayList<>();
        // a new sublist is started by the first deeper item after a sibling
        boolean createSublist = true;

        for (Element child : rootContent) {
            ListItem item = (ListItem) child;
            if (item.depth <= lowestDepth) {
                result.add(item);
                createSublist = true;
                continue;
            }

            if (createSublist) {
                createSublist = false;
                if (result.isEmpty()) {
                    result.add(new ListItem(item.position.copy(), lowestDepth, item.kind, new ArrayList<>()));
                }
                ListItem last = (ListItem) result.get(result.size() - 1);
                last.content = append(last.content, new ListElement(item.position.copy(), new ArrayList<>()));
            }

            ListItem last = (ListItem) result.get(result.size() - 1);
            Element sublist = last.content.isEmpty() ? null : last.content.get(last.content.size() - 1);
            if (!(sublist instanceof ListElement)) {
                throw error("sublist was not instantiated properly.", item, FOLD_LISTS);
            }
            ListElement list = (ListElement) sublist;
            list.content = append(list.content, item);
        }

        return Recursion.applyAll(trans, result, settings);
    }

    private static List<Element> rejectStrayItems(Transformation<GeneralSettings> trans,
                                                  List<Element> rootContent,
                                                  GeneralSettings settings) throws TransformationException {
        for (Element child : rootContent) {
            if (child instanceof ListItem) {
                throw error("a list item was found outside of a list.", child, FOLD_LISTS);
            }
        }
        return Recursion.applyAll(trans, rootContent, settings);
    }

    // ---- whitespace_paragraphs_to_empty ----

    /**
     * Empties paragraphs that consist of whitespace text only.
     */
    public static Element whitespaceParagraphsToEmpty(Element root, GeneralSettings settings)
            throws TransformationException {
        if (root instanceof Paragraph) {
            Paragraph paragraph = (Paragraph) root;
            boolean onlyWhitespace = true;
            for (Element child : paragraph.content) {
                if (!(child instanceof Text) || !TextUtils.isWhitespace(((Text) child).text)) {
                    onlyWhitespace = false;
                    break;
                }
            }
            if (onlyWhitespace) {
                paragraph.content = new ArrayList<>();
            }
        }
        return Recursion.recurse(GeneralTransformations::whitespaceParagraphsToEmpty, root, settings);
    }

    // ---- collapse_paragraphs ----

    /**
     * Merges consecutive paragraphs into one, unless they are separated by an empty paragraph.
     * Empty paragraphs are dropped.
     */
    public static Element collapseParagraphs(Element root, GeneralSettings settings) throws TransformationException {
        return Recursion.recurseWith(GeneralTransformations::collapseParagraphs, root, settings,
                GeneralTransformations::squashEmptyParagraphs);
    }

    private static List<Element> squashEmptyParagraphs(Transformation<GeneralSettings> trans,
                                                       List<Element> rootContent,
                                                       GeneralSettings settings) throws TransformationException {
        List<Element> result = new ArrayList<>();
        boolean lastEmpty = false;

        for (Element child : rootContent) {
            if (child instanceof Paragraph) {
                Paragraph paragraph = (Paragraph) child;
                if (paragraph.content.isEmpty()) {
                    lastEmpty = true;
                    continue;
                }

                Element previous = result.isEmpty() ? null : result.get(result.size() - 1);
                if (!lastEmpty && previous instanceof Paragraph) {
                    Paragraph last = (Paragraph) previous;
                    // the line break between the paragraphs
                    last.content = append(last.content, new Text(last.position.copy(), " "));
                    last.content.addAll(paragraph.content);
                    last.position.end = paragraph.position.end;
                    continue;
                }
            }
            result.add(child);
            lastEmpty = false;
        }

        return Recursion.applyAll(trans, result, settings);
    }

    // ---- collapse_consecutive_text ----

    /**
     * Merges adjacent text nodes. Whitespace-only text contributes a single space.
     */
    public static Element collapseConsecutiveText(Element root, GeneralSettings settings)
            throws TransformationException {
        return Recursion.recurseWith(GeneralTransformations::collapseConsecutiveText, root, settings,
                GeneralTransformations::squashText);
    }

    private static List<Element> squashText(Transformation<GeneralSettings> trans,
                                            List<Element> rootContent,
                                            GeneralSettings settings) throws TransformationException {
        List<Element> result = new ArrayList<>();

        for (Element child : rootContent) {
            Element previous = result.isEmpty() ? null : result.get(result.size() - 1);
            if (child instanceof Text && previous instanceof Text) {
                Text text = (Text) child;
                Text last = (Text) previous;
                last.text = TextUtils.isWhitespace(text.text) ? last.text + " " : last.text + text.text;
                last.position.end = text.position.end;
                continue;
            }
            result.add(child);
        }

        return Recursion.applyAll(trans, result, settings);
    }

    // ---- enumerate_anon_args ----

    /**
     * Names anonymous template arguments "1", "2", ... in order of appearance.
     */
    public static Element enumerateAnonArgs(Element root, GeneralSettings settings) throws TransformationException {
        if (root instanceof Template) {
            int counter = 1;
            for (Element child : ((Template) root).content) {
                if (child instanceof TemplateArgument) {
                    TemplateArgument argument = (TemplateArgument) child;
                    if (argument.name == null || argument.name.isBlank()) {
                        argument.name = Integer.toString(counter);
                        counter++;
                    }
                }
            }
        }
        return Recursion.recurse(GeneralTransformations::enumerateAnonArgs, root, settings);
    }

    // appends in place unless the list cannot grow
    private static List<Element> append(List<Element> content, Element element) {
        List<Element> result = content instanceof ArrayList ? content : new ArrayList<>(content);
        result.add(element);
        return result;
    }

    private static TransformationException error(String cause, Element offending, String transformationName) {
        return new TransformationException(new TransformationError(
                cause, offending.position.copy(), transformationName, Recursion.deepCopy(offending)));
    }
}
