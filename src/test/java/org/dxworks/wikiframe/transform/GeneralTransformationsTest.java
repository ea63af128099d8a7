package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.wikiframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class GeneralTransformationsTest {

    @Test
    void foldHeadings_nestsDeeperHeadings() throws TransformationException {
        Document doc = document(heading(1, "a"), heading(2, "b"), heading(2, "c"), heading(1, "d"), heading(3, "e"));

        Document folded = (Document) GeneralTransformations.foldHeadings(doc, GeneralSettings.DEFAULT);

        assertEquals(2, folded.content.size());
        Heading first = (Heading) folded.content.get(0);
        Heading second = (Heading) folded.content.get(1);
        assertEquals(1, first.depth);
        assertEquals(1, second.depth);
        assertEquals(2, first.content.size());
        assertEquals(2, ((Heading) first.content.get(0)).depth);
        assertEquals(2, ((Heading) first.content.get(1)).depth);
        assertEquals(1, second.content.size());
        assertEquals(3, ((Heading) second.content.get(0)).depth);
    }

    @Test
    void foldHeadings_keepsSectionBlocksBeforeSubheadings() throws TransformationException {
        Document doc = document(heading(1, "a", paragraph(text("intro"))), heading(2, "b", paragraph(text("body"))));

        Document folded = (Document) GeneralTransformations.foldHeadings(doc, GeneralSettings.DEFAULT);

        assertTreeMatches(document(
                heading(1, "a", paragraph(text("intro")), heading(2, "b", paragraph(text("body"))))), folded);
    }

    @Test
    void foldHeadings_rejectsBlockAfterHeading() {
        Document doc = document(heading(1, "a"), paragraph(text("stray")));

        TransformationException e = assertThrows(TransformationException.class,
                () -> GeneralTransformations.foldHeadings(doc, GeneralSettings.DEFAULT));

        assertEquals(GeneralTransformations.FOLD_HEADINGS, e.getTransformationName());
        assertEquals("a non-heading element was found after a heading. This should not happen.",
                e.getError().cause);
        assertTrue(e.getError().tree instanceof Paragraph);
    }

    @Test
    void foldLists_nestsDeeperItems() throws TransformationException {
        ListElement list = listOf(item(1, "a"), item(2, "b"), item(2, "c"), item(1, "d"));

        ListElement folded = (ListElement) GeneralTransformations.foldLists(list, GeneralSettings.DEFAULT);

        assertEquals(2, folded.content.size());
        ListItem first = (ListItem) folded.content.get(0);
        ListItem second = (ListItem) folded.content.get(1);
        assertEquals(1, first.depth);
        assertEquals(1, second.depth);
        assertEquals(2, first.content.size());
        ListElement sublist = (ListElement) first.content.get(1);
        assertEquals(2, sublist.content.size());
        assertEquals(2, ((ListItem) sublist.content.get(0)).depth);
        assertEquals(2, ((ListItem) sublist.content.get(1)).depth);
        assertTreeMatches(item(1, "d"), second);
    }

    @Test
    void foldLists_foldsRecursively() throws TransformationException {
        ListElement list = listOf(item(1, "a"), item(2, "b"), item(3, "c"));

        ListElement folded = (ListElement) GeneralTransformations.foldLists(list, GeneralSettings.DEFAULT);

        ListItem a = (ListItem) folded.content.get(0);
        ListItem b = (ListItem) ((ListElement) a.content.get(1)).content.get(0);
        ListElement inner = (ListElement) b.content.get(1);
        assertEquals(3, ((ListItem) inner.content.get(0)).depth);
    }

    @Test
    void foldLists_createsPlaceholderForLeadingDeeperItem() throws TransformationException {
        ListElement list = listOf(item(2, "deep"), item(1, "top"));

        ListElement folded = (ListElement) GeneralTransformations.foldLists(list, GeneralSettings.DEFAULT);

        assertEquals(2, folded.content.size());
        ListItem placeholder = (ListItem) folded.content.get(0);
        assertEquals(1, placeholder.depth);
        assertEquals(1, placeholder.content.size());
        assertTrue(placeholder.content.get(0) instanceof ListElement);
    }

    @Test
    void foldLists_rejectsNonItemsInList() {
        ListElement list = listOf(item(1, "a"), paragraph(text("x")));

        TransformationException e = assertThrows(TransformationException.class,
                () -> GeneralTransformations.foldLists(list, GeneralSettings.DEFAULT));

        assertEquals(GeneralTransformations.FOLD_LISTS, e.getTransformationName());
        assertEquals("A list should not contain non-listitems.", e.getError().cause);
    }

    @Test
    void foldLists_rejectsItemOutsideList() {
        Document doc = document(paragraph(text("x")), item(1, "stray"));

        TransformationException e = assertThrows(TransformationException.class,
                () -> GeneralTransformations.foldLists(doc, GeneralSettings.DEFAULT));

        assertEquals(GeneralTransformations.FOLD_LISTS, e.getTransformationName());
        assertEquals("a list item was found outside of a list.", e.getError().cause);
    }

    @Test
    void whitespaceParagraphsToEmpty_clearsOnlyWhitespaceParagraphs() throws TransformationException {
        Document doc = document(paragraph(text("  "), text("\t")), paragraph(text(" x ")));

        Document result = (Document) GeneralTransformations.whitespaceParagraphsToEmpty(doc, GeneralSettings.DEFAULT);

        assertTrue(((Paragraph) result.content.get(0)).content.isEmpty());
        assertEquals(1, ((Paragraph) result.content.get(1)).content.size());
    }

    @Test
    void collapseParagraphs_mergesAdjacentParagraphs() throws TransformationException {
        Document doc = document(paragraph(text("a")), paragraph(text("b")));

        Document result = (Document) GeneralTransformations.collapseParagraphs(doc, GeneralSettings.DEFAULT);

        assertTreeMatches(document(paragraph(text("a"), text(" "), text("b"))), result);
    }

    @Test
    void collapseParagraphs_extendsSpanOfMergedParagraph() throws TransformationException {
        Span firstSpan = new Span(new Position(0, 1, 1), new Position(2, 1, 3));
        Paragraph first = new Paragraph(firstSpan, list(new Text(firstSpan.copy(), "ab")));
        Span secondSpan = new Span(new Position(3, 2, 1), new Position(5, 2, 3));
        Paragraph second = new Paragraph(secondSpan, list(new Text(secondSpan.copy(), "cd")));

        Document result = (Document) GeneralTransformations.collapseParagraphs(document(first, second),
                GeneralSettings.DEFAULT);

        assertEquals(1, result.content.size());
        Paragraph merged = (Paragraph) result.content.get(0);
        assertEquals(new Position(0, 1, 1), merged.position.start);
        assertEquals(new Position(5, 2, 3), merged.position.end);
        Text separator = (Text) merged.content.get(1);
        assertEquals(" ", separator.text);
        assertEquals(new Span(new Position(0, 1, 1), new Position(2, 1, 3)), separator.position);
        assertNotSame(merged.position, separator.position);
    }

    @Test
    void whitespaceParagraphsToEmpty_usesUnicodeWhiteSpace() throws TransformationException {
        Document doc = document(paragraph(text("\u0085")), paragraph(text("\u001C")));

        Document result = (Document) GeneralTransformations.whitespaceParagraphsToEmpty(doc, GeneralSettings.DEFAULT);

        assertTrue(((Paragraph) result.content.get(0)).content.isEmpty());
        assertEquals(1, ((Paragraph) result.content.get(1)).content.size());
    }

    @Test
    void collapseParagraphs_keepsParagraphsSeparatedByEmptyOne() throws TransformationException {
        Document doc = document(paragraph(text("a")), paragraph(text("   ")), paragraph(text("b")));

        Element cleared = GeneralTransformations.whitespaceParagraphsToEmpty(doc, GeneralSettings.DEFAULT);
        Document result = (Document) GeneralTransformations.collapseParagraphs(cleared, GeneralSettings.DEFAULT);

        assertTreeMatches(document(paragraph(text("a")), paragraph(text("b"))), result);
    }

    @Test
    void collapseConsecutiveText_mergesWhitespaceIntoSingleSpace() throws TransformationException {
        Paragraph paragraph = paragraph(text("a"), text("  "), text("b"));

        Paragraph result = (Paragraph) GeneralTransformations.collapseConsecutiveText(paragraph, GeneralSettings.DEFAULT);

        assertEquals(1, result.content.size());
        assertEquals("a b", ((Text) result.content.get(0)).text);
    }

    @Test
    void collapseConsecutiveText_extendsSpanOfMergedText() throws TransformationException {
        Text a = new Text(new Span(new Position(0, 1, 1), new Position(1, 1, 2)), "a");
        Text b = new Text(new Span(new Position(1, 1, 2), new Position(2, 1, 3)), "b");
        Paragraph paragraph = new Paragraph(Span.any(), list(a, b));

        Paragraph result = (Paragraph) GeneralTransformations.collapseConsecutiveText(paragraph, GeneralSettings.DEFAULT);

        Text merged = (Text) result.content.get(0);
        assertEquals(new Position(0, 1, 1), merged.position.start);
        assertEquals(new Position(2, 1, 3), merged.position.end);
    }

    @Test
    void enumerateAnonArgs_numbersAnonymousArguments() throws TransformationException {
        Template template = template("t", argument("", "x"), argument("foo", "y"), argument("", "z"));

        Template result = (Template) GeneralTransformations.enumerateAnonArgs(template, GeneralSettings.DEFAULT);

        List<String> names = List.of(
                ((TemplateArgument) result.content.get(0)).name,
                ((TemplateArgument) result.content.get(1)).name,
                ((TemplateArgument) result.content.get(2)).name);
        assertEquals(List.of("1", "foo", "2"), names);
    }

    @Test
    void enumerateAnonArgs_countsPerTemplate() throws TransformationException {
        Template inner = template("inner", argument("", "x"));
        Template outer = template("outer", argument("", "a"),
                new TemplateArgument(Span.any(), "", list(inner)));

        GeneralTransformations.enumerateAnonArgs(outer, GeneralSettings.DEFAULT);

        assertEquals("2", ((TemplateArgument) outer.content.get(1)).name);
        assertEquals("1", ((TemplateArgument) inner.content.get(0)).name);
    }
}
