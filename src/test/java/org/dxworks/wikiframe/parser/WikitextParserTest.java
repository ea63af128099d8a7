package org.dxworks.wikiframe.parser;

import org.dxworks.wikiframe.model.*;
import org.dxworks.wikiframe.source.SourceIndex;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.wikiframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class WikitextParserTest {

    private static final WikitextParser PARSER = new WikitextParser();

    private static Document parse(String source) throws GrammarException {
        return (Document) PARSER.parse(source, SourceIndex.of(source));
    }

    private static GrammarException failure(String source) {
        return assertThrows(GrammarException.class, () -> parse(source));
    }

    private static Formatted formatted(MarkupType markup, Element... content) {
        return new Formatted(Span.any(), markup, list(content));
    }

    private static TagAttribute attribute(String key, String value) {
        return new TagAttribute(Span.any(), key, value);
    }

    private static TableCell cell(boolean header, List<TagAttribute> attributes, Element... content) {
        return new TableCell(Span.any(), header, attributes, list(content));
    }

    // ---- blocks ----

    @Test
    void paragraphs_onePerLine() throws GrammarException {
        assertTreeMatches(document(
                paragraph(text("a")),
                paragraph(),
                paragraph(text("b"))), parse("a\n\nb"));
    }

    @Test
    void headings_collectFollowingBlocks() throws GrammarException {
        Document doc = parse("intro\n= A =\ntext\n== B ==");

        assertTreeMatches(document(
                paragraph(text("intro")),
                new Heading(Span.any(), 1, list(text(" A ")), list(paragraph(text("text")))),
                new Heading(Span.any(), 2, list(text(" B ")), list())), doc);
    }

    @Test
    void headings_useShorterSideForDepth() throws GrammarException {
        Heading heading = (Heading) parse("=== x ==").content.get(0);

        assertEquals(2, heading.depth);
        assertTreeMatches(text("= x "), heading.caption.get(0));
    }

    @Test
    void headings_requireCaption() throws GrammarException {
        assertTrue(parse("==").content.get(0) instanceof Paragraph);
    }

    @Test
    void lists_groupConsecutiveLines() throws GrammarException {
        assertTreeMatches(document(listOf(
                new ListItem(Span.any(), 1, ListItemKind.UNORDERED, list(text("a"))),
                new ListItem(Span.any(), 2, ListItemKind.UNORDERED, list(text("b"))),
                new ListItem(Span.any(), 1, ListItemKind.ORDERED, list(text("c"))),
                new ListItem(Span.any(), 2, ListItemKind.DEFINITION, list(text("d"))))),
                parse("* a\n** b\n# c\n*: d"));
    }

    @Test
    void tables_parseCaptionRowsAndCells() throws GrammarException {
        Document doc = parse("{| class=\"wikitable\"\n"
                + "|+ Caption\n"
                + "! H1 !! H2\n"
                + "|-\n"
                + "| style=\"x\" | a || b\n"
                + "|}");

        Table expected = new Table(Span.any(), new ArrayList<>(List.of(attribute("class", "wikitable"))),
                list(text(" Caption")), new ArrayList<>(),
                list(
                        new TableRow(Span.any(), new ArrayList<>(), list(
                                cell(true, new ArrayList<>(), text(" H1 ")),
                                cell(true, new ArrayList<>(), text(" H2")))),
                        new TableRow(Span.any(), new ArrayList<>(), list(
                                cell(false, new ArrayList<>(List.of(attribute("style", "x"))), text(" a ")),
                                cell(false, new ArrayList<>(), text(" b"))))));
        assertTreeMatches(document(expected), doc);
    }

    @Test
    void tables_nestInsideCells() throws GrammarException {
        Table outer = (Table) parse("{|\n|\n{|\n| inner\n|}\n|}").content.get(0);

        TableCell cell = (TableCell) ((TableRow) outer.rows.get(0)).cells.get(0);
        assertEquals(1, cell.content.size());
        Table inner = (Table) cell.content.get(0);
        assertEquals(1, inner.rows.size());
    }

    @Test
    void gallery_oneReferencePerLine() throws GrammarException {
        Document doc = parse("<gallery mode=\"packed\">\nFile:a.jpg|Cap\n\nFile:b.jpg\n</gallery>");

        assertTreeMatches(document(new Gallery(Span.any(), new ArrayList<>(List.of(attribute("mode", "packed"))), list(
                new InternalReference(Span.any(), list(text("File:a.jpg")), new ArrayList<>(), list(text("Cap"))),
                new InternalReference(Span.any(), list(text("File:b.jpg")), new ArrayList<>(), list())))), doc);
    }

    // ---- inline ----

    @Test
    void formatting_boldAndItalic() throws GrammarException {
        assertTreeMatches(document(paragraph(
                text("Hello "),
                formatted(MarkupType.ITALIC, text("world")),
                text(" "),
                formatted(MarkupType.BOLD, text("and "), formatted(MarkupType.ITALIC, text("more"))))),
                parse("Hello ''world'' '''and ''more'''''"));
    }

    @Test
    void formatting_closesAtEndOfLine() throws GrammarException {
        assertTreeMatches(document(
                paragraph(formatted(MarkupType.BOLD, text("a"))),
                paragraph(text("b"))), parse("'''a\nb"));
    }

    @Test
    void templates_withAnonymousAndNamedArguments() throws GrammarException {
        Paragraph paragraph = (Paragraph) parse("{{foo|bar|key = value}}").content.get(0);

        assertTreeMatches(paragraph(template("foo", argument("", "bar"), argument("key", " value"))), paragraph);
    }

    @Test
    void templates_spanLines() throws GrammarException {
        Document doc = parse("{{Infobox\n| name = x\n}}\nafter");

        Template template = (Template) ((Paragraph) doc.content.get(0)).content.get(0);
        assertEquals("name", ((TemplateArgument) template.content.get(0)).name);
        assertTreeMatches(paragraph(text("after")), doc.content.get(1));
    }

    @Test
    void internalReferences_splitTargetOptionsAndCaption() throws GrammarException {
        Paragraph paragraph = (Paragraph) parse("[[File:a.png|thumb|A caption]]").content.get(0);

        List<List<Element>> options = new ArrayList<>();
        options.add(list(text("thumb")));
        assertTreeMatches(paragraph(new InternalReference(Span.any(), list(text("File:a.png")), options,
                list(text("A caption")))), paragraph);
    }

    @Test
    void externalReferences_keepTargetAsString() throws GrammarException {
        Paragraph paragraph = (Paragraph) parse("see [https://example.org Example site]").content.get(0);

        assertTreeMatches(paragraph(text("see "),
                new ExternalReference(Span.any(), "https://example.org", list(text("Example site")))), paragraph);
    }

    @Test
    void bracketWithoutUrl_isText() throws GrammarException {
        Paragraph paragraph = (Paragraph) parse("[a]").content.get(0);

        assertTreeMatches(paragraph(text("["), text("a"), text("]")), paragraph);
    }

    @Test
    void comments_keepTheirText() throws GrammarException {
        assertTreeMatches(document(paragraph(text("a"), new Comment(Span.any(), " c "), text("b"))),
                parse("a<!-- c -->b"));
    }

    @Test
    void tags_markupHtmlAndRaw() throws GrammarException {
        Paragraph paragraph = (Paragraph) parse(
                "<nowiki>''x''</nowiki><s>y</s><span class=\"k\">z</span><br/><br>").content.get(0);

        assertTreeMatches(paragraph(
                formatted(MarkupType.NO_WIKI, text("''x''")),
                formatted(MarkupType.STRIKE_THROUGH, text("y")),
                new HtmlTag(Span.any(), "span", new ArrayList<>(List.of(attribute("class", "k"))), list(text("z"))),
                new HtmlTag(Span.any(), "br", new ArrayList<>(), list()),
                new HtmlTag(Span.any(), "br", new ArrayList<>(), list())), paragraph);
    }

    // ---- positions ----

    @Test
    void positions_areByteOffsetsWithLineAndColumn() throws GrammarException {
        Document doc = parse("ab\n''c''");

        Paragraph second = (Paragraph) doc.content.get(1);
        Formatted italic = (Formatted) second.content.get(0);
        Text c = (Text) italic.content.get(0);
        assertEquals(new Span(new Position(3, 2, 1), new Position(8, 2, 6)), second.position);
        assertEquals(new Span(new Position(3, 2, 1), new Position(8, 2, 6)), italic.position);
        assertEquals(new Span(new Position(5, 2, 3), new Position(6, 2, 4)), c.position);
        assertNotSame(second.position, italic.position);
    }

    @Test
    void positions_countMultiByteCharacters() throws GrammarException {
        Paragraph paragraph = (Paragraph) parse("é [[x]]").content.get(0);

        InternalReference reference = (InternalReference) paragraph.content.get(1);
        assertEquals(new Position(3, 1, 3), reference.position.start);
        assertEquals(new Position(8, 1, 8), reference.position.end);
    }

    // ---- failures ----

    @Test
    void unclosedTemplate_expectsPipeOrBraces() {
        GrammarException e = failure("a\n{{b\n");

        assertEquals(List.of("|", "}}"), e.getExpected());
        assertEquals(6, e.getOffset());
        assertEquals(3, e.getLine());
    }

    @Test
    void unclosedConstructs_nameTheirClosingToken() {
        assertEquals(List.of("|", "]]"), failure("[[a").getExpected());
        assertEquals(List.of("-->"), failure("x <!-- y").getExpected());
        assertEquals(List.of("]"), failure("[http://x y\nz]").getExpected());
        assertEquals(List.of("|}"), failure("{|\n| a").getExpected());
        assertEquals(List.of("</span>"), failure("<span>x").getExpected());
        assertEquals(List.of("</nowiki>"), failure("<nowiki>x").getExpected());
        assertEquals(List.of("</gallery>"), failure("<gallery>\nFile:a.jpg").getExpected());
    }

    @Test
    void unclosedExternalReference_failsAtLineEnd() {
        GrammarException e = failure("[http://x y\nz]");

        assertEquals(11, e.getOffset());
        assertEquals(1, e.getLine());
    }
}
