package org.dxworks.wikiframe;

import org.dxworks.wikiframe.error.ParseError;
import org.dxworks.wikiframe.error.TransformationError;
import org.dxworks.wikiframe.error.WikiframeException;
import org.dxworks.wikiframe.model.*;
import org.dxworks.wikiframe.transform.GeneralTransformations;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.wikiframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class WikiframeTest {

    @Test
    void parse_foldsHeadingsAndLists() throws WikiframeException {
        Element tree = Wikiframe.parse("= A =\n== B ==\ntext\n* one\n** two");

        assertTreeMatches(document(
                new Heading(Span.any(), 1, list(text(" A ")), list(
                        new Heading(Span.any(), 2, list(text(" B ")), list(
                                paragraph(text("text")),
                                listOf(new ListItem(Span.any(), 1, ListItemKind.UNORDERED,
                                        list(text("one"), listOf(item(2, "two")))))))))), tree);
    }

    @Test
    void parse_emptyInput() throws WikiframeException {
        assertTreeMatches(document(), Wikiframe.parse(""));
    }

    @Test
    void parse_wrapsGrammarFailureInParseError() {
        WikiframeException e = assertThrows(WikiframeException.class, () -> Wikiframe.parse("{{x"));

        ParseError error = (ParseError) e.getError();
        assertEquals(new Position(3, 1, 4), error.position);
        assertEquals(List.of("|", "}}"), error.expected);
        assertEquals(List.of("{{x"), error.context);
    }

    @Test
    void parse_reportsTransformationFailure() {
        WikiframeException e = assertThrows(WikiframeException.class, () -> Wikiframe.parse("ignored",
                (source, index) -> document(paragraph(text("x")), item(1, "stray")), 5));

        TransformationError error = (TransformationError) e.getError();
        assertEquals(GeneralTransformations.FOLD_LISTS, error.transformationName);
        assertTrue(error.tree instanceof ListItem);
    }

    @Test
    void parse_usesConfiguredContextLines() {
        WikiframeConfig config = WikiframeConfig.with(80, 1, WikiframeConfig.ColorMode.NEVER);

        WikiframeException e = assertThrows(WikiframeException.class,
                () -> Wikiframe.parse("a\nb\nc\n[[d\ne\nf", config));

        ParseError error = (ParseError) e.getError();
        assertEquals(6, error.position.line);
        assertEquals(List.of("e", "f"), error.context);
    }
}
