package org.dxworks.wikiframe.model;

/**
 * Visitor over all element kinds. There are intentionally no default methods: adding a node kind
 * breaks the build of every visitor until it handles the new kind.
 *
 * @param <R> result type
 * @param <E> checked exception the visitor may throw
 */
public interface ElementVisitor<R, E extends Exception> {

    R visitDocument(Document document) throws E;

    R visitHeading(Heading heading) throws E;

    R visitText(Text text) throws E;

    R visitFormatted(Formatted formatted) throws E;

    R visitParagraph(Paragraph paragraph) throws E;

    R visitTemplate(Template template) throws E;

    R visitTemplateArgument(TemplateArgument argument) throws E;

    R visitInternalReference(InternalReference reference) throws E;

    R visitExternalReference(ExternalReference reference) throws E;

    R visitListItem(ListItem item) throws E;

    R visitList(ListElement list) throws E;

    R visitTable(Table table) throws E;

    R visitTableRow(TableRow row) throws E;

    R visitTableCell(TableCell cell) throws E;

    R visitComment(Comment comment) throws E;

    R visitHtmlTag(HtmlTag tag) throws E;

    R visitGallery(Gallery gallery) throws E;

    R visitError(ErrorElement error) throws E;
}
