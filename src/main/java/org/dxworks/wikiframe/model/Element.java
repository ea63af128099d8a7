package org.dxworks.wikiframe.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base type of all nodes in the syntax tree. Every node keeps track of its position in the
 * original input document.
 *
 * <p>The set of node kinds is closed: each subclass is listed in {@link ElementVisitor}, which
 * has no default methods, so every consumer dispatching through {@link #accept} has to handle
 * every kind.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Document.class, name = "document"),
        @JsonSubTypes.Type(value = Heading.class, name = "heading"),
        @JsonSubTypes.Type(value = Text.class, name = "text"),
        @JsonSubTypes.Type(value = Formatted.class, name = "formatted"),
        @JsonSubTypes.Type(value = Paragraph.class, name = "paragraph"),
        @JsonSubTypes.Type(value = Template.class, name = "template"),
        @JsonSubTypes.Type(value = TemplateArgument.class, name = "templateargument"),
        @JsonSubTypes.Type(value = InternalReference.class, name = "internalreference"),
        @JsonSubTypes.Type(value = ExternalReference.class, name = "externalreference"),
        @JsonSubTypes.Type(value = ListItem.class, name = "listitem"),
        @JsonSubTypes.Type(value = ListElement.class, name = "list"),
        @JsonSubTypes.Type(value = Table.class, name = "table"),
        @JsonSubTypes.Type(value = TableRow.class, name = "tablerow"),
        @JsonSubTypes.Type(value = TableCell.class, name = "tablecell"),
        @JsonSubTypes.Type(value = Comment.class, name = "comment"),
        @JsonSubTypes.Type(value = HtmlTag.class, name = "htmltag"),
        @JsonSubTypes.Type(value = Gallery.class, name = "gallery"),
        @JsonSubTypes.Type(value = ErrorElement.class, name = "error")
})
public abstract class Element {
    public Span position = Span.any();

    protected Element() {
    }

    protected Element(Span position) {
        this.position = position;
    }

    public abstract <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E;

    /** Name of the node kind, e.g. {@code "Heading"}. */
    public abstract String variantName();
}
