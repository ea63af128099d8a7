package org.dxworks.wikiframe.transform;

import org.dxworks.wikiframe.error.TransformationException;
import org.dxworks.wikiframe.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic recursion over the element tree, so that a transformation only has to handle the node
 * kinds it cares about.
 *
 * <p>Child lists are visited in declaration order: caption before content for headings, name
 * before content for templates, target, options and caption for internal references, caption
 * before rows for tables. Scalar fields are left untouched.</p>
 */
public final class Recursion {

    private Recursion() {
        // utility class
    }

    // ---- in-place ----

    /** Applies {@code f} to every child of {@code root}, replacing each child list with the results. */
    public static <S> Element recurse(Transformation<S> f, Element root, S settings)
            throws TransformationException {
        return recurseWith(f, root, settings, Recursion::applyAll);
    }

    /** Like {@link #recurse}, but each direct child list of {@code root} is rebuilt by {@code handler}. */
    public static <S> Element recurseWith(Transformation<S> f, Element root, S settings, ContentHandler<S> handler)
            throws TransformationException {
        return root.accept(new InPlaceRecursion<>(f, settings, handler));
    }

    /** Maps {@code f} over {@code content} in order, stopping at the first error. */
    public static <S> List<Element> applyAll(Transformation<S> f, List<Element> content, S settings)
            throws TransformationException {
        List<Element> result = new ArrayList<>(content.size());
        for (Element child : content) {
            result.add(f.apply(child, settings));
        }
        return result;
    }

    // ---- cloning ----

    public static <S> Element recurseClone(CloningTransformation<S> f, Element root, List<Element> path, S settings)
            throws TransformationException {
        return recurseCloneWith(f, root, path, settings, Recursion::applyAllClone);
    }

    /**
     * Builds a copy of {@code root} whose child lists are produced by {@code handler} from the
     * original children. {@code root} is on the path while its children are handled.
     */
    public static <S> Element recurseCloneWith(CloningTransformation<S> f, Element root, List<Element> path,
                                               S settings, CloningContentHandler<S> handler)
            throws TransformationException {
        path.add(root);
        try {
            return root.accept(new CloningRecursion<>(f, path, settings, handler));
        } finally {
            path.remove(path.size() - 1);
        }
    }

    public static <S> List<Element> applyAllClone(CloningTransformation<S> f, List<Element> content,
                                                  List<Element> path, S settings)
            throws TransformationException {
        List<Element> result = new ArrayList<>(content.size());
        for (Element child : content) {
            result.add(f.apply(child, path, settings));
        }
        return result;
    }

    /** An independent copy of the whole subtree. */
    public static Element deepCopy(Element root) {
        try {
            return copy(root, new ArrayList<>(), null);
        } catch (TransformationException e) {
            throw new IllegalStateException("copying a tree cannot fail", e);
        }
    }

    private static Element copy(Element root, List<Element> path, Void settings) throws TransformationException {
        return recurseClone(Recursion::copy, root, path, settings);
    }

    private static final class InPlaceRecursion<S> implements ElementVisitor<Element, TransformationException> {
        private final Transformation<S> f;
        private final S settings;
        private final ContentHandler<S> handler;

        InPlaceRecursion(Transformation<S> f, S settings, ContentHandler<S> handler) {
            this.f = f;
            this.settings = settings;
            this.handler = handler;
        }

        private List<Element> handle(List<Element> content) throws TransformationException {
            return handler.handle(f, content, settings);
        }

        @Override
        public Element visitDocument(Document document) throws TransformationException {
            document.content = handle(document.content);
            return document;
        }

        @Override
        public Element visitHeading(Heading heading) throws TransformationException {
            heading.caption = handle(heading.caption);
            heading.content = handle(heading.content);
            return heading;
        }

        @Override
        public Element visitText(Text text) {
            return text;
        }

        @Override
        public Element visitFormatted(Formatted formatted) throws TransformationException {
            formatted.content = handle(formatted.content);
            return formatted;
        }

        @Override
        public Element visitParagraph(Paragraph paragraph) throws TransformationException {
            paragraph.content = handle(paragraph.content);
            return paragraph;
        }

        @Override
        public Element visitTemplate(Template template) throws TransformationException {
            template.name = handle(template.name);
            template.content = handle(template.content);
            return template;
        }

        @Override
        public Element visitTemplateArgument(TemplateArgument argument) throws TransformationException {
            argument.value = handle(argument.value);
            return argument;
        }

        @Override
        public Element visitInternalReference(InternalReference reference) throws TransformationException {
            reference.target = handle(reference.target);
            List<List<Element>> options = new ArrayList<>(reference.options.size());
            for (List<Element> option : reference.options) {
                options.add(handle(option));
            }
            reference.options = options;
            reference.caption = handle(reference.caption);
            return reference;
        }

        @Override
        public Element visitExternalReference(ExternalReference reference) throws TransformationException {
            reference.caption = handle(reference.caption);
            return reference;
        }

        @Override
        public Element visitListItem(ListItem item) throws TransformationException {
            item.content = handle(item.content);
            return item;
        }

        @Override
        public Element visitList(ListElement list) throws TransformationException {
            list.content = handle(list.content);
            return list;
        }

        @Override
        public Element visitTable(Table table) throws TransformationException {
            table.caption = handle(table.caption);
            table.rows = handle(table.rows);
            return table;
        }

        @Override
        public Element visitTableRow(TableRow row) throws TransformationException {
            row.cells = handle(row.cells);
            return row;
        }

        @Override
        public Element visitTableCell(TableCell cell) throws TransformationException {
            cell.content = handle(cell.content);
            return cell;
        }

        @Override
        public Element visitComment(Comment comment) {
            return comment;
        }

        @Override
        public Element visitHtmlTag(HtmlTag tag) throws TransformationException {
            tag.content = handle(tag.content);
            return tag;
        }

        @Override
        public Element visitGallery(Gallery gallery) throws TransformationException {
            gallery.content = handle(gallery.content);
            return gallery;
        }

        @Override
        public Element visitError(ErrorElement error) {
            return error;
        }
    }

    private static final class CloningRecursion<S> implements ElementVisitor<Element, TransformationException> {
        private final CloningTransformation<S> f;
        private final List<Element> path;
        private final S settings;
        private final CloningContentHandler<S> handler;

        CloningRecursion(CloningTransformation<S> f, List<Element> path, S settings, CloningContentHandler<S> handler) {
            this.f = f;
            this.path = path;
            this.settings = settings;
            this.handler = handler;
        }

        private List<Element> handle(List<Element> content) throws TransformationException {
            return handler.handle(f, content, path, settings);
        }

        @Override
        public Element visitDocument(Document document) throws TransformationException {
            return new Document(document.position.copy(), handle(document.content));
        }

        @Override
        public Element visitHeading(Heading heading) throws TransformationException {
            List<Element> caption = handle(heading.caption);
            List<Element> content = handle(heading.content);
            return new Heading(heading.position.copy(), heading.depth, caption, content);
        }

        @Override
        public Element visitText(Text text) {
            return new Text(text.position.copy(), text.text);
        }

        @Override
        public Element visitFormatted(Formatted formatted) throws TransformationException {
            return new Formatted(formatted.position.copy(), formatted.markup, handle(formatted.content));
        }

        @Override
        public Element visitParagraph(Paragraph paragraph) throws TransformationException {
            return new Paragraph(paragraph.position.copy(), handle(paragraph.content));
        }

        @Override
        public Element visitTemplate(Template template) throws TransformationException {
            List<Element> name = handle(template.name);
            List<Element> content = handle(template.content);
            return new Template(template.position.copy(), name, content);
        }

        @Override
        public Element visitTemplateArgument(TemplateArgument argument) throws TransformationException {
            return new TemplateArgument(argument.position.copy(), argument.name, handle(argument.value));
        }

        @Override
        public Element visitInternalReference(InternalReference reference) throws TransformationException {
            List<Element> target = handle(reference.target);
            List<List<Element>> options = new ArrayList<>(reference.options.size());
            for (List<Element> option : reference.options) {
                options.add(handle(option));
            }
            List<Element> caption = handle(reference.caption);
            return new InternalReference(reference.position.copy(), target, options, caption);
        }

        @Override
        public Element visitExternalReference(ExternalReference reference) throws TransformationException {
            return new ExternalReference(reference.position.copy(), reference.target, handle(reference.caption));
        }

        @Override
        public Element visitListItem(ListItem item) throws TransformationException {
            return new ListItem(item.position.copy(), item.depth, item.kind, handle(item.content));
        }

        @Override
        public Element visitList(ListElement list) throws TransformationException {
            return new ListElement(list.position.copy(), handle(list.content));
        }

        @Override
        public Element visitTable(Table table) throws TransformationException {
            List<Element> caption = handle(table.caption);
            List<Element> rows = handle(table.rows);
            return new Table(table.position.copy(), TagAttribute.copyAll(table.attributes), caption,
                    TagAttribute.copyAll(table.captionAttributes), rows);
        }

        @Override
        public Element visitTableRow(TableRow row) throws TransformationException {
            return new TableRow(row.position.copy(), TagAttribute.copyAll(row.attributes), handle(row.cells));
        }

        @Override
        public Element visitTableCell(TableCell cell) throws TransformationException {
            return new TableCell(cell.position.copy(), cell.header, TagAttribute.copyAll(cell.attributes),
                    handle(cell.content));
        }

        @Override
        public Element visitComment(Comment comment) {
            return new Comment(comment.position.copy(), comment.text);
        }

        @Override
        public Element visitHtmlTag(HtmlTag tag) throws TransformationException {
            return new HtmlTag(tag.position.copy(), tag.name, TagAttribute.copyAll(tag.attributes),
                    handle(tag.content));
        }

        @Override
        public Element visitGallery(Gallery gallery) throws TransformationException {
            return new Gallery(gallery.position.copy(), TagAttribute.copyAll(gallery.attributes),
                    handle(gallery.content));
        }

        @Override
        public Element visitError(ErrorElement error) {
            return new ErrorElement(error.position.copy(), error.message);
        }
    }
}
