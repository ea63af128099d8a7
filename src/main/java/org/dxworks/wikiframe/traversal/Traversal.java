package org.dxworks.wikiframe.traversal;

import org.dxworks.wikiframe.model.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only traversal of an element tree, for consumers such as collectors and printers.
 *
 * <p>Subclasses override {@link #work} and/or {@link #workList}. Returning {@code false} from a
 * hook skips the children of that node or list; the rest of the traversal continues. While a
 * node and its children are handled, the node is the last entry of {@link #getPath()}.</p>
 *
 * @param <S> settings passed unchanged to every hook
 */
public abstract class Traversal<S> {
    private final List<Element> path = new ArrayList<>();

    protected void pathPush(Element element) {
        path.add(element);
    }

    protected Element pathPop() {
        return path.isEmpty() ? null : path.remove(path.size() - 1);
    }

    /** Ancestors of the current node, outermost first, ending with the current node. */
    public List<Element> getPath() {
        return Collections.unmodifiableList(path);
    }

    /**
     * Handles a single node.
     *
     * @return whether the children of {@code root} should be traversed
     */
    protected boolean work(Element root, S settings, Appendable out) throws IOException {
        return true;
    }

    /**
     * Handles a list of sibling nodes before its elements are traversed.
     *
     * @return whether the elements of {@code content} should be traversed
     */
    protected boolean workList(List<Element> content, S settings, Appendable out) throws IOException {
        return true;
    }

    public void runList(List<Element> content, S settings, Appendable out) throws IOException {
        if (!workList(content, settings, out)) {
            return;
        }
        for (Element element : content) {
            run(element, settings, out);
        }
    }

    public void run(Element root, S settings, Appendable out) throws IOException {
        pathPush(root);
        try {
            if (work(root, settings, out)) {
                root.accept(new Children(settings, out));
            }
        } finally {
            pathPop();
        }
    }

    private final class Children implements ElementVisitor<Void, IOException> {
        private final S settings;
        private final Appendable out;

        Children(S settings, Appendable out) {
            this.settings = settings;
            this.out = out;
        }

        private Void all(List<Element> content) throws IOException {
            runList(content, settings, out);
            return null;
        }

        @Override
        public Void visitDocument(Document document) throws IOException {
            return all(document.content);
        }

        @Override
        public Void visitHeading(Heading heading) throws IOException {
            all(heading.caption);
            return all(heading.content);
        }

        @Override
        public Void visitText(Text text) {
            return null;
        }

        @Override
        public Void visitFormatted(Formatted formatted) throws IOException {
            return all(formatted.content);
        }

        @Override
        public Void visitParagraph(Paragraph paragraph) throws IOException {
            return all(paragraph.content);
        }

        @Override
        public Void visitTemplate(Template template) throws IOException {
            all(template.name);
            return all(template.content);
        }

        @Override
        public Void visitTemplateArgument(TemplateArgument argument) throws IOException {
            return all(argument.value);
        }

        @Override
        public Void visitInternalReference(InternalReference reference) throws IOException {
            all(reference.target);
            for (List<Element> option : reference.options) {
                all(option);
            }
            return all(reference.caption);
        }

        @Override
        public Void visitExternalReference(ExternalReference reference) throws IOException {
            return all(reference.caption);
        }

        @Override
        public Void visitListItem(ListItem item) throws IOException {
            return all(item.content);
        }

        @Override
        public Void visitList(ListElement list) throws IOException {
            return all(list.content);
        }

        @Override
        public Void visitTable(Table table) throws IOException {
            all(table.caption);
            return all(table.rows);
        }

        @Override
        public Void visitTableRow(TableRow row) throws IOException {
            return all(row.cells);
        }

        @Override
        public Void visitTableCell(TableCell cell) throws IOException {
            return all(cell.content);
        }

        @Override
        public Void visitComment(Comment comment) {
            return null;
        }

        @Override
        public Void visitHtmlTag(HtmlTag tag) throws IOException {
            return all(tag.content);
        }

        @Override
        public Void visitGallery(Gallery gallery) throws IOException {
            return all(gallery.content);
        }

        @Override
        public Void visitError(ErrorElement error) {
            return null;
        }
    }
}
