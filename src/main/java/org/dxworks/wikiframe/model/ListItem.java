package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

public class ListItem extends Element {
    public int depth;
    public ListItemKind kind;
    public List<Element> content = new ArrayList<>();

    public ListItem() {
    }

    public ListItem(Span position, int depth, ListItemKind kind, List<Element> content) {
        super(position);
        this.depth = depth;
        this.kind = kind;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitListItem(this);
    }

    @Override
    public String variantName() {
        return "ListItem";
    }
}
