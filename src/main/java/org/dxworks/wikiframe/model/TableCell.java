package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

public class TableCell extends Element {
    public boolean header;
    public List<TagAttribute> attributes = new ArrayList<>();
    public List<Element> content = new ArrayList<>();

    public TableCell() {
    }

    public TableCell(Span position, boolean header, List<TagAttribute> attributes, List<Element> content) {
        super(position);
        this.header = header;
        this.attributes = attributes;
        this.content = content;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitTableCell(this);
    }

    @Override
    public String variantName() {
        return "TableCell";
    }
}
