package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;

public class TableRow extends Element {
    public List<TagAttribute> attributes = new ArrayList<>();
    public List<Element> cells = new ArrayList<>();

    public TableRow() {
    }

    public TableRow(Span position, List<TagAttribute> attributes, List<Element> cells) {
        super(position);
        this.attributes = attributes;
        this.cells = cells;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitTableRow(this);
    }

    @Override
    public String variantName() {
        return "TableRow";
    }
}
