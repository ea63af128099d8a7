package org.dxworks.wikiframe.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class Table extends Element {
    public List<TagAttribute> attributes = new ArrayList<>();
    public List<Element> caption = new ArrayList<>();
    @JsonProperty("caption_attributes")
    public List<TagAttribute> captionAttributes = new ArrayList<>();
    public List<Element> rows = new ArrayList<>();

    public Table() {
    }

    public Table(Span position, List<TagAttribute> attributes, List<Element> caption,
                 List<TagAttribute> captionAttributes, List<Element> rows) {
        super(position);
        this.attributes = attributes;
        this.caption = caption;
        this.captionAttributes = captionAttributes;
        this.rows = rows;
    }

    @Override
    public <R, E extends Exception> R accept(ElementVisitor<R, E> visitor) throws E {
        return visitor.visitTable(this);
    }

    @Override
    public String variantName() {
        return "Table";
    }
}
