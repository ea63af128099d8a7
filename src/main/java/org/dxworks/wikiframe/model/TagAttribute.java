package org.dxworks.wikiframe.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A key/value attribute of an html tag, table or table cell.
 */
public class TagAttribute {
    public Span position = Span.any();
    public String key;
    public String value;

    public TagAttribute() {
    }

    public TagAttribute(Span position, String key, String value) {
        this.position = position;
        this.key = key;
        this.value = value;
    }

    public TagAttribute copy() {
        return new TagAttribute(position.copy(), key, value);
    }

    public static List<TagAttribute> copyAll(List<TagAttribute> attributes) {
        List<TagAttribute> result = new ArrayList<>(attributes.size());
        for (TagAttribute attribute : attributes) {
            result.add(attribute.copy());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagAttribute)) return false;
        TagAttribute other = (TagAttribute) o;
        return Objects.equals(position, other.position)
                && Objects.equals(key, other.key)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, key, value);
    }
}
