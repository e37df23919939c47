/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable XML element snapshot: name, attributes in document order, and
 * content (child {@code XMLNode}s and non-blank text runs).
 * <p>
 * Used for markup the model keeps without interpreting it, so it can be
 * written back in place.  Whitespace-only text between elements is not
 * retained.</p>
 */
public final class XMLNode {

    private final String name;
    private final Map<String, String> attributes;
    private final List<Object> content;

    public XMLNode(String name, Map<String, String> attributes, List<?> content) {
        this.name = Objects.requireNonNull(name, "name");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        List<Object> items = new ArrayList<>(content.size());
        for (Object item : content) {
            if (!(item instanceof XMLNode || item instanceof String))
                throw new IllegalArgumentException("Unsupported content: " + item);

            items.add(item);
        }
        this.content = Collections.unmodifiableList(items);
    }

    public static XMLNode of(String name, Map<String, String> attributes) {
        return new XMLNode(name, attributes, Collections.emptyList());
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * @return  child {@code XMLNode}s and {@code String} text runs, in
     *          document order
     */
    public List<Object> getContent() {
        return content;
    }

    public List<XMLNode> getChildren() {
        List<XMLNode> children = new ArrayList<>(content.size());
        for (Object item : content) {
            if (item instanceof XMLNode) {
                children.add((XMLNode) item);
            }
        }
        return children;
    }

    /**
     * @return  the concatenated text runs of this element (not descendants)
     */
    public String getText() {
        StringBuilder text = new StringBuilder();
        for (Object item : content) {
            if (item instanceof String) {
                text.append((String) item);
            }
        }
        return text.toString();
    }

    public XMLNode withoutAttributes(String... names) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        for (String key : names) {
            copy.remove(key);
        }
        return new XMLNode(name, copy, content);
    }

    public XMLNode withContent(List<?> newContent) {
        return new XMLNode(name, attributes, newContent);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof XMLNode))
            return false;

        XMLNode other = (XMLNode) obj;
        return name.equals(other.name)
                // Attribute order is significant for round-trip output
                && new ArrayList<>(attributes.entrySet())
                        .equals(new ArrayList<>(other.attributes.entrySet()))
                && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, content);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('<').append(name);
        attributes.forEach((key, value) -> buf.append(' ')
                .append(key).append("=\"").append(value).append('"'));
        if (content.isEmpty()) {
            return buf.append("/>").toString();
        }
        buf.append('>');
        content.forEach(buf::append);
        return buf.append("</").append(name).append('>').toString();
    }

}
