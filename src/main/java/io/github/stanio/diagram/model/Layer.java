/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.github.stanio.diagram.style.Style;
import io.github.stanio.diagram.xml.XMLNode;

/**
 * Structural cell of a page: the root cell ({@code parentId == null}) or a
 * layer (child of the root).  Top-level elements have a layer as parent.
 */
public final class Layer {

    private final String id;
    private final String parentId;
    private final String label;
    private final Style style;
    private final boolean visible;
    private final Map<String, String> extraAttributes;
    private final List<XMLNode> extraNodes;
    private final XMLNode wrapper;

    public Layer(String id, String parentId, String label, Style style,
                 boolean visible, Map<String, String> extraAttributes,
                 List<XMLNode> extraNodes, XMLNode wrapper) {
        this.id = Objects.requireNonNull(id, "id");
        this.parentId = parentId;
        this.label = label;
        this.style = Objects.requireNonNull(style, "style");
        this.visible = visible;
        this.extraAttributes = Collections
                .unmodifiableMap(new LinkedHashMap<>(extraAttributes));
        this.extraNodes = Collections.unmodifiableList(new ArrayList<>(extraNodes));
        this.wrapper = wrapper;
    }

    public static Layer root(String id) {
        return new Layer(id, null, null, Style.EMPTY, true,
                Collections.emptyMap(), Collections.emptyList(), null);
    }

    public static Layer of(String id, String rootId) {
        return new Layer(id, Objects.requireNonNull(rootId, "rootId"), null,
                Style.EMPTY, true, Collections.emptyMap(), Collections.emptyList(), null);
    }

    public String getId() {
        return id;
    }

    public String getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public String getLabel() {
        return label;
    }

    public Style getStyle() {
        return style;
    }

    public boolean isVisible() {
        return visible;
    }

    public Map<String, String> getExtraAttributes() {
        return extraAttributes;
    }

    public List<XMLNode> getExtraNodes() {
        return extraNodes;
    }

    public XMLNode getWrapper() {
        return wrapper;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Layer))
            return false;

        Layer other = (Layer) obj;
        return id.equals(other.id)
                && Objects.equals(parentId, other.parentId)
                && Objects.equals(label, other.label)
                && style.equals(other.style)
                && visible == other.visible
                && new ArrayList<>(extraAttributes.entrySet())
                        .equals(new ArrayList<>(other.extraAttributes.entrySet()))
                && extraNodes.equals(other.extraNodes)
                && Objects.equals(wrapper, other.wrapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId, label, style, visible,
                extraAttributes, extraNodes, wrapper);
    }

    @Override
    public String toString() {
        return (isRoot() ? "Root(" : "Layer(") + id + ")";
    }

}
