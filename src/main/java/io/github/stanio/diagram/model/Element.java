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

import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.style.Style;
import io.github.stanio.diagram.xml.XMLNode;

/**
 * Immutable diagram element: a shape, a connector, or a group.
 * <p>
 * All kinds share the common attributes (id, label, style, geometry,
 * parent reference, visibility); {@link #getKind() kind} selects the
 * payload: a {@link Connection} for connectors, the collapsed flag for
 * groups.  The parent is referenced by id: a layer, a group, or (for edge
 * labels) a connector of the same page.</p>
 * <p>
 * Markup not interpreted by the model is kept with the element: extra cell
 * attributes, extra child nodes, and the {@code <object>} wrapper carrying
 * custom properties, if any.</p>
 */
public final class Element {

    public enum Kind { SHAPE, CONNECTOR, GROUP }

    /** Connector end. */
    public enum End { SOURCE, TARGET }


    /**
     * Connector endpoints.  Each end either references an element by id,
     * or is {@code null} (floating end at the geometry terminal point).
     * A <i>dangling</i> end references an id not found on the page when
     * loaded; it's retained as is.
     */
    public static final class Connection {

        public static final Connection FLOATING = new Connection(null, null, false, false);

        private final String sourceId;
        private final String targetId;
        private final boolean sourceDangling;
        private final boolean targetDangling;

        public Connection(String sourceId, String targetId) {
            this(sourceId, targetId, false, false);
        }

        public Connection(String sourceId, String targetId,
                          boolean sourceDangling, boolean targetDangling) {
            if (sourceDangling && sourceId == null
                    || targetDangling && targetId == null)
                throw new IllegalArgumentException("Dangling end without id");

            this.sourceId = sourceId;
            this.targetId = targetId;
            this.sourceDangling = sourceDangling;
            this.targetDangling = targetDangling;
        }

        public String getSourceId() {
            return sourceId;
        }

        public String getTargetId() {
            return targetId;
        }

        public String get(End end) {
            return (end == End.SOURCE) ? sourceId : targetId;
        }

        public boolean isDangling(End end) {
            return (end == End.SOURCE) ? sourceDangling : targetDangling;
        }

        public boolean isDangling() {
            return sourceDangling || targetDangling;
        }

        /**
         * @return  whether either end references the given id (dangling or not)
         */
        public boolean references(String id) {
            return id.equals(sourceId) || id.equals(targetId);
        }

        public Connection with(End end, String id, boolean dangling) {
            return (end == End.SOURCE)
                    ? new Connection(id, targetId, dangling, targetDangling)
                    : new Connection(sourceId, id, sourceDangling, dangling);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Connection))
                return false;

            Connection other = (Connection) obj;
            return Objects.equals(sourceId, other.sourceId)
                    && Objects.equals(targetId, other.targetId)
                    && sourceDangling == other.sourceDangling
                    && targetDangling == other.targetDangling;
        }

        @Override
        public int hashCode() {
            return Objects.hash(sourceId, targetId, sourceDangling, targetDangling);
        }

        @Override
        public String toString() {
            return (sourceDangling ? "?" : "") + sourceId
                    + " -> " + (targetDangling ? "?" : "") + targetId;
        }

    } // class Connection


    private final String id;
    private final Kind kind;
    private final String label;
    private final Style style;
    private final Geometry geometry;
    private final String parentId;
    private final boolean visible;
    private final Connection connection;
    private final boolean collapsed;
    private final Map<String, String> extraAttributes;
    private final List<XMLNode> extraNodes;
    private final XMLNode wrapper;

    Element(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.kind = builder.kind;
        this.label = builder.label;
        this.style = builder.style;
        this.geometry = builder.geometry;
        this.parentId = builder.parentId;
        this.visible = builder.visible;
        this.connection = (kind == Kind.CONNECTOR) ? builder.connection : null;
        this.collapsed = (kind == Kind.GROUP) && builder.collapsed;
        this.extraAttributes = Collections
                .unmodifiableMap(new LinkedHashMap<>(builder.extraAttributes));
        this.extraNodes = Collections
                .unmodifiableList(new ArrayList<>(builder.extraNodes));
        this.wrapper = builder.wrapper;
    }

    public static Builder builder(Kind kind, String id) {
        return new Builder(kind, id);
    }

    public static Builder shape(String id) {
        return new Builder(Kind.SHAPE, id);
    }

    public static Builder connector(String id) {
        return new Builder(Kind.CONNECTOR, id);
    }

    public static Builder group(String id) {
        return new Builder(Kind.GROUP, id);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isShape() {
        return kind == Kind.SHAPE;
    }

    public boolean isConnector() {
        return kind == Kind.CONNECTOR;
    }

    public boolean isGroup() {
        return kind == Kind.GROUP;
    }

    /**
     * @return  the label text (draw.io cell value), or {@code null} if none
     */
    public String getLabel() {
        return label;
    }

    public Style getStyle() {
        return style;
    }

    public boolean hasGeometry() {
        return geometry != null;
    }

    /**
     * @return  the element geometry; {@link Geometry#EMPTY} if none
     */
    public Geometry getGeometry() {
        return (geometry == null) ? Geometry.EMPTY : geometry;
    }

    public String getParentId() {
        return parentId;
    }

    public boolean isVisible() {
        return visible;
    }

    /**
     * The lock flag is the {@code locked=1} style entry.
     */
    public boolean isLocked() {
        return style.isLocked();
    }

    /**
     * @return  the shape type tag derived from the style, e.g.
     *          {@code rectangle}, {@code ellipse}
     */
    public String getShapeType() {
        return style.shapeType();
    }

    /**
     * @return  the connector routing style tag, or {@code null}
     */
    public String getRoutingStyle() {
        return style.edgeStyle();
    }

    /**
     * @return  the endpoints of this connector
     * @throws  IllegalStateException  if not a connector
     */
    public Connection getConnection() {
        if (kind != Kind.CONNECTOR)
            throw new IllegalStateException(kind + " " + id + " has no connection");

        return connection;
    }

    public boolean isCollapsed() {
        return collapsed;
    }

    public Map<String, String> getExtraAttributes() {
        return extraAttributes;
    }

    public List<XMLNode> getExtraNodes() {
        return extraNodes;
    }

    /**
     * @return  the {@code <object>}/{@code <UserObject>} wrapper without
     *          {@code id} and {@code label}, or {@code null}
     */
    public XMLNode getWrapper() {
        return wrapper;
    }

    public Element withLabel(String newLabel) {
        return toBuilder().label(newLabel).build();
    }

    public Element withStyle(Style newStyle) {
        return toBuilder().style(newStyle).build();
    }

    public Element withGeometry(Geometry newGeometry) {
        return toBuilder().geometry(newGeometry).build();
    }

    public Element withParent(String newParentId) {
        return toBuilder().parent(newParentId).build();
    }

    public Element withVisible(boolean newVisible) {
        return toBuilder().visible(newVisible).build();
    }

    public Element withConnection(Connection newConnection) {
        getConnection();
        return toBuilder().connection(newConnection).build();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Element))
            return false;

        Element other = (Element) obj;
        return id.equals(other.id)
                && kind == other.kind
                && Objects.equals(label, other.label)
                && style.equals(other.style)
                && Objects.equals(geometry, other.geometry)
                && Objects.equals(parentId, other.parentId)
                && visible == other.visible
                && Objects.equals(connection, other.connection)
                && collapsed == other.collapsed
                && new ArrayList<>(extraAttributes.entrySet())
                        .equals(new ArrayList<>(other.extraAttributes.entrySet()))
                && extraNodes.equals(other.extraNodes)
                && Objects.equals(wrapper, other.wrapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, label, style, geometry, parentId,
                visible, connection, collapsed, extraAttributes, extraNodes, wrapper);
    }

    @Override
    public String toString() {
        return kind + "(id=" + id
                + (label == null || label.isEmpty() ? "" : ", label=" + label)
                + ", parent=" + parentId
                + (connection == null ? "" : ", " + connection)
                + ", " + getGeometry() + ")";
    }


    public static final class Builder {

        final String id;
        final Kind kind;
        String label;
        Style style = Style.EMPTY;
        Geometry geometry;
        String parentId;
        boolean visible = true;
        Connection connection = Connection.FLOATING;
        boolean collapsed;
        Map<String, String> extraAttributes = Collections.emptyMap();
        List<XMLNode> extraNodes = Collections.emptyList();
        XMLNode wrapper;

        Builder(Kind kind, String id) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.id = Objects.requireNonNull(id, "id");
        }

        Builder(Element element) {
            this.id = element.id;
            this.kind = element.kind;
            this.label = element.label;
            this.style = element.style;
            this.geometry = element.geometry;
            this.parentId = element.parentId;
            this.visible = element.visible;
            if (element.connection != null) {
                this.connection = element.connection;
            }
            this.collapsed = element.collapsed;
            this.extraAttributes = element.extraAttributes;
            this.extraNodes = element.extraNodes;
            this.wrapper = element.wrapper;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder style(Style style) {
            this.style = Objects.requireNonNull(style, "style");
            return this;
        }

        public Builder style(String style) {
            return style(Style.parseLenient(style));
        }

        public Builder geometry(Geometry geometry) {
            this.geometry = geometry;
            return this;
        }

        public Builder parent(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder connection(Connection connection) {
            this.connection = Objects.requireNonNull(connection, "connection");
            return this;
        }

        public Builder source(String sourceId) {
            this.connection = connection.with(End.SOURCE, sourceId, false);
            return this;
        }

        public Builder target(String targetId) {
            this.connection = connection.with(End.TARGET, targetId, false);
            return this;
        }

        public Builder collapsed(boolean collapsed) {
            this.collapsed = collapsed;
            return this;
        }

        public Builder extraAttributes(Map<String, String> attributes) {
            this.extraAttributes = Objects.requireNonNull(attributes);
            return this;
        }

        public Builder extraNodes(List<XMLNode> nodes) {
            this.extraNodes = Objects.requireNonNull(nodes);
            return this;
        }

        public Builder wrapper(XMLNode wrapper) {
            this.wrapper = wrapper;
            return this;
        }

        public Element build() {
            return new Element(this);
        }

    } // class Builder


}
