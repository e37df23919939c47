/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import static io.github.stanio.diagram.model.InvariantViolationException.Kind.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.github.stanio.diagram.event.ChangeBus;
import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.Element.Connection;
import io.github.stanio.diagram.model.Element.End;
import io.github.stanio.diagram.xml.XMLNode;

/**
 * A page (draw.io {@code <diagram>}) with its structural cells (root and
 * layers) and its elements in z-order: later elements are drawn on top.
 * <p>
 * Elements are changed only by {@link #apply(PageEdit) applying} edits.
 * An edit either commits completely, leaving the page consistent, or
 * fails leaving the page unchanged.</p>
 * <p>
 * Invariants checked on every change:</p>
 * <ul>
 * <li>Ids are unique among the root, the layers, and the elements;</li>
 * <li>Every element parent resolves to a layer, a group, or a connector
 * (edge labels);</li>
 * <li>Containment is acyclic;</li>
 * <li>Connector ends not marked dangling resolve to elements of this
 * page, other than the connector itself.</li>
 * </ul>
 */
public final class Page {

    private final String id;
    private String name;
    private PageSettings settings;
    private final Layer root;
    private final List<Layer> layers;
    private List<Element> elements;
    private Map<String, Element> index;

    private final Map<String, String> extraAttributes;
    private final List<XMLNode> extraNodes;
    private final List<XMLNode> modelNodes;
    private final List<XMLNode> rootNodes;

    private ChangeBus bus;

    Page(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name;
        this.settings = builder.settings;
        this.root = Objects.requireNonNull(builder.root, "root");
        this.layers = Collections.unmodifiableList(new ArrayList<>(builder.layers));
        this.elements = Collections.unmodifiableList(new ArrayList<>(builder.elements));
        this.index = validate(root, layers, elements);
        this.extraAttributes = Collections
                .unmodifiableMap(new LinkedHashMap<>(builder.extraAttributes));
        this.extraNodes = Collections.unmodifiableList(new ArrayList<>(builder.extraNodes));
        this.modelNodes = Collections.unmodifiableList(new ArrayList<>(builder.modelNodes));
        this.rootNodes = Collections.unmodifiableList(new ArrayList<>(builder.rootNodes));
    }

    /**
     * Creates an empty page with a root cell {@code "0"} and a default
     * layer {@code "1"}.
     */
    public static Page blank(String id, String name) {
        return builder(id).name(name).build();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public PageSettings getSettings() {
        return settings;
    }

    void setSettings(PageSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Layer getRootCell() {
        return root;
    }

    public List<Layer> getLayers() {
        return layers;
    }

    /**
     * @return  the first layer, or the root cell if the page has no layers
     */
    public Layer getDefaultLayer() {
        return layers.isEmpty() ? root : layers.get(0);
    }

    /**
     * @return  whether {@code id} names the root cell or a layer
     */
    public boolean isStructural(String id) {
        if (root.getId().equals(id))
            return true;

        for (Layer layer : layers) {
            if (layer.getId().equals(id))
                return true;
        }
        return false;
    }

    /**
     * @return  the elements in z-order (bottom-most first)
     */
    public List<Element> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean contains(String elementId) {
        return index.containsKey(elementId);
    }

    /**
     * @return  the element with the given id, or {@code null}
     */
    public Element getElement(String elementId) {
        return index.get(elementId);
    }

    /**
     * @throws  InvariantViolationException  ({@code UNKNOWN_ELEMENT}) if
     *          there's no such element
     */
    public Element requireElement(String elementId) {
        Element element = index.get(elementId);
        if (element == null)
            throw new InvariantViolationException(UNKNOWN_ELEMENT, elementId,
                    "No element " + elementId + " on page " + id);

        return element;
    }

    /**
     * @return  the z-order position of the element, or {@code -1}
     */
    public int indexOf(String elementId) {
        Element element = index.get(elementId);
        return (element == null) ? -1 : elements.indexOf(element);
    }

    /**
     * Lists the elements directly contained in the given layer, group,
     * or connector.  Group membership is the parent reference of the
     * members; the result is in z-order.
     */
    public List<Element> children(String parentId) {
        List<Element> result = new ArrayList<>();
        for (Element element : elements) {
            if (parentId.equals(element.getParentId())) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * @return  connectors with a (non-dangling) end attached to the given
     *          element
     */
    public List<Element> connectorsOf(String elementId) {
        return connectorsOf(elements, elementId);
    }

    static List<Element> connectorsOf(List<Element> elements, String elementId) {
        List<Element> result = new ArrayList<>();
        for (Element element : elements) {
            if (!element.isConnector())
                continue;

            Connection conn = element.getConnection();
            for (End end : End.values()) {
                if (elementId.equals(conn.get(end)) && !conn.isDangling(end)) {
                    result.add(element);
                    break;
                }
            }
        }
        return result;
    }

    /**
     * @return  connectors having a dangling end
     */
    public List<Element> danglingConnectors() {
        List<Element> result = new ArrayList<>();
        for (Element element : elements) {
            if (element.isConnector() && element.getConnection().isDangling()) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Element coordinates are relative to the containing group (or vertex).
     * This is the page position of the given element's top-left corner.
     */
    public Point absolutePosition(String elementId) {
        return absolutePosition(index, requireElement(elementId));
    }

    /**
     * @return  the page position of the element center
     */
    public Point absoluteCenter(String elementId) {
        Element element = requireElement(elementId);
        Point origin = absolutePosition(index, element);
        return new Point(origin.getX() + element.getGeometry().getWidth() / 2,
                         origin.getY() + element.getGeometry().getHeight() / 2);
    }

    static Point absolutePosition(Map<String, Element> index, Element element) {
        double x = element.getGeometry().getX();
        double y = element.getGeometry().getY();
        Element parent = index.get(element.getParentId());
        for (int depth = 0; parent != null
                && !parent.isConnector() && depth < index.size(); depth++) {
            x += parent.getGeometry().getX();
            y += parent.getGeometry().getY();
            parent = index.get(parent.getParentId());
        }
        return new Point(x, y);
    }

    /**
     * @return  the smallest integer id, starting from 2, not in use on
     *          this page
     */
    public String newElementId() {
        for (int n = 2; ; n++) {
            String candidate = String.valueOf(n);
            if (!index.containsKey(candidate) && !isStructural(candidate))
                return candidate;
        }
    }

    public Map<String, String> getExtraAttributes() {
        return extraAttributes;
    }

    /**
     * @return  extra child nodes of the {@code <diagram>} element
     */
    public List<XMLNode> getExtraNodes() {
        return extraNodes;
    }

    /**
     * @return  extra child nodes of the {@code <mxGraphModel>} element
     */
    public List<XMLNode> getModelNodes() {
        return modelNodes;
    }

    /**
     * @return  unrecognized child nodes of the {@code <root>} element
     */
    public List<XMLNode> getRootNodes() {
        return rootNodes;
    }

    void attach(ChangeBus changeBus) {
        this.bus = changeBus;
    }

    ChangeBus bus() {
        return bus;
    }

    /**
     * Validates the edit against the current state without applying it.
     *
     * @throws  InvariantViolationException  if the edit would break a page
     *          invariant
     * @throws  IllegalStateException  if the edit was not planned against
     *          the current state
     */
    public void check(PageEdit edit) {
        validate(root, layers, edit.applyTo(elements));
    }

    /**
     * Applies the edit atomically and publishes a single change event.
     * An empty edit changes nothing and publishes nothing.
     *
     * @throws  InvariantViolationException  if the edit would break a page
     *          invariant; the page is left unchanged
     * @throws  IllegalStateException  if the edit was not planned against
     *          the current state
     * @throws  io.github.stanio.diagram.event.ReentrantMutationException
     *          if called from a change listener
     */
    public void apply(PageEdit edit) {
        if (bus != null) {
            bus.checkMutationAllowed();
        }
        if (edit.isEmpty())
            return;

        List<Element> updated = edit.applyTo(elements);
        Map<String, Element> updatedIndex = validate(root, layers, updated);
        this.elements = Collections.unmodifiableList(updated);
        this.index = updatedIndex;

        if (bus != null) {
            bus.publish(new ChangeEvent(edit.getKind(),
                    edit.getCause(), id, edit.getAffectedIds()));
        }
    }

    static Map<String, Element> validate(Layer root,
                                         List<Layer> layers,
                                         List<Element> elements) {
        Set<String> structural = new HashSet<>();
        structural.add(root.getId());
        for (Layer layer : layers) {
            if (!structural.add(layer.getId()))
                throw new InvariantViolationException(ID_COLLISION,
                        layer.getId(), "Duplicate layer id: " + layer.getId());

            if (!root.getId().equals(layer.getParentId()))
                throw new InvariantViolationException(DETACHED_REFERENCE,
                        layer.getId(), "Layer " + layer.getId()
                                + " is not a child of the root cell");
        }

        Map<String, Element> index = new HashMap<>(elements.size() * 4 / 3 + 1);
        for (Element element : elements) {
            String elementId = element.getId();
            if (structural.contains(elementId)
                    || index.putIfAbsent(elementId, element) != null)
                throw new InvariantViolationException(ID_COLLISION,
                        elementId, "Duplicate id: " + elementId);
        }

        for (Element element : elements) {
            validateParent(structural, index, element);
            if (element.isConnector()) {
                validateEnds(index, element);
            }
        }
        return index;
    }

    private static void validateParent(Set<String> structural,
                                       Map<String, Element> index,
                                       Element element) {
        String parentId = element.getParentId();
        if (parentId == null)
            throw new InvariantViolationException(DETACHED_REFERENCE,
                    element.getId(), "No parent for " + element.getId());

        if (structural.contains(parentId))
            return;

        Element parent = index.get(parentId);
        if (parent == null)
            throw new InvariantViolationException(DETACHED_REFERENCE,
                    element.getId(), "Parent " + parentId + " of "
                            + element.getId() + " not found");

        if (parent.isShape())
            throw new InvariantViolationException(SCOPE_VIOLATION,
                    element.getId(), "Shape " + parentId
                            + " cannot contain " + element.getId());

        Element ancestor = parent;
        for (int depth = 0; ancestor != null; depth++) {
            if (ancestor == element || depth > index.size())
                throw new InvariantViolationException(GROUP_CYCLE,
                        element.getId(), "Cyclic containment: " + element.getId());

            ancestor = index.get(ancestor.getParentId());
        }
    }

    private static void validateEnds(Map<String, Element> index, Element connector) {
        Connection conn = connector.getConnection();
        for (End end : End.values()) {
            String endId = conn.get(end);
            if (endId == null || conn.isDangling(end))
                continue;

            Element terminal = index.get(endId);
            if (terminal == null)
                throw new InvariantViolationException(DETACHED_REFERENCE,
                        connector.getId(), "Connector " + connector.getId()
                                + " " + end + " " + endId + " not found");

            if (terminal == connector)
                throw new InvariantViolationException(SCOPE_VIOLATION,
                        connector.getId(), "Connector " + connector.getId()
                                + " attached to itself");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Page))
            return false;

        Page other = (Page) obj;
        return id.equals(other.id)
                && Objects.equals(name, other.name)
                && settings.equals(other.settings)
                && root.equals(other.root)
                && layers.equals(other.layers)
                && elements.equals(other.elements)
                && new ArrayList<>(extraAttributes.entrySet())
                        .equals(new ArrayList<>(other.extraAttributes.entrySet()))
                && extraNodes.equals(other.extraNodes)
                && modelNodes.equals(other.modelNodes)
                && rootNodes.equals(other.rootNodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, settings, elements);
    }

    @Override
    public String toString() {
        return "Page(id=" + id + ", name=" + name
                + ", elements=" + elements.size() + ")";
    }


    public static final class Builder {

        final String id;
        String name;
        PageSettings settings = PageSettings.defaults();
        Layer root;
        List<Layer> layers = new ArrayList<>();
        List<Element> elements = new ArrayList<>();
        Map<String, String> extraAttributes = Collections.emptyMap();
        List<XMLNode> extraNodes = Collections.emptyList();
        List<XMLNode> modelNodes = Collections.emptyList();
        List<XMLNode> rootNodes = Collections.emptyList();

        Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder settings(PageSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder root(Layer root) {
            if (!root.isRoot())
                throw new IllegalArgumentException("Not a root cell: " + root);

            this.root = root;
            return this;
        }

        public Builder layer(Layer layer) {
            layers.add(layer);
            return this;
        }

        public Builder element(Element element) {
            elements.add(element);
            return this;
        }

        public Builder elements(List<Element> list) {
            elements.addAll(list);
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

        public Builder modelNodes(List<XMLNode> nodes) {
            this.modelNodes = Objects.requireNonNull(nodes);
            return this;
        }

        public Builder rootNodes(List<XMLNode> nodes) {
            this.rootNodes = Objects.requireNonNull(nodes);
            return this;
        }

        /**
         * A missing root cell is created as {@code "0"}; an empty page
         * without layers gets a default layer {@code "1"}.
         *
         * @throws  InvariantViolationException  if the page content is
         *          inconsistent
         */
        public Page build() {
            if (root == null) {
                root = Layer.root("0");
            }
            if (layers.isEmpty() && elements.isEmpty()) {
                layers.add(Layer.of(root.getId().equals("1") ? "0" : "1", root.getId()));
            }
            return new Page(this);
        }

    } // class Builder


}
