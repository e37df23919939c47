/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.codec;

import static io.github.stanio.diagram.codec.FormatException.Kind.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.DataFormatException;

import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.geom.Numbers;
import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.DanglingReferencePolicy;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.Element.Connection;
import io.github.stanio.diagram.model.InvariantViolationException;
import io.github.stanio.diagram.model.Layer;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.PageSettings;
import io.github.stanio.diagram.style.Style;
import io.github.stanio.diagram.xml.XMLNode;
import io.github.stanio.diagram.xml.XMLNodeReader;

/**
 * Builds a {@code Diagram} from an {@code <mxfile>} or a bare
 * {@code <mxGraphModel>} document.
 */
class DiagramDecoder {

    private static final Logger log = Logger.getLogger(DiagramDecoder.class.getName());

    static final String MXFILE = "mxfile";
    static final String DIAGRAM = "diagram";
    static final String GRAPH_MODEL = "mxGraphModel";
    static final String ROOT = "root";
    static final String CELL = "mxCell";
    static final String GEOMETRY = "mxGeometry";
    static final String POINT = "mxPoint";
    static final String ARRAY = "Array";

    static final String OBJECT = "object";
    static final String USER_OBJECT = "UserObject";

    private final DanglingReferencePolicy danglingReferences;

    private final XMLNodeReader xmlReader = new XMLNodeReader();

    DiagramDecoder(DanglingReferencePolicy danglingReferences) {
        this.danglingReferences = danglingReferences;
    }

    public Diagram decode(InputSource source) throws IOException {
        XMLNode document = parse(source, null);
        String name = document.getName();
        if (name.equals(MXFILE))
            return decodeFile(document);

        if (name.equals(GRAPH_MODEL)) {
            Page.Builder page = Page.builder("page-1");
            decodeModel(page, document, "/" + GRAPH_MODEL);
            return Diagram.builder()
                    .bareGraphModel(true)
                    .page(build(page, "/" + GRAPH_MODEL))
                    .build();
        }
        throw new FormatException(MALFORMED_XML, "Not a diagram document",
                "/" + name, null);
    }

    private XMLNode parse(InputSource source, String path) throws IOException {
        try {
            return xmlReader.parse(source);
        } catch (SAXParseException e) {
            String location = "line " + e.getLineNumber()
                              + ", column " + e.getColumnNumber();
            throw new FormatException(MALFORMED_XML, e.getMessage(),
                    (path == null) ? location : path + " (" + location + ")", null, e);
        } catch (SAXException e) {
            throw new FormatException(MALFORMED_XML, String.valueOf(e.getMessage()),
                    path, null, e);
        }
    }

    private Diagram decodeFile(XMLNode file) throws IOException {
        String filePath = "/" + MXFILE;
        Set<String> pageIds = new HashSet<>();
        int index = 0;
        for (XMLNode child : file.getChildren()) {
            if (!child.getName().equals(DIAGRAM))
                continue;

            index++;
            String id = child.getAttribute("id");
            if (id != null && !pageIds.add(id))
                throw new FormatException(DUPLICATE_ID, "Duplicate page id",
                        pagePath(index), id);
        }

        Diagram.Builder diagram = Diagram.builder().metadata(file.getAttributes());
        List<XMLNode> extraNodes = new ArrayList<>();
        index = 0;
        for (Object item : file.getContent()) {
            if (item instanceof String)
                throw new FormatException(MALFORMED_XML, "Unexpected text content",
                        filePath, (String) item);

            XMLNode child = (XMLNode) item;
            if (!child.getName().equals(DIAGRAM)) {
                extraNodes.add(child);
                continue;
            }

            index++;
            String id = child.getAttribute("id");
            if (id == null) {
                id = newPageId(pageIds, index);
                log.log(Level.FINE, "Page {0} has no id, using: {1}",
                        new Object[] { pagePath(index), id });
            }
            diagram.page(decodePage(child, id, pagePath(index)));
        }
        return diagram.extraNodes(extraNodes).build();
    }

    private static String pagePath(int index) {
        return "/" + MXFILE + "/" + DIAGRAM + "[" + index + "]";
    }

    private static String newPageId(Set<String> used, int index) {
        for (int n = index; ; n++) {
            String candidate = "page-" + n;
            if (used.add(candidate))
                return candidate;
        }
    }

    private Page decodePage(XMLNode node, String id, String path) throws IOException {
        Map<String, String> extraAttributes = new LinkedHashMap<>(node.getAttributes());
        extraAttributes.remove("id");
        extraAttributes.remove("name");

        XMLNode model = null;
        List<XMLNode> extraNodes = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (Object item : node.getContent()) {
            if (item instanceof String) {
                text.append((String) item);
            } else if (model == null && ((XMLNode) item).getName().equals(GRAPH_MODEL)) {
                model = (XMLNode) item;
            } else {
                extraNodes.add((XMLNode) item);
            }
        }

        String content = text.toString().trim();
        if (model != null && !content.isEmpty())
            throw new FormatException(MALFORMED_XML, "Both compressed and plain content",
                    path, content);

        if (!content.isEmpty()) {
            model = inflate(content, path);
        }

        Page.Builder page = Page.builder(id)
                .name(node.getAttribute("name"))
                .extraAttributes(extraAttributes)
                .extraNodes(extraNodes);
        if (model != null) {
            decodeModel(page, model, path + "/" + GRAPH_MODEL);
        }
        return build(page, path);
    }

    private XMLNode inflate(String content, String path) throws IOException {
        String xml;
        try {
            xml = Envelope.decompress(content);
        } catch (DataFormatException e) {
            throw new FormatException(MALFORMED_COMPRESSION, String.valueOf(e.getMessage()),
                    path, content, e);
        }

        XMLNode model = parse(new InputSource(new StringReader(xml)), path);
        if (!model.getName().equals(GRAPH_MODEL))
            throw new FormatException(MALFORMED_XML, "Compressed content is not a graph model",
                    path, "<" + model.getName());

        return model;
    }

    private static Page build(Page.Builder page, String path) throws FormatException {
        try {
            return page.build();
        } catch (InvariantViolationException e) {
            throw new FormatException(e.getKind() == InvariantViolationException.Kind.ID_COLLISION
                                      ? DUPLICATE_ID : UNRESOLVABLE_REFERENCE,
                                      e.getMessage(), path, e.getElementId(), e);
        }
    }

    private void decodeModel(Page.Builder page, XMLNode model, String path)
            throws FormatException {
        page.settings(new PageSettings(model.getAttributes()));

        XMLNode root = null;
        List<XMLNode> modelNodes = new ArrayList<>();
        for (XMLNode child : model.getChildren()) {
            if (root == null && child.getName().equals(ROOT)) {
                root = child;
            } else {
                modelNodes.add(child);
            }
        }
        page.modelNodes(modelNodes);

        if (root != null) {
            decodeCells(page, root, path + "/" + ROOT);
        }
    }

    private void decodeCells(Page.Builder page, XMLNode root, String path)
            throws FormatException {
        Map<String, RawCell> cells = new LinkedHashMap<>();
        List<XMLNode> rootNodes = new ArrayList<>();
        Map<String, Integer> nameIndex = new HashMap<>();
        for (XMLNode child : root.getChildren()) {
            String name = child.getName();
            String cellPath = path + "/" + name + "[" + nameIndex.merge(name, 1, Integer::sum) + "]";
            if (!name.equals(CELL) && !name.equals(OBJECT) && !name.equals(USER_OBJECT)) {
                rootNodes.add(child);
                continue;
            }

            RawCell cell = RawCell.read(child, cellPath);
            if (cells.putIfAbsent(cell.id, cell) != null)
                throw new FormatException(DUPLICATE_ID, "Duplicate cell id", cellPath, cell.id);
        }
        page.rootNodes(rootNodes);
        if (cells.isEmpty())
            return;

        RawCell rootCell = null;
        Set<String> containers = new HashSet<>();
        for (RawCell cell : cells.values()) {
            if (cell.parentId != null) {
                containers.add(cell.parentId);
            } else if (rootCell == null) {
                rootCell = cell;
            } else {
                throw new FormatException(UNRESOLVABLE_REFERENCE, "Cell without parent",
                        cell.path, cell.id);
            }
        }
        if (rootCell == null)
            throw new FormatException(UNRESOLVABLE_REFERENCE, "No root cell", path, null);

        page.root(rootCell.toLayer());
        Set<String> structural = new HashSet<>();
        structural.add(rootCell.id);
        List<RawCell> elementCells = new ArrayList<>();
        for (RawCell cell : cells.values()) {
            if (cell == rootCell)
                continue;

            if (!cells.containsKey(cell.parentId))
                throw new FormatException(UNRESOLVABLE_REFERENCE, "Parent not found",
                        cell.path, cell.parentId);

            if (cell.parentId.equals(rootCell.id) && !cell.isVertex() && !cell.isEdge()) {
                page.layer(cell.toLayer());
                structural.add(cell.id);
            } else {
                elementCells.add(cell);
            }
        }

        for (RawCell cell : elementCells) {
            Element.Kind kind;
            if (cell.isEdge()) {
                kind = Element.Kind.CONNECTOR;
            } else if (cell.style().contains("group") || containers.contains(cell.id)) {
                kind = Element.Kind.GROUP;
            } else {
                kind = Element.Kind.SHAPE;
            }
            page.element(toElement(cell, kind, cells.keySet(), structural));
        }
    }

    private Element toElement(RawCell cell, Element.Kind kind,
                              Set<String> ids, Set<String> structural)
            throws FormatException {
        Map<String, String> extras = new LinkedHashMap<>(cell.attributes);
        extras.remove((kind == Element.Kind.CONNECTOR) ? "edge" : "vertex", "1");

        Element.Builder element = Element.builder(kind, cell.id)
                .label(cell.label)
                .style(cell.style())
                .parent(cell.parentId)
                .wrapper(cell.wrapper);
        if (extras.remove("visible", "0")) {
            element.visible(false);
        }
        if (kind == Element.Kind.GROUP && extras.remove("collapsed", "1")) {
            element.collapsed(true);
        }
        if (kind == Element.Kind.CONNECTOR) {
            String source = extras.remove("source");
            String target = extras.remove("target");
            element.connection(new Connection(source, target,
                    isDangling(cell, "source", source, ids, structural),
                    isDangling(cell, "target", target, ids, structural)));
        }

        List<XMLNode> extraNodes = new ArrayList<>();
        Geometry geometry = null;
        for (XMLNode child : cell.children) {
            if (geometry == null && child.getName().equals(GEOMETRY)
                    && "geometry".equals(child.getAttribute("as"))) {
                geometry = readGeometry(child);
            } else {
                extraNodes.add(child);
            }
        }
        return element.geometry(geometry)
                .extraAttributes(extras)
                .extraNodes(extraNodes)
                .build();
    }

    private boolean isDangling(RawCell cell, String end, String ref,
                               Set<String> ids, Set<String> structural)
            throws FormatException {
        if (ref == null || ids.contains(ref)
                && !structural.contains(ref) && !ref.equals(cell.id))
            return false;

        if (danglingReferences == DanglingReferencePolicy.FAIL)
            throw new FormatException(UNRESOLVABLE_REFERENCE,
                    "Connector " + end + " not found", cell.path, ref);

        log.log(Level.WARNING, "Connector {0} {1} \"{2}\" not found on page, retained as dangling",
                new Object[] { cell.path, end, ref });
        return true;
    }

    private static Geometry readGeometry(XMLNode node) {
        Map<String, String> extras = new LinkedHashMap<>(node.getAttributes());
        extras.remove("as");
        double x = number(extras, "x", false);
        double y = number(extras, "y", false);
        double width = number(extras, "width", true);
        double height = number(extras, "height", true);
        boolean relative = extras.remove("relative", "1");

        Point sourcePoint = null;
        Point targetPoint = null;
        Point offset = null;
        List<Point> waypoints = null;
        List<XMLNode> extraNodes = new ArrayList<>();
        for (XMLNode child : node.getChildren()) {
            String as = child.getAttribute("as");
            Point point = child.getName().equals(POINT) ? readPoint(child) : null;
            if (point != null && sourcePoint == null && "sourcePoint".equals(as)) {
                sourcePoint = point;
            } else if (point != null && targetPoint == null && "targetPoint".equals(as)) {
                targetPoint = point;
            } else if (point != null && offset == null && "offset".equals(as)) {
                offset = point;
            } else if (waypoints == null && child.getName().equals(ARRAY)
                    && "points".equals(as) && child.getAttributes().size() == 1
                    && readPoints(child) != null) {
                waypoints = readPoints(child);
            } else {
                extraNodes.add(child);
            }
        }

        Geometry geometry = Geometry.of(x, y, width, height)
                .withRelative(relative)
                .withSourcePoint(sourcePoint)
                .withTargetPoint(targetPoint)
                .withOffset(offset)
                .withExtraAttributes(extras)
                .withExtraNodes(extraNodes);
        return (waypoints == null) ? geometry : geometry.withWaypoints(waypoints);
    }

    /*
     * Removes the attribute if it's a valid number, otherwise it's kept
     * as an extra attribute.
     */
    private static double number(Map<String, String> attributes,
                                 String name, boolean nonNegative) {
        String value = attributes.get(name);
        if (value == null)
            return 0;

        try {
            double number = Numbers.parse(value);
            if (nonNegative && number < 0)
                return 0;

            attributes.remove(name);
            return number;
        } catch (NumberFormatException e) {
            log.log(Level.FINE, "Non-numeric geometry {0}=\"{1}\" kept as is",
                    new Object[] { name, value });
            return 0;
        }
    }

    /*
     * null if not a plain point.
     */
    private static Point readPoint(XMLNode node) {
        if (!node.getContent().isEmpty())
            return null;

        double x = 0;
        double y = 0;
        for (Map.Entry<String, String> entry : node.getAttributes().entrySet()) {
            try {
                switch (entry.getKey()) {
                case "x":
                    x = Numbers.parse(entry.getValue());
                    break;
                case "y":
                    y = Numbers.parse(entry.getValue());
                    break;
                case "as":
                    break;
                default:
                    return null;
                }
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return new Point(x, y);
    }

    /*
     * null if not a plain point list.
     */
    private static List<Point> readPoints(XMLNode array) {
        if (!array.getText().isEmpty())
            return null;

        List<Point> points = new ArrayList<>();
        for (XMLNode child : array.getChildren()) {
            Point point = child.getName().equals(POINT)
                          && child.getAttribute("as") == null
                          ? readPoint(child) : null;
            if (point == null)
                return null;

            points.add(point);
        }
        return points;
    }


    /**
     * A cell as read, before its kind is known.
     */
    private static final class RawCell {

        final String path;
        final String id;
        final String parentId;
        final String label;
        final String styleText;
        final Map<String, String> attributes;
        final List<XMLNode> children;
        final XMLNode wrapper;

        private Style style;

        private RawCell(String path, String id, String parentId,
                        String label, String styleText,
                        Map<String, String> attributes,
                        List<XMLNode> children, XMLNode wrapper) {
            this.path = path;
            this.id = id;
            this.parentId = parentId;
            this.label = label;
            this.styleText = styleText;
            this.attributes = attributes;
            this.children = children;
            this.wrapper = wrapper;
        }

        static RawCell read(XMLNode node, String path) throws FormatException {
            XMLNode cell = node;
            XMLNode wrapper = null;
            String id;
            String label;
            Map<String, String> attributes;
            if (node.getName().equals(CELL)) {
                attributes = new LinkedHashMap<>(node.getAttributes());
                id = attributes.remove("id");
                label = attributes.remove("value");
            } else {
                cell = null;
                List<Object> content = new ArrayList<>();
                for (Object item : node.getContent()) {
                    if (cell == null && item instanceof XMLNode
                            && ((XMLNode) item).getName().equals(CELL)) {
                        cell = (XMLNode) item;
                    } else {
                        content.add(item);
                    }
                }
                if (cell == null)
                    throw new FormatException(MALFORMED_XML, "No mxCell in " + node.getName(),
                            path, node.getAttribute("id"));

                id = node.getAttribute("id");
                label = node.getAttribute("label");
                wrapper = node.withoutAttributes("id", "label").withContent(content);
                attributes = new LinkedHashMap<>(cell.getAttributes());
            }
            if (id == null)
                throw new FormatException(MALFORMED_XML, "Cell without id", path, null);

            String parentId = attributes.remove("parent");
            String styleText = attributes.remove("style");
            return new RawCell(path, id, parentId, label, styleText,
                    attributes, cell.getChildren(), wrapper);
        }

        boolean isVertex() {
            return "1".equals(attributes.get("vertex"));
        }

        boolean isEdge() {
            return "1".equals(attributes.get("edge"));
        }

        Style style() {
            if (style == null) {
                style = (styleText == null) ? Style.EMPTY : Style.parseLenient(styleText);
                if (style.isRaw()) {
                    log.log(Level.WARNING, "Malformed style of {0} preserved as is: {1}",
                            new Object[] { path, styleText });
                }
            }
            return style;
        }

        Layer toLayer() {
            Map<String, String> extras = new LinkedHashMap<>(attributes);
            boolean visible = !extras.remove("visible", "0");
            return new Layer(id, parentId, label, style(), visible,
                    extras, children, wrapper);
        }

    } // class RawCell


}
