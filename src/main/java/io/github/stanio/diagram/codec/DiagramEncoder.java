/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.codec;

import static io.github.stanio.diagram.codec.DiagramDecoder.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.geom.Numbers;
import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.Element.Connection;
import io.github.stanio.diagram.model.Layer;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.xml.XMLNode;
import io.github.stanio.diagram.xml.XMLNodeWriter;

/**
 * Builds the document tree for a {@code Diagram}.  Encoding doesn't
 * validate: any diagram the model accepts is encoded.
 */
class DiagramEncoder {

    private final boolean uriEncodeCompressed;

    DiagramEncoder(boolean uriEncodeCompressed) {
        this.uriEncodeCompressed = uriEncodeCompressed;
    }

    /**
     * A diagram read from a bare graph model document, having a single
     * page without page-level data, is written back bare unless
     * compressed.
     */
    XMLNode encode(Diagram diagram, boolean compressed) {
        if (!compressed && diagram.isBareGraphModel() && diagram.pageCount() == 1) {
            Page page = diagram.getPage(0);
            if (page.getName() == null
                    && page.getExtraAttributes().isEmpty()
                    && page.getExtraNodes().isEmpty()
                    && diagram.getMetadata().isEmpty()
                    && diagram.getExtraNodes().isEmpty())
                return encodeModel(page);
        }

        List<Object> content = new ArrayList<>();
        for (Page page : diagram.getPages()) {
            content.add(encodePage(page, compressed));
        }
        content.addAll(diagram.getExtraNodes());
        return new XMLNode(MXFILE, diagram.getMetadata(), content);
    }

    private XMLNode encodePage(Page page, boolean compressed) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("id", page.getId());
        if (page.getName() != null) {
            attributes.put("name", page.getName());
        }
        attributes.putAll(page.getExtraAttributes());

        List<Object> content = new ArrayList<>();
        XMLNode model = encodeModel(page);
        if (compressed) {
            content.add(Envelope.compress(XMLNodeWriter.toString(model), uriEncodeCompressed));
        } else {
            content.add(model);
        }
        content.addAll(page.getExtraNodes());
        return new XMLNode(DIAGRAM, attributes, content);
    }

    private static XMLNode encodeModel(Page page) {
        List<Object> cells = new ArrayList<>();
        cells.add(encodeLayer(page.getRootCell()));
        for (Layer layer : page.getLayers()) {
            cells.add(encodeLayer(layer));
        }
        for (Element element : page.getElements()) {
            cells.add(encodeElement(element));
        }
        cells.addAll(page.getRootNodes());

        List<Object> content = new ArrayList<>();
        content.add(new XMLNode(ROOT, Collections.emptyMap(), cells));
        content.addAll(page.getModelNodes());
        return new XMLNode(GRAPH_MODEL, page.getSettings().asMap(), content);
    }

    private static XMLNode encodeLayer(Layer layer) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (layer.getWrapper() == null) {
            attributes.put("id", layer.getId());
            putIfNotNull(attributes, "value", layer.getLabel());
        }
        String style = layer.getStyle().toString();
        if (!style.isEmpty()) {
            attributes.put("style", style);
        }
        if (!layer.isVisible()) {
            attributes.put("visible", "0");
        }
        attributes.putAll(layer.getExtraAttributes());
        putIfNotNull(attributes, "parent", layer.getParentId());

        XMLNode cell = new XMLNode(CELL, attributes, layer.getExtraNodes());
        return wrap(layer.getWrapper(), layer.getId(), layer.getLabel(), cell);
    }

    private static XMLNode encodeElement(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (element.getWrapper() == null) {
            attributes.put("id", element.getId());
            putIfNotNull(attributes, "value", element.getLabel());
        }
        String style = element.getStyle().toString();
        if (!style.isEmpty()) {
            attributes.put("style", style);
        }
        if (element.isCollapsed()) {
            attributes.put("collapsed", "1");
        }
        if (element.isConnector()) {
            attributes.put("edge", "1");
        } else {
            attributes.put("vertex", "1");
        }
        if (!element.isVisible()) {
            attributes.put("visible", "0");
        }
        attributes.putAll(element.getExtraAttributes());
        attributes.put("parent", element.getParentId());
        if (element.isConnector()) {
            Connection connection = element.getConnection();
            putIfNotNull(attributes, "source", connection.getSourceId());
            putIfNotNull(attributes, "target", connection.getTargetId());
        }

        List<Object> content = new ArrayList<>();
        if (element.hasGeometry()) {
            content.add(encodeGeometry(element.getGeometry()));
        }
        content.addAll(element.getExtraNodes());

        XMLNode cell = new XMLNode(CELL, attributes, content);
        return wrap(element.getWrapper(), element.getId(), element.getLabel(), cell);
    }

    private static XMLNode wrap(XMLNode wrapper, String id, String label, XMLNode cell) {
        if (wrapper == null)
            return cell;

        Map<String, String> attributes = new LinkedHashMap<>();
        putIfNotNull(attributes, "label", label);
        attributes.putAll(wrapper.getAttributes());
        attributes.put("id", id);

        List<Object> content = new ArrayList<>();
        content.add(cell);
        content.addAll(wrapper.getContent());
        return new XMLNode(wrapper.getName(), attributes, content);
    }

    private static XMLNode encodeGeometry(Geometry geometry) {
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfNotZero(attributes, "x", geometry.getX());
        putIfNotZero(attributes, "y", geometry.getY());
        putIfNotZero(attributes, "width", geometry.getWidth());
        putIfNotZero(attributes, "height", geometry.getHeight());
        if (geometry.isRelative()) {
            attributes.put("relative", "1");
        }
        attributes.putAll(geometry.getExtraAttributes());
        attributes.put("as", "geometry");

        List<Object> content = new ArrayList<>();
        addPoint(content, geometry.getSourcePoint(), "sourcePoint");
        addPoint(content, geometry.getTargetPoint(), "targetPoint");
        if (!geometry.getWaypoints().isEmpty()) {
            List<Object> points = new ArrayList<>();
            for (Point point : geometry.getWaypoints()) {
                addPoint(points, point, null);
            }
            content.add(new XMLNode(ARRAY, Collections.singletonMap("as", "points"), points));
        }
        addPoint(content, geometry.getOffset(), "offset");
        content.addAll(geometry.getExtraNodes());
        return new XMLNode(GEOMETRY, attributes, content);
    }

    private static void addPoint(List<Object> content, Point point, String as) {
        if (point == null)
            return;

        Map<String, String> attributes = new LinkedHashMap<>();
        putIfNotZero(attributes, "x", point.getX());
        putIfNotZero(attributes, "y", point.getY());
        putIfNotNull(attributes, "as", as);
        content.add(XMLNode.of(POINT, attributes));
    }

    private static void putIfNotNull(Map<String, String> attributes,
                                     String name, String value) {
        if (value != null) {
            attributes.put(name, value);
        }
    }

    private static void putIfNotZero(Map<String, String> attributes,
                                     String name, double value) {
        if (Double.compare(value, 0.0) != 0) {
            attributes.put(name, Numbers.format(value));
        }
    }

}
