/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.geom;

import static io.github.stanio.diagram.geom.Numbers.requireFinite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.github.stanio.diagram.xml.XMLNode;

/**
 * Immutable position, size, and routing points of a diagram element.
 * <p>
 * For vertices {@code x, y, width, height} define the bounds relative to
 * the parent.  Connectors usually have {@code relative} geometry, an
 * ordered list of waypoints, and terminal points used when an end is not
 * attached to an element.</p>
 * <p>
 * Attributes and child markup this model doesn't interpret are carried
 * along unchanged ({@link #getExtraAttributes()},
 * {@link #getExtraNodes()}).</p>
 */
public final class Geometry {

    public static final Geometry EMPTY = of(0, 0, 0, 0);

    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final boolean relative;
    private final Point sourcePoint;
    private final Point targetPoint;
    private final Point offset;
    private final List<Point> waypoints;
    private final Map<String, String> extraAttributes;
    private final List<XMLNode> extraNodes;

    private Geometry(double x, double y, double width, double height,
                     boolean relative, Point sourcePoint, Point targetPoint,
                     Point offset, List<Point> waypoints,
                     Map<String, String> extraAttributes,
                     List<XMLNode> extraNodes) {
        this.x = requireFinite(x, "x");
        this.y = requireFinite(y, "y");
        this.width = requireFinite(width, "width");
        this.height = requireFinite(height, "height");
        if (width < 0 || height < 0)
            throw new IllegalArgumentException("Negative size: "
                    + Numbers.format(width) + " x " + Numbers.format(height));

        this.relative = relative;
        this.sourcePoint = sourcePoint;
        this.targetPoint = targetPoint;
        this.offset = offset;
        this.waypoints = waypoints;
        this.extraAttributes = extraAttributes;
        this.extraNodes = extraNodes;
    }

    public static Geometry of(double x, double y, double width, double height) {
        return new Geometry(x, y, width, height, false, null, null, null,
                Collections.emptyList(), Collections.emptyMap(), Collections.emptyList());
    }

    /**
     * Geometry for a connector: relative, zero bounds.
     */
    public static Geometry relative() {
        return EMPTY.withRelative(true);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public boolean isRelative() {
        return relative;
    }

    public Point getSourcePoint() {
        return sourcePoint;
    }

    public Point getTargetPoint() {
        return targetPoint;
    }

    public Point getOffset() {
        return offset;
    }

    public List<Point> getWaypoints() {
        return waypoints;
    }

    public Map<String, String> getExtraAttributes() {
        return extraAttributes;
    }

    public List<XMLNode> getExtraNodes() {
        return extraNodes;
    }

    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    public Geometry movedTo(double newX, double newY) {
        return translated(newX - x, newY - y);
    }

    /**
     * Translates the bounds origin together with all routing points.  The
     * origin of a relative geometry is not translated: it's a position
     * along the connector, not in the container.
     */
    public Geometry translated(double dx, double dy) {
        if (dx == 0 && dy == 0)
            return this;

        List<Point> points = new ArrayList<>(waypoints.size());
        for (Point p : waypoints) {
            points.add(p.translated(dx, dy));
        }
        return new Geometry(relative ? x : x + dx,
                relative ? y : y + dy, width, height, relative,
                translate(sourcePoint, dx, dy), translate(targetPoint, dx, dy),
                offset, Collections.unmodifiableList(points),
                extraAttributes, extraNodes);
    }

    private static Point translate(Point point, double dx, double dy) {
        return (point == null) ? null : point.translated(dx, dy);
    }

    public Geometry resized(double newWidth, double newHeight) {
        return new Geometry(x, y, newWidth, newHeight, relative,
                sourcePoint, targetPoint, offset, waypoints,
                extraAttributes, extraNodes);
    }

    public Geometry withRelative(boolean newRelative) {
        return new Geometry(x, y, width, height, newRelative,
                sourcePoint, targetPoint, offset, waypoints,
                extraAttributes, extraNodes);
    }

    public Geometry withSourcePoint(Point point) {
        return new Geometry(x, y, width, height, relative,
                point, targetPoint, offset, waypoints,
                extraAttributes, extraNodes);
    }

    public Geometry withTargetPoint(Point point) {
        return new Geometry(x, y, width, height, relative,
                sourcePoint, point, offset, waypoints,
                extraAttributes, extraNodes);
    }

    public Geometry withOffset(Point point) {
        return new Geometry(x, y, width, height, relative,
                sourcePoint, targetPoint, point, waypoints,
                extraAttributes, extraNodes);
    }

    public Geometry withWaypoints(List<Point> points) {
        List<Point> copy = new ArrayList<>(points);
        copy.forEach(Objects::requireNonNull);
        return new Geometry(x, y, width, height, relative,
                sourcePoint, targetPoint, offset,
                Collections.unmodifiableList(copy),
                extraAttributes, extraNodes);
    }

    public Geometry withExtraAttributes(Map<String, String> attributes) {
        return new Geometry(x, y, width, height, relative,
                sourcePoint, targetPoint, offset, waypoints,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)),
                extraNodes);
    }

    public Geometry withExtraNodes(List<XMLNode> nodes) {
        return new Geometry(x, y, width, height, relative,
                sourcePoint, targetPoint, offset, waypoints, extraAttributes,
                Collections.unmodifiableList(new ArrayList<>(nodes)));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Geometry))
            return false;

        Geometry other = (Geometry) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0
                && relative == other.relative
                && Objects.equals(sourcePoint, other.sourcePoint)
                && Objects.equals(targetPoint, other.targetPoint)
                && Objects.equals(offset, other.offset)
                && waypoints.equals(other.waypoints)
                && new ArrayList<>(extraAttributes.entrySet())
                        .equals(new ArrayList<>(other.extraAttributes.entrySet()))
                && extraNodes.equals(other.extraNodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height, relative, sourcePoint,
                targetPoint, offset, waypoints, extraAttributes, extraNodes);
    }

    @Override
    public String toString() {
        return "Geometry(x=" + Numbers.format(x)
                + ", y=" + Numbers.format(y)
                + ", width=" + Numbers.format(width)
                + ", height=" + Numbers.format(height)
                + (relative ? ", relative" : "")
                + (waypoints.isEmpty() ? "" : ", waypoints=" + waypoints) + ")";
    }

}
