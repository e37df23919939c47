/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.geom;

import static io.github.stanio.diagram.geom.Numbers.requireFinite;

/**
 * Immutable 2D point.
 */
public final class Point {

    public static final Point ORIGIN = new Point(0, 0);

    private final double x;
    private final double y;

    public Point(double x, double y) {
        this.x = requireFinite(x, "x");
        this.y = requireFinite(y, "y");
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Point translated(double dx, double dy) {
        if (dx == 0 && dy == 0)
            return this;

        return new Point(x + dx, y + dy);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Point))
            return false;

        Point other = (Point) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "Point(" + Numbers.format(x) + ", " + Numbers.format(y) + ")";
    }

}
