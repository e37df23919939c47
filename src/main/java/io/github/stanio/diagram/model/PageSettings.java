/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.github.stanio.diagram.geom.Numbers;

/**
 * Page-level graph settings: the {@code <mxGraphModel>} attributes, in
 * document order, with typed access to the common ones.  Attributes not
 * covered by an accessor are kept as they are.
 */
public final class PageSettings {

    public static final PageSettings EMPTY = new PageSettings(Collections.emptyMap());

    private final Map<String, String> attributes;

    public PageSettings(Map<String, String> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * The settings draw.io writes for a new blank page.
     */
    public static PageSettings defaults() {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("grid", "1");
        attrs.put("gridSize", "10");
        attrs.put("guides", "1");
        attrs.put("tooltips", "1");
        attrs.put("connect", "1");
        attrs.put("arrows", "1");
        attrs.put("fold", "1");
        attrs.put("page", "1");
        attrs.put("pageScale", "1");
        attrs.put("pageWidth", "850");
        attrs.put("pageHeight", "1100");
        attrs.put("math", "0");
        attrs.put("shadow", "0");
        return new PageSettings(attrs);
    }

    public Map<String, String> asMap() {
        return attributes;
    }

    public String get(String name) {
        return attributes.get(name);
    }

    public PageSettings with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        if (value == null) {
            copy.remove(name);
        } else {
            copy.put(name, value);
        }
        return new PageSettings(copy);
    }

    public boolean isGridEnabled() {
        return "1".equals(attributes.get("grid"));
    }

    public PageSettings withGridEnabled(boolean enabled) {
        return with("grid", enabled ? "1" : "0");
    }

    public double getGridSize() {
        return number("gridSize", 10);
    }

    public PageSettings withGridSize(double size) {
        if (!(size > 0))
            throw new IllegalArgumentException("Grid size must be positive: " + size);

        return with("gridSize", Numbers.format(size));
    }

    /**
     * @return  the background color, or {@code null} if none
     */
    public String getBackground() {
        return attributes.get("background");
    }

    public PageSettings withBackground(String color) {
        return with("background", color);
    }

    public double getPageWidth() {
        return number("pageWidth", 850);
    }

    public double getPageHeight() {
        return number("pageHeight", 1100);
    }

    public PageSettings withPageSize(double width, double height) {
        return with("pageWidth", Numbers.format(width))
                .with("pageHeight", Numbers.format(height));
    }

    private double number(String name, double defaultValue) {
        String value = attributes.get(name);
        if (value == null)
            return defaultValue;

        try {
            return Numbers.parse(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof PageSettings))
            return false;

        return new ArrayList<>(attributes.entrySet())
                .equals(new ArrayList<>(((PageSettings) obj).attributes.entrySet()));
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "PageSettings" + attributes;
    }

}
