/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named styles a cell style may refer to by a bare token, like a
 * stylesheet.  {@code "myStyle;fillColor=red"} resolves to the entries of
 * {@code myStyle} overridden by the cell's own entries.
 * <p>
 * Resolution is read-only: cells keep their own style text.</p>
 */
public class StyleRegistry {

    private final Map<String, Style> named = new LinkedHashMap<>();

    public StyleRegistry register(String name, Style style) {
        if (style.isRaw())
            throw new IllegalArgumentException("Raw style can't be registered: " + name);

        named.put(Objects.requireNonNull(name, "name"), style);
        return this;
    }

    public Style unregister(String name) {
        return named.remove(name);
    }

    public Style get(String name) {
        return named.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(named.keySet());
    }

    /**
     * Resolves named style references.
     *
     * @param   style  a cell style
     * @return  the effective style; {@code style} itself if it's raw or
     *          refers to no registered names
     */
    public Style resolve(Style style) {
        if (style.isRaw())
            return style;

        boolean referenced = false;
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : style.asMap().entrySet()) {
            Style base = (entry.getValue() == null) ? named.get(entry.getKey()) : null;
            if (base != null) {
                resolved.putAll(base.asMap());
                referenced = true;
            }
        }
        if (!referenced)
            return style;

        for (Map.Entry<String, String> entry : style.asMap().entrySet()) {
            if (entry.getValue() != null || !named.containsKey(entry.getKey())) {
                resolved.put(entry.getKey(), entry.getValue());
            }
        }
        return Style.of(resolved);
    }

}
