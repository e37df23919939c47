/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.style;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

import io.github.stanio.diagram.geom.Numbers;

/**
 * Immutable, ordered style record parsed from a draw.io style string:
 * <pre>
 * <code>rounded=0;whiteSpace=wrap;html=1;fillColor=#dae8fc;</code></pre>
 * <p>
 * Entries are separated by {@code ';'}.  An entry without {@code '='} is a
 * bare <i>flag</i> (value {@code null}), commonly a shape or named style
 * reference like {@code ellipse} or {@code text}.  When a key repeats, the
 * last value wins while the entry keeps the position of its first
 * occurrence.</p>
 * <p>
 * A style obtained by {@link #parse(String)} and not modified afterwards
 * reproduces its source text exactly from {@link #toString()}, including
 * empty segments, duplicate keys and the trailing delimiter.  Keys with no
 * defined meaning are kept like any other.</p>
 */
public final class Style {

    static final char FIELD_DELIMITER = ';';
    static final char VALUE_DELIMITER = '=';

    /**
     * Characters never found in style names.  Their presence in a key
     * usually means an unescaped {@code ';'} inside a preceding value,
     * e.g. in a {@code data:image/svg+xml;base64,...} URI.
     */
    private static final String INVALID_KEY_CHARS = " \t\r\n,\"'<>(){}";

    static final List<String> SHAPE_FLAGS = Arrays.asList("ellipse",
            "rhombus", "triangle", "text", "line", "image", "label",
            "swimlane", "cylinder", "hexagon", "cloud", "doubleEllipse",
            "actor", "rectangle");

    public static final Style EMPTY = new Style("", Collections.emptyMap(), true, false);

    /** Exact source text; {@code null} once modified. */
    private final String source;
    private final Map<String, String> entries;
    private final boolean trailingDelimiter;
    private final boolean raw;

    private Style(String source, Map<String, String> entries,
                  boolean trailingDelimiter, boolean raw) {
        this.source = source;
        this.entries = entries;
        this.trailingDelimiter = trailingDelimiter;
        this.raw = raw;
    }

    /**
     * Parses the given style string.
     *
     * @param   text  the style text
     * @return  a style reproducing {@code text} from {@code toString()}
     * @throws  MalformedStyleException  if an entry has an empty key with a
     *          value ({@code =x}), or a key containing characters not valid
     *          in a style name
     */
    public static Style parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty())
            return EMPTY;

        Map<String, String> entries = new LinkedHashMap<>();
        int len = text.length();
        int pos = 0;
        while (pos < len) {
            int end = text.indexOf(FIELD_DELIMITER, pos);
            if (end < 0) end = len;

            if (end > pos) {
                int eq = text.indexOf(VALUE_DELIMITER, pos);
                String key;
                String value;
                if (eq < 0 || eq > end) {
                    key = text.substring(pos, end);
                    value = null;
                } else {
                    key = text.substring(pos, eq);
                    value = text.substring(eq + 1, end);
                }
                checkKey(key, text, pos);
                entries.put(key, value);
            }
            pos = end + 1;
        }
        return new Style(text, Collections.unmodifiableMap(entries),
                text.charAt(len - 1) == FIELD_DELIMITER, false);
    }

    private static void checkKey(String key, String text, int offset) {
        if (key.isEmpty()) {
            throw new MalformedStyleException("Empty style key", text, offset);
        }
        for (int i = 0, len = key.length(); i < len; i++) {
            char ch = key.charAt(i);
            if (INVALID_KEY_CHARS.indexOf(ch) >= 0 || Character.isISOControl(ch)) {
                throw new MalformedStyleException("Invalid character '" + ch
                        + "' in style key \"" + key + '"', text, offset + i);
            }
        }
    }

    /**
     * Like {@link #parse(String)} but falls back to an opaque
     * {@link #isRaw() raw} style instead of failing.
     *
     * @param   text  the style text
     * @return  a parsed or a raw style, reproducing {@code text} either way
     */
    public static Style parseLenient(String text) {
        try {
            return parse(text);
        } catch (MalformedStyleException e) {
            return raw(text);
        }
    }

    /**
     * An opaque style kept verbatim.  Has no entries and can't be modified,
     * only replaced.
     *
     * @param   text  the style text
     * @return  a raw style for the given text
     */
    public static Style raw(String text) {
        return new Style(Objects.requireNonNull(text, "text"),
                Collections.emptyMap(), false, true);
    }

    /**
     * @param   entries  style entries in order, {@code null} values for flags
     * @return  a new style with the given entries
     */
    public static Style of(Map<String, String> entries) {
        Map<String, String> copy = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            checkKey(key, key, 0);
            copy.put(key, value);
        });
        return new Style(null, Collections.unmodifiableMap(copy), true, false);
    }

    public boolean isRaw() {
        return raw;
    }

    public boolean isEmpty() {
        return raw ? source.isEmpty() : entries.isEmpty();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean isFlag(String key) {
        return entries.containsKey(key) && entries.get(key) == null;
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    /**
     * @return  an unmodifiable view of the entries, {@code null} values
     *          denoting flags
     */
    public Map<String, String> asMap() {
        return entries;
    }

    /**
     * @param   key  the property name
     * @return  the value, or {@code null} if absent or a flag
     */
    public String getString(String key) {
        return entries.get(key);
    }

    public OptionalDouble getNumber(String key) {
        String value = entries.get(key);
        if (value == null || value.isEmpty())
            return OptionalDouble.empty();

        try {
            return OptionalDouble.of(Numbers.parse(value));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * {@code 1} and {@code true} are {@code true}; a bare flag is
     * {@code true}; other values are {@code false}.
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        if (!entries.containsKey(key))
            return defaultValue;

        String value = entries.get(key);
        return value == null || value.equals("1") || value.equalsIgnoreCase("true");
    }

    public Style with(String key, String value) {
        if (!raw && entries.containsKey(key)
                && Objects.equals(entries.get(key), value))
            return this;

        Map<String, String> copy = editableEntries();
        if (!entries.containsKey(key)) {
            checkKey(key, key, 0);
        }
        if (value != null && value.indexOf(FIELD_DELIMITER) >= 0)
            throw new IllegalArgumentException("Style value contains '"
                    + FIELD_DELIMITER + "': " + value);

        copy.put(key, value);
        return modified(copy);
    }

    public Style with(String key, Number value) {
        return with(key, Numbers.format(value.doubleValue()));
    }

    public Style with(String key, boolean value) {
        return with(key, value ? "1" : "0");
    }

    public Style withFlag(String key) {
        return with(key, (String) null);
    }

    public Style without(String key) {
        if (!entries.containsKey(key))
            return this;

        Map<String, String> copy = editableEntries();
        copy.remove(key);
        return modified(copy);
    }

    private Map<String, String> editableEntries() {
        if (raw)
            throw new IllegalStateException("Raw style can't be modified: " + source);

        return new LinkedHashMap<>(entries);
    }

    private Style modified(Map<String, String> newEntries) {
        return new Style(null, Collections.unmodifiableMap(newEntries),
                trailingDelimiter, false);
    }

    /**
     * The shape type tag: the {@code shape} value, or the first known shape
     * flag (like {@code ellipse}), or {@code rectangle}.
     */
    public String shapeType() {
        String shape = entries.get("shape");
        if (shape != null && !shape.isEmpty())
            return shape;

        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (entry.getValue() == null && SHAPE_FLAGS.contains(entry.getKey()))
                return entry.getKey();
        }
        return "rectangle";
    }

    /**
     * @return  the connector routing style tag, or {@code null}
     */
    public String edgeStyle() {
        return entries.get("edgeStyle");
    }

    public boolean isLocked() {
        return getBoolean("locked", false);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Style))
            return false;

        Style other = (Style) obj;
        return raw == other.raw && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
     * @return  the style text: the exact source if not modified
     */
    @Override
    public String toString() {
        if (source != null)
            return source;

        StringBuilder buf = new StringBuilder();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (buf.length() > 0) {
                buf.append(FIELD_DELIMITER);
            }
            buf.append(entry.getKey());
            if (entry.getValue() != null) {
                buf.append(VALUE_DELIMITER).append(entry.getValue());
            }
        }
        if (trailingDelimiter && buf.length() > 0) {
            buf.append(FIELD_DELIMITER);
        }
        return buf.toString();
    }

}
