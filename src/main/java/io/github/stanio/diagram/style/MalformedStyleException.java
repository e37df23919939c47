/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.style;

/**
 * Signals a style string that can't be split into well-formed
 * {@code key=value} entries.
 *
 * @see  Style#parse(String)
 */
public class MalformedStyleException extends IllegalArgumentException {

    private static final long serialVersionUID = 4127436581059276624L;

    private final String style;
    private final int offset;

    public MalformedStyleException(String message, String style, int offset) {
        super(message + " (offset " + offset + "): " + style);
        this.style = style;
        this.offset = offset;
    }

    /**
     * @return  the complete style text being parsed
     */
    public String getStyle() {
        return style;
    }

    /**
     * @return  the offset of the offending entry
     */
    public int getOffset() {
        return offset;
    }

}
