/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.codec;

import java.io.IOException;
import java.util.Objects;

/**
 * Signals a document that cannot be loaded.  Carries the path of the
 * offending node (like {@code /mxfile/diagram[2]/mxGraphModel/root/mxCell[3]})
 * and the raw fragment that triggered the failure, where available.
 */
public class FormatException extends IOException {

    public enum Kind {
        MALFORMED_XML,
        MALFORMED_COMPRESSION,
        DUPLICATE_ID,
        UNRESOLVABLE_REFERENCE
    }

    private static final long serialVersionUID = -2296380419731861533L;

    private static final int MAX_FRAGMENT = 60;

    private final Kind kind;
    private final String nodePath;
    private final String fragment;

    public FormatException(Kind kind, String message,
                           String nodePath, String fragment) {
        this(kind, message, nodePath, fragment, null);
    }

    public FormatException(Kind kind, String message,
                           String nodePath, String fragment, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.nodePath = nodePath;
        this.fragment = abbreviate(fragment);
    }

    private static String abbreviate(String text) {
        if (text == null || text.length() <= MAX_FRAGMENT)
            return text;

        return text.substring(0, MAX_FRAGMENT - 3) + "...";
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return  the path of the offending node, or {@code null}
     */
    public String getNodePath() {
        return nodePath;
    }

    /**
     * @return  excerpt of the offending input, or {@code null}
     */
    public String getFragment() {
        return fragment;
    }

    @Override
    public String getMessage() {
        StringBuilder buf = new StringBuilder();
        buf.append(kind).append(": ").append(super.getMessage());
        if (nodePath != null) {
            buf.append(" at ").append(nodePath);
        }
        if (fragment != null) {
            buf.append(" (\"").append(fragment).append("\")");
        }
        return buf.toString();
    }

}
