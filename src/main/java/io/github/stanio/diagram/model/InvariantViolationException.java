/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import java.util.Objects;

/**
 * A model operation rejected because its result would break a structural
 * invariant.  The model is left unchanged.
 */
public class InvariantViolationException extends RuntimeException {

    public enum Kind {
        /** Id already used on the page (or by another page). */
        ID_COLLISION,
        /** Group containment would become cyclic. */
        GROUP_CYCLE,
        /** A reference doesn't resolve to an existing element. */
        DETACHED_REFERENCE,
        /** Operation not applicable to the element kind or its container. */
        SCOPE_VIOLATION,
        /** No element (or page) with the given id. */
        UNKNOWN_ELEMENT,
        /** The element geometry is locked. */
        LOCKED
    }

    private static final long serialVersionUID = 6906164516226357412L;

    private final Kind kind;
    private final String elementId;

    public InvariantViolationException(Kind kind, String elementId, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.elementId = elementId;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return  the id of the offending element, if known
     */
    public String getElementId() {
        return elementId;
    }

}
