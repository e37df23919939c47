/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes one committed model mutation.
 */
public final class ChangeEvent {

    public enum Kind {
        ELEMENT_CREATED,
        ELEMENT_DELETED,
        ELEMENT_MOVED,
        ELEMENT_RESIZED,
        ELEMENT_RESTYLED,
        ELEMENT_RELABELED,
        VISIBILITY_CHANGED,
        CONNECTED,
        DISCONNECTED,
        WAYPOINTS_CHANGED,
        GROUPED,
        UNGROUPED,
        MEMBERSHIP_CHANGED,
        PAGE_ADDED,
        PAGE_REMOVED,
        PAGE_CHANGED,
        DIAGRAM_CHANGED
    }

    /** How the mutation came about. */
    public enum Cause { EDIT, UNDO, REDO }

    private final Kind kind;
    private final Cause cause;
    private final String pageId;
    private final List<String> affectedIds;

    public ChangeEvent(Kind kind, Cause cause, String pageId, List<String> affectedIds) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.cause = Objects.requireNonNull(cause, "cause");
        this.pageId = pageId;
        this.affectedIds = Collections.unmodifiableList(new ArrayList<>(affectedIds));
    }

    public Kind getKind() {
        return kind;
    }

    public Cause getCause() {
        return cause;
    }

    /**
     * @return  the page the change applies to, or {@code null} for
     *          diagram-level changes
     */
    public String getPageId() {
        return pageId;
    }

    /**
     * @return  ids of the elements (or pages) directly affected
     */
    public List<String> getAffectedIds() {
        return affectedIds;
    }

    @Override
    public String toString() {
        return "ChangeEvent(" + kind + ", " + cause
                + ", page=" + pageId + ", ids=" + affectedIds + ")";
    }

}
