/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import static io.github.stanio.diagram.model.InvariantViolationException.Kind.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plans page management and metadata changes as {@link DiagramEdit}s.
 */
public final class DiagramOperations {

    private DiagramOperations() {
        // no instances
    }

    /**
     * Adds a blank page at the given position.
     *
     * @param   index  position in the page list; {@code -1} to append
     */
    public static DiagramEdit addPage(Diagram diagram, int index, String name) {
        return insertPage(diagram, index,
                Page.blank(diagram.newPageId(), name));
    }

    public static DiagramEdit insertPage(Diagram diagram, int index, Page page) {
        if (page.bus() != null)
            throw new IllegalArgumentException("Page " + page.getId()
                    + " already belongs to a diagram");
        if (diagram.getPage(page.getId()) != null)
            throw new InvariantViolationException(ID_COLLISION, page.getId(),
                    "Duplicate page id: " + page.getId());

        int position = (index < 0) ? diagram.pageCount() : index;
        if (position > diagram.pageCount())
            throw new IndexOutOfBoundsException("Page index " + index
                    + " out of bounds for " + diagram.pageCount() + " pages");

        return DiagramEdit.insertPage(position, page);
    }

    public static DiagramEdit removePage(Diagram diagram, String pageId) {
        Page page = diagram.requirePage(pageId);
        if (diagram.pageCount() == 1)
            throw new InvariantViolationException(SCOPE_VIOLATION, pageId,
                    "Cannot remove the only page");

        return DiagramEdit.removePage(diagram.indexOf(pageId), page);
    }

    public static DiagramEdit renamePage(Diagram diagram, String pageId, String name) {
        Page page = diagram.requirePage(pageId);
        return DiagramEdit.updatePage(page, name, page.getSettings());
    }

    /**
     * Replaces the graph settings (grid, background, page size...) of a page.
     */
    public static DiagramEdit changeSettings(Diagram diagram,
                                             String pageId, PageSettings settings) {
        Page page = diagram.requirePage(pageId);
        return DiagramEdit.updatePage(page, page.getName(), settings);
    }

    /**
     * Sets or (given a {@code null} value) removes a document attribute.
     */
    public static DiagramEdit setMetadata(Diagram diagram, String name, String value) {
        Map<String, String> updated = new LinkedHashMap<>(diagram.getMetadata());
        if (value == null) {
            updated.remove(name);
        } else {
            updated.put(name, value);
        }
        return DiagramEdit.updateMetadata(diagram.getMetadata(), updated);
    }

}
