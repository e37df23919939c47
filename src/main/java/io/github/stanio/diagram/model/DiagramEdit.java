/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.event.ChangeEvent.Cause;

/**
 * A planned change to the page list or the metadata of a diagram.
 * Like {@link PageEdit}, it records the exact state before and after so
 * that {@link #inverse()} restores the previous state.
 *
 * @see  Diagram#apply(DiagramEdit)
 * @see  DiagramOperations
 */
public final class DiagramEdit {

    enum Op { INSERT_PAGE, REMOVE_PAGE, UPDATE_PAGE, UPDATE_METADATA }

    private final Op op;
    private final Cause cause;
    private final int index;
    private final Page page;
    private final String nameBefore;
    private final String nameAfter;
    private final PageSettings settingsBefore;
    private final PageSettings settingsAfter;
    private final Map<String, String> metadataBefore;
    private final Map<String, String> metadataAfter;

    private DiagramEdit(Op op, Cause cause, int index, Page page,
                        String nameBefore, String nameAfter,
                        PageSettings settingsBefore, PageSettings settingsAfter,
                        Map<String, String> metadataBefore,
                        Map<String, String> metadataAfter) {
        this.op = op;
        this.cause = cause;
        this.index = index;
        this.page = page;
        this.nameBefore = nameBefore;
        this.nameAfter = nameAfter;
        this.settingsBefore = settingsBefore;
        this.settingsAfter = settingsAfter;
        this.metadataBefore = metadataBefore;
        this.metadataAfter = metadataAfter;
    }

    static DiagramEdit insertPage(int index, Page page) {
        return new DiagramEdit(Op.INSERT_PAGE, Cause.EDIT, index,
                Objects.requireNonNull(page, "page"), null, null, null, null, null, null);
    }

    static DiagramEdit removePage(int index, Page page) {
        return new DiagramEdit(Op.REMOVE_PAGE, Cause.EDIT, index,
                page, null, null, null, null, null, null);
    }

    static DiagramEdit updatePage(Page page,
                                  String newName, PageSettings newSettings) {
        return new DiagramEdit(Op.UPDATE_PAGE, Cause.EDIT, -1, page,
                page.getName(), newName, page.getSettings(),
                Objects.requireNonNull(newSettings, "newSettings"), null, null);
    }

    static DiagramEdit updateMetadata(Map<String, String> before,
                                      Map<String, String> after) {
        return new DiagramEdit(Op.UPDATE_METADATA, Cause.EDIT, -1, null,
                null, null, null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(before)),
                Collections.unmodifiableMap(new LinkedHashMap<>(after)));
    }

    public ChangeEvent.Kind getKind() {
        switch (op) {
        case INSERT_PAGE:
            return ChangeEvent.Kind.PAGE_ADDED;
        case REMOVE_PAGE:
            return ChangeEvent.Kind.PAGE_REMOVED;
        case UPDATE_PAGE:
            return ChangeEvent.Kind.PAGE_CHANGED;
        default:
            return ChangeEvent.Kind.DIAGRAM_CHANGED;
        }
    }

    public Cause getCause() {
        return cause;
    }

    /**
     * @return  the id of the page affected, or {@code null} for metadata
     *          changes
     */
    public String getPageId() {
        return (page == null) ? null : page.getId();
    }

    Op op() {
        return op;
    }

    int index() {
        return index;
    }

    Page page() {
        return page;
    }

    String nameBefore() {
        return nameBefore;
    }

    String nameAfter() {
        return nameAfter;
    }

    PageSettings settingsBefore() {
        return settingsBefore;
    }

    PageSettings settingsAfter() {
        return settingsAfter;
    }

    Map<String, String> metadataBefore() {
        return metadataBefore;
    }

    Map<String, String> metadataAfter() {
        return metadataAfter;
    }

    public DiagramEdit inverse() {
        switch (op) {
        case INSERT_PAGE:
            return new DiagramEdit(Op.REMOVE_PAGE, Cause.UNDO, index, page,
                    null, null, null, null, null, null);
        case REMOVE_PAGE:
            return new DiagramEdit(Op.INSERT_PAGE, Cause.UNDO, index, page,
                    null, null, null, null, null, null);
        default:
            return new DiagramEdit(op, Cause.UNDO, index, page,
                    nameAfter, nameBefore, settingsAfter, settingsBefore,
                    metadataAfter, metadataBefore);
        }
    }

    public DiagramEdit redo() {
        return new DiagramEdit(op, Cause.REDO, index, page,
                nameBefore, nameAfter, settingsBefore, settingsAfter,
                metadataBefore, metadataAfter);
    }

    @Override
    public String toString() {
        return "DiagramEdit(" + op + ", " + cause
                + (page == null ? "" : ", page=" + page.getId()) + ")";
    }

}
