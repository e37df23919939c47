/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.DiagramOperations;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.Element.End;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.PageOperations;
import io.github.stanio.diagram.model.PageSettings;
import io.github.stanio.diagram.model.RemovalPolicy;
import io.github.stanio.diagram.style.Style;

/**
 * Factory methods for the editing commands.
 */
public final class Commands {

    private Commands() {
        // no instances
    }

    public static PageCommand create(Page page, Element element) {
        return PageCommand.of(page, "Create " + element.getKind().name().toLowerCase(Locale.ROOT)
                + " " + element.getId(), p -> PageOperations.create(p, element));
    }

    public static PageCommand move(Page page, String id, double dx, double dy) {
        return PageCommand.of(page, "Move " + id,
                p -> PageOperations.move(p, id, dx, dy));
    }

    public static PageCommand resize(Page page, String id, double width, double height) {
        return PageCommand.of(page, "Resize " + id,
                p -> PageOperations.resize(p, id, width, height));
    }

    public static PageCommand restyle(Page page, String id, Style style) {
        return PageCommand.of(page, "Change style of " + id,
                p -> PageOperations.restyle(p, id, style));
    }

    public static PageCommand relabel(Page page, String id, String label) {
        return PageCommand.of(page, "Edit label of " + id,
                p -> PageOperations.relabel(p, id, label));
    }

    public static PageCommand setVisible(Page page, String id, boolean visible) {
        return PageCommand.of(page, (visible ? "Show " : "Hide ") + id,
                p -> PageOperations.setVisible(p, id, visible));
    }

    public static PageCommand connect(Page page, String connectorId,
                                      String sourceId, String targetId) {
        return PageCommand.of(page, "Connect " + sourceId + " to " + targetId,
                p -> PageOperations.connect(p, connectorId, sourceId, targetId));
    }

    public static PageCommand connect(Page page, String connectorId,
                                      End end, String terminalId) {
        return PageCommand.of(page, "Connect " + connectorId + " to " + terminalId,
                p -> PageOperations.connect(p, connectorId, end, terminalId));
    }

    public static PageCommand disconnect(Page page, String connectorId, End end) {
        return PageCommand.of(page, "Disconnect " + connectorId,
                p -> PageOperations.disconnect(p, connectorId, end));
    }

    public static PageCommand setWaypoints(Page page, String connectorId, List<Point> points) {
        List<Point> copy = new ArrayList<>(points);
        return PageCommand.of(page, "Edit waypoints of " + connectorId,
                p -> PageOperations.setWaypoints(p, connectorId, copy));
    }

    public static PageCommand group(Page page, String groupId, List<String> memberIds) {
        List<String> copy = new ArrayList<>(memberIds);
        return PageCommand.of(page, "Group " + String.join(", ", copy),
                p -> PageOperations.group(p, groupId, copy));
    }

    public static PageCommand ungroup(Page page, String groupId) {
        return PageCommand.of(page, "Ungroup " + groupId,
                p -> PageOperations.ungroup(p, groupId));
    }

    public static PageCommand addToGroup(Page page, String groupId, String memberId) {
        return PageCommand.of(page, "Add " + memberId + " to " + groupId,
                p -> PageOperations.addToGroup(p, groupId, memberId));
    }

    public static PageCommand removeFromGroup(Page page, String memberId) {
        return PageCommand.of(page, "Remove " + memberId + " from group",
                p -> PageOperations.removeFromGroup(p, memberId));
    }

    public static PageCommand delete(Page page, String id, RemovalPolicy policy) {
        return PageCommand.of(page, "Delete " + id,
                p -> PageOperations.delete(p, id, policy));
    }

    public static DiagramCommand addPage(Diagram diagram, int index, String name) {
        return DiagramCommand.of(diagram, "Add page " + name,
                d -> DiagramOperations.addPage(d, index, name));
    }

    public static DiagramCommand insertPage(Diagram diagram, int index, Page page) {
        return DiagramCommand.of(diagram, "Insert page " + page.getName(),
                d -> DiagramOperations.insertPage(d, index, page));
    }

    public static DiagramCommand removePage(Diagram diagram, String pageId) {
        return DiagramCommand.of(diagram, "Remove page " + pageId,
                d -> DiagramOperations.removePage(d, pageId));
    }

    public static DiagramCommand renamePage(Diagram diagram, String pageId, String name) {
        return DiagramCommand.of(diagram, "Rename page " + pageId,
                d -> DiagramOperations.renamePage(d, pageId, name));
    }

    public static DiagramCommand changeSettings(Diagram diagram,
                                                String pageId, PageSettings settings) {
        return DiagramCommand.of(diagram, "Change settings of page " + pageId,
                d -> DiagramOperations.changeSettings(d, pageId, settings));
    }

    public static DiagramCommand setMetadata(Diagram diagram, String name, String value) {
        return DiagramCommand.of(diagram, "Set " + name,
                d -> DiagramOperations.setMetadata(d, name, value));
    }

}
