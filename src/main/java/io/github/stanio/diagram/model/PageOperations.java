/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import static io.github.stanio.diagram.model.InvariantViolationException.Kind.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.Element.Connection;
import io.github.stanio.diagram.model.Element.End;
import io.github.stanio.diagram.style.Style;

/**
 * Plans the element editing operations as {@link PageEdit}s.  Planning
 * doesn't modify the page; the resulting edit is validated as a whole when
 * {@link Page#apply(PageEdit) applied}.
 * <p>
 * Element coordinates are relative to the containing vertex (group).
 * Operations changing the container of an element translate its geometry
 * so its position on the page stays the same.</p>
 */
public final class PageOperations {

    private PageOperations() {
        // no instances
    }

    /**
     * Adds the element on top of the z-order.  An element without parent
     * is added to the default layer.
     */
    public static PageEdit create(Page page, Element element) {
        Element added = element;
        if (element.getParentId() == null) {
            added = element.withParent(page.getDefaultLayer().getId());
        }
        if (page.contains(added.getId()) || page.isStructural(added.getId()))
            throw new InvariantViolationException(ID_COLLISION,
                    added.getId(), "Id already in use: " + added.getId());

        return PageEdit.builder(page, ChangeEvent.Kind.ELEMENT_CREATED)
                .append(added).build();
    }

    public static PageEdit move(Page page, String id, double dx, double dy) {
        Element element = requireUnlocked(page, id);
        return PageEdit.builder(page, ChangeEvent.Kind.ELEMENT_MOVED)
                .replace(element.withGeometry(element.getGeometry().translated(dx, dy)))
                .build();
    }

    public static PageEdit resize(Page page, String id, double width, double height) {
        Element element = requireUnlocked(page, id);
        if (element.isConnector())
            throw new InvariantViolationException(SCOPE_VIOLATION, id,
                    "Connector " + id + " cannot be resized");

        return PageEdit.builder(page, ChangeEvent.Kind.ELEMENT_RESIZED)
                .replace(element.withGeometry(element.getGeometry().resized(width, height)))
                .build();
    }

    public static PageEdit restyle(Page page, String id, Style style) {
        Element element = page.requireElement(id);
        return PageEdit.builder(page, ChangeEvent.Kind.ELEMENT_RESTYLED)
                .replace(element.withStyle(style)).build();
    }

    public static PageEdit relabel(Page page, String id, String label) {
        Element element = page.requireElement(id);
        return PageEdit.builder(page, ChangeEvent.Kind.ELEMENT_RELABELED)
                .replace(element.withLabel(label)).build();
    }

    public static PageEdit setVisible(Page page, String id, boolean visible) {
        Element element = page.requireElement(id);
        return PageEdit.builder(page, ChangeEvent.Kind.VISIBILITY_CHANGED)
                .replace(element.withVisible(visible)).build();
    }

    /**
     * Attaches the given end of a connector to an element.  The terminal
     * point of that end, if any, is cleared.
     */
    public static PageEdit connect(Page page, String connectorId,
                                   End end, String terminalId) {
        Objects.requireNonNull(terminalId, "terminalId");
        Element connector = requireConnector(page, connectorId);
        page.requireElement(terminalId);
        return PageEdit.builder(page, ChangeEvent.Kind.CONNECTED)
                .replace(attach(connector, end, terminalId)).build();
    }

    /**
     * Attaches both ends of a connector.
     */
    public static PageEdit connect(Page page, String connectorId,
                                   String sourceId, String targetId) {
        Element connector = requireConnector(page, connectorId);
        page.requireElement(sourceId);
        page.requireElement(targetId);
        return PageEdit.builder(page, ChangeEvent.Kind.CONNECTED)
                .replace(attach(attach(connector, End.SOURCE, sourceId),
                                End.TARGET, targetId))
                .build();
    }

    private static Element attach(Element connector, End end, String terminalId) {
        Geometry geometry = connector.getGeometry();
        geometry = (end == End.SOURCE) ? geometry.withSourcePoint(null)
                                       : geometry.withTargetPoint(null);
        return connector.toBuilder()
                .connection(connector.getConnection().with(end, terminalId, false))
                .geometry(connector.hasGeometry() ? geometry : null)
                .build();
    }

    /**
     * Detaches the given end of a connector.  The end becomes floating,
     * pinned at the centre of the element it was attached to.
     */
    public static PageEdit disconnect(Page page, String connectorId, End end) {
        Element connector = requireConnector(page, connectorId);
        PageEdit.Builder edit = PageEdit.builder(page, ChangeEvent.Kind.DISCONNECTED);
        edit.replace(detach(page, connector, end));
        return edit.build();
    }

    private static Element detach(Page page, Element connector, End end) {
        Connection connection = connector.getConnection();
        String terminalId = connection.get(end);
        if (terminalId == null)
            return connector;

        Geometry geometry = connector.getGeometry();
        if (!connection.isDangling(end) && page.contains(terminalId)) {
            Point center = page.absoluteCenter(terminalId);
            Point origin = frameOrigin(page, connector.getParentId());
            Point pin = new Point(center.getX() - origin.getX(),
                                  center.getY() - origin.getY());
            geometry = (end == End.SOURCE) ? geometry.withSourcePoint(pin)
                                           : geometry.withTargetPoint(pin);
        }
        return connector.toBuilder()
                .connection(connection.with(end, null, false))
                .geometry(geometry)
                .build();
    }

    public static PageEdit setWaypoints(Page page, String connectorId, List<Point> points) {
        Element connector = requireConnector(page, connectorId);
        return PageEdit.builder(page, ChangeEvent.Kind.WAYPOINTS_CHANGED)
                .replace(connector.withGeometry(connector.getGeometry().withWaypoints(points)))
                .build();
    }

    /**
     * Creates a group containing the given elements.  The members must
     * share the same container; the group takes their place in it, at the
     * z-order position of the bottom-most member, and its bounds are the
     * union of the member bounds.
     *
     * @param   groupId  id for the new group, or {@code null} to generate one
     */
    public static PageEdit group(Page page, String groupId, List<String> memberIds) {
        if (memberIds.isEmpty())
            throw new IllegalArgumentException("No elements to group");

        String id = (groupId == null) ? page.newElementId() : groupId;
        if (page.contains(id) || page.isStructural(id))
            throw new InvariantViolationException(ID_COLLISION,
                    id, "Id already in use: " + id);

        Set<String> members = new LinkedHashSet<>(memberIds);
        String parentId = null;
        int lowest = Integer.MAX_VALUE;
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (String memberId : members) {
            Element member = page.requireElement(memberId);
            if (parentId == null) {
                parentId = member.getParentId();
            } else if (!parentId.equals(member.getParentId())) {
                throw new InvariantViolationException(SCOPE_VIOLATION, memberId,
                        "Grouped elements must share the same container: "
                        + parentId + " != " + member.getParentId());
            }
            lowest = Math.min(lowest, page.indexOf(memberId));

            Geometry bounds = member.getGeometry();
            if (member.isConnector() || !member.hasGeometry() || bounds.isRelative())
                continue;

            minX = Math.min(minX, bounds.getX());
            minY = Math.min(minY, bounds.getY());
            maxX = Math.max(maxX, bounds.getX() + bounds.getWidth());
            maxY = Math.max(maxY, bounds.getY() + bounds.getHeight());
        }
        Geometry groupBounds = (minX > maxX)
                               ? Geometry.EMPTY
                               : Geometry.of(minX, minY, maxX - minX, maxY - minY);

        PageEdit.Builder edit = PageEdit.builder(page, ChangeEvent.Kind.GROUPED);
        edit.insert(lowest, Element.group(id)
                                   .style(Style.parse("group;"))
                                   .geometry(groupBounds)
                                   .parent(parentId)
                                   .build());
        for (String memberId : members) {
            Element member = edit.require(memberId);
            edit.replace(member.toBuilder()
                    .parent(id)
                    .geometry(translated(member, -groupBounds.getX(), -groupBounds.getY()))
                    .build());
        }
        return edit.build();
    }

    /**
     * Dissolves a group.  Its members move to the container of the group;
     * connectors attached to the group itself are detached.
     */
    public static PageEdit ungroup(Page page, String groupId) {
        Element group = page.requireElement(groupId);
        if (!group.isGroup())
            throw new InvariantViolationException(SCOPE_VIOLATION, groupId,
                    group.getKind() + " " + groupId + " is not a group");

        return planDelete(page, group, RemovalPolicy.DETACH, ChangeEvent.Kind.UNGROUPED);
    }

    /**
     * Moves an element into a group, keeping its position on the page.
     */
    public static PageEdit addToGroup(Page page, String groupId, String memberId) {
        Element group = page.requireElement(groupId);
        Element member = page.requireElement(memberId);
        if (!group.isGroup())
            throw new InvariantViolationException(SCOPE_VIOLATION, groupId,
                    group.getKind() + " " + groupId + " is not a group");

        for (Element ancestor = group; ancestor != null;
                ancestor = page.getElement(ancestor.getParentId())) {
            if (ancestor.getId().equals(memberId))
                throw new InvariantViolationException(GROUP_CYCLE, memberId,
                        "Cannot add " + memberId + " to " + groupId
                        + ": it contains the group");
        }

        Point from = frameOrigin(page, member.getParentId());
        Point to = page.absolutePosition(groupId);
        return PageEdit.builder(page, ChangeEvent.Kind.MEMBERSHIP_CHANGED)
                .replace(member.toBuilder()
                        .parent(groupId)
                        .geometry(translated(member, from.getX() - to.getX(),
                                                     from.getY() - to.getY()))
                        .build())
                .build();
    }

    /**
     * Moves a group member to the container of its group, keeping its
     * position on the page.
     */
    public static PageEdit removeFromGroup(Page page, String memberId) {
        Element member = page.requireElement(memberId);
        Element group = page.getElement(member.getParentId());
        if (group == null || !group.isGroup())
            throw new InvariantViolationException(SCOPE_VIOLATION, memberId,
                    memberId + " is not a group member");

        Geometry groupBounds = group.getGeometry();
        return PageEdit.builder(page, ChangeEvent.Kind.MEMBERSHIP_CHANGED)
                .replace(member.toBuilder()
                        .parent(group.getParentId())
                        .geometry(translated(member, groupBounds.getX(), groupBounds.getY()))
                        .build())
                .build();
    }

    /**
     * Removes an element.
     * <ul>
     * <li>Connectors attached to the removed element are detached (pinned at
     * the centre of the element) or removed, according to {@code policy};</li>
     * <li>Members of a removed group move to the container of the group;</li>
     * <li>Labels of a removed connector are removed with it.</li>
     * </ul>
     */
    public static PageEdit delete(Page page, String id, RemovalPolicy policy) {
        return planDelete(page, page.requireElement(id),
                Objects.requireNonNull(policy, "policy"),
                ChangeEvent.Kind.ELEMENT_DELETED);
    }

    private static PageEdit planDelete(Page page, Element target,
                                       RemovalPolicy policy, ChangeEvent.Kind kind) {
        Set<String> removed = new LinkedHashSet<>();
        collectRemoved(page, target, removed);
        if (policy == RemovalPolicy.CASCADE) {
            boolean added;
            do {
                added = false;
                for (String removedId : new ArrayList<>(removed)) {
                    for (Element connector : page.connectorsOf(removedId)) {
                        if (!removed.contains(connector.getId())) {
                            collectRemoved(page, connector, removed);
                            added = true;
                        }
                    }
                }
            } while (added);
        }

        PageEdit.Builder edit = PageEdit.builder(page, kind);
        if (!target.isConnector()) {
            Geometry bounds = target.getGeometry();
            for (Element child : page.children(target.getId())) {
                if (removed.contains(child.getId()))
                    continue;

                edit.replace(child.toBuilder()
                        .parent(target.getParentId())
                        .geometry(translated(child, bounds.getX(), bounds.getY()))
                        .build());
            }
        }

        for (String removedId : removed) {
            for (Element connector : page.connectorsOf(removedId)) {
                if (removed.contains(connector.getId()))
                    continue;

                Element planned = edit.require(connector.getId());
                Connection connection = planned.getConnection();
                for (End end : End.values()) {
                    if (removedId.equals(connection.get(end))
                            && !connection.isDangling(end)) {
                        planned = detach(page, planned, end);
                        connection = planned.getConnection();
                    }
                }
                edit.replace(planned);
            }
        }

        for (String removedId : removed) {
            edit.remove(removedId);
        }
        return edit.build();
    }

    /*
     * The element, and everything contained in it if it's a connector.
     */
    private static void collectRemoved(Page page, Element element, Set<String> removed) {
        if (!removed.add(element.getId()) || !element.isConnector())
            return;

        List<Element> pending = new ArrayList<>(page.children(element.getId()));
        while (!pending.isEmpty()) {
            Element child = pending.remove(pending.size() - 1);
            if (removed.add(child.getId())) {
                pending.addAll(page.children(child.getId()));
            }
        }
    }

    private static Geometry translated(Element element, double dx, double dy) {
        return element.hasGeometry()
                ? element.getGeometry().translated(dx, dy)
                : null;
    }

    /*
     * Page position of the coordinate origin for children of the given
     * container.
     */
    static Point frameOrigin(Page page, String containerId) {
        Element container = page.getElement(containerId);
        if (container == null || container.isConnector())
            return Point.ORIGIN;

        return page.absolutePosition(containerId);
    }

    private static Element requireUnlocked(Page page, String id) {
        Element element = page.requireElement(id);
        if (element.isLocked())
            throw new InvariantViolationException(LOCKED, id,
                    "Element " + id + " is locked");

        return element;
    }

    private static Element requireConnector(Page page, String id) {
        Element element = page.requireElement(id);
        if (!element.isConnector())
            throw new InvariantViolationException(SCOPE_VIOLATION, id,
                    element.getKind() + " " + id + " is not a connector");

        return element;
    }

}
