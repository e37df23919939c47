/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.diagram.codec.DiagramCodec;
import io.github.stanio.diagram.codec.FormatException;
import io.github.stanio.diagram.config.EditorSettings;
import io.github.stanio.diagram.event.ChangeListener;
import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.Element.End;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.PageSettings;
import io.github.stanio.diagram.model.RemovalPolicy;
import io.github.stanio.diagram.style.Style;

/**
 * Editing session over a single diagram: opening and saving through the
 * codec, and every mutation entry point as an undoable command.
 * <p>
 * Change listeners registered with the editor stay registered when another
 * diagram is opened.</p>
 */
public class DiagramEditor {

    private static final Logger log = Logger.getLogger(DiagramEditor.class.getName());

    private final EditorSettings settings;
    private final DiagramCodec codec;
    private final CommandManager commands;
    private final List<ChangeListener> listeners = new ArrayList<>();

    private Diagram diagram;

    public DiagramEditor() {
        this(EditorSettings.defaults());
    }

    public DiagramEditor(EditorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = new DiagramCodec(settings);
        this.commands = new CommandManager(settings.historyLimit());
        this.diagram = Diagram.create();
    }

    public EditorSettings getSettings() {
        return settings;
    }

    public Diagram getDiagram() {
        return diagram;
    }

    public CommandManager getCommandManager() {
        return commands;
    }

    public Page getPage(String pageId) {
        return diagram.requirePage(pageId);
    }

    /**
     * Replaces the current diagram with the one decoded from the given
     * data.  The undo history is cleared.
     */
    public Diagram open(byte[] data) throws FormatException {
        return replace(codec.decode(data));
    }

    public Diagram open(InputStream in) throws IOException {
        return replace(codec.decode(in));
    }

    /**
     * Starts a new diagram with a single blank page.
     */
    public Diagram newDiagram() {
        return replace(Diagram.create());
    }

    private Diagram replace(Diagram loaded) {
        for (ChangeListener listener : listeners) {
            diagram.getChangeBus().unsubscribe(listener);
            loaded.getChangeBus().subscribe(listener);
        }
        diagram = loaded;
        commands.clearHistory();
        log.log(Level.FINE, "Opened {0}", loaded);
        return loaded;
    }

    /**
     * @see  EditorSettings#compress()
     */
    public byte[] save() {
        return save(settings.compress());
    }

    public byte[] save(boolean compressed) {
        return codec.encode(diagram, compressed);
    }

    public void save(OutputStream out, boolean compressed) throws IOException {
        codec.encode(diagram, compressed, out);
    }

    public void subscribe(ChangeListener listener) {
        diagram.getChangeBus().subscribe(listener);
        if (!containsIdentity(listener)) {
            listeners.add(listener);
        }
    }

    public void unsubscribe(ChangeListener listener) {
        diagram.getChangeBus().unsubscribe(listener);
        listeners.removeIf(item -> item == listener);
    }

    private boolean containsIdentity(ChangeListener listener) {
        for (ChangeListener item : listeners) {
            if (item == listener) return true;
        }
        return false;
    }

    public void execute(Command command) {
        commands.execute(command);
    }

    public boolean canExecute(Command command) {
        return commands.canExecute(command);
    }

    public void undo() {
        commands.undo();
    }

    public void redo() {
        commands.redo();
    }

    public boolean canUndo() {
        return commands.canUndo();
    }

    public boolean canRedo() {
        return commands.canRedo();
    }

    /**
     * Adds the element to the page.
     */
    public void createElement(String pageId, Element element) {
        execute(Commands.create(getPage(pageId), element));
    }

    /**
     * Adds a shape of the default size to the default layer.
     *
     * @return  the id of the new shape
     */
    public String createShape(String pageId, String label, Style style, double x, double y) {
        Page page = getPage(pageId);
        String id = page.newElementId();
        execute(Commands.create(page, Element.shape(id)
                .label(label)
                .style(style)
                .geometry(Geometry.of(x, y, settings.defaultShapeWidth(),
                                            settings.defaultShapeHeight()))
                .build()));
        return id;
    }

    /**
     * Adds a connector between the given elements to the default layer.
     *
     * @return  the id of the new connector
     */
    public String createConnector(String pageId, String sourceId,
                                  String targetId, Style style) {
        Page page = getPage(pageId);
        String id = page.newElementId();
        execute(Commands.create(page, Element.connector(id)
                .label("")
                .style(style)
                .geometry(Geometry.relative())
                .source(sourceId)
                .target(targetId)
                .build()));
        return id;
    }

    public void moveElement(String pageId, String id, double dx, double dy) {
        execute(Commands.move(getPage(pageId), id, dx, dy));
    }

    public void resizeElement(String pageId, String id, double width, double height) {
        execute(Commands.resize(getPage(pageId), id, width, height));
    }

    public void restyleElement(String pageId, String id, Style style) {
        execute(Commands.restyle(getPage(pageId), id, style));
    }

    public void relabelElement(String pageId, String id, String label) {
        execute(Commands.relabel(getPage(pageId), id, label));
    }

    public void setVisible(String pageId, String id, boolean visible) {
        execute(Commands.setVisible(getPage(pageId), id, visible));
    }

    public void connect(String pageId, String connectorId,
                        String sourceId, String targetId) {
        execute(Commands.connect(getPage(pageId), connectorId, sourceId, targetId));
    }

    public void connect(String pageId, String connectorId, End end, String terminalId) {
        execute(Commands.connect(getPage(pageId), connectorId, end, terminalId));
    }

    public void disconnect(String pageId, String connectorId, End end) {
        execute(Commands.disconnect(getPage(pageId), connectorId, end));
    }

    public void setWaypoints(String pageId, String connectorId, List<Point> points) {
        execute(Commands.setWaypoints(getPage(pageId), connectorId, points));
    }

    /**
     * @return  the id of the new group
     */
    public String group(String pageId, List<String> memberIds) {
        Page page = getPage(pageId);
        String id = page.newElementId();
        execute(Commands.group(page, id, memberIds));
        return id;
    }

    public void ungroup(String pageId, String groupId) {
        execute(Commands.ungroup(getPage(pageId), groupId));
    }

    public void addToGroup(String pageId, String groupId, String memberId) {
        execute(Commands.addToGroup(getPage(pageId), groupId, memberId));
    }

    public void removeFromGroup(String pageId, String memberId) {
        execute(Commands.removeFromGroup(getPage(pageId), memberId));
    }

    /**
     * Deletes the element, treating attached connectors according to the
     * configured removal policy.
     *
     * @see  EditorSettings#removalPolicy()
     */
    public void deleteElement(String pageId, String id) {
        deleteElement(pageId, id, settings.removalPolicy());
    }

    public void deleteElement(String pageId, String id, RemovalPolicy policy) {
        execute(Commands.delete(getPage(pageId), id, policy));
    }

    /**
     * Appends a blank page.
     *
     * @return  the id of the new page
     */
    public String addPage(String name) {
        execute(Commands.addPage(diagram, -1, name));
        return diagram.getPage(diagram.pageCount() - 1).getId();
    }

    public void removePage(String pageId) {
        execute(Commands.removePage(diagram, pageId));
    }

    public void renamePage(String pageId, String name) {
        execute(Commands.renamePage(diagram, pageId, name));
    }

    public void changePageSettings(String pageId, PageSettings pageSettings) {
        execute(Commands.changeSettings(diagram, pageId, pageSettings));
    }

    public void setMetadata(String name, String value) {
        execute(Commands.setMetadata(diagram, name, value));
    }

}
