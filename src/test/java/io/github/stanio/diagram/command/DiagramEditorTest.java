/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.stanio.diagram.codec.DiagramCodecTest;
import io.github.stanio.diagram.config.EditorSettings;
import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.event.ChangeListener;
import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.InvariantViolationException;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.RemovalPolicy;
import io.github.stanio.diagram.style.Style;

public class DiagramEditorTest {

    private static final String PAGE = "page-1";

    private DiagramEditor editor;
    private List<ChangeEvent> events;

    @BeforeEach
    void setUp() {
        editor = new DiagramEditor();
        events = new ArrayList<>();
        editor.subscribe(events::add);
    }

    @Test
    void shapesAndConnector() {
        String a = editor.createShape(PAGE, "A", Style.parse("rounded=1;"), 0, 0);
        String b = editor.createShape(PAGE, "B", Style.EMPTY, 200, 0);
        String c = editor.createConnector(PAGE, a, b, Style.EMPTY);

        Page page = editor.getPage(PAGE);
        assertThat(Arrays.asList(a, b, c)).as("ids").containsExactly("2", "3", "4");
        assertThat(page.requireElement(a).getGeometry())
                .as("default size").isEqualTo(Geometry.of(0, 0, 120, 60));

        editor.undo();
        assertThat(page.getElements()).extracting(Element::getId)
                .as("after undo").containsExactly(a, b);

        editor.redo();
        Element connector = page.requireElement(c);
        assertThat(connector.getConnection().getSourceId()).as("source").isEqualTo(a);
        assertThat(connector.getConnection().getTargetId()).as("target").isEqualTo(b);

        assertThat(events).extracting(ChangeEvent::getCause).containsExactly(
                ChangeEvent.Cause.EDIT, ChangeEvent.Cause.EDIT, ChangeEvent.Cause.EDIT,
                ChangeEvent.Cause.UNDO, ChangeEvent.Cause.REDO);
    }

    @Test
    void groupAndUngroup() {
        String a = editor.createShape(PAGE, "A", Style.EMPTY, 10, 10);
        String b = editor.createShape(PAGE, "B", Style.EMPTY, 200, 10);

        String group = editor.group(PAGE, Arrays.asList(a, b));
        Page page = editor.getPage(PAGE);
        assertThat(page.children(group)).extracting(Element::getId).containsExactly(a, b);

        editor.ungroup(PAGE, group);
        assertThat(page.contains(group)).as("group present").isFalse();
        assertThat(page.requireElement(b).getGeometry())
                .as("member bounds").isEqualTo(Geometry.of(200, 10, 120, 60));

        editor.undo();
        assertThat(page.requireElement(b).getParentId()).as("parent").isEqualTo(group);
    }

    @Test
    void deleteUsesConfiguredPolicy() {
        editor = new DiagramEditor(EditorSettings.defaults()
                .withRemovalPolicy(RemovalPolicy.CASCADE));
        String a = editor.createShape(PAGE, "A", Style.EMPTY, 0, 0);
        String b = editor.createShape(PAGE, "B", Style.EMPTY, 200, 0);
        editor.createConnector(PAGE, a, b, Style.EMPTY);

        editor.deleteElement(PAGE, a);

        assertThat(editor.getPage(PAGE).getElements())
                .extracting(Element::getId).containsExactly(b);
    }

    @Test
    void failedEditLeavesHistoryUnchanged() {
        String a = editor.createShape(PAGE, "A", Style.EMPTY, 0, 0);

        assertThatThrownBy(() -> editor.resizeElement(PAGE, "missing", 10, 10))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> editor.createElement(PAGE, Element.shape(a).build()))
                .isInstanceOf(InvariantViolationException.class);

        assertThat(editor.getCommandManager().undoCount()).isEqualTo(1);
        assertThat(events).hasSize(1);
    }

    @Test
    void pages() {
        String second = editor.addPage("Second");
        editor.renamePage(second, "Details");
        editor.removePage(PAGE);

        Diagram diagram = editor.getDiagram();
        assertThat(diagram.getPages()).extracting(Page::getName).containsExactly("Details");

        editor.undo();
        assertThat(diagram.getPages()).extracting(Page::getId).containsExactly(PAGE, second);

        editor.removePage(second);
        assertThatThrownBy(() -> editor.removePage(PAGE))
                .as("only page").isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void openReplacesDiagram() throws Exception {
        editor.createShape(PAGE, "A", Style.EMPTY, 0, 0);

        Diagram opened;
        try (InputStream stream = DiagramCodecTest.getResourceStream("two-pages.drawio")) {
            opened = editor.open(stream);
        }

        assertThat(editor.getDiagram()).isSameAs(opened);
        assertThat(editor.canUndo()).as("can undo").isFalse();

        events.clear();
        editor.moveElement("p1", "A", 10, 0);
        assertThat(events).as("listener kept").hasSize(1);
        assertThat(events.get(0).getPageId()).isEqualTo("p1");
    }

    @Test
    void newDiagram() {
        editor.addPage("Second");

        Diagram blank = editor.newDiagram();

        assertThat(blank.pageCount()).isEqualTo(1);
        assertThat(editor.canUndo()).isFalse();
    }

    @Test
    void unsubscribe() {
        List<ChangeEvent> other = new ArrayList<>();
        ChangeListener listener = other::add;
        editor.subscribe(listener);
        editor.unsubscribe(listener);

        editor.newDiagram();
        editor.createShape(PAGE, "A", Style.EMPTY, 0, 0);

        assertThat(other).as("unsubscribed").isEmpty();
        assertThat(events).as("subscribed").hasSize(1);
    }

    @Test
    void saveAndReopen() throws Exception {
        String a = editor.createShape(PAGE, "Café", Style.parse("ellipse;"), 40, 20);
        editor.setMetadata("name", "Sketch");
        Diagram saved = editor.getDiagram();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        editor.save(out, true);
        byte[] plain = editor.save();

        DiagramEditor other = new DiagramEditor();
        assertThat(other.open(out.toByteArray())).as("compressed").isEqualTo(saved);
        assertThat(other.open(plain)).as("plain").isEqualTo(saved);
        assertThat(other.getPage(PAGE).requireElement(a).getLabel()).isEqualTo("Café");
    }

}
