/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.stanio.diagram.command.CommandManager.HistoryEvent;
import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.event.ListenerFailureException;
import io.github.stanio.diagram.event.ReentrantMutationException;
import io.github.stanio.diagram.geom.Geometry;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.InvariantViolationException;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.RemovalPolicy;

public class CommandManagerTest {

    private Diagram diagram;
    private Page page;
    private CommandManager manager;

    @BeforeEach
    void setUp() {
        diagram = Diagram.create();
        page = diagram.getPage(0);
        manager = new CommandManager();
    }

    private Command createShape(String id, double x) {
        return Commands.create(page, Element.shape(id)
                .label(id).geometry(Geometry.of(x, 0, 120, 60)).build());
    }

    private Command createConnector(String id, String source, String target) {
        return Commands.create(page, Element.connector(id)
                .geometry(Geometry.relative()).source(source).target(target).build());
    }

    @Test
    void undoRedoConnector() {
        manager.execute(createShape("A", 0));
        manager.execute(createShape("B", 200));
        manager.execute(createConnector("C", "A", "B"));

        manager.undo();
        assertThat(page.getElements()).extracting(Element::getId)
                .as("after undo").containsExactly("A", "B");

        manager.redo();
        assertThat(page.getElements()).extracting(Element::getId)
                .as("after redo").containsExactly("A", "B", "C");
        Element.Connection connection = page.requireElement("C").getConnection();
        assertThat(connection.getSourceId()).as("source").isEqualTo("A");
        assertThat(connection.getTargetId()).as("target").isEqualTo("B");
    }

    @Test
    void undoAllRedoAll() {
        List<Element> initial = new ArrayList<>(page.getElements());
        manager.execute(createShape("A", 0));
        manager.execute(createShape("B", 200));
        manager.execute(createConnector("C", "A", "B"));
        manager.execute(Commands.move(page, "A", 10, 10));
        manager.execute(Commands.delete(page, "B",
                RemovalPolicy.DETACH));
        List<Element> last = new ArrayList<>(page.getElements());

        while (manager.canUndo()) {
            manager.undo();
        }
        assertThat(page.getElements()).as("initial state").isEqualTo(initial);

        while (manager.canRedo()) {
            manager.redo();
        }
        assertThat(page.getElements()).as("final state").isEqualTo(last);
    }

    @Test
    void newCommandDiscardsRedo() {
        manager.execute(createShape("A", 0));
        manager.execute(createShape("B", 200));
        manager.undo();

        manager.execute(createShape("X", 400));

        assertThat(manager.canRedo()).as("can redo").isFalse();
        assertThat(manager.undoCount()).as("undo count").isEqualTo(2);
        assertThat(page.contains("B")).as("B present").isFalse();
    }

    @Test
    void nothingToUndoOrRedo() {
        assertThatThrownBy(manager::undo).isInstanceOf(NothingToUndoException.class);
        assertThatThrownBy(manager::redo).isInstanceOf(NothingToRedoException.class);

        manager.execute(createShape("A", 0));
        assertThatThrownBy(manager::redo).isInstanceOf(NothingToRedoException.class);
    }

    @Test
    void failedCommandNotRecorded() {
        manager.execute(createShape("A", 0));

        assertThatThrownBy(() -> manager.execute(createShape("A", 100)))
                .isInstanceOf(InvariantViolationException.class);

        assertThat(manager.undoCount()).isEqualTo(1);
        assertThat(page.requireElement("A").getGeometry().getX()).isZero();
    }

    @Test
    void canExecute() {
        manager.execute(createShape("A", 0));

        assertThat(manager.canExecute(createShape("A", 10))).as("duplicate").isFalse();
        assertThat(manager.canExecute(Commands.move(page, "A", 1, 1))).as("move").isTrue();
        assertThat(manager.canExecute(Commands.connect(page, "A", "A", "A")))
                .as("connect shape").isFalse();
        assertThat(page.requireElement("A").getGeometry().getX()).as("unchanged").isZero();
    }

    @Test
    void historyLimit() {
        CommandManager limited = new CommandManager(2);
        limited.execute(createShape("A", 0));
        limited.execute(createShape("B", 100));
        limited.execute(createShape("C", 200));

        assertThat(limited.undoCount()).isEqualTo(2);
        limited.undo();
        limited.undo();
        assertThat(limited.canUndo()).as("can undo").isFalse();
        assertThat(page.getElements()).extracting(Element::getId).containsExactly("A");
    }

    @Test
    void descriptions() {
        manager.execute(createShape("A", 0));
        manager.execute(Commands.move(page, "A", 5, 5));
        manager.undo();

        assertThat(manager.getUndoDescription()).isEqualTo("Create shape A");
        assertThat(manager.getRedoDescription()).isEqualTo("Move A");
    }

    @Test
    void eventsCarryCause() {
        List<ChangeEvent> events = new ArrayList<>();
        diagram.getChangeBus().subscribe(events::add);

        manager.execute(createShape("A", 0));
        manager.undo();
        manager.redo();

        assertThat(events).extracting(ChangeEvent::getCause).containsExactly(
                ChangeEvent.Cause.EDIT, ChangeEvent.Cause.UNDO, ChangeEvent.Cause.REDO);
        assertThat(events).extracting(ChangeEvent::getKind)
                .containsOnly(ChangeEvent.Kind.ELEMENT_CREATED);
    }

    @Test
    void historyListeners() {
        List<HistoryEvent> history = new ArrayList<>();
        manager.addHistoryListener((event, command) -> history.add(event));

        manager.execute(createShape("A", 0));
        manager.undo();
        manager.redo();
        manager.clearHistory();

        assertThat(history).containsExactly(HistoryEvent.EXECUTE,
                HistoryEvent.UNDO, HistoryEvent.REDO, HistoryEvent.CLEAR);
    }

    @Test
    void listenerFailureKeepsChange() {
        diagram.getChangeBus().subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });

        assertThatThrownBy(() -> manager.execute(createShape("A", 0)))
                .isInstanceOf(ListenerFailureException.class);

        assertThat(page.contains("A")).as("change committed").isTrue();
        assertThat(manager.undoCount()).as("command recorded").isEqualTo(1);

        assertThatThrownBy(manager::undo).isInstanceOf(ListenerFailureException.class);
        assertThat(page.contains("A")).as("undone").isFalse();
        assertThat(manager.canRedo()).as("can redo").isTrue();
    }

    @Test
    void mutationFromListenerRejected() {
        diagram.getChangeBus().subscribe(event -> {
            if (event.getAffectedIds().contains("A")) {
                manager.execute(createShape("B", 100));
            }
        });

        Throwable failure = catchThrowable(() -> manager.execute(createShape("A", 0)));

        assertThat(failure).isInstanceOf(ListenerFailureException.class)
                .hasCauseInstanceOf(ReentrantMutationException.class);
        assertThat(page.getElements()).extracting(Element::getId).containsExactly("A");
        assertThat(manager.undoCount()).isEqualTo(1);
    }

    @Test
    void unchangedModelNotRecorded() {
        List<HistoryEvent> history = new ArrayList<>();
        List<ChangeEvent> events = new ArrayList<>();
        manager.execute(createShape("A", 0));
        manager.addHistoryListener((event, command) -> history.add(event));
        diagram.getChangeBus().subscribe(events::add);

        manager.execute(Commands.move(page, "A", 0, 0));
        manager.execute(Commands.relabel(page, "A", "A"));

        assertThat(manager.undoCount()).as("undo count").isEqualTo(1);
        assertThat(manager.getUndoDescription()).isEqualTo("Create shape A");
        assertThat(history).as("history events").isEmpty();
        assertThat(events).as("change events").isEmpty();
    }

    @Test
    void cannotInsertPageOfAnotherDiagram() {
        Diagram other = Diagram.create();
        Page owned = other.getPage(0);

        Command insert = Commands.insertPage(diagram, -1, owned);

        assertThat(manager.canExecute(insert)).as("can execute").isFalse();
        assertThatThrownBy(() -> manager.execute(insert))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(diagram.pageCount()).isEqualTo(1);
        assertThat(manager.canUndo()).as("can undo").isFalse();
    }

    @Test
    void pageCommands() {
        manager.execute(Commands.addPage(diagram, -1, "Second"));
        manager.execute(Commands.renamePage(diagram, "page-2", "Details"));
        assertThat(diagram.getPages()).extracting(Page::getName)
                .containsExactly("Page-1", "Details");

        manager.undo();
        manager.undo();
        assertThat(diagram.pageCount()).isEqualTo(1);

        manager.redo();
        manager.redo();
        assertThat(diagram.requirePage("page-2").getName()).isEqualTo("Details");
    }

}
