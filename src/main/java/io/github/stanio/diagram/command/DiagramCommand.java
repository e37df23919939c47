/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.diagram.event.ListenerFailureException;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.DiagramEdit;
import io.github.stanio.diagram.model.InvariantViolationException;

/**
 * Command changing the page list, page properties, or metadata of a
 * diagram.
 *
 * @see  io.github.stanio.diagram.model.DiagramOperations
 */
public class DiagramCommand implements Command {

    private static final Logger log = Logger.getLogger(DiagramCommand.class.getName());

    private final Diagram diagram;
    private final String description;
    private final Function<Diagram, DiagramEdit> planner;

    private DiagramEdit edit;

    protected DiagramCommand(Diagram diagram, String description,
                             Function<Diagram, DiagramEdit> planner) {
        this.diagram = Objects.requireNonNull(diagram, "diagram");
        this.description = Objects.requireNonNull(description, "description");
        this.planner = Objects.requireNonNull(planner, "planner");
    }

    public static DiagramCommand of(Diagram diagram, String description,
                                    Function<Diagram, DiagramEdit> planner) {
        return new DiagramCommand(diagram, description, planner);
    }

    @Override
    public void execute() {
        if (edit != null)
            throw new IllegalStateException("Already executed: " + description);

        DiagramEdit planned = planner.apply(diagram);
        try {
            diagram.apply(planned);
        } catch (ListenerFailureException e) {
            edit = planned;
            throw e;
        }
        edit = planned;
    }

    @Override
    public void undo() {
        diagram.apply(executed().inverse());
    }

    @Override
    public void redo() {
        diagram.apply(executed().redo());
    }

    private DiagramEdit executed() {
        if (edit == null)
            throw new IllegalStateException("Not executed: " + description);

        return edit;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean canExecute() {
        if (edit != null)
            return false;

        try {
            planner.apply(diagram);
            return true;
        } catch (InvariantViolationException | IllegalArgumentException
                | IndexOutOfBoundsException e) {
            log.log(Level.FINE, "Cannot execute \"{0}\": {1}",
                    new Object[] { description, e.getMessage() });
            return false;
        }
    }

    @Override
    public String toString() {
        return "DiagramCommand(" + description + ")";
    }

}
