/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

/**
 * A reversible model change.
 * <p>
 * {@link #execute()} captures the exact model state it changes, so that
 * {@link #undo()} restores it precisely, and {@link #redo()} re-applies
 * the same change.  A command failing to execute leaves the model
 * unchanged.</p>
 *
 * @see  CommandManager
 */
public interface Command {

    /**
     * @throws  io.github.stanio.diagram.model.InvariantViolationException
     *          if the change is not valid for the current model state
     */
    void execute();

    void undo();

    void redo();

    String getDescription();

    /**
     * @return  {@code false} if executing left the model as it was
     */
    default boolean changesModel() {
        return true;
    }

    /**
     * Tests whether executing this command in the current model state would
     * succeed, without changing the model.
     */
    default boolean canExecute() {
        return true;
    }

}
