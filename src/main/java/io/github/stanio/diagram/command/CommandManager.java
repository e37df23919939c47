/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.diagram.event.ListenerFailureException;

/**
 * Undo/redo history of executed commands.
 * <p>
 * The history is a list of commands with a cursor: commands before the
 * cursor can be undone, commands after it redone.  Executing a new command
 * discards the redo part.  When the history limit is exceeded the oldest
 * commands are discarded.</p>
 * <p>
 * A command failing to execute, undo, or redo leaves the history as is.
 * A {@link ListenerFailureException} is not a command failure: the change
 * is committed and recorded before the exception propagates.</p>
 */
public class CommandManager {

    public enum HistoryEvent { EXECUTE, UNDO, REDO, CLEAR }


    /**
     * Notified after the history changes, e.g. to update undo/redo
     * buttons.
     */
    @FunctionalInterface
    public interface HistoryListener {

        /**
         * @param  command  the command executed, undone, or redone;
         *         {@code null} for {@code CLEAR}
         */
        void historyChanged(HistoryEvent event, Command command);

    }


    public static final int DEFAULT_LIMIT = 100;

    private static final Logger log = Logger.getLogger(CommandManager.class.getName());

    private final List<Command> history = new ArrayList<>();
    private int cursor;
    private final int limit;

    private final List<HistoryListener> listeners = new ArrayList<>(2);

    public CommandManager() {
        this(DEFAULT_LIMIT);
    }

    /**
     * @param  limit  maximum number of commands kept; {@code 0} for
     *         unbounded
     */
    public CommandManager(int limit) {
        if (limit < 0)
            throw new IllegalArgumentException("Negative history limit: " + limit);

        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Executes the command and records it in the history.  If execution
     * fails, or leaves the model unchanged, the history is not changed.
     */
    public void execute(Command command) {
        Objects.requireNonNull(command, "command");
        try {
            command.execute();
        } catch (ListenerFailureException e) {
            record(command);
            throw e;
        }
        if (command.changesModel()) {
            record(command);
        } else {
            log.log(Level.FINE, "No change: {0}", command.getDescription());
        }
    }

    private void record(Command command) {
        history.subList(cursor, history.size()).clear();
        history.add(command);
        cursor++;
        while (limit > 0 && history.size() > limit) {
            history.remove(0);
            cursor--;
        }
        log.log(Level.FINE, "Executed: {0}", command.getDescription());
        fireHistoryChanged(HistoryEvent.EXECUTE, command);
    }

    /**
     * Tests whether the command would execute successfully in the current
     * model state.
     */
    public boolean canExecute(Command command) {
        return command.canExecute();
    }

    /**
     * @throws  NothingToUndoException  if at the start of history
     */
    public void undo() {
        if (!canUndo())
            throw new NothingToUndoException();

        Command command = history.get(cursor - 1);
        try {
            command.undo();
        } catch (ListenerFailureException e) {
            cursor--;
            throw e;
        }
        cursor--;
        log.log(Level.FINE, "Undone: {0}", command.getDescription());
        fireHistoryChanged(HistoryEvent.UNDO, command);
    }

    /**
     * @throws  NothingToRedoException  if at the end of history
     */
    public void redo() {
        if (!canRedo())
            throw new NothingToRedoException();

        Command command = history.get(cursor);
        try {
            command.redo();
        } catch (ListenerFailureException e) {
            cursor++;
            throw e;
        }
        cursor++;
        log.log(Level.FINE, "Redone: {0}", command.getDescription());
        fireHistoryChanged(HistoryEvent.REDO, command);
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < history.size();
    }

    /**
     * @return  description of the command to undo, or {@code null}
     */
    public String getUndoDescription() {
        return canUndo() ? history.get(cursor - 1).getDescription() : null;
    }

    /**
     * @return  description of the command to redo, or {@code null}
     */
    public String getRedoDescription() {
        return canRedo() ? history.get(cursor).getDescription() : null;
    }

    /**
     * @return  number of commands that can be undone
     */
    public int undoCount() {
        return cursor;
    }

    /**
     * @return  number of commands that can be redone
     */
    public int redoCount() {
        return history.size() - cursor;
    }

    public void clearHistory() {
        history.clear();
        cursor = 0;
        fireHistoryChanged(HistoryEvent.CLEAR, null);
    }

    public void addHistoryListener(HistoryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeHistoryListener(HistoryListener listener) {
        listeners.remove(listener);
    }

    private void fireHistoryChanged(HistoryEvent event, Command command) {
        for (HistoryListener listener : listeners.toArray(new HistoryListener[0])) {
            listener.historyChanged(event, command);
        }
    }

}
