/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

public class NothingToUndoException extends IllegalStateException {

    private static final long serialVersionUID = -4310264383557001384L;

    public NothingToUndoException() {
        super("Nothing to undo");
    }

}
