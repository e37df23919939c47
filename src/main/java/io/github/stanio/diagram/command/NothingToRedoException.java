/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

public class NothingToRedoException extends IllegalStateException {

    private static final long serialVersionUID = 2961583004541712277L;

    public NothingToRedoException() {
        super("Nothing to redo");
    }

}
