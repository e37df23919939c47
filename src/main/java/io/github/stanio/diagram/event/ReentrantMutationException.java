/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.event;

/**
 * Thrown when the model is mutated from within a change notification.
 */
public class ReentrantMutationException extends IllegalStateException {

    private static final long serialVersionUID = -2871632006389710413L;

    public ReentrantMutationException(String message) {
        super(message);
    }

}
