/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.event;

/**
 * Receives model change notifications.
 * <p>
 * Invoked synchronously, before the mutating call returns.  Must not
 * mutate the model: doing so fails with {@link ReentrantMutationException}.</p>
 */
@FunctionalInterface
public interface ChangeListener {

    void changed(ChangeEvent event);

}
