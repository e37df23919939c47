/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.event;

import java.util.Objects;

/**
 * Thrown after notifying listeners when one or more of them failed.  The
 * cause is the first failure; later ones are attached as suppressed.
 * The change being reported has been committed.
 */
public class ListenerFailureException extends RuntimeException {

    private static final long serialVersionUID = 4395214376720339181L;

    private final transient ChangeEvent event;

    public ListenerFailureException(ChangeEvent event, Throwable cause) {
        super("Listener failed handling " + event, cause);
        this.event = Objects.requireNonNull(event, "event");
    }

    public ChangeEvent getEvent() {
        return event;
    }

}
