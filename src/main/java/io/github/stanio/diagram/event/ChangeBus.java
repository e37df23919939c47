/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous, in-process change notification.
 * <p>
 * Listeners are notified in registration order.  A listener failing with
 * an exception doesn't prevent the rest from being notified; once all have
 * been called, a {@link ListenerFailureException} is thrown with the first
 * failure as cause, later ones attached as
 * {@linkplain Throwable#getSuppressed() suppressed}.  The mutation being
 * reported stays committed.</p>
 * <p>
 * Not thread-safe.  A bus belongs to a single model instance.</p>
 */
public final class ChangeBus {

    private static final Logger log = Logger.getLogger(ChangeBus.class.getName());

    private final List<ChangeListener> listeners = new ArrayList<>();

    private ChangeEvent dispatching;

    /**
     * Registers a listener.  Subscribing the same instance twice has no
     * effect.
     */
    public void subscribe(ChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        for (ChangeListener item : listeners) {
            if (item == listener) return;
        }
        listeners.add(listener);
    }

    public boolean unsubscribe(ChangeListener listener) {
        for (int i = 0, len = listeners.size(); i < len; i++) {
            if (listeners.get(i) == listener) {
                listeners.remove(i);
                return true;
            }
        }
        return false;
    }

    public int listenerCount() {
        return listeners.size();
    }

    public boolean isDispatching() {
        return dispatching != null;
    }

    /**
     * Invoked by the model before any mutation.
     *
     * @throws  ReentrantMutationException  if called from a listener
     */
    public void checkMutationAllowed() {
        if (dispatching != null) {
            throw new ReentrantMutationException("Model mutated while notifying "
                    + dispatching.getKind() + " to listeners");
        }
    }

    public void publish(ChangeEvent event) {
        checkMutationAllowed();
        if (listeners.isEmpty())
            return;

        ChangeListener[] snapshot = listeners.toArray(new ChangeListener[0]);
        ListenerFailureException failure = null;
        dispatching = event;
        try {
            for (ChangeListener listener : snapshot) {
                try {
                    listener.changed(event);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, e, () -> "Listener failed handling " + event);
                    if (failure == null) {
                        failure = new ListenerFailureException(event, e);
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        } finally {
            dispatching = null;
        }
        if (failure != null) {
            throw failure;
        }
    }

}
