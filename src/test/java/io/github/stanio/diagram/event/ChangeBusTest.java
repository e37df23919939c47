/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ChangeBusTest {

    private final ChangeBus bus = new ChangeBus();

    private static ChangeEvent event(ChangeEvent.Kind kind) {
        return new ChangeEvent(kind, ChangeEvent.Cause.EDIT,
                "page-1", Collections.singletonList("2"));
    }

    @Test
    void listenersNotifiedInSubscriptionOrder() {
        List<String> calls = new ArrayList<>();
        bus.subscribe(e -> calls.add("first " + e.getKind()));
        bus.subscribe(e -> calls.add("second " + e.getKind()));

        bus.publish(event(ChangeEvent.Kind.ELEMENT_MOVED));

        assertThat(calls).containsExactly("first ELEMENT_MOVED", "second ELEMENT_MOVED");
    }

    @Test
    void duplicateSubscriptionIgnored() {
        List<ChangeEvent> received = new ArrayList<>();
        ChangeListener listener = received::add;
        bus.subscribe(listener);
        bus.subscribe(listener);

        bus.publish(event(ChangeEvent.Kind.ELEMENT_CREATED));

        assertThat(bus.listenerCount()).as("listener count").isEqualTo(1);
        assertThat(received).as("received").hasSize(1);
    }

    @Test
    void unsubscribe() {
        List<ChangeEvent> received = new ArrayList<>();
        ChangeListener listener = received::add;
        bus.subscribe(listener);

        assertThat(bus.unsubscribe(listener)).as("removed").isTrue();
        assertThat(bus.unsubscribe(listener)).as("removed again").isFalse();

        bus.publish(event(ChangeEvent.Kind.ELEMENT_CREATED));
        assertThat(received).isEmpty();
    }

    @Test
    void unsubscribeDuringDispatch() {
        List<String> calls = new ArrayList<>();
        ChangeListener second = e -> calls.add("second");
        bus.subscribe(e -> {
            calls.add("first");
            bus.unsubscribe(second);
        });
        bus.subscribe(second);

        bus.publish(event(ChangeEvent.Kind.ELEMENT_CREATED));
        bus.publish(event(ChangeEvent.Kind.ELEMENT_DELETED));

        assertThat(calls).containsExactly("first", "second", "first");
    }

    @Test
    void mutationFromListenerRejected() {
        List<Throwable> failures = new ArrayList<>();
        bus.subscribe(e -> {
            try {
                bus.checkMutationAllowed();
            } catch (ReentrantMutationException ex) {
                failures.add(ex);
            }
        });

        bus.publish(event(ChangeEvent.Kind.ELEMENT_MOVED));

        assertThat(failures).hasSize(1);
        assertThat(bus.isDispatching()).as("dispatching").isFalse();
    }

    @Test
    void listenerFailureReportedAfterAllNotified() {
        List<String> calls = new ArrayList<>();
        bus.subscribe(e -> { throw new IllegalStateException("first"); });
        bus.subscribe(e -> calls.add("second"));
        bus.subscribe(e -> { throw new IllegalArgumentException("third"); });

        ChangeEvent event = event(ChangeEvent.Kind.ELEMENT_RESIZED);
        Throwable thrown = catchThrowable(() -> bus.publish(event));

        assertThat(thrown).isInstanceOf(ListenerFailureException.class);
        ListenerFailureException failure = (ListenerFailureException) thrown;

        assertThat(calls).as("calls").containsExactly("second");
        assertThat(failure.getEvent()).as("event").isSameAs(event);
        assertThat(failure.getCause()).as("cause").hasMessage("first");
        assertThat(failure.getSuppressed()).as("suppressed")
                .extracting(Throwable::getMessage).containsExactly("third");
        assertThat(bus.isDispatching()).as("dispatching").isFalse();
    }

    @Test
    void nullListenerRejected() {
        assertThatThrownBy(() -> bus.subscribe(null))
                .isInstanceOf(NullPointerException.class);
    }

}
