/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.style;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

public class StyleRegistryTest {

    private final StyleRegistry registry = new StyleRegistry()
            .register("note", Style.parse("fillColor=#fff2cc;strokeColor=#d6b656;rounded=1;"))
            .register("dashed", Style.parse("dashed=1;"));

    @Test
    void resolveNamedReference() {
        Style resolved = registry.resolve(Style.parse("note;strokeColor=#000000;"));

        assertThat(resolved.asMap()).containsExactly(
                entry("fillColor", "#fff2cc"),
                entry("strokeColor", "#000000"),
                entry("rounded", "1"));
    }

    @Test
    void resolveMultipleReferences() {
        Style resolved = registry.resolve(Style.parse("note;dashed;html=1"));

        assertThat(resolved.asMap()).containsExactly(
                entry("fillColor", "#fff2cc"),
                entry("strokeColor", "#d6b656"),
                entry("rounded", "1"),
                entry("dashed", "1"),
                entry("html", "1"));
    }

    @Test
    void unreferencedStyleReturnedAsIs() {
        Style style = Style.parse("ellipse;html=1;");

        assertThat(registry.resolve(style)).isSameAs(style);
    }

    @Test
    void rawStyleNotResolved() {
        Style raw = Style.raw("note;=x");

        assertThat(registry.resolve(raw)).isSameAs(raw);
        assertThatThrownBy(() -> registry.register("broken", raw))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unregister() {
        StyleRegistry local = new StyleRegistry()
                .register("a", Style.parse("x=1"));

        assertThat(local.unregister("a")).isEqualTo(Style.parse("x=1"));
        assertThat(local.names()).isEmpty();
        assertThat(local.get("a")).isNull();
    }

}
