/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.style;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class StyleTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "rounded=0;whiteSpace=wrap;html=1;fillColor=#dae8fc;",
        "ellipse;whiteSpace=wrap;html=1",
        "a=1;;b=2;",
        "a=1;b=2;a=3;",
        "text;strokeColor=none;align=center;",
        "image=data:image/png,iVBORw0KGgo=;",
        ";",
    })
    void parseReproducesSource(String text) {
        Style style = Style.parse(text);

        assertThat(style.toString()).as("style text").isEqualTo(text);
        assertThat(style.isRaw()).as("raw").isFalse();
    }

    @Test
    void parseEntries() {
        Style style = Style.parse("ellipse;whiteSpace=wrap;fillColor=#dae8fc;dashed=;");

        assertThat(style.asMap()).containsExactly(
                entry("ellipse", null),
                entry("whiteSpace", "wrap"),
                entry("fillColor", "#dae8fc"),
                entry("dashed", ""));
        assertThat(style.isFlag("ellipse")).as("ellipse flag").isTrue();
        assertThat(style.isFlag("dashed")).as("dashed flag").isFalse();
        assertThat(style.getString("ellipse")).as("flag value").isNull();
    }

    @Test
    void duplicateKeyLastValueWins() {
        Style style = Style.parse("a=1;b=2;a=3;");

        assertThat(style.asMap()).containsExactly(entry("a", "3"), entry("b", "2"));
        assertThat(style.toString()).isEqualTo("a=1;b=2;a=3;");
    }

    @Test
    void modifiedStyleWrittenFromEntries() {
        Style style = Style.parse("a=1;b=2;a=3;").with("c", "4");

        assertThat(style.toString()).isEqualTo("a=3;b=2;c=4;");
    }

    @Test
    void modifiedStyleWithoutTrailingDelimiter() {
        Style style = Style.parse("ellipse;html=1").with("html", "0");

        assertThat(style.toString()).isEqualTo("ellipse;html=0");
    }

    @Test
    void withSameValueReturnsSameInstance() {
        Style style = Style.parse("a=1;");

        assertThat(style.with("a", "1")).isSameAs(style);
        assertThat(style.without("missing")).isSameAs(style);
    }

    @Test
    void withoutRemovesEntry() {
        Style style = Style.parse("a=1;b=2;c=3;").without("b");

        assertThat(style.toString()).isEqualTo("a=1;c=3;");
    }

    @Test
    void typedValues() {
        Style style = Style.parse("fontSize=14;opacity=abc;rounded=1;shadow=true;glass=0;");

        assertThat(style.getNumber("fontSize")).hasValue(14.0);
        assertThat(style.getNumber("opacity")).isEmpty();
        assertThat(style.getNumber("missing")).isEmpty();
        assertThat(style.getBoolean("rounded", false)).as("rounded").isTrue();
        assertThat(style.getBoolean("shadow", false)).as("shadow").isTrue();
        assertThat(style.getBoolean("glass", true)).as("glass").isFalse();
        assertThat(style.getBoolean("missing", true)).as("missing").isTrue();
    }

    @Test
    void numberValueFormat() {
        Style style = Style.EMPTY.with("fontSize", 12.0).with("opacity", 0.5);

        assertThat(style.toString()).isEqualTo("fontSize=12;opacity=0.5;");
    }

    @Test
    void valueWithDelimiterRejected() {
        assertThatThrownBy(() -> Style.EMPTY.with("label", "a;b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyKeyMalformed() {
        assertThatThrownBy(() -> Style.parse("fillColor=red;=blue;"))
                .isInstanceOf(MalformedStyleException.class)
                .extracting(e -> ((MalformedStyleException) e).getOffset())
                .isEqualTo(14);
    }

    @Test
    void unescapedDelimiterInValueMalformed() {
        String text = "shape=image;image=data:image/svg+xml;base64,PHN2Zz48L3N2Zz4=;";

        assertThatThrownBy(() -> Style.parse(text))
                .isInstanceOf(MalformedStyleException.class);

        Style lenient = Style.parseLenient(text);
        assertThat(lenient.isRaw()).as("raw").isTrue();
        assertThat(lenient.toString()).as("raw text").isEqualTo(text);
        assertThat(lenient.asMap()).as("raw entries").isEmpty();
    }

    @Test
    void rawStyleCannotBeModified() {
        Style raw = Style.raw("=x");

        assertThatThrownBy(() -> raw.with("a", "1"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shapeTypeTag() {
        assertThat(Style.parse("shape=cylinder3;ellipse;").shapeType()).isEqualTo("cylinder3");
        assertThat(Style.parse("whiteSpace=wrap;ellipse;").shapeType()).isEqualTo("ellipse");
        assertThat(Style.parse("rounded=1;").shapeType()).isEqualTo("rectangle");
        assertThat(Style.parse("edgeStyle=orthogonalEdgeStyle;").edgeStyle())
                .isEqualTo("orthogonalEdgeStyle");
    }

    @Test
    void lockedEntry() {
        assertThat(Style.parse("locked=1;").isLocked()).as("locked=1").isTrue();
        assertThat(Style.parse("locked=0;").isLocked()).as("locked=0").isFalse();
        assertThat(Style.EMPTY.isLocked()).as("empty").isFalse();
    }

    @Test
    void equalityByText() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("a", "1");
        entries.put("b", null);

        assertThat(Style.of(entries)).isEqualTo(Style.parse("a=1;b;"));
        assertThat(Style.parse("a=1;b=2;a=1;")).isNotEqualTo(Style.parse("a=1;b=2;"));
    }

}
