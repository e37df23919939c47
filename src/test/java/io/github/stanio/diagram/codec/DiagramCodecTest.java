/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.xmlunit.assertj3.XmlAssert;
import org.xmlunit.builder.Input;

import io.github.stanio.diagram.config.EditorSettings;
import io.github.stanio.diagram.geom.Point;
import io.github.stanio.diagram.model.DanglingReferencePolicy;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.model.Element;
import io.github.stanio.diagram.model.Element.End;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.PageOperations;

public class DiagramCodecTest {

    private final DiagramCodec codec = new DiagramCodec();

    @Test
    void decodeTwoPages() throws Exception {
        Diagram diagram = decodeResource("two-pages.drawio");

        assertThat(diagram.getVersion()).as("version").isEqualTo("24.7.5");
        assertThat(diagram.getPages()).extracting(Page::getName)
                .as("page names").containsExactly("Overview", "Details");

        Page overview = diagram.getPage(0);
        Element service = overview.requireElement("A");
        assertThat(service.getLabel()).as("label").isEqualTo("Service");
        assertThat(service.getStyle().getString("customKey")).as("unknown style key").isEqualTo("42");
        assertThat(overview.getSettings().get("dx")).as("page setting").isEqualTo("1200");

        Element connector = diagram.getPage(1).requireElement("E");
        assertThat(connector.getGeometry().getWaypoints()).as("waypoints")
                .containsExactly(new Point(240, 200), new Point(100, 200));
    }

    @Test
    void danglingTargetRetained() throws Exception {
        Diagram diagram = decodeResource("two-pages.drawio");

        Element connector = diagram.getPage(1).requireElement("E");
        assertThat(connector.getConnection().getTargetId()).as("target").isEqualTo("A");
        assertThat(connector.getConnection().isDangling(End.TARGET)).as("target dangling").isTrue();
        assertThat(connector.getConnection().isDangling(End.SOURCE)).as("source dangling").isFalse();
        assertThat(diagram.getPage(1).danglingConnectors()).containsExactly(connector);

        byte[] encoded = codec.encode(diagram, false);
        XmlAssert.assertThat(Input.fromByteArray(encoded))
                .valueByXPath("/mxfile/diagram[@id='p2']//mxCell[@id='E']/@target")
                .isEqualTo("A");
    }

    @Test
    void danglingTargetRejectedOnRequest() throws Exception {
        DiagramCodec strict = new DiagramCodec(EditorSettings.defaults()
                .withDanglingReferences(DanglingReferencePolicy.FAIL));

        FormatException failure = decodeFailure(strict, readResource("two-pages.drawio"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.UNRESOLVABLE_REFERENCE);
        assertThat(failure.getFragment()).as("fragment").isEqualTo("A");
        assertThat(failure.getNodePath()).as("node path")
                .isEqualTo("/mxfile/diagram[2]/mxGraphModel/root/mxCell[4]");
    }

    @Test
    void plainRoundTrip() throws Exception {
        byte[] source = readResource("two-pages.drawio");
        byte[] encoded = codec.encode(codec.decode(source), false);

        XmlAssert.assertThat(Input.fromByteArray(encoded))
                .and(Input.fromByteArray(source))
                .ignoreWhitespace()
                .areSimilar();
    }

    @Test
    void unknownMarkupPreserved() throws Exception {
        byte[] source = readResource("extras.drawio");
        Diagram diagram = codec.decode(source);

        Page page = diagram.getPage(0);
        assertThat(page.getLayers()).extracting(layer -> layer.getId())
                .as("layers").containsExactly("1", "bg");
        assertThat(page.getLayers().get(1).isVisible()).as("bg visible").isFalse();
        assertThat(page.getExtraAttributes()).as("page attributes").containsKey("data-owner");
        assertThat(page.getRootNodes()).extracting(node -> node.getName())
                .as("root nodes").containsExactly("customCell");

        Element service = page.requireElement("svc");
        assertThat(service.getLabel()).as("object label").isEqualTo("Billing");
        assertThat(service.getWrapper().getAttributes()).as("object properties")
                .containsOnlyKeys("owner", "tier");
        assertThat(service.getExtraAttributes()).as("cell attributes").containsKey("customFlag");
        assertThat(service.getShapeType()).as("shape type").isEqualTo("ellipse");

        Element image = page.requireElement("raw");
        assertThat(image.getStyle().isRaw()).as("raw style").isTrue();

        XmlAssert.assertThat(Input.fromByteArray(codec.encode(diagram, false)))
                .and(Input.fromByteArray(source))
                .ignoreWhitespace()
                .areSimilar();
    }

    @Test
    void decodeCompressed() throws Exception {
        Diagram encoded = decodeResource("compressed.drawio");
        Diagram unencoded = decodeResource("compressed-unencoded.drawio");

        Page page = encoded.getPage(0);
        assertThat(page.getElements()).extracting(Element::getId).containsExactly("A", "B", "C");
        assertThat(page.requireElement("A").getLabel()).isEqualTo("Café ✓");
        assertThat(page.requireElement("C").getConnection().getSourceId()).isEqualTo("A");
        assertThat(unencoded.getPage(0)).isEqualTo(page);
    }

    @Test
    void compressedRoundTrip() throws Exception {
        Diagram diagram = decodeResource("two-pages.drawio");

        byte[] compressed = codec.encode(diagram, true);

        XmlAssert.assertThat(Input.fromByteArray(compressed))
                .doesNotHaveXPath("/mxfile/diagram/mxGraphModel");
        assertThat(codec.decode(compressed)).isEqualTo(diagram);
    }

    @Test
    void compressedWithoutUriEncoding() throws Exception {
        DiagramCodec plain = new DiagramCodec(EditorSettings.defaults()
                .withUriEncodeCompressed(false));
        Diagram diagram = decodeResource("compressed.drawio");

        assertThat(codec.decode(plain.encode(diagram, true))).isEqualTo(diagram);
    }

    @Test
    void editedDiagramRoundTrip() throws Exception {
        Diagram diagram = decodeResource("two-pages.drawio");
        Page page = diagram.getPage(0);
        page.apply(PageOperations.create(page, Element.shape("N")
                .label("New & <improved>")
                .style("ellipse;")
                .build()));
        Page details = diagram.getPage(1);
        details.apply(PageOperations.setWaypoints(details, "E",
                Arrays.asList(new Point(0.5, 1.25))));

        assertThat(codec.decode(codec.encode(diagram, false))).isEqualTo(diagram);
    }

    @Test
    void negativeZeroRoundTrip() throws Exception {
        Diagram diagram = codec.decode(bytes("<mxGraphModel><root>"
                + "<mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
                + "<mxCell id=\"A\" vertex=\"1\" parent=\"1\">"
                + "<mxGeometry x=\"-0\" y=\"5\" width=\"10\" height=\"10\" as=\"geometry\"/>"
                + "</mxCell>"
                + "<mxCell id=\"E\" edge=\"1\" parent=\"1\">"
                + "<mxGeometry relative=\"1\" as=\"geometry\">"
                + "<Array as=\"points\"><mxPoint x=\"-0\" y=\"20\"/></Array>"
                + "</mxGeometry></mxCell>"
                + "</root></mxGraphModel>"));

        byte[] encoded = codec.encode(diagram, false);

        XmlAssert.assertThat(Input.fromByteArray(encoded))
                .valueByXPath("//mxCell[@id='A']/mxGeometry/@x").isEqualTo("-0");
        XmlAssert.assertThat(Input.fromByteArray(encoded))
                .valueByXPath("//mxCell[@id='E']//mxPoint/@x").isEqualTo("-0");
        assertThat(codec.decode(encoded)).isEqualTo(diagram);
    }

    @Test
    void bareGraphModel() throws Exception {
        byte[] source = readResource("bare-model.xml");
        Diagram diagram = codec.decode(source);

        assertThat(diagram.isBareGraphModel()).as("bare").isTrue();
        Page page = diagram.getPage(0);
        assertThat(page.requireElement("g").isGroup()).as("group").isTrue();
        assertThat(page.children("g")).extracting(Element::getId).containsExactly("m1", "m2");
        assertThat(page.absolutePosition("m2")).isEqualTo(new Point(220, 100));

        XmlAssert.assertThat(Input.fromByteArray(codec.encode(diagram, false)))
                .and(Input.fromByteArray(source))
                .ignoreWhitespace()
                .areSimilar();
    }

    @Test
    void emptyPageGetsDefaultCells() throws Exception {
        Diagram diagram = codec.decode(bytes("<mxfile><diagram name=\"Empty\"/></mxfile>"));

        Page page = diagram.getPage(0);
        assertThat(page.getId()).as("generated id").isEqualTo("page-1");
        assertThat(page.getRootCell().getId()).as("root").isEqualTo("0");
        assertThat(page.getDefaultLayer().getId()).as("layer").isEqualTo("1");
    }

    @Test
    void malformedXml() throws Exception {
        FormatException failure = decodeFailure(codec, bytes("<mxfile><diagram>"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.MALFORMED_XML);
        assertThat(failure.getNodePath()).as("location").startsWith("line 1");
    }

    @Test
    void notADiagram() throws Exception {
        FormatException failure = decodeFailure(codec, bytes("<svg/>"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.MALFORMED_XML);
        assertThat(failure.getNodePath()).isEqualTo("/svg");
    }

    @Test
    void malformedCompression() throws Exception {
        FormatException failure = decodeFailure(codec, readResource("bad-compression.drawio"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.MALFORMED_COMPRESSION);
        assertThat(failure.getNodePath()).isEqualTo("/mxfile/diagram[1]");
    }

    @Test
    void invalidBase64() throws Exception {
        FormatException failure = decodeFailure(codec,
                bytes("<mxfile><diagram id=\"x\">@@not base64@@</diagram></mxfile>"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.MALFORMED_COMPRESSION);
    }

    @Test
    void duplicateCellId() throws Exception {
        FormatException failure = decodeFailure(codec, readResource("duplicate-ids.drawio"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.DUPLICATE_ID);
        assertThat(failure.getFragment()).as("fragment").isEqualTo("A");
        assertThat(failure.getNodePath()).as("node path")
                .isEqualTo("/mxfile/diagram[1]/mxGraphModel/root/mxCell[4]");
    }

    @Test
    void duplicatePageId() throws Exception {
        FormatException failure = decodeFailure(codec,
                bytes("<mxfile><diagram id=\"p\"/><diagram id=\"p\"/></mxfile>"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.DUPLICATE_ID);
        assertThat(failure.getNodePath()).isEqualTo("/mxfile/diagram[2]");
    }

    @Test
    void unresolvableParent() throws Exception {
        FormatException failure = decodeFailure(codec, readResource("missing-parent.drawio"));

        assertThat(failure.getKind()).isEqualTo(FormatException.Kind.UNRESOLVABLE_REFERENCE);
        assertThat(failure.getFragment()).isEqualTo("nowhere");
    }

    @Test
    void decodeFromStream() throws Exception {
        try (InputStream stream = getResourceStream("two-pages.drawio")) {
            assertThat(codec.decode(stream).pageCount()).isEqualTo(2);
        }
    }

    private Diagram decodeResource(String name) throws IOException {
        return codec.decode(readResource(name));
    }

    private static FormatException decodeFailure(DiagramCodec codec, byte[] data) {
        Throwable thrown = catchThrowable(() -> codec.decode(data));
        assertThat(thrown).as("decode failure").isInstanceOf(FormatException.class);
        return (FormatException) thrown;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    static byte[] readResource(String name) throws IOException {
        try (InputStream stream = getResourceStream(name)) {
            return stream.readAllBytes();
        }
    }

    public static InputStream getResourceStream(String name) throws IOException {
        URL resource = DiagramCodecTest.class.getResource(name);
        if (resource == null) {
            String fqName = name.startsWith("/") ? name.substring(1)
                : DiagramCodecTest.class.getPackage().getName().replace('.', '/') + "/" + name;
            throw new FileNotFoundException("Resource not found: " + fqName);
        }
        return resource.openStream();
    }

}
