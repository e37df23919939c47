/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.xml;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.xmlunit.assertj3.XmlAssert;

public class XMLNodeWriterTest {

    @Test
    void writeTree() throws Exception {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("value", "a < b & \"c\"");
        attributes.put("id", "2");
        XMLNode node = new XMLNode("mxCell", attributes, Arrays.asList(
                XMLNode.of("mxGeometry", Collections.singletonMap("as", "geometry")),
                "Grüße"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        XMLNodeWriter.write(node, out);
        String xml = new String(out.toByteArray(), StandardCharsets.UTF_8);

        assertThat(xml).as("xml declaration").doesNotStartWith("<?xml");
        assertThat(xml).as("attribute order").contains("value=").contains("id=\"2\"");
        assertThat(xml.indexOf("value=")).isLessThan(xml.indexOf("id="));
        XmlAssert.assertThat(xml)
                .and("<mxCell value='a &lt; b &amp; &quot;c&quot;' id='2'>"
                        + "<mxGeometry as='geometry'/>Grüße</mxCell>")
                .areIdentical();
    }

    @Test
    void readWriteRoundTrip() throws Exception {
        String source = "<mxfile host=\"x\"><diagram id=\"1\" name=\"P\">"
                + "<custom a=\"1\">text</custom></diagram></mxfile>";

        XMLNode node = new XMLNodeReader().parse(source);

        XmlAssert.assertThat(XMLNodeWriter.toString(node)).and(source).areIdentical();
        assertThat(new XMLNodeReader().parse(XMLNodeWriter.toString(node))).isEqualTo(node);
    }

}
