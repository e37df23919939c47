/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.xml;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.lang.ref.Reference;
import java.lang.ref.SoftReference;
import java.util.Map;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Result;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.sax.SAXTransformerFactory;
import javax.xml.transform.sax.TransformerHandler;
import javax.xml.transform.stream.StreamResult;

import org.xml.sax.SAXException;
import org.xml.sax.helpers.AttributesImpl;

/**
 * Serializes {@link XMLNode} trees as UTF-8 XML without an XML
 * declaration.  Content is written as is: no indentation is added.
 */
public final class XMLNodeWriter {

    private static final ThreadLocal<Reference<SAXTransformerFactory>>
            localFactory = ThreadLocal.withInitial(() -> new SoftReference<>(null));

    private XMLNodeWriter() {
        // no instances
    }

    public static void write(XMLNode node, OutputStream out) throws IOException {
        write(node, new StreamResult(out));
    }

    public static void write(XMLNode node, Writer out) throws IOException {
        write(node, new StreamResult(out));
    }

    public static String toString(XMLNode node) {
        StringWriter buf = new StringWriter();
        try {
            write(node, buf);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return buf.toString();
    }

    private static void write(XMLNode node, Result result) throws IOException {
        TransformerHandler xmlOut = newHandler();
        xmlOut.setResult(result);
        try {
            xmlOut.startDocument();
            writeElement(xmlOut, node);
            xmlOut.endDocument();
        } catch (SAXException e) {
            throw ioException(e);
        }
    }

    private static void writeElement(TransformerHandler xmlOut, XMLNode node)
            throws SAXException {
        AttributesImpl atts = new AttributesImpl();
        for (Map.Entry<String, String> entry : node.getAttributes().entrySet()) {
            atts.addAttribute("", "", entry.getKey(), "CDATA", entry.getValue());
        }
        xmlOut.startElement("", "", node.getName(), atts);
        for (Object item : node.getContent()) {
            if (item instanceof XMLNode) {
                writeElement(xmlOut, (XMLNode) item);
            } else {
                char[] chars = ((String) item).toCharArray();
                xmlOut.characters(chars, 0, chars.length);
            }
        }
        xmlOut.endElement("", "", node.getName());
    }

    private static TransformerHandler newHandler() {
        TransformerHandler handler;
        try {
            handler = transformerFactory().newTransformerHandler();
        } catch (TransformerConfigurationException e) {
            throw new IllegalStateException(e);
        }
        Transformer transformer = handler.getTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.INDENT, "no");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        return handler;
    }

    private static SAXTransformerFactory transformerFactory() {
        SAXTransformerFactory stf = localFactory.get().get();
        if (stf == null) {
            stf = (SAXTransformerFactory) TransformerFactory.newInstance();
            localFactory.set(new SoftReference<>(stf));
        }
        return stf;
    }

    static IOException ioException(SAXException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
            return (IOException) cause;
        }
        return new IOException(e);
    }

}
