/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.xml;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.XMLReader;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads an XML document into an {@link XMLNode} tree.  External entities
 * and DTDs are not loaded.
 * <p>
 * Instances are not thread-safe; the parser is reused between {@code
 * parse} invocations.</p>
 */
public class XMLNodeReader {

    private final TreeBuilder treeBuilder = new TreeBuilder();

    private XMLReader xmlReader;

    private XMLReader xmlReader() {
        if (xmlReader != null) return xmlReader;

        try {
            SAXParserFactory spf = SAXParserFactory.newInstance();
            spf.setNamespaceAware(false);
            spf.setValidating(false);
            spf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);

            SAXParser parser = spf.newSAXParser();
            parser.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");

            XMLReader reader = parser.getXMLReader();
            reader.setContentHandler(treeBuilder);
            reader.setErrorHandler(treeBuilder);
            reader.setEntityResolver(treeBuilder);
            return (xmlReader = reader);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * @return  the document element
     * @throws  SAXParseException  if the document is not well-formed
     * @throws  IOException  if I/O error occurs
     */
    public XMLNode parse(InputSource source) throws IOException, SAXException {
        try {
            xmlReader().parse(source);
            return treeBuilder.documentElement;
        } finally {
            treeBuilder.reset();
        }
    }

    public XMLNode parse(String text) throws IOException, SAXException {
        return parse(new InputSource(new StringReader(text)));
    }


    private static final class OpenElement {

        final String name;
        final Map<String, String> attributes;
        final List<Object> content = new ArrayList<>();

        OpenElement(String name, Attributes atts) {
            this.name = name;
            this.attributes = new LinkedHashMap<>(atts.getLength() * 4 / 3 + 1);
            for (int i = 0, len = atts.getLength(); i < len; i++) {
                attributes.put(atts.getQName(i), atts.getValue(i));
            }
        }

        XMLNode toNode() {
            return new XMLNode(name, attributes, content);
        }

    }


    private static final class TreeBuilder extends DefaultHandler {

        private final Deque<OpenElement> stack = new ArrayDeque<>();
        private final StringBuilder text = new StringBuilder();

        XMLNode documentElement;

        void reset() {
            stack.clear();
            text.setLength(0);
            documentElement = null;
        }

        @Override
        public InputSource resolveEntity(String publicId, String systemId) {
            return new InputSource(new StringReader(""));
        }

        @Override
        public void startDocument() {
            reset();
        }

        @Override
        public void startElement(String uri, String localName,
                                 String qname, Attributes attributes) {
            flushText();
            stack.push(new OpenElement(qname, attributes));
        }

        @Override
        public void endElement(String uri, String localName, String qname) {
            flushText();
            XMLNode node = stack.pop().toNode();
            if (stack.isEmpty()) {
                documentElement = node;
            } else {
                stack.peek().content.add(node);
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            text.append(ch, start, length);
        }

        private void flushText() {
            if (text.length() == 0)
                return;

            if (!stack.isEmpty() && !isBlank(text)) {
                stack.peek().content.add(text.toString());
            }
            text.setLength(0);
        }

        private static boolean isBlank(CharSequence chars) {
            for (int i = 0, len = chars.length(); i < len; i++) {
                if (!Character.isWhitespace(chars.charAt(i)))
                    return false;
            }
            return true;
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

    } // class TreeBuilder


}
