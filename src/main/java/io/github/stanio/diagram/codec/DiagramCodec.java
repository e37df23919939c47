/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xml.sax.InputSource;

import io.github.stanio.diagram.config.EditorSettings;
import io.github.stanio.diagram.model.Diagram;
import io.github.stanio.diagram.xml.XMLNode;
import io.github.stanio.diagram.xml.XMLNodeWriter;

/**
 * Reads and writes draw.io documents.
 * <p>
 * Reads {@code <mxfile>} documents with plain or compressed pages, and bare
 * {@code <mxGraphModel>} documents.  Markup not interpreted by the model
 * (unknown attributes and elements) is retained and written back in
 * place.</p>
 * <p>
 * Instances are not thread-safe.  Use separate instances to load or save
 * diagrams concurrently.</p>
 *
 * @see  EditorSettings#danglingReferences()
 * @see  EditorSettings#uriEncodeCompressed()
 */
public class DiagramCodec {

    private static final Logger log = Logger.getLogger(DiagramCodec.class.getName());

    private final DiagramDecoder decoder;
    private final DiagramEncoder encoder;

    public DiagramCodec() {
        this(EditorSettings.defaults());
    }

    public DiagramCodec(EditorSettings settings) {
        this.decoder = new DiagramDecoder(settings.danglingReferences());
        this.encoder = new DiagramEncoder(settings.uriEncodeCompressed());
    }

    public Diagram decode(byte[] data) throws FormatException {
        try {
            return decode(new ByteArrayInputStream(data));
        } catch (FormatException e) {
            throw e;
        } catch (IOException e) {
            // Not expected reading from memory
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @throws  FormatException  if the content is not a valid document
     * @throws  IOException  if I/O error occurs reading the input
     */
    public Diagram decode(InputStream in) throws IOException {
        Diagram diagram = decoder.decode(new InputSource(in));
        log.log(Level.FINE, "Decoded {0}", diagram);
        return diagram;
    }

    public byte[] encode(Diagram diagram, boolean compressed) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            encode(diagram, compressed, buf);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buf.toByteArray();
    }

    /**
     * Writes the diagram as UTF-8 XML.
     *
     * @param   compressed  whether to write the pages compressed
     */
    public void encode(Diagram diagram, boolean compressed, OutputStream out)
            throws IOException {
        XMLNode document = encoder.encode(diagram, compressed);
        XMLNodeWriter.write(document, out);
        log.log(Level.FINE, "Encoded {0} (compressed: {1})",
                new Object[] { diagram, compressed });
    }

}
