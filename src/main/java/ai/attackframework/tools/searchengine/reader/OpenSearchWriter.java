package ai.attackframework.tools.searchengine.reader;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import ai.attackframework.tools.searchengine.OpenSearchEngine;
import ai.attackframework.tools.searchengine.Parameter;
import ai.attackframework.tools.searchengine.RequestMethod;

/**
 * Writes an engine as an OpenSearch 1.1 description that {@link OpenSearchReader} reads back
 * to an equal engine.
 *
 * <p>Child elements are unprefixed and inherit the default namespace declared on the root.
 * {@code ShortName} and {@code Description} are always written. A {@code Url} is written
 * per non-empty template, with its method and {@code Param} children in order. {@code Image}
 * and {@code Tags} are written when set. The cached image is not part of the document.</p>
 */
public class OpenSearchWriter {

    private final XMLOutputFactory factory = XMLOutputFactory.newFactory();

    /** Writes {@code engine} as UTF-8 to {@code out}. The stream is flushed, not closed. */
    public void write(OpenSearchEngine engine, OutputStream out) throws IOException {
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            writeDocument(xml, engine);
        } catch (XMLStreamException e) {
            throw new IOException("Could not write description of '" + engine.getName() + "'", e);
        }
        out.flush();
    }

    /** Writes {@code engine} to {@code out}. The writer is flushed, not closed. */
    public void write(OpenSearchEngine engine, Writer out) throws IOException {
        try {
            writeDocument(factory.createXMLStreamWriter(out), engine);
        } catch (XMLStreamException e) {
            throw new IOException("Could not write description of '" + engine.getName() + "'", e);
        }
        out.flush();
    }

    /** Returns the description document of {@code engine} as a string. */
    public String toXml(OpenSearchEngine engine) {
        StringWriter out = new StringWriter();
        try {
            write(engine, out);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return out.toString();
    }

    private void writeDocument(XMLStreamWriter xml, OpenSearchEngine engine) throws XMLStreamException {
        xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
        xml.writeStartElement(OpenSearchReader.ROOT_ELEMENT);
        xml.writeDefaultNamespace(OpenSearchReader.NAMESPACE);

        textElement(xml, "ShortName", engine.getName());
        textElement(xml, "Description", engine.getDescription());

        if (!engine.getSearchUrlTemplate().isEmpty()) {
            url(xml, OpenSearchReader.TYPE_HTML, engine.getSearchUrlTemplate(),
                    engine.getSearchMethod(), engine.getSearchParameters());
        }
        if (!engine.getSuggestionsUrlTemplate().isEmpty()) {
            url(xml, OpenSearchReader.TYPE_SUGGESTIONS_JSON, engine.getSuggestionsUrlTemplate(),
                    engine.getSuggestionsMethod(), engine.getSuggestionsParameters());
        }
        if (!engine.getImageUrl().isEmpty()) {
            textElement(xml, "Image", engine.getImageUrl());
        }
        if (!engine.getTags().isEmpty()) {
            textElement(xml, "Tags", String.join(" ", engine.getTags()));
        }

        xml.writeEndElement();
        xml.writeEndDocument();
        xml.flush();
        xml.close();
    }

    private static void url(XMLStreamWriter xml, String type, String template,
                            RequestMethod method, List<Parameter> parameters) throws XMLStreamException {
        if (parameters.isEmpty()) {
            xml.writeEmptyElement("Url");
        } else {
            xml.writeStartElement("Url");
        }
        xml.writeAttribute("type", type);
        xml.writeAttribute("method", method.wireName());
        xml.writeAttribute("template", template);

        if (parameters.isEmpty()) return;
        for (Parameter p : parameters) {
            xml.writeEmptyElement("Param");
            xml.writeAttribute("name", p.key());
            xml.writeAttribute("value", p.value());
        }
        xml.writeEndElement();
    }

    private static void textElement(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }
}
