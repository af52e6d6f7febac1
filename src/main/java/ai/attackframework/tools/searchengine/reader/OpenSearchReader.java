package ai.attackframework.tools.searchengine.reader;

import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import ai.attackframework.tools.searchengine.OpenSearchEngine;
import ai.attackframework.tools.searchengine.Parameter;
import ai.attackframework.tools.searchengine.utils.Logger;

/**
 * Reads a search engine description in the OpenSearch 1.1 format.
 *
 * <p>{@code read} always returns a new engine, also when the document is not an OpenSearch
 * description or is not well-formed XML. Check {@link #hasError()} and
 * {@link OpenSearchEngine#isValid()} afterwards.</p>
 *
 * <p>Only a wrong root element and malformed XML count as errors. Everything else that does
 * not fit (unknown elements, a {@code Url} without template, a second {@code Url} of the same
 * type, {@code Param} without name or value) is skipped quietly.</p>
 *
 * <p>One reader may be used for several documents, one after the other. Not thread-safe.</p>
 *
 * @see <a href="https://github.com/dewitt/opensearch/blob/master/opensearch-1-1-draft-6.md">OpenSearch 1.1</a>
 */
public class OpenSearchReader {

    public static final String NAMESPACE = "http://a9.com/-/spec/opensearch/1.1/";
    public static final String ROOT_ELEMENT = "OpenSearchDescription";

    public static final String TYPE_HTML = "text/html";
    public static final String TYPE_XHTML = "application/xhtml+xml";
    public static final String TYPE_SUGGESTIONS_JSON = "application/x-suggestions+json";

    static final String NOT_OPENSEARCH = "The file is not an OpenSearch 1.1 file.";

    private final XMLInputFactory factory;

    private String errorString = "";

    public OpenSearchReader() {
        factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    /** Reads a description from a byte stream; the encoding is taken from the XML declaration. */
    public OpenSearchEngine read(InputStream in) {
        reset();
        OpenSearchEngine engine = new OpenSearchEngine();
        if (in == null) {
            raiseError(NOT_OPENSEARCH);
            return engine;
        }
        try {
            readDocument(factory.createXMLStreamReader(in), engine);
        } catch (XMLStreamException e) {
            raiseError(describe(e));
        }
        return engine;
    }

    /** Reads a description from a character stream. */
    public OpenSearchEngine read(Reader reader) {
        reset();
        OpenSearchEngine engine = new OpenSearchEngine();
        if (reader == null) {
            raiseError(NOT_OPENSEARCH);
            return engine;
        }
        try {
            readDocument(factory.createXMLStreamReader(reader), engine);
        } catch (XMLStreamException e) {
            raiseError(describe(e));
        }
        return engine;
    }

    /** Reads a description held in a string. */
    public OpenSearchEngine read(String xml) {
        return read(xml == null ? null : new StringReader(xml));
    }

    /** True when the last {@code read} hit a structural error. */
    public boolean hasError() {
        return !errorString.isEmpty();
    }

    /** Message of the last structural error, or an empty string. */
    public String errorString() {
        return errorString;
    }

    // -------- document structure --------

    private void readDocument(XMLStreamReader xml, OpenSearchEngine engine) throws XMLStreamException {
        try {
            while (!xml.isStartElement() && xml.hasNext()) {
                xml.next();
            }

            if (!xml.isStartElement()
                    || !ROOT_ELEMENT.equals(xml.getLocalName())
                    || !NAMESPACE.equals(xml.getNamespaceURI())) {
                raiseError(NOT_OPENSEARCH);
                return;
            }

            while (xml.hasNext()) {
                int event = xml.next();
                if (event == XMLStreamConstants.END_ELEMENT) break;
                if (event != XMLStreamConstants.START_ELEMENT) continue;

                switch (xml.getLocalName()) {
                    case "ShortName":   engine.setName(readText(xml)); break;
                    case "Description": engine.setDescription(readText(xml)); break;
                    case "Url":         readUrl(xml, engine); break;
                    case "Image":       engine.setImageUrl(readText(xml)); break;
                    case "Tags":        readTags(xml, engine); break;
                    default:            skipSubtree(xml); break;
                }
            }
        } finally {
            xml.close();
        }
    }

    private void readUrl(XMLStreamReader xml, OpenSearchEngine engine) throws XMLStreamException {
        String type = attribute(xml, "type");
        String template = attribute(xml, "template");
        String method = attribute(xml, "method");

        if (type.isEmpty() || TYPE_XHTML.equals(type)) {
            type = TYPE_HTML;
        }

        if (template.isEmpty()) {
            skipSubtree(xml);
            return;
        }

        // first Url of each type wins
        if (TYPE_SUGGESTIONS_JSON.equals(type) && engine.providesSuggestions()) {
            skipSubtree(xml);
            return;
        }
        if (TYPE_HTML.equals(type) && !engine.getSearchUrlTemplate().isEmpty()) {
            skipSubtree(xml);
            return;
        }

        List<Parameter> parameters = new ArrayList<>();
        while (xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.END_ELEMENT) break;
            if (event != XMLStreamConstants.START_ELEMENT) continue;

            String name = xml.getLocalName();
            if ("Param".equals(name) || "Parameter".equals(name)) {
                readParameter(xml, parameters);
            } else {
                skipSubtree(xml);
            }
        }

        if (TYPE_SUGGESTIONS_JSON.equals(type)) {
            engine.setSuggestionsUrlTemplate(template);
            engine.setSuggestionsParameters(parameters);
            engine.setSuggestionsMethod(method);
        } else if (TYPE_HTML.equals(type)) {
            engine.setSearchUrlTemplate(template);
            engine.setSearchParameters(parameters);
            engine.setSearchMethod(method);
        } else {
            Logger.internalDebug("[Reader] Ignoring Url of type " + type);
        }
    }

    private void readParameter(XMLStreamReader xml, List<Parameter> parameters) throws XMLStreamException {
        String key = attribute(xml, "name");
        String value = attribute(xml, "value");
        if (!key.isEmpty() && !value.isEmpty()) {
            parameters.add(new Parameter(key, value));
        }
        skipSubtree(xml);
    }

    private void readTags(XMLStreamReader xml, OpenSearchEngine engine) throws XMLStreamException {
        String text = readText(xml);
        engine.setTags(Arrays.stream(text.split(" "))
                .filter(t -> !t.isEmpty())
                .toList());
    }

    // -------- token helpers --------

    /**
     * Collects the character data of the current element up to its end tag.
     * Nested elements are skipped together with their text.
     */
    private String readText(XMLStreamReader xml) throws XMLStreamException {
        StringBuilder text = new StringBuilder();
        while (xml.hasNext()) {
            int event = xml.next();
            switch (event) {
                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                case XMLStreamConstants.SPACE:
                case XMLStreamConstants.ENTITY_REFERENCE:
                    text.append(xml.getText());
                    break;
                case XMLStreamConstants.START_ELEMENT:
                    skipSubtree(xml);
                    break;
                case XMLStreamConstants.END_ELEMENT:
                    return text.toString();
                default:
                    break;
            }
        }
        return text.toString();
    }

    /** Consumes events up to and including the end tag of the current element. */
    private void skipSubtree(XMLStreamReader xml) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.START_ELEMENT) depth++;
            else if (event == XMLStreamConstants.END_ELEMENT) depth--;
        }
    }

    private static String attribute(XMLStreamReader xml, String name) {
        String v = xml.getAttributeValue(null, name);
        return v == null ? "" : v;
    }

    // -------- error state --------

    private void reset() {
        errorString = "";
    }

    private void raiseError(String message) {
        errorString = message;
        Logger.logWarn("[Reader] " + message);
    }

    private static String describe(XMLStreamException e) {
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (e.getLocation() != null && e.getLocation().getLineNumber() > 0) {
            return "XML error at line " + e.getLocation().getLineNumber() + ": " + msg;
        }
        return "XML error: " + msg;
    }
}
