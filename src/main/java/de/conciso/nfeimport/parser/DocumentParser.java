package de.conciso.nfeimport.parser;

import java.io.ByteArrayInputStream;
import java.util.ArrayDeque;
import java.util.Deque;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Turns raw XML into a Jackson tree keyed by local element names. Attributes are {@code @name} fields,
 * repeated siblings become arrays and empty elements {@code null}.
 */
@Component
public class DocumentParser {

    static final String TEXT_KEY = "#text";
    static final String ATTRIBUTE_PREFIX = "@";

    private final XMLInputFactory inputFactory;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public DocumentParser() {
        this.inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    private static final class Frame {
        final String name;
        final ObjectNode content;
        final StringBuilder text = new StringBuilder();

        Frame(String name, ObjectNode content) {
            this.name = name;
            this.content = content;
        }
    }

    public JsonNode parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentParseException("Document is empty", null);
        }
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(content));
            return readDocument(reader);
        } catch (XMLStreamException e) {
            throw new DocumentParseException("Malformed XML: " + e.getMessage(), e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException ignored) {
                    // the underlying stream is an in-memory buffer
                }
            }
        }
    }

    private JsonNode readDocument(XMLStreamReader reader) throws XMLStreamException {
        Deque<Frame> stack = new ArrayDeque<>();
        ObjectNode root = nodes.objectNode();

        while (reader.hasNext()) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> stack.push(openElement(reader));
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                    if (!stack.isEmpty()) {
                        stack.peek().text.append(reader.getText());
                    }
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    Frame frame = stack.pop();
                    JsonNode value = closeElement(frame);
                    addChild(stack.isEmpty() ? root : stack.peek().content, frame.name, value);
                }
                default -> {
                    // comments, processing instructions and the document boundaries carry no data
                }
            }
        }

        if (root.isEmpty()) {
            throw new DocumentParseException("Document has no root element", null);
        }
        return root;
    }

    private Frame openElement(XMLStreamReader reader) {
        ObjectNode content = nodes.objectNode();
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            String prefix = reader.getNamespacePrefix(i);
            String key = (prefix == null || prefix.isEmpty()) ? "xmlns" : "xmlns:" + prefix;
            content.put(ATTRIBUTE_PREFIX + key, reader.getNamespaceURI(i));
        }
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            String prefix = reader.getAttributePrefix(i);
            String local = reader.getAttributeLocalName(i);
            String key = (prefix == null || prefix.isEmpty()) ? local : prefix + ":" + local;
            content.put(ATTRIBUTE_PREFIX + key, reader.getAttributeValue(i));
        }
        return new Frame(reader.getLocalName(), content);
    }

    private JsonNode closeElement(Frame frame) {
        String text = frame.text.toString().trim();
        if (frame.content.isEmpty()) {
            return text.isEmpty() ? nodes.nullNode() : nodes.textNode(text);
        }
        if (!text.isEmpty()) {
            frame.content.put(TEXT_KEY, text);
        }
        return frame.content;
    }

    private void addChild(ObjectNode parent, String name, JsonNode value) {
        JsonNode existing = parent.get(name);
        if (existing == null) {
            parent.set(name, value);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
        } else {
            ArrayNode repeated = nodes.arrayNode();
            repeated.add(existing);
            repeated.add(value);
            parent.set(name, repeated);
        }
    }
}
