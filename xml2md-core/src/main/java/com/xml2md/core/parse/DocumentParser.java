package com.xml2md.core.parse;

import com.xml2md.core.model.DocNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads docutils XML (the output of {@code rst2xml}) into a {@link DocNode} tree.
 *
 * <p>Parsing uses the JDK DOM parser. The docutils DOCTYPE is accepted but its external DTD
 * is never fetched, and external entities are refused. Comments and processing
 * instructions are dropped; CDATA sections are merged into the surrounding text. Whitespace
 * between elements is kept as text, since literal blocks depend on it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DocNode document = new DocumentParser().parse(Paths.get("guide.xml"));
 * }</pre>
 */
public class DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    private static final String FEATURE_LOAD_EXTERNAL_DTD =
        "http://apache.org/xml/features/nonvalidating/load-external-dtd";
    private static final String FEATURE_EXTERNAL_GENERAL_ENTITIES =
        "http://xml.org/sax/features/external-general-entities";
    private static final String FEATURE_EXTERNAL_PARAMETER_ENTITIES =
        "http://xml.org/sax/features/external-parameter-entities";

    /**
     * Parses a document file.
     *
     * @param file XML file to read
     * @return root element of the document
     * @throws IOException if the file cannot be read
     * @throws DocumentParseException if the content is not well-formed XML
     */
    public DocNode parse(Path file) throws IOException {
        log.debug("Parsing document: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            InputSource source = new InputSource(in);
            source.setSystemId(file.toUri().toString());
            return parse(source, file.toString());
        }
    }

    /**
     * Parses a document from a stream. The stream is not closed.
     *
     * @param in XML input
     * @return root element of the document
     * @throws IOException if the stream cannot be read
     * @throws DocumentParseException if the content is not well-formed XML
     */
    public DocNode parse(InputStream in) throws IOException {
        return parse(new InputSource(in), "<stream>");
    }

    /**
     * Parses a document held in a string.
     *
     * @param xml XML text
     * @return root element of the document
     * @throws DocumentParseException if the content is not well-formed XML
     */
    public DocNode parseString(String xml) throws DocumentParseException {
        try {
            return parse(new InputSource(new StringReader(xml)), "<string>");
        } catch (DocumentParseException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read XML string", e);
        }
    }

    private DocNode parse(InputSource source, String description) throws IOException {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler(description));
            Element root = builder.parse(source).getDocumentElement();
            DocNode document = toDocNode(root);
            log.debug("Parsed {}: root <{}>", description, document.kind());
            return document;
        } catch (SAXException e) {
            throw new DocumentParseException("Failed to parse document " + description + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        factory.setExpandEntityReferences(true);
        factory.setXIncludeAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature(FEATURE_LOAD_EXTERNAL_DTD, false);
        factory.setFeature(FEATURE_EXTERNAL_GENERAL_ENTITIES, false);
        factory.setFeature(FEATURE_EXTERNAL_PARAMETER_ENTITIES, false);
        return factory;
    }

    /**
     * Logs recoverable parser warnings and fails on errors, instead of the JDK default of
     * printing to stderr.
     */
    private static final class LoggingErrorHandler implements ErrorHandler {
        private final String description;

        private LoggingErrorHandler(String description) {
            this.description = description;
        }

        @Override
        public void warning(SAXParseException e) {
            log.warn("XML warning in {} at line {}: {}", description, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    private static DocNode toDocNode(Element element) {
        DocNode.Builder builder = DocNode.builder(element.getTagName());

        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attribute = attributes.item(i);
            builder.attribute(attribute.getNodeName(), attribute.getNodeValue());
        }

        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE -> builder.child(toDocNode((Element) child));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> builder.text(child.getNodeValue());
                default -> {
                    // comments and processing instructions carry no content
                }
            }
        }
        return builder.build();
    }
}
