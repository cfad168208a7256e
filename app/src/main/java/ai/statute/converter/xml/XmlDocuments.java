package ai.statute.converter.xml;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses and serializes statute XML fragments with the JDK DOM implementation.
 */
public final class XmlDocuments {

    private XmlDocuments() {
    }

    /**
     * Parses a complete XML string and returns its root element.
     *
     * @throws MalformedXmlException when the string is not well-formed
     */
    public static Element parse(String xml) {
        Objects.requireNonNull(xml, "xml");
        try {
            DocumentBuilder builder = newBuilder();
            return builder.parse(new InputSource(new StringReader(xml))).getDocumentElement();
        } catch (SAXException ex) {
            throw new MalformedXmlException("Invalid XML format: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new MalformedXmlException("Failed to read XML input", ex);
        }
    }

    /**
     * Serializes an element and its descendants into a standalone XML string without declaration.
     */
    public static String serialize(Element element) {
        Objects.requireNonNull(element, "element");
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(element), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException ex) {
            throw new StatuteConversionException("Failed to serialize <" + element.getTagName() + ">", ex);
        }
    }

    private static DocumentBuilder newBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder;
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is not available", ex);
        }
    }

    /**
     * Keeps the JDK parser from printing diagnostics to stderr; fatal errors surface as exceptions.
     */
    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            // warnings do not affect the parsed tree
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
