package io.github.yok.batchbulkedit.util;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
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
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/**
 * Utility class for reading, navigating and writing recipe XML documents through JAXP DOM.
 *
 * <p>
 * Documents are parsed namespace-aware with DTDs and external entities disabled. Element lookups
 * compare local names only, so the helpers work regardless of the namespace prefix a document
 * uses.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class XmlUtils {

    // Indentation written between elements
    private static final String INDENT_AMOUNT = "2";

    private XmlUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Parses the given XML file.
     *
     * @param file XML file to read
     * @return parsed document
     * @throws IOException if the file cannot be read
     * @throws SAXException if the file is not well-formed XML
     * @throws ParserConfigurationException if the JAXP parser cannot be configured
     */
    public static Document parse(Path file)
            throws IOException, SAXException, ParserConfigurationException {
        Preconditions.checkNotNull(file, "file must not be null");
        DocumentBuilder builder = newDocumentBuilder();
        try (InputStream in = Files.newInputStream(file)) {
            Document document = builder.parse(in, file.toUri().toString());
            log.debug("Parsed XML: file={}, encoding={}", file, document.getXmlEncoding());
            return document;
        }
    }

    /**
     * Serializes the document to the given file.
     *
     * <p>
     * The declared encoding of the source document is kept ({@code UTF-8} when none was declared).
     * Whitespace-only text between elements is dropped and the tree is re-indented with two
     * spaces, so edited and untouched elements share one layout.
     * </p>
     *
     * @param document document to write
     * @param file destination file (created or overwritten)
     * @throws IOException if the file cannot be written or serialization fails
     */
    public static void write(Document document, Path file) throws IOException {
        Preconditions.checkNotNull(document, "document must not be null");
        Preconditions.checkNotNull(file, "file must not be null");
        String encoding = StringUtils.defaultIfBlank(document.getXmlEncoding(),
                StandardCharsets.UTF_8.name());
        stripIndentation(document.getDocumentElement());
        try (OutputStream out = Files.newOutputStream(file)) {
            // The declaration is written here so that the root element starts on its own line
            out.write(declaration(document, encoding).getBytes(encoding));
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, encoding);
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount",
                    INDENT_AMOUNT);
            transformer.transform(new DOMSource(document), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IOException("Failed to serialize XML: " + file, e);
        }
    }

    /**
     * Builds the XML declaration line for a document, keeping its version and standalone flag.
     *
     * @param document document to write
     * @param encoding output encoding
     * @return declaration followed by a line separator
     */
    static String declaration(Document document, String encoding) {
        String version = StringUtils.defaultIfBlank(document.getXmlVersion(), "1.0");
        String standalone = document.getXmlStandalone() ? " standalone=\"yes\"" : "";
        return "<?xml version=\"" + version + "\" encoding=\"" + encoding + "\"" + standalone
                + "?>" + System.lineSeparator();
    }

    /**
     * Returns the local name of a node, falling back to its node name without prefix.
     *
     * @param node DOM node
     * @return local name
     */
    public static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    /**
     * Returns the direct element children of the given element, in document order.
     *
     * @param parent parent element
     * @return child elements (empty if none)
     */
    public static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) child);
            }
        }
        return children;
    }

    /**
     * Returns the first direct child element with the given local name.
     *
     * @param parent parent element
     * @param localName local name to look for
     * @return matching child, or {@code null} if there is none
     */
    public static Element findChild(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(child))) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * Returns the text of the first direct child with the given local name.
     *
     * @param parent parent element
     * @param localName local name of the child
     * @return child text, or an empty string if the child is absent or empty
     */
    public static String childText(Element parent, String localName) {
        Element child = findChild(parent, localName);
        return child == null ? "" : text(child);
    }

    /**
     * Returns the text content of an element.
     *
     * @param element element to read
     * @return text content, never {@code null}
     */
    public static String text(Element element) {
        return StringUtils.defaultString(element.getTextContent());
    }

    /**
     * Returns whether the element has at least one element child.
     *
     * @param element element to inspect
     * @return {@code true} for structural elements
     */
    public static boolean hasChildElements(Element element) {
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every descendant element with the given local name, depth-first in document order.
     *
     * @param ancestor element to search below (not included in the result)
     * @param localName local name to look for
     * @return matching descendants
     */
    public static List<Element> descendants(Element ancestor, String localName) {
        List<Element> result = new ArrayList<>();
        collectDescendants(ancestor, localName, result);
        return result;
    }

    /**
     * Creates a detached element that shares the namespace and prefix of {@code context}.
     *
     * @param context element whose document and namespace are used
     * @param localName local name of the new element
     * @return new element, not yet attached
     */
    public static Element createElement(Element context, String localName) {
        Document document = context.getOwnerDocument();
        String namespace = context.getNamespaceURI();
        if (namespace == null) {
            return document.createElement(localName);
        }
        String prefix = context.getPrefix();
        String qualifiedName = prefix == null ? localName : prefix + ":" + localName;
        return document.createElementNS(namespace, qualifiedName);
    }

    /**
     * Removes whitespace-only text nodes from every element that has element children.
     *
     * <p>
     * Text of leaf elements is left untouched, even when it is blank.
     * </p>
     *
     * @param element root of the subtree to clean
     */
    public static void stripIndentation(Element element) {
        if (!hasChildElements(element)) {
            return;
        }
        Node child = element.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child.getNodeType() == Node.TEXT_NODE
                    && StringUtils.isBlank(child.getNodeValue())) {
                element.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                stripIndentation((Element) child);
            }
            child = next;
        }
    }

    private static void collectDescendants(Element parent, String localName,
            List<Element> result) {
        for (Element child : childElements(parent)) {
            if (localName.equals(localName(child))) {
                result.add(child);
            }
            collectDescendants(child, localName, result);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        return factory.newDocumentBuilder();
    }
}
