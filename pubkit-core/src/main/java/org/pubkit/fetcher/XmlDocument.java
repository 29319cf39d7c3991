package org.pubkit.fetcher;

import org.pubkit.util.SecureXmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed XML resource queried with XPath, using the prefix bindings it was read with.
 */
public final class XmlDocument {

    private final Document document;
    private final XPath xpath;

    private XmlDocument(Document document, XPath xpath) {
        this.document = document;
        this.xpath = xpath;
    }

    public static XmlDocument parse(byte[] content, Map<String, String> prefixBindings) throws IOException {
        try {
            DocumentBuilder builder = SecureXmlUtils.createSecureDocumentBuilder(true);
            Document document = builder.parse(new ByteArrayInputStream(content));
            return new XmlDocument(document, SecureXmlUtils.createXPath(prefixBindings));
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Malformed XML: " + e.getMessage(), e);
        }
    }

    public Document getDocument() {
        return document;
    }

    public Element getRoot() {
        return document.getDocumentElement();
    }

    public Optional<Element> selectElement(String expression) {
        return selectElement(document, expression);
    }

    public Optional<Element> selectElement(Node context, String expression) {
        List<Element> elements = selectElements(context, expression);
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
    }

    public List<Element> selectElements(String expression) {
        return selectElements(document, expression);
    }

    public List<Element> selectElements(Node context, String expression) {
        NodeList nodes;
        try {
            nodes = (NodeList) xpath.evaluate(expression, context, XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Invalid XPath expression: " + expression, e);
        }
        List<Element> elements = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                elements.add(element);
            }
        }
        return elements;
    }

    /**
     * Trimmed text content of the first element matching the expression, if it is not blank.
     */
    public Optional<String> selectText(Node context, String expression) {
        return selectElement(context, expression)
                .map(Element::getTextContent)
                .map(String::trim)
                .filter(text -> !text.isEmpty());
    }

    public Optional<String> selectText(String expression) {
        return selectText(document, expression);
    }
}
