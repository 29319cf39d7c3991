package org.pubkit.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathFactory;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

@Slf4j
@UtilityClass
public class SecureXmlUtils {

    public static DocumentBuilderFactory createSecureDocumentBuilderFactory(boolean namespaceAware) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(namespaceAware);

            // NCX and XHTML documents carry DOCTYPEs; accept them but never fetch DTDs or external entities
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            return factory;
        } catch (ParserConfigurationException e) {
            log.warn("Failed to configure secure XML parser, using defaults: {}", e.getMessage());
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(namespaceAware);
            return factory;
        }
    }

    public static DocumentBuilder createSecureDocumentBuilder(boolean namespaceAware)
            throws ParserConfigurationException {
        return createSecureDocumentBuilderFactory(namespaceAware).newDocumentBuilder();
    }

    /**
     * Creates an XPath evaluator resolving the given prefix to namespace URI bindings.
     */
    public static XPath createXPath(Map<String, String> prefixBindings) {
        XPath xpath = XPathFactory.newInstance().newXPath();
        xpath.setNamespaceContext(new BindingNamespaceContext(Map.copyOf(prefixBindings)));
        return xpath;
    }

    private record BindingNamespaceContext(Map<String, String> bindings) implements NamespaceContext {

        @Override
        public String getNamespaceURI(String prefix) {
            if (prefix == null) {
                throw new IllegalArgumentException("Null prefix");
            }
            return bindings.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
        }

        @Override
        public String getPrefix(String namespaceURI) {
            return bindings.entrySet().stream()
                    .filter(e -> e.getValue().equals(namespaceURI))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(null);
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceURI) {
            String prefix = getPrefix(namespaceURI);
            return prefix == null ? List.<String>of().iterator() : List.of(prefix).iterator();
        }
    }
}
