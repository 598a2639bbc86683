package io.hearthwarrio.locatium.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
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
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link UiTree} from a hierarchy source (Appium page source XML).
 * <p>
 * Never throws: null, blank or malformed sources degrade to {@link UiTree#EMPTY}.
 */
public final class UiTreeParser {

    private static final Logger log = LoggerFactory.getLogger(UiTreeParser.class);

    public UiTree parse(String source) {
        if (source == null || source.isBlank()) {
            return UiTree.EMPTY;
        }

        Document document;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            document = builder.parse(new InputSource(new StringReader(source.trim())));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            log.warn("Hierarchy source could not be parsed, treating it as empty: {}", e.getMessage());
            return UiTree.EMPTY;
        }

        Element rootElement = document.getDocumentElement();
        if (rootElement == null) {
            return UiTree.EMPTY;
        }

        Map<String, UiNode> nodesByPath = new HashMap<>();
        Map<Node, UiNode> nodesByElement = new IdentityHashMap<>();
        Map<UiNode, Element> elementsByNode = new IdentityHashMap<>();

        UiNode root = build(rootElement, "", nodesByPath, nodesByElement, elementsByNode);
        return new UiTree(root, document, nodesByPath, nodesByElement, elementsByNode);
    }

    private UiNode build(
            Element element,
            String path,
            Map<String, UiNode> nodesByPath,
            Map<Node, UiNode> nodesByElement,
            Map<UiNode, Element> elementsByNode
    ) {
        List<Element> childElements = childElementsOf(element);
        List<UiNode> children = new ArrayList<>(childElements.size());
        for (int i = 0; i < childElements.size(); i++) {
            String childPath = path.isEmpty() ? String.valueOf(i) : path + "." + i;
            children.add(build(childElements.get(i), childPath, nodesByPath, nodesByElement, elementsByNode));
        }

        UiNode node = new UiNode(element.getTagName(), attributesOf(element), children, path);
        nodesByPath.put(path, node);
        nodesByElement.put(element, node);
        elementsByNode.put(node, element);
        return node;
    }

    private List<Element> childElementsOf(Element element) {
        NodeList nodes = element.getChildNodes();
        List<Element> out = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private Map<String, String> attributesOf(Element element) {
        NamedNodeMap attrs = element.getAttributes();
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            out.put(attr.getNodeName(), attr.getNodeValue());
        }
        return out;
    }

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new LoggingErrorHandler());
        return builder;
    }

    /**
     * Routes parser diagnostics to the logger instead of stderr.
     */
    private static final class LoggingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            log.debug("Hierarchy source warning at {}:{}: {}", e.getLineNumber(), e.getColumnNumber(), e.getMessage());
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
}
