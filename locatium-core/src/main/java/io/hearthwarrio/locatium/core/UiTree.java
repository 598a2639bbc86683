package io.hearthwarrio.locatium.core;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed hierarchy snapshot: the root {@link UiNode}, a path index and the read-only XML document
 * that selector expressions are evaluated against.
 * <p>
 * Instances are built by {@link UiTreeParser} and never modified afterwards.
 * {@link #EMPTY} stands for a source without any element.
 */
public final class UiTree {

    /**
     * Sentinel for empty or malformed sources.
     */
    public static final UiTree EMPTY = new UiTree(
            new UiNode("", Map.of(), List.of(), ""),
            null,
            Map.of(),
            Map.of(),
            Map.of()
    );

    private final UiNode root;
    private final Document document;
    private final Map<String, UiNode> nodesByPath;
    private final Map<Node, UiNode> nodesByElement;
    private final Map<UiNode, Element> elementsByNode;

    UiTree(
            UiNode root,
            Document document,
            Map<String, UiNode> nodesByPath,
            Map<Node, UiNode> nodesByElement,
            Map<UiNode, Element> elementsByNode
    ) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.document = document;
        this.nodesByPath = nodesByPath;
        this.nodesByElement = nodesByElement;
        this.elementsByNode = elementsByNode;
    }

    public boolean isEmpty() {
        return document == null;
    }

    public UiNode getRoot() {
        return root;
    }

    public int size() {
        return nodesByPath.size();
    }

    /**
     * Looks up a node by its dot-separated path.
     *
     * @param path path such as {@code "0.2.1"}; empty string addresses the root
     * @return node or null when no node has this path
     */
    public UiNode findByPath(String path) {
        if (path == null) {
            return null;
        }
        return nodesByPath.get(path);
    }

    /**
     * Resolves the parent of the given node.
     *
     * @return parent node, or null for the root
     */
    public UiNode parentOf(UiNode node) {
        if (node == null || node.isRoot()) {
            return null;
        }
        String path = node.getPath();
        int dot = path.lastIndexOf('.');
        return nodesByPath.get(dot < 0 ? "" : path.substring(0, dot));
    }

    /**
     * Returns the 0-based position of the node among parent children sharing its tag name.
     *
     * @return ordinal, or -1 when the node has no same-tag siblings (or no parent)
     */
    public int sameTagSiblingIndex(UiNode node) {
        UiNode parent = parentOf(node);
        if (parent == null) {
            return -1;
        }

        int count = 0;
        int index = -1;
        for (UiNode sibling : parent.getChildren()) {
            if (!sibling.getTagName().equals(node.getTagName())) {
                continue;
            }
            if (sibling == node) {
                index = count;
            }
            count++;
        }
        return count > 1 ? index : -1;
    }

    /**
     * Returns all nodes in depth-first pre-order.
     */
    public List<UiNode> nodes() {
        if (isEmpty()) {
            return List.of();
        }
        List<UiNode> out = new ArrayList<>(nodesByPath.size());
        Deque<UiNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            UiNode current = stack.pop();
            out.add(current);
            List<UiNode> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Serializes the subtree rooted at the given node back to markup (without XML declaration).
     *
     * @throws LocatorGenerationException if the node does not belong to this tree or serialization fails
     */
    public String serialize(UiNode node) {
        Element element = node == null ? null : elementsByNode.get(node);
        if (element == null) {
            throw new LocatorGenerationException("Node does not belong to this tree: " + node);
        }
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(element), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new LocatorGenerationException("Failed to serialize node at path '" + node.getPath() + "'", e);
        }
    }

    Document document() {
        return document;
    }

    UiNode nodeFor(Node domNode) {
        return nodesByElement.get(domNode);
    }
}
