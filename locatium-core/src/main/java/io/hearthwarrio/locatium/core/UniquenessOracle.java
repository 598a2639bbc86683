package io.hearthwarrio.locatium.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Answers "does this XPath select exactly my node?" against a {@link UiTree}.
 * <p>
 * Malformed expressions never propagate: they are reported as non-matching.
 * <p>
 * This class is not thread-safe; use one instance per thread.
 */
public class UniquenessOracle {

    private static final Logger log = LoggerFactory.getLogger(UniquenessOracle.class);

    private final XPathFactory xPathFactory;

    public UniquenessOracle() {
        this.xPathFactory = XPathFactory.newInstance();
    }

    /**
     * Evaluates an XPath expression.
     *
     * @return matching nodes in document order; empty when nothing matches or the expression is malformed
     */
    public List<UiNode> select(String expression, UiTree tree) {
        List<UiNode> nodes = selectOrNull(expression, tree);
        return nodes == null ? List.of() : nodes;
    }

    /**
     * Evaluates an XPath expression.
     *
     * @return matching nodes in document order, or null when the expression cannot be evaluated
     */
    public List<UiNode> selectOrNull(String expression, UiTree tree) {
        if (tree == null || tree.isEmpty() || expression == null || expression.isBlank()) {
            return null;
        }

        NodeList result;
        try {
            XPath xPath = xPathFactory.newXPath();
            result = (NodeList) xPath.evaluate(expression, tree.document(), XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            log.debug("Selector '{}' could not be evaluated: {}", expression, e.getMessage());
            return null;
        }

        List<UiNode> out = new ArrayList<>(result.getLength());
        for (int i = 0; i < result.getLength(); i++) {
            UiNode node = tree.nodeFor(result.item(i));
            if (node != null) {
                out.add(node);
            }
        }
        return out;
    }

    /**
     * Classifies an expression relative to the target.
     *
     * @return {@link Uniqueness#unique()} when the target is the only match,
     * {@link Uniqueness#semiUnique(int)} with the target position when there are several matches,
     * {@link Uniqueness#none()} otherwise
     */
    public Uniqueness determine(String expression, UiTree tree, UiNode target) {
        Objects.requireNonNull(target, "target must not be null");

        List<UiNode> matches = selectOrNull(expression, tree);
        if (matches == null || matches.isEmpty()) {
            return Uniqueness.none();
        }
        if (matches.size() == 1) {
            return matches.get(0) == target ? Uniqueness.unique() : Uniqueness.none();
        }

        int index = indexOf(matches, target);
        return index < 0 ? Uniqueness.none() : Uniqueness.semiUnique(index);
    }

    /**
     * Checks that fewer than two nodes of the whole tree carry the attribute with this exact value.
     * <p>
     * Double quotes are stripped from the value before the query is built. An empty tree is optimistically
     * treated as unique (no sibling data available).
     */
    public boolean areAttrAndValueUnique(String attrName, String attrValue, UiTree tree) {
        if (tree == null || tree.isEmpty()) {
            return true;
        }
        String value = attrValue == null ? "" : attrValue.replace("\"", "");
        List<UiNode> matches = selectOrNull("//*[@" + attrName + "=\"" + value + "\"]", tree);
        return matches != null && matches.size() < 2;
    }

    /**
     * Identity-based position of the target, or -1.
     */
    public static int indexOf(List<UiNode> nodes, UiNode target) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        return -1;
    }
}
