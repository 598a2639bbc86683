package io.hearthwarrio.locatium.core.strategies;

import io.hearthwarrio.locatium.core.CandidateSelector;
import io.hearthwarrio.locatium.core.GeneratorKind;
import io.hearthwarrio.locatium.core.LocatorStrategy;
import io.hearthwarrio.locatium.core.UiNode;
import io.hearthwarrio.locatium.core.UiTree;
import io.hearthwarrio.locatium.core.Uniqueness;
import io.hearthwarrio.locatium.core.UniquenessOracle;

import java.util.List;
import java.util.Objects;

/**
 * Builds an XCUITest class chain ({@code **}{@code /XCUIElementTypeButton[`name == "OK"`]}).
 * <p>
 * The first of {@code name}, {@code label}, {@code value} present on the node qualifies its segment, with a
 * 1-based index appended when the attribute is shared by several nodes. A node without these attributes
 * contributes {@code /tag[n]} and the walk continues with its parent. The application element cannot be
 * addressed by class chain, so it ends the walk.
 */
public final class ClassChainStrategy {

    static final String APPLICATION_TAG = "XCUIElementTypeApplication";

    static final List<String> CLASS_CHAIN_ATTRIBUTES = List.of("name", "label", "value");

    private final UniquenessOracle oracle;

    public ClassChainStrategy(UniquenessOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    }

    /**
     * @return candidate prefixed with {@code **}, or null when no chain could be built
     */
    public CandidateSelector generate(UiNode target, UiTree tree) {
        String chain = optimalClassChain(tree, target);
        if (chain.isEmpty()) {
            return null;
        }
        Segment own = attributeSegmentOrNull(tree, target);
        Uniqueness uniqueness = own == null ? Uniqueness.none() : own.uniqueness;
        return new CandidateSelector(GeneratorKind.CLASS_PATH, LocatorStrategy.IOS_CLASS_CHAIN, "**" + chain, uniqueness);
    }

    /**
     * Returns the class chain of the node without the leading {@code **}; empty above the root and for the
     * application element.
     */
    public String optimalClassChain(UiTree tree, UiNode node) {
        if (node == null || APPLICATION_TAG.equals(node.getTagName())) {
            return "";
        }

        Segment segment = attributeSegmentOrNull(tree, node);
        if (segment != null) {
            return segment.text;
        }

        String step = "/" + node.getTagName();
        int siblingIndex = tree.sameTagSiblingIndex(node);
        if (siblingIndex >= 0) {
            step += "[" + (siblingIndex + 1) + "]";
        }
        return optimalClassChain(tree, tree.parentOf(node)) + step;
    }

    private Segment attributeSegmentOrNull(UiTree tree, UiNode node) {
        String tag = node.getTagName().isEmpty() ? "*" : node.getTagName();

        for (String attr : CLASS_CHAIN_ATTRIBUTES) {
            String value = node.getAttribute(attr);
            if (value.isEmpty()) {
                continue;
            }

            List<UiNode> matches = oracle.selectOrNull("//" + tag + "[@" + attr + "=\"" + value + "\"]", tree);
            if (matches == null) {
                continue;
            }

            String segment = "/" + tag + "[`" + attr + " == \"" + value + "\"`]";
            if (matches.size() > 1) {
                int index = UniquenessOracle.indexOf(matches, node);
                return new Segment(segment + "[" + (index + 1) + "]", Uniqueness.semiUnique(Math.max(index, 0)));
            }
            return new Segment(segment, Uniqueness.unique());
        }
        return null;
    }

    private static final class Segment {
        private final String text;
        private final Uniqueness uniqueness;

        private Segment(String text, Uniqueness uniqueness) {
            this.text = text;
            this.uniqueness = uniqueness;
        }
    }
}
