package io.hearthwarrio.locatium.core.strategies;

import io.hearthwarrio.locatium.core.CandidateSelector;
import io.hearthwarrio.locatium.core.GeneratorKind;
import io.hearthwarrio.locatium.core.LocatorStrategy;
import io.hearthwarrio.locatium.core.UiNode;
import io.hearthwarrio.locatium.core.UiTree;
import io.hearthwarrio.locatium.core.Uniqueness;
import io.hearthwarrio.locatium.core.UniquenessOracle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the most robust XPath for an element. Applies to every platform and always yields an expression.
 * <p>
 * Search order (the first fully unique expression wins):
 * <ol>
 *   <li>a likely-unique attribute alone</li>
 *   <li>a pair of attributes taken from the likely-unique and maybe-unique lists</li>
 *   <li>a maybe-unique attribute alone</li>
 *   <li>the tag name alone (only when fully unique)</li>
 * </ol>
 * An attribute expression matching several nodes is kept as {@code (expr)[n]}; the first such expression
 * found is returned when no step yields a unique one. Without any attribute candidate the expression is
 * purely hierarchical: {@code /tag[n]} prefixed with the same computation for the parent.
 * <p>
 * The fallback is always the first semi-unique expression found, even if a later one matches fewer nodes.
 */
public final class XPathStrategy {

    static final List<String> UNIQUE_XPATH_ATTRIBUTES = List.of(
            "name",
            "content-desc",
            "id",
            "resource-id",
            "accessibility-id"
    );

    // recommended only as a fallback, ideally combined with another attribute
    static final List<String> MAYBE_UNIQUE_XPATH_ATTRIBUTES = List.of(
            "label",
            "text",
            "value"
    );

    private static final List<List<List<String>>> ATTRIBUTE_TIERS = List.of(
            singles(UNIQUE_XPATH_ATTRIBUTES),
            pairs(),
            singles(MAYBE_UNIQUE_XPATH_ATTRIBUTES)
    );

    private final UniquenessOracle oracle;

    public XPathStrategy(UniquenessOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    }

    public CandidateSelector generate(UiNode target, UiTree tree) {
        Candidate c = attributeCandidateOrNull(tree, target);
        if (c != null) {
            return new CandidateSelector(GeneratorKind.GENERIC_PATH, LocatorStrategy.XPATH, c.expression, c.uniqueness);
        }

        String xpath = hierarchicalXPath(tree, target);
        return new CandidateSelector(
                GeneratorKind.GENERIC_PATH,
                LocatorStrategy.XPATH,
                xpath,
                oracle.determine(xpath, tree, target)
        );
    }

    /**
     * Returns the optimal XPath for the node; an empty string above the root.
     */
    public String optimalXPath(UiTree tree, UiNode node) {
        if (node == null) {
            return "";
        }
        Candidate c = attributeCandidateOrNull(tree, node);
        if (c != null) {
            return c.expression;
        }
        return hierarchicalXPath(tree, node);
    }

    private String hierarchicalXPath(UiTree tree, UiNode node) {
        String step = "/" + node.getTagName();
        int siblingIndex = tree.sameTagSiblingIndex(node);
        if (siblingIndex >= 0) {
            step += "[" + (siblingIndex + 1) + "]";
        }
        return optimalXPath(tree, tree.parentOf(node)) + step;
    }

    private Candidate attributeCandidateOrNull(UiTree tree, UiNode node) {
        Candidate semiUnique = null;

        for (List<List<String>> tier : ATTRIBUTE_TIERS) {
            Candidate c = findInTierOrNull(tree, node, tier);
            if (c == null) {
                continue;
            }
            if (c.uniqueness.isUnique()) {
                return c;
            }
            if (semiUnique == null) {
                semiUnique = c;
            }
        }

        Candidate byTag = uniqueByTagNameOrNull(tree, node);
        if (byTag != null) {
            return byTag;
        }
        return semiUnique;
    }

    private Candidate findInTierOrNull(UiTree tree, UiNode node, List<List<String>> attributeSets) {
        String tag = tagFor(node);
        Candidate semiUnique = null;

        for (List<String> attributes : attributeSets) {
            String predicate = predicateOrNull(node, attributes);
            if (predicate == null) {
                continue;
            }
            String xpath = "//" + tag + "[" + predicate + "]";
            Uniqueness u = oracle.determine(xpath, tree, node);
            if (u.isUnique()) {
                return new Candidate(xpath, u);
            }
            if (semiUnique == null && u.isSemiUnique()) {
                semiUnique = new Candidate("(" + xpath + ")[" + (u.getIndex() + 1) + "]", u);
            }
        }
        return semiUnique;
    }

    private Candidate uniqueByTagNameOrNull(UiTree tree, UiNode node) {
        String xpath = "//" + tagFor(node);
        if (!oracle.determine(xpath, tree, node).isUnique()) {
            return null;
        }
        if (node.isRoot()) {
            xpath = "/" + tagFor(node);
        }
        return new Candidate(xpath, Uniqueness.unique());
    }

    private String predicateOrNull(UiNode node, List<String> attributes) {
        StringBuilder sb = new StringBuilder();
        for (String attr : attributes) {
            String value = node.getAttribute(attr);
            if (value.isEmpty()) {
                return null;
            }
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append('@').append(attr).append("=\"").append(value).append('"');
        }
        return sb.toString();
    }

    private String tagFor(UiNode node) {
        return node.getTagName().isEmpty() ? "*" : node.getTagName();
    }

    private static List<List<String>> singles(List<String> attributes) {
        List<List<String>> out = new ArrayList<>(attributes.size());
        for (String a : attributes) {
            out.add(List.of(a));
        }
        return List.copyOf(out);
    }

    private static List<List<String>> pairs() {
        List<String> all = new ArrayList<>(UNIQUE_XPATH_ATTRIBUTES);
        all.addAll(MAYBE_UNIQUE_XPATH_ATTRIBUTES);

        List<List<String>> out = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            for (int j = i + 1; j < all.size(); j++) {
                out.add(List.of(all.get(i), all.get(j)));
            }
        }
        return List.copyOf(out);
    }

    private static final class Candidate {
        private final String expression;
        private final Uniqueness uniqueness;

        private Candidate(String expression, Uniqueness uniqueness) {
            this.expression = expression;
            this.uniqueness = uniqueness;
        }
    }
}
