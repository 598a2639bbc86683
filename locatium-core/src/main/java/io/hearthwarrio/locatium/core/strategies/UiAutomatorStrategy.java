package io.hearthwarrio.locatium.core.strategies;

import io.hearthwarrio.locatium.core.CandidateSelector;
import io.hearthwarrio.locatium.core.GeneratorKind;
import io.hearthwarrio.locatium.core.LocatorStrategy;
import io.hearthwarrio.locatium.core.UiNode;
import io.hearthwarrio.locatium.core.UiTree;
import io.hearthwarrio.locatium.core.UiTreeParser;
import io.hearthwarrio.locatium.core.Uniqueness;
import io.hearthwarrio.locatium.core.UniquenessOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds an Android UiSelector ({@code new UiSelector().resourceId("...")}).
 * <p>
 * UiAutomator only sees elements inside the last direct child of the hierarchy root, so uniqueness is
 * evaluated against a document rebuilt from that subtree. When no attribute is unique the candidate
 * matching the fewest nodes is used with an {@code instance(n)} suffix (0-based).
 */
public final class UiAutomatorStrategy {

    private static final Logger log = LoggerFactory.getLogger(UiAutomatorStrategy.class);

    private static final String SCOPE_WRAPPER_TAG = "dummy";

    private static final String[][] UIAUTOMATOR_ATTRIBUTES = {
            {"resource-id", "resourceId"},
            {"text", "text"},
            {"content-desc", "description"},
            {"class", "className"}
    };

    private final UniquenessOracle oracle;
    private final UiTreeParser parser;

    public UiAutomatorStrategy(UniquenessOracle oracle, UiTreeParser parser) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * @return candidate, or null when the node is outside the addressable scope or has none of the attributes
     */
    public CandidateSelector generate(UiNode target, UiTree tree) {
        List<UiNode> topLevel = tree.getRoot().getChildren();
        if (topLevel.isEmpty()) {
            return null;
        }

        int lastIndex = topLevel.size() - 1;
        if (target.topLevelIndex() != lastIndex) {
            return null;
        }

        UiTree scoped;
        UiNode scopedTarget;
        try {
            scoped = parser.parse("<" + SCOPE_WRAPPER_TAG + ">" + tree.serialize(topLevel.get(lastIndex))
                    + "</" + SCOPE_WRAPPER_TAG + ">");
            scopedTarget = scoped.findByPath(scopedPath(target.getPath()));
        } catch (RuntimeException e) {
            log.error("UiSelector could not be determined for path '{}': {}", target.getPath(), e.getMessage());
            return null;
        }
        if (scopedTarget == null) {
            log.error("UiSelector could not be determined for path '{}': node not found in scoped source",
                    target.getPath());
            return null;
        }

        Integer fewestMatches = null;
        CandidateSelector mostUnique = null;

        for (String[] mapping : UIAUTOMATOR_ATTRIBUTES) {
            String attr = mapping[0];
            String value = scopedTarget.getAttribute(attr);
            if (value.isEmpty()) {
                continue;
            }

            List<UiNode> matches = oracle.selectOrNull(
                    "//" + scopedTarget.getTagName() + "[@" + attr + "=\"" + value + "\"]",
                    scoped
            );
            if (matches == null || matches.isEmpty()) {
                continue;
            }

            String selector = "new UiSelector()." + mapping[1] + "(\"" + value + "\")";
            if (matches.size() == 1) {
                return new CandidateSelector(GeneratorKind.SCOPED_SELECTOR, LocatorStrategy.ANDROID_UIAUTOMATOR,
                        selector, Uniqueness.unique());
            }
            if (fewestMatches == null || matches.size() < fewestMatches) {
                fewestMatches = matches.size();
                int index = Math.max(UniquenessOracle.indexOf(matches, scopedTarget), 0);
                mostUnique = new CandidateSelector(GeneratorKind.SCOPED_SELECTOR, LocatorStrategy.ANDROID_UIAUTOMATOR,
                        selector + ".instance(" + index + ")", Uniqueness.semiUnique(index));
            }
        }
        return mostUnique;
    }

    // the subtree becomes the first child of the wrapper
    private String scopedPath(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? "0" : "0" + path.substring(dot);
    }
}
