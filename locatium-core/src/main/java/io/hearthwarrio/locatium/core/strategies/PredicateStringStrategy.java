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
 * Builds an XCUITest predicate string ({@code name == "OK" AND label == "Confirm"}).
 * <p>
 * Predicates address a single element, so there is no ancestor walk: clauses are accumulated until the
 * conjunction matches exactly one node.
 */
public final class PredicateStringStrategy {

    static final List<String> PREDICATE_ATTRIBUTES = List.of("name", "label", "value", "type");

    private final UniquenessOracle oracle;

    public PredicateStringStrategy(UniquenessOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    }

    /**
     * @return candidate, or null when the attribute list never becomes unique
     */
    public CandidateSelector generate(UiNode target, UiTree tree) {
        List<String> xpathClauses = new ArrayList<>();
        List<String> predicateClauses = new ArrayList<>();

        for (String attr : PREDICATE_ATTRIBUTES) {
            String value = target.getAttribute(attr);
            if (value.isEmpty()) {
                continue;
            }

            xpathClauses.add("@" + attr + "=\"" + value + "\"");
            predicateClauses.add(attr + " == \"" + value + "\"");

            String xpath = "//*[" + String.join(" and ", xpathClauses) + "]";
            if (oracle.determine(xpath, tree, target).isUnique()) {
                return new CandidateSelector(
                        GeneratorKind.PREDICATE_COMBINATION,
                        LocatorStrategy.IOS_PREDICATE_STRING,
                        String.join(" AND ", predicateClauses),
                        Uniqueness.unique()
                );
            }
        }
        return null;
    }
}
