package io.hearthwarrio.locatium.core.strategies;

import io.hearthwarrio.locatium.core.CandidateSelector;
import io.hearthwarrio.locatium.core.GeneratorKind;
import io.hearthwarrio.locatium.core.LocatorStrategy;
import io.hearthwarrio.locatium.core.UiNode;
import io.hearthwarrio.locatium.core.UiTree;
import io.hearthwarrio.locatium.core.Uniqueness;
import io.hearthwarrio.locatium.core.UniquenessOracle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Suggests plain attribute values for the "simple" Appium strategies (accessibility id, id, class name).
 * <p>
 * An attribute qualifies only when its value is unique in the whole tree; there is no fallback.
 * Several attributes map to the same strategy: a later attribute replaces the value of an earlier one.
 */
public final class SimpleAttributeStrategy {

    private static final List<AttributeMapping> MAPPINGS = List.of(
            new AttributeMapping("name", LocatorStrategy.ACCESSIBILITY_ID),
            new AttributeMapping("content-desc", LocatorStrategy.ACCESSIBILITY_ID),
            new AttributeMapping("id", LocatorStrategy.ID),
            new AttributeMapping("rntestid", LocatorStrategy.ID),
            new AttributeMapping("resource-id", LocatorStrategy.ID),
            new AttributeMapping("class", LocatorStrategy.CLASS_NAME),
            new AttributeMapping("type", LocatorStrategy.CLASS_NAME)
    );

    private final UniquenessOracle oracle;

    public SimpleAttributeStrategy(UniquenessOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    }

    /**
     * @param nativeContext accessibility id is only suggested for native contexts
     * @return one candidate per strategy, in first-discovery order (may be empty)
     */
    public List<CandidateSelector> generate(UiNode target, UiTree tree, boolean nativeContext) {
        Map<LocatorStrategy, String> found = new LinkedHashMap<>();
        for (AttributeMapping m : MAPPINGS) {
            if (m.strategy == LocatorStrategy.ACCESSIBILITY_ID && !nativeContext) {
                continue;
            }
            String value = target.getAttribute(m.attribute);
            if (!value.isEmpty() && oracle.areAttrAndValueUnique(m.attribute, value, tree)) {
                found.put(m.strategy, value);
            }
        }

        List<CandidateSelector> out = new ArrayList<>(found.size());
        for (Map.Entry<LocatorStrategy, String> e : found.entrySet()) {
            out.add(new CandidateSelector(GeneratorKind.SIMPLE_ATTRIBUTE, e.getKey(), e.getValue(), Uniqueness.unique()));
        }
        return out;
    }

    private static final class AttributeMapping {
        private final String attribute;
        private final LocatorStrategy strategy;

        private AttributeMapping(String attribute, LocatorStrategy strategy) {
            this.attribute = attribute;
            this.strategy = strategy;
        }
    }
}
