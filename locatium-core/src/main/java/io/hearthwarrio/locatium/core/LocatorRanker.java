package io.hearthwarrio.locatium.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges generator output for one element into a single strategy-label to expression mapping ordered by the
 * platform priority list ({@link Platform#priorityOrder(boolean)}).
 * <p>
 * Strategies missing from the priority list follow in discovery order. Empty expressions are dropped.
 */
public final class LocatorRanker {

    public Map<String, String> rank(List<CandidateSelector> candidates, Platform platform, boolean nativeContext) {
        Objects.requireNonNull(platform, "platform must not be null");
        if (candidates == null || candidates.isEmpty()) {
            return Map.of();
        }

        Map<LocatorStrategy, String> discovered = new LinkedHashMap<>();
        for (CandidateSelector c : candidates) {
            if (c == null || c.getExpression().isEmpty()) {
                continue;
            }
            discovered.put(c.getStrategy(), c.getExpression());
        }

        List<LocatorStrategy> priority = platform.priorityOrder(nativeContext);
        Map<String, String> ranked = new LinkedHashMap<>();
        for (LocatorStrategy s : priority) {
            String expression = discovered.get(s);
            if (expression != null) {
                ranked.put(s.label(), expression);
            }
        }
        for (Map.Entry<LocatorStrategy, String> e : discovered.entrySet()) {
            if (!priority.contains(e.getKey())) {
                ranked.put(e.getKey().label(), e.getValue());
            }
        }
        return Collections.unmodifiableMap(ranked);
    }
}
