package io.hearthwarrio.locatium.core;

import java.util.Objects;

/**
 * A generated selector for one element.
 */
public final class CandidateSelector {

    private final GeneratorKind generator;
    private final LocatorStrategy strategy;
    private final String expression;
    private final Uniqueness uniqueness;

    public CandidateSelector(GeneratorKind generator, LocatorStrategy strategy, String expression, Uniqueness uniqueness) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.uniqueness = Objects.requireNonNull(uniqueness, "uniqueness must not be null");
    }

    public GeneratorKind getGenerator() {
        return generator;
    }

    public LocatorStrategy getStrategy() {
        return strategy;
    }

    public String getExpression() {
        return expression;
    }

    public Uniqueness getUniqueness() {
        return uniqueness;
    }

    @Override
    public String toString() {
        return "CandidateSelector{" +
                "generator=" + generator +
                ", strategy='" + strategy.label() + '\'' +
                ", expression='" + expression + '\'' +
                ", uniqueness=" + uniqueness +
                '}';
    }
}
