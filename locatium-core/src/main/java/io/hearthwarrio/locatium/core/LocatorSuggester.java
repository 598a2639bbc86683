package io.hearthwarrio.locatium.core;

import io.hearthwarrio.locatium.core.strategies.ClassChainStrategy;
import io.hearthwarrio.locatium.core.strategies.PredicateStringStrategy;
import io.hearthwarrio.locatium.core.strategies.SimpleAttributeStrategy;
import io.hearthwarrio.locatium.core.strategies.UiAutomatorStrategy;
import io.hearthwarrio.locatium.core.strategies.XPathStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every generator applicable to the platform for one element and ranks the result.
 * <p>
 * Unexpected generator failures propagate to the caller.
 */
public final class LocatorSuggester {

    private final SimpleAttributeStrategy simpleAttributes;
    private final XPathStrategy xPath;
    private final ClassChainStrategy classChain;
    private final PredicateStringStrategy predicateString;
    private final UiAutomatorStrategy uiAutomator;
    private final LocatorRanker ranker;

    public LocatorSuggester(UniquenessOracle oracle, UiTreeParser parser) {
        Objects.requireNonNull(oracle, "oracle must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
        this.simpleAttributes = new SimpleAttributeStrategy(oracle);
        this.xPath = new XPathStrategy(oracle);
        this.classChain = new ClassChainStrategy(oracle);
        this.predicateString = new PredicateStringStrategy(oracle);
        this.uiAutomator = new UiAutomatorStrategy(oracle, parser);
        this.ranker = new LocatorRanker();
    }

    /**
     * Generates candidates in discovery order (simple attributes first, XPath last).
     */
    public List<CandidateSelector> suggest(UiNode target, UiTree tree, Platform platform, boolean nativeContext) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(platform, "platform must not be null");

        List<CandidateSelector> out = new ArrayList<>();
        for (GeneratorKind kind : GeneratorKind.applicableTo(platform, nativeContext)) {
            switch (kind) {
                case SIMPLE_ATTRIBUTE -> out.addAll(simpleAttributes.generate(target, tree, nativeContext));
                case CLASS_PATH -> addIfPresent(out, classChain.generate(target, tree));
                case PREDICATE_COMBINATION -> addIfPresent(out, predicateString.generate(target, tree));
                case SCOPED_SELECTOR -> addIfPresent(out, uiAutomator.generate(target, tree));
                case GENERIC_PATH -> addIfPresent(out, xPath.generate(target, tree));
            }
        }
        return out;
    }

    /**
     * Generates and ranks locators for one element.
     *
     * @return strategy label to expression, in platform priority order
     */
    public Map<String, String> suggestRanked(UiNode target, UiTree tree, Platform platform, boolean nativeContext) {
        return ranker.rank(suggest(target, tree, platform, nativeContext), platform, nativeContext);
    }

    private void addIfPresent(List<CandidateSelector> out, CandidateSelector candidate) {
        if (candidate != null) {
            out.add(candidate);
        }
    }
}
