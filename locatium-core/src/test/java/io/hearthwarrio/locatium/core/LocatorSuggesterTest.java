package io.hearthwarrio.locatium.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorSuggesterTest {
    private final UniquenessOracle oracle = new UniquenessOracle();
    private final LocatorSuggester suggester = new LocatorSuggester(oracle, new UiTreeParser());

    @Test
    void uniqueXPathCandidatesSelectExactlyTheirElement() {
        assertUniqueXPathsAreSound(Fixtures.parse(Fixtures.ANDROID_LOGIN), Platform.UIAUTOMATOR2);
        assertUniqueXPathsAreSound(Fixtures.parse(Fixtures.IOS_WELCOME), Platform.XCUITEST);
    }

    @Test
    void candidatesFollowDiscoveryOrder() {
        UiTree tree = Fixtures.parse(Fixtures.IOS_WELCOME);

        List<CandidateSelector> out = suggester.suggest(tree.findByPath("0.0.0"), tree, Platform.XCUITEST, true);

        assertEquals(GeneratorKind.SIMPLE_ATTRIBUTE, out.get(0).getGenerator());
        assertEquals(GeneratorKind.CLASS_PATH, out.get(out.size() - 3).getGenerator());
        assertEquals(GeneratorKind.PREDICATE_COMBINATION, out.get(out.size() - 2).getGenerator());
        assertEquals(GeneratorKind.GENERIC_PATH, out.get(out.size() - 1).getGenerator());
    }

    @Test
    void webContextRunsOnlyPortableGenerators() {
        UiTree tree = Fixtures.parse(Fixtures.ANDROID_LOGIN);

        List<CandidateSelector> out = suggester.suggest(tree.findByPath("0.0.2"), tree, Platform.UIAUTOMATOR2, false);

        for (CandidateSelector c : out) {
            assertTrue(
                    c.getGenerator() == GeneratorKind.SIMPLE_ATTRIBUTE || c.getGenerator() == GeneratorKind.GENERIC_PATH,
                    c.toString()
            );
        }
    }

    private void assertUniqueXPathsAreSound(UiTree tree, Platform platform) {
        for (UiNode node : tree.nodes()) {
            for (CandidateSelector c : suggester.suggest(node, tree, platform, true)) {
                if (c.getStrategy() != LocatorStrategy.XPATH || !c.getUniqueness().isUnique()) {
                    continue;
                }
                List<UiNode> matches = oracle.select(c.getExpression(), tree);
                assertEquals(1, matches.size(), c.getExpression());
                assertSame(node, matches.get(0), c.getExpression());
            }
        }
    }
}
