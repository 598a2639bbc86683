package io.hearthwarrio.locatium.core.strategies;

import io.hearthwarrio.locatium.core.CandidateSelector;
import io.hearthwarrio.locatium.core.Fixtures;
import io.hearthwarrio.locatium.core.LocatorStrategy;
import io.hearthwarrio.locatium.core.UiTree;
import io.hearthwarrio.locatium.core.Uniqueness;
import io.hearthwarrio.locatium.core.UniquenessOracle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClassChainStrategyTest {
    private final ClassChainStrategy strategy = new ClassChainStrategy(new UniquenessOracle());
    private final UiTree tree = Fixtures.parse(Fixtures.IOS_WELCOME);

    @Test
    void usesUniqueNameSegment() {
        CandidateSelector c = strategy.generate(tree.findByPath("0.0.0"), tree);

        assertEquals(LocatorStrategy.IOS_CLASS_CHAIN, c.getStrategy());
        assertEquals("**/XCUIElementTypeButton[`name == \"Login\"`]", c.getExpression());
        assertTrue(c.getUniqueness().isUnique());
    }

    @Test
    void sharedValueGetsOneBasedIndex() {
        CandidateSelector c = strategy.generate(tree.findByPath("0.0.2"), tree);

        assertEquals("**/XCUIElementTypeStaticText[`value == \"Welcome\"`][2]", c.getExpression());
        assertEquals(Uniqueness.semiUnique(1), c.getUniqueness());
    }

    @Test
    void walksUpToApplicationWithoutAttributes() {
        CandidateSelector c = strategy.generate(tree.findByPath("0.0"), tree);

        assertEquals("**/XCUIElementTypeWindow/XCUIElementTypeOther", c.getExpression());
        assertEquals(Uniqueness.none(), c.getUniqueness());
    }

    @Test
    void applicationElementHasNoClassChain() {
        assertNull(strategy.generate(tree.getRoot(), tree));
        assertEquals("", strategy.optimalClassChain(tree, tree.getRoot()));
    }

    @Test
    void sameTagSiblingsWithoutAttributesAreIndexed() {
        UiTree cells = Fixtures.parse(
                "<XCUIElementTypeApplication>" +
                "<XCUIElementTypeTable name=\"list\"><XCUIElementTypeCell/><XCUIElementTypeCell/></XCUIElementTypeTable>" +
                "</XCUIElementTypeApplication>"
        );

        CandidateSelector c = strategy.generate(cells.findByPath("0.1"), cells);

        assertEquals("**/XCUIElementTypeTable[`name == \"list\"`]/XCUIElementTypeCell[2]", c.getExpression());
    }
}
