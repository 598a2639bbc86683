package io.hearthwarrio.locatium.core.strategies;

import io.hearthwarrio.locatium.core.CandidateSelector;
import io.hearthwarrio.locatium.core.Fixtures;
import io.hearthwarrio.locatium.core.LocatorStrategy;
import io.hearthwarrio.locatium.core.UiTree;
import io.hearthwarrio.locatium.core.UniquenessOracle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class XPathStrategyTest {
    private final UniquenessOracle oracle = new UniquenessOracle();
    private final XPathStrategy strategy = new XPathStrategy(oracle);

    @Test
    void prefersUniqueAttribute() {
        UiTree tree = Fixtures.parse("<root><Button id=\"ok\" text=\"OK\"/></root>");

        CandidateSelector c = strategy.generate(tree.findByPath("0"), tree);

        assertEquals(LocatorStrategy.XPATH, c.getStrategy());
        assertEquals("//Button[@id=\"ok\"]", c.getExpression());
        assertTrue(c.getUniqueness().isUnique());
    }

    @Test
    void fallsBackToAttributePair() {
        UiTree tree = Fixtures.parse(
                "<root><Cell name=\"row\" text=\"A\"/><Cell name=\"row\" text=\"B\"/></root>"
        );

        CandidateSelector c = strategy.generate(tree.findByPath("1"), tree);

        assertEquals("//Cell[@name=\"row\" and @text=\"B\"]", c.getExpression());
        assertTrue(c.getUniqueness().isUnique());
    }

    @Test
    void firstSemiUniqueExpressionIsTheFallback() {
        UiTree tree = Fixtures.parse(
                "<root>" +
                "<Cell name=\"row\" label=\"L\" text=\"T\"/>" +
                "<Cell name=\"row\" label=\"L\" text=\"T\"/>" +
                "</root>"
        );

        CandidateSelector c = strategy.generate(tree.findByPath("1"), tree);

        assertEquals("(//Cell[@name=\"row\"])[2]", c.getExpression());
        assertTrue(c.getUniqueness().isSemiUnique());
        assertEquals(1, c.getUniqueness().getIndex());
    }

    @Test
    void duplicateIdentifiersGetOneBasedIndex() {
        UiTree tree = Fixtures.parse("<root><Button id=\"x\"/><Button id=\"x\"/></root>");

        assertEquals("(//Button[@id=\"x\"])[1]", strategy.generate(tree.findByPath("0"), tree).getExpression());
        assertEquals("(//Button[@id=\"x\"])[2]", strategy.generate(tree.findByPath("1"), tree).getExpression());
    }

    @Test
    void uniqueTagNameWhenNoAttributes() {
        UiTree tree = Fixtures.parse("<root><Layout><Switch/></Layout></root>");

        assertEquals("//Switch", strategy.generate(tree.findByPath("0.0"), tree).getExpression());
    }

    @Test
    void rootWithUniqueTagIsAbsolute() {
        UiTree tree = Fixtures.parse("<root><Layout/></root>");

        assertEquals("/root", strategy.optimalXPath(tree, tree.getRoot()));
    }

    @Test
    void hierarchicalPathUsesParentExpression() {
        UiTree tree = Fixtures.parse("<root><Layout><Button/><Button/></Layout></root>");

        CandidateSelector c = strategy.generate(tree.findByPath("0.1"), tree);

        assertEquals("//Layout/Button[2]", c.getExpression());
        assertTrue(c.getUniqueness().isUnique());
    }

    @Test
    void hierarchicalPathClimbsToAttributedAncestor() {
        UiTree tree = Fixtures.parse(
                "<root>" +
                "<Layout id=\"form\"><Row><Text/></Row><Row><Text/></Row></Layout>" +
                "<Layout id=\"footer\"><Row><Text/></Row></Layout>" +
                "</root>"
        );

        CandidateSelector c = strategy.generate(tree.findByPath("0.1.0"), tree);

        assertEquals("//Layout[@id=\"form\"]/Row[2]/Text", c.getExpression());
        assertEquals(1, oracle.select(c.getExpression(), tree).size());
        assertSame(tree.findByPath("0.1.0"), oracle.select(c.getExpression(), tree).get(0));
    }

    @Test
    void optimalXPathOfNullIsEmpty() {
        UiTree tree = Fixtures.parse("<root/>");

        assertEquals("", strategy.optimalXPath(tree, null));
    }
}
