package io.hearthwarrio.locatium.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorRankerTest {
    private final LocatorRanker ranker = new LocatorRanker();

    private static CandidateSelector candidate(GeneratorKind kind, LocatorStrategy strategy, String expression) {
        return new CandidateSelector(kind, strategy, expression, Uniqueness.unique());
    }

    private static List<CandidateSelector> allKinds() {
        return List.of(
                candidate(GeneratorKind.SIMPLE_ATTRIBUTE, LocatorStrategy.ACCESSIBILITY_ID, "login"),
                candidate(GeneratorKind.SIMPLE_ATTRIBUTE, LocatorStrategy.ID, "com.app:id/login"),
                candidate(GeneratorKind.SIMPLE_ATTRIBUTE, LocatorStrategy.CLASS_NAME, "Button"),
                candidate(GeneratorKind.CLASS_PATH, LocatorStrategy.IOS_CLASS_CHAIN, "**/Button"),
                candidate(GeneratorKind.PREDICATE_COMBINATION, LocatorStrategy.IOS_PREDICATE_STRING, "name == \"x\""),
                candidate(GeneratorKind.SCOPED_SELECTOR, LocatorStrategy.ANDROID_UIAUTOMATOR, "new UiSelector()"),
                candidate(GeneratorKind.GENERIC_PATH, LocatorStrategy.XPATH, "//Button")
        );
    }

    @Test
    void appleNativeOrder() {
        Map<String, String> ranked = ranker.rank(allKinds(), Platform.XCUITEST, true);

        assertEquals(
                List.of("id", "accessibility id", "-ios predicate string", "-ios class chain", "xpath", "class name",
                        "-android uiautomator"),
                new ArrayList<>(ranked.keySet())
        );
    }

    @Test
    void androidNativeOrder() {
        Map<String, String> ranked = ranker.rank(allKinds(), Platform.UIAUTOMATOR2, true);

        assertEquals(
                List.of("id", "accessibility id", "xpath", "-android uiautomator", "class name",
                        "-ios class chain", "-ios predicate string"),
                new ArrayList<>(ranked.keySet())
        );
    }

    @Test
    void webContextOrderAppendsUnlistedInDiscoveryOrder() {
        Map<String, String> ranked = ranker.rank(allKinds(), Platform.UIAUTOMATOR2, false);

        assertEquals(
                List.of("id", "class name", "xpath", "accessibility id", "-ios class chain",
                        "-ios predicate string", "-android uiautomator"),
                new ArrayList<>(ranked.keySet())
        );
    }

    @Test
    void emptyExpressionsAreDropped() {
        List<CandidateSelector> in = List.of(
                candidate(GeneratorKind.SIMPLE_ATTRIBUTE, LocatorStrategy.ID, ""),
                candidate(GeneratorKind.GENERIC_PATH, LocatorStrategy.XPATH, "//a")
        );

        assertEquals(Map.of("xpath", "//a"), ranker.rank(in, Platform.OTHER, true));
    }

    @Test
    void nothingToRank() {
        assertTrue(ranker.rank(List.of(), Platform.OTHER, true).isEmpty());
        assertTrue(ranker.rank(null, Platform.OTHER, true).isEmpty());
    }
}
