package io.hearthwarrio.locatium.core;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed set of locator generators.
 * <p>
 * Applicability is a static decision of platform and context, see {@link #applicableTo(Platform, boolean)}.
 */
public enum GeneratorKind {
    /**
     * Single attribute values usable with id / accessibility id / class name.
     */
    SIMPLE_ATTRIBUTE,
    /**
     * XPath, available everywhere.
     */
    GENERIC_PATH,
    /**
     * iOS class chain.
     */
    CLASS_PATH,
    /**
     * iOS predicate string.
     */
    PREDICATE_COMBINATION,
    /**
     * Android UiSelector, addressable only inside the last root child.
     */
    SCOPED_SELECTOR;

    /**
     * Generators to run, in discovery order.
     */
    public static List<GeneratorKind> applicableTo(Platform platform, boolean nativeContext) {
        List<GeneratorKind> out = new ArrayList<>(4);
        out.add(SIMPLE_ATTRIBUTE);
        if (nativeContext && platform.isApple()) {
            out.add(CLASS_PATH);
            out.add(PREDICATE_COMBINATION);
        }
        if (nativeContext && platform.isUiAutomator()) {
            out.add(SCOPED_SELECTOR);
        }
        out.add(GENERIC_PATH);
        return out;
    }
}
