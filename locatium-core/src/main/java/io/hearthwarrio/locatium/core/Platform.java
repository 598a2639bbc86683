package io.hearthwarrio.locatium.core;

import java.util.List;
import java.util.Locale;

/**
 * Automation backend that produced the hierarchy source.
 * <p>
 * Decides which generators apply and how their output is ranked.
 */
public enum Platform {
    XCUITEST("xcuitest"),
    MAC2("mac2"),
    UIAUTOMATOR2("uiautomator2"),
    OTHER("");

    private static final List<LocatorStrategy> APPLE_PRIORITY = List.of(
            LocatorStrategy.ID,
            LocatorStrategy.ACCESSIBILITY_ID,
            LocatorStrategy.IOS_PREDICATE_STRING,
            LocatorStrategy.IOS_CLASS_CHAIN,
            LocatorStrategy.XPATH,
            LocatorStrategy.CLASS_NAME
    );

    private static final List<LocatorStrategy> ANDROID_PRIORITY = List.of(
            LocatorStrategy.ID,
            LocatorStrategy.ACCESSIBILITY_ID,
            LocatorStrategy.XPATH,
            LocatorStrategy.ANDROID_UIAUTOMATOR,
            LocatorStrategy.CLASS_NAME
    );

    private static final List<LocatorStrategy> DEFAULT_PRIORITY = List.of(
            LocatorStrategy.ID,
            LocatorStrategy.CLASS_NAME,
            LocatorStrategy.XPATH
    );

    private final String automationName;

    Platform(String automationName) {
        this.automationName = automationName;
    }

    public String automationName() {
        return automationName;
    }

    /**
     * Resolves an Appium {@code automationName} capability value (case-insensitive).
     *
     * @return matching platform, {@link #OTHER} for unknown or blank names
     */
    public static Platform fromAutomationName(String automationName) {
        if (automationName == null || automationName.isBlank()) {
            return OTHER;
        }
        String normalized = automationName.trim().toLowerCase(Locale.ROOT);
        for (Platform p : values()) {
            if (p != OTHER && p.automationName.equals(normalized)) {
                return p;
            }
        }
        return OTHER;
    }

    /**
     * XCUITest and Mac2 understand class chains and predicate strings.
     */
    public boolean isApple() {
        return this == XCUITEST || this == MAC2;
    }

    public boolean isUiAutomator() {
        return this == UIAUTOMATOR2;
    }

    /**
     * Strategy ranking used when merging generator output.
     */
    public List<LocatorStrategy> priorityOrder(boolean nativeContext) {
        if (nativeContext && isApple()) {
            return APPLE_PRIORITY;
        }
        if (nativeContext && isUiAutomator()) {
            return ANDROID_PRIORITY;
        }
        return DEFAULT_PRIORITY;
    }
}
