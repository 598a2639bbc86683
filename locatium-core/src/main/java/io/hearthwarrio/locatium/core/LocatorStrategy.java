package io.hearthwarrio.locatium.core;

/**
 * Appium locator strategies a generated expression is meant for.
 */
public enum LocatorStrategy {
    ACCESSIBILITY_ID("accessibility id"),
    ID("id"),
    CLASS_NAME("class name"),
    XPATH("xpath"),
    IOS_CLASS_CHAIN("-ios class chain"),
    IOS_PREDICATE_STRING("-ios predicate string"),
    ANDROID_UIAUTOMATOR("-android uiautomator");

    private final String label;

    LocatorStrategy(String label) {
        this.label = label;
    }

    /**
     * Strategy name as understood by Appium's find element endpoint.
     */
    public String label() {
        return label;
    }
}
