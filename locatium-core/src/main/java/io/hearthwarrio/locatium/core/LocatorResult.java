package io.hearthwarrio.locatium.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Locators generated for one element, plus a short summary of the element itself.
 * <p>
 * {@link #getLocators()} is ordered by platform priority: the first entry is the preferred locator.
 */
public final class LocatorResult {

    private static final String TRUE = "true";

    private final String tagName;
    private final String path;
    private final String text;
    private final String contentDesc;
    private final String resourceId;
    private final boolean clickable;
    private final boolean enabled;
    private final boolean displayed;
    private final Map<String, String> locators;

    public LocatorResult(
            String tagName,
            String path,
            String text,
            String contentDesc,
            String resourceId,
            boolean clickable,
            boolean enabled,
            boolean displayed,
            Map<String, String> locators
    ) {
        this.tagName = Objects.requireNonNull(tagName, "tagName must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.text = text == null ? "" : text;
        this.contentDesc = contentDesc == null ? "" : contentDesc;
        this.resourceId = resourceId == null ? "" : resourceId;
        this.clickable = clickable;
        this.enabled = enabled;
        this.displayed = displayed;
        this.locators = locators == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(locators));
    }

    /**
     * Builds a result from the element summary fields of the node.
     */
    public static LocatorResult from(UiNode node, Map<String, String> locators) {
        Objects.requireNonNull(node, "node must not be null");
        return new LocatorResult(
                node.getTagName(),
                node.getPath(),
                node.getAttribute("text"),
                node.getAttribute("content-desc"),
                node.getAttribute("resource-id"),
                TRUE.equals(node.getAttribute("clickable")),
                TRUE.equals(node.getAttribute("enabled")),
                TRUE.equals(node.getAttribute("displayed")),
                locators
        );
    }

    public String getTagName() {
        return tagName;
    }

    public String getPath() {
        return path;
    }

    public String getText() {
        return text;
    }

    public String getContentDesc() {
        return contentDesc;
    }

    public String getResourceId() {
        return resourceId;
    }

    public boolean isClickable() {
        return clickable;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isDisplayed() {
        return displayed;
    }

    public Map<String, String> getLocators() {
        return locators;
    }

    /**
     * Highest-priority locator.
     *
     * @return strategy label and expression, or null when no locator was generated
     */
    public Map.Entry<String, String> preferredLocatorOrNull() {
        if (locators.isEmpty()) {
            return null;
        }
        return locators.entrySet().iterator().next();
    }

    @Override
    public String toString() {
        return "LocatorResult{" +
                "tagName='" + tagName + '\'' +
                ", path='" + path + '\'' +
                ", locators=" + locators +
                '}';
    }
}
