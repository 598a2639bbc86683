package io.hearthwarrio.locatium.core;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether an element is a candidate for locator generation.
 * <p>
 * Checks are independent and applied in order: tag allow/deny lists, required attributes, minimum attribute
 * count, clickable-only, fetchable-only. Excluding a node never excludes its descendants.
 */
public class ElementFilter {

    static final List<String> ANDROID_INTERACTABLE_TAGS = List.of(
            "EditText",
            "Button",
            "ImageButton",
            "CheckBox",
            "RadioButton",
            "Switch",
            "ToggleButton",
            "TextView"
    );

    static final List<String> APPLE_INTERACTABLE_TAGS = List.of(
            "XCUIElementTypeTextField",
            "XCUIElementTypeSecureTextField",
            "XCUIElementTypeButton",
            "XCUIElementTypeImage",
            "XCUIElementTypeSwitch",
            "XCUIElementTypeStaticText",
            "XCUIElementTypeTextView",
            "XCUIElementTypeCell",
            "XCUIElementTypeLink"
    );

    private static final String TRUE = "true";

    public boolean shouldInclude(UiNode node, FilterOptions options, Platform platform, boolean nativeContext) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(platform, "platform must not be null");

        if (!matchesTagFilters(node, options)) {
            return false;
        }
        if (!matchesAttributeFilters(node, options)) {
            return false;
        }
        if (options.isClickableOnly() && !TRUE.equals(node.getAttribute("clickable"))) {
            return false;
        }
        return !options.isFetchableOnly() || isInteractable(node, platform, nativeContext);
    }

    private boolean matchesTagFilters(UiNode node, FilterOptions options) {
        if (!options.getIncludeTagNames().isEmpty() && !options.getIncludeTagNames().contains(node.getTagName())) {
            return false;
        }
        return !options.getExcludeTagNames().contains(node.getTagName());
    }

    private boolean matchesAttributeFilters(UiNode node, FilterOptions options) {
        if (!options.getRequireAttributes().isEmpty()) {
            boolean hasRequired = false;
            for (String attr : options.getRequireAttributes()) {
                if (node.hasAttribute(attr)) {
                    hasRequired = true;
                    break;
                }
            }
            if (!hasRequired) {
                return false;
            }
        }
        return node.getAttributes().size() >= options.getMinAttributeCount();
    }

    // tag lists match by substring so fully qualified Android classes (android.widget.Button) qualify
    private boolean isInteractable(UiNode node, Platform platform, boolean nativeContext) {
        List<String> interactableTags = nativeContext && platform.isUiAutomator()
                ? ANDROID_INTERACTABLE_TAGS
                : APPLE_INTERACTABLE_TAGS;

        for (String tag : interactableTags) {
            if (node.getTagName().contains(tag)) {
                return true;
            }
        }
        return TRUE.equals(node.getAttribute("clickable")) || TRUE.equals(node.getAttribute("focusable"));
    }
}
