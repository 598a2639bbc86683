package io.hearthwarrio.locatium.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable element of a parsed hierarchy snapshot.
 * <p>
 * A node is addressed by its {@link #getPath() path}: dot-separated 0-based child ordinals from the root
 * (the root itself has an empty path). Parents are resolved through {@link UiTree#parentOf(UiNode)}.
 * <p>
 * Identity is scoped to a single snapshot: nodes of different trees must never be compared.
 */
public final class UiNode {

    private final String tagName;
    private final Map<String, String> attributes;
    private final List<UiNode> children;
    private final String path;

    UiNode(String tagName, Map<String, String> attributes, List<UiNode> children, String path) {
        this.tagName = tagName == null ? "" : tagName;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = children == null ? List.of() : List.copyOf(children);
        this.path = path == null ? "" : path;
    }

    public String getTagName() {
        return tagName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Returns the attribute value, or an empty string when the attribute is absent.
     */
    public String getAttribute(String name) {
        String v = attributes.get(name);
        return v == null ? "" : v;
    }

    /**
     * Whether the attribute is present with a non-empty value.
     */
    public boolean hasAttribute(String name) {
        return !getAttribute(name).isEmpty();
    }

    public List<UiNode> getChildren() {
        return children;
    }

    public String getPath() {
        return path;
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    /**
     * Ordinal of the root child this node lives under, or -1 for the root itself.
     */
    public int topLevelIndex() {
        if (path.isEmpty()) {
            return -1;
        }
        int dot = path.indexOf('.');
        return Integer.parseInt(dot < 0 ? path : path.substring(0, dot));
    }

    @Override
    public String toString() {
        return "UiNode{" +
                "tagName='" + tagName + '\'' +
                ", path='" + path + '\'' +
                ", attributes=" + attributes +
                ", children=" + children.size() +
                '}';
    }
}
