package io.hearthwarrio.locatium.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable selection criteria deciding which elements get locators.
 * <p>
 * Defaults: all tags except the synthetic {@code hierarchy} root, no required attributes, no minimum attribute
 * count, neither fetchable-only nor clickable-only.
 */
public final class FilterOptions {

    /**
     * Tag of the wrapper element UiAutomator2 puts around the page source.
     */
    public static final String HIERARCHY_ROOT_TAG = "hierarchy";

    private static final FilterOptions DEFAULTS = builder().build();

    private final Set<String> includeTagNames;
    private final Set<String> excludeTagNames;
    private final Set<String> requireAttributes;
    private final int minAttributeCount;
    private final boolean fetchableOnly;
    private final boolean clickableOnly;

    private FilterOptions(Builder b) {
        this.includeTagNames = Collections.unmodifiableSet(new LinkedHashSet<>(b.includeTagNames));
        this.excludeTagNames = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludeTagNames));
        this.requireAttributes = Collections.unmodifiableSet(new LinkedHashSet<>(b.requireAttributes));
        this.minAttributeCount = b.minAttributeCount;
        this.fetchableOnly = b.fetchableOnly;
        this.clickableOnly = b.clickableOnly;
    }

    public static FilterOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Allowed tags; empty means every tag.
     */
    public Set<String> getIncludeTagNames() {
        return includeTagNames;
    }

    public Set<String> getExcludeTagNames() {
        return excludeTagNames;
    }

    /**
     * At least one of these attributes must be present; empty disables the check.
     */
    public Set<String> getRequireAttributes() {
        return requireAttributes;
    }

    public int getMinAttributeCount() {
        return minAttributeCount;
    }

    public boolean isFetchableOnly() {
        return fetchableOnly;
    }

    public boolean isClickableOnly() {
        return clickableOnly;
    }

    @Override
    public String toString() {
        return "FilterOptions{" +
                "includeTagNames=" + includeTagNames +
                ", excludeTagNames=" + excludeTagNames +
                ", requireAttributes=" + requireAttributes +
                ", minAttributeCount=" + minAttributeCount +
                ", fetchableOnly=" + fetchableOnly +
                ", clickableOnly=" + clickableOnly +
                '}';
    }

    public static final class Builder {
        private final Set<String> includeTagNames = new LinkedHashSet<>();
        private final Set<String> excludeTagNames = new LinkedHashSet<>(Set.of(HIERARCHY_ROOT_TAG));
        private final Set<String> requireAttributes = new LinkedHashSet<>();
        private int minAttributeCount = 0;
        private boolean fetchableOnly = false;
        private boolean clickableOnly = false;

        private Builder() {
        }

        public Builder includeTagNames(String... tagNames) {
            return includeTagNames(tagNames == null ? null : Arrays.asList(tagNames));
        }

        public Builder includeTagNames(Collection<String> tagNames) {
            replace(includeTagNames, tagNames);
            return this;
        }

        /**
         * Replaces the default exclusion of {@link #HIERARCHY_ROOT_TAG}.
         */
        public Builder excludeTagNames(String... tagNames) {
            return excludeTagNames(tagNames == null ? null : Arrays.asList(tagNames));
        }

        public Builder excludeTagNames(Collection<String> tagNames) {
            replace(excludeTagNames, tagNames);
            return this;
        }

        public Builder requireAttributes(String... attributes) {
            return requireAttributes(attributes == null ? null : Arrays.asList(attributes));
        }

        public Builder requireAttributes(Collection<String> attributes) {
            replace(requireAttributes, attributes);
            return this;
        }

        public Builder minAttributeCount(int minAttributeCount) {
            if (minAttributeCount < 0) {
                throw new IllegalArgumentException("minAttributeCount must not be negative: " + minAttributeCount);
            }
            this.minAttributeCount = minAttributeCount;
            return this;
        }

        public Builder fetchableOnly(boolean fetchableOnly) {
            this.fetchableOnly = fetchableOnly;
            return this;
        }

        public Builder clickableOnly(boolean clickableOnly) {
            this.clickableOnly = clickableOnly;
            return this;
        }

        public FilterOptions build() {
            return new FilterOptions(this);
        }

        private static void replace(Set<String> target, Collection<String> values) {
            target.clear();
            if (values == null) {
                return;
            }
            for (String v : values) {
                if (v != null && !v.isBlank()) {
                    target.add(v.trim());
                }
            }
        }
    }
}
