package io.hearthwarrio.locatium.core;

import java.util.Objects;

/**
 * How a selector expression resolves against a tree relative to its target node.
 * <ul>
 *   <li>{@link Kind#UNIQUE}: exactly one match, the target</li>
 *   <li>{@link Kind#SEMI_UNIQUE}: several matches; {@link #getIndex()} is the 0-based position of the target</li>
 *   <li>{@link Kind#NONE}: no single-match guarantee (no match, foreign match, malformed or positional expression)</li>
 * </ul>
 */
public final class Uniqueness {

    public enum Kind {
        UNIQUE,
        SEMI_UNIQUE,
        NONE
    }

    private static final Uniqueness UNIQUE = new Uniqueness(Kind.UNIQUE, -1);
    private static final Uniqueness NONE = new Uniqueness(Kind.NONE, -1);

    private final Kind kind;
    private final int index;

    private Uniqueness(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static Uniqueness unique() {
        return UNIQUE;
    }

    public static Uniqueness none() {
        return NONE;
    }

    /**
     * @param index 0-based position of the target among all matches
     */
    public static Uniqueness semiUnique(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        return new Uniqueness(Kind.SEMI_UNIQUE, index);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 0-based position of the target among matches; -1 unless {@link Kind#SEMI_UNIQUE}.
     */
    public int getIndex() {
        return index;
    }

    public boolean isUnique() {
        return kind == Kind.UNIQUE;
    }

    public boolean isSemiUnique() {
        return kind == Kind.SEMI_UNIQUE;
    }

    @Override
    public String toString() {
        return kind == Kind.SEMI_UNIQUE ? "SEMI_UNIQUE(" + index + ")" : kind.name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Uniqueness)) return false;
        Uniqueness that = (Uniqueness) o;
        return index == that.index && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }
}
