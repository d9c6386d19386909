package com.spintax.engine.count;

/**
 * Number of renderings of a tree, or {@link #OVERFLOW} when the count passed the counter's
 * ceiling. Overflow is an expected answer for large trees, not an error.
 */
public final class VariationCount {

    public static final VariationCount OVERFLOW = new VariationCount(-1);

    private static final VariationCount ONE = new VariationCount(1);

    private final long value;

    private VariationCount(long value) {
        this.value = value;
    }

    public static VariationCount of(long value) {
        if (value < 1) {
            throw new IllegalArgumentException("variation count must be positive: " + value);
        }
        return value == 1 ? ONE : new VariationCount(value);
    }

    public boolean isOverflow() {
        return this == OVERFLOW;
    }

    public long value() {
        if (isOverflow()) {
            throw new IllegalStateException("variation count overflowed");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariationCount other && other.value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isOverflow() ? "overflow" : Long.toString(value);
    }
}
