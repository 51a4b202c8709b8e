package com.blockstore.model;

/**
 * How many levels of descendants to hydrate when fetching a block.
 * {@code levels == null} means the whole subtree sharing the block's root.
 */
public record Depth(Integer levels) {

    private static final Depth NONE = new Depth(0);
    private static final Depth UNBOUNDED = new Depth(null);

    public Depth {
        if (levels != null && levels < 0) {
            throw new IllegalArgumentException("Depth must be a non-negative integer or unbounded, got " + levels);
        }
    }

    public static Depth none() {
        return NONE;
    }

    public static Depth of(int levels) {
        return levels == 0 ? NONE : new Depth(levels);
    }

    public static Depth unbounded() {
        return UNBOUNDED;
    }

    public boolean isUnbounded() {
        return levels == null;
    }

    public boolean isNone() {
        return levels != null && levels == 0;
    }
}
