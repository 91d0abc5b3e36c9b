package com.xml2md.core.convert;

import java.util.Objects;

/**
 * Immutable render context threaded through the traversal.
 *
 * <p>A handler that needs a different context for its children derives a new value with
 * {@link #withMode(RenderMode)}, {@link #right()} or {@link #left()} and passes that down;
 * the value it received is never changed, so siblings processed afterwards see the caller's
 * context.
 *
 * <p>Depth counts enclosing sections in {@link RenderMode#SECTION} and list nesting in the
 * list modes. It is never negative.
 *
 * @param mode current render mode
 * @param depth nesting depth, floored at zero
 */
public record RenderState(
    RenderMode mode,
    int depth
) {
    /**
     * Compact constructor with validation.
     */
    public RenderState {
        Objects.requireNonNull(mode, "mode must not be null");
        if (depth < 0) {
            depth = 0;
        }
    }

    /**
     * Returns the state traversal starts from: {@link RenderMode#TOP}, depth 0.
     *
     * @return initial state
     */
    public static RenderState initial() {
        return new RenderState(RenderMode.TOP, 0);
    }

    public RenderState withMode(RenderMode newMode) {
        return new RenderState(newMode, depth);
    }

    public RenderState withDepth(int newDepth) {
        return new RenderState(mode, newDepth);
    }

    /**
     * Returns a copy one level deeper.
     *
     * @return state with depth + 1
     */
    public RenderState right() {
        return new RenderState(mode, depth + 1);
    }

    /**
     * Returns a copy one level shallower; depth stays at 0 if already there.
     *
     * @return state with depth - 1, floored at 0
     */
    public RenderState left() {
        return new RenderState(mode, depth - 1);
    }

    /**
     * Returns true if the current mode is any of the given modes.
     *
     * @param modes modes to test
     * @return true on match
     */
    public boolean isIn(RenderMode... modes) {
        for (RenderMode candidate : modes) {
            if (mode == candidate) {
                return true;
            }
        }
        return false;
    }
}
