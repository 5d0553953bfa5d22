package com.ethnicthv.layers;

import java.util.Objects;

/**
 * Identity checks against one mask, obtained from {@link Mask#is()}.
 * Identity is mask equality: a mask "is" a layer only when that layer is its sole member.
 */
public final class IsQuery {
    private final Mask mask;

    IsQuery(Mask mask) {
        this.mask = Objects.requireNonNull(mask, "mask");
    }

    /**
     * True iff the mask equals the union of all candidates.
     */
    public boolean exactly(MaskLike... candidates) {
        return mask.equals(Mask.of(candidates));
    }

    public boolean exactly(int... layers) {
        return mask.equals(Mask.of(layers));
    }

    /**
     * True iff the mask equals at least one candidate taken on its own.
     */
    public boolean any(MaskLike... candidates) {
        Objects.requireNonNull(candidates, "candidates");
        for (MaskLike candidate : candidates) {
            if (mask.equals(Objects.requireNonNull(candidate, "candidate").toMask())) {
                return true;
            }
        }
        return false;
    }

    public boolean any(int... layers) {
        Objects.requireNonNull(layers, "layers");
        // No short-circuit: every index is range-checked.
        boolean match = false;
        for (int layer : layers) {
            match |= mask.equals(Mask.fromLayer(layer));
        }
        return match;
    }

    public boolean not(MaskLike... candidates) {
        return !exactly(candidates);
    }

    public boolean not(int... layers) {
        return !exactly(layers);
    }

    /**
     * True iff the mask equals none of the candidates taken on their own.
     */
    public boolean none(MaskLike... candidates) {
        return !any(candidates);
    }

    public boolean none(int... layers) {
        return !any(layers);
    }
}
