package com.ethnicthv.layers;

import java.util.Objects;

/**
 * Batch containment checks against one mask, obtained from {@link Mask#contains()}.
 * <p>
 * Supports:
 * - all(): the mask contains every candidate
 * - any(): the mask contains at least one non-empty candidate
 * - none(): negation of any()
 * - only(): the candidates together account for exactly the layers of the mask
 */
public final class ContainsQuery {
    private final Mask mask;

    ContainsQuery(Mask mask) {
        this.mask = Objects.requireNonNull(mask, "mask");
    }

    /**
     * True iff the mask contains every candidate. Vacuously true without candidates.
     */
    public boolean all(MaskLike... candidates) {
        Objects.requireNonNull(candidates, "candidates");
        for (MaskLike candidate : candidates) {
            if (!mask.contains(candidate)) {
                return false;
            }
        }
        return true;
    }

    public boolean all(int... layers) {
        return mask.contains(Mask.of(layers));
    }

    /**
     * True iff the mask contains at least one candidate. An empty candidate mask never matches.
     */
    public boolean any(MaskLike... candidates) {
        Objects.requireNonNull(candidates, "candidates");
        for (MaskLike candidate : candidates) {
            if (mask.containsAndNotEmpty(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean any(int... layers) {
        // Every index is range-checked, including those after a match.
        return mask.intersects(Mask.of(layers));
    }

    public boolean none(MaskLike... candidates) {
        return !any(candidates);
    }

    public boolean none(int... layers) {
        return !any(layers);
    }

    /**
     * True iff the mask contains every candidate and the union of the candidates has as many
     * layers as the mask. Repeating a candidate does not change the result.
     */
    public boolean only(MaskLike... candidates) {
        return all(candidates) && Mask.of(candidates).layerCount() == mask.layerCount();
    }

    public boolean only(int... layers) {
        return all(layers) && Mask.of(layers).layerCount() == mask.layerCount();
    }
}
