package com.ethnicthv.layers;

/**
 * Anything that can stand in for a {@link Mask} operand: a mask itself or a single {@link Layer}.
 * <p>
 * Every binary operation first normalises its right-hand side into one mask (the union of all
 * arguments) and then applies a single bitwise rule, so {@code Layer.WATER.or(mask)},
 * {@code mask.or(Layer.WATER)} and {@code mask.or(4)} all take the same path. Raw {@code int}
 * arguments are always layer indices, never bit patterns; use {@link Mask#fromBits(int)} for the latter.
 */
public interface MaskLike {

    /**
     * This operand as a mask. Implementations must never return {@code null}; operations reject
     * a {@code null} result with a {@link NullPointerException} naming the implementing class.
     */
    Mask toMask();

    /**
     * Union with every argument.
     */
    default Mask or(MaskLike... others) {
        return Mask.combine(this, Mask.of(others), Mask.Op.OR);
    }

    default Mask or(int... layers) {
        return Mask.combine(this, Mask.of(layers), Mask.Op.OR);
    }

    /**
     * Same as {@link #or(MaskLike...)}.
     */
    default Mask plus(MaskLike... others) {
        return or(others);
    }

    default Mask plus(int... layers) {
        return or(layers);
    }

    /**
     * Intersection with the union of the arguments.
     */
    default Mask and(MaskLike... others) {
        return Mask.combine(this, Mask.of(others), Mask.Op.AND);
    }

    default Mask and(int... layers) {
        return Mask.combine(this, Mask.of(layers), Mask.Op.AND);
    }

    /**
     * Clear every layer of the arguments, whether or not it was set here.
     */
    default Mask minus(MaskLike... others) {
        return Mask.combine(this, Mask.of(others), Mask.Op.MINUS);
    }

    default Mask minus(int... layers) {
        return Mask.combine(this, Mask.of(layers), Mask.Op.MINUS);
    }

    /**
     * Every layer of the universe that is not set here.
     */
    default Mask not() {
        return Mask.fromBits(~Mask.of(this).bits());
    }

    /**
     * Strict equality: true iff this is exactly the union of the arguments.
     * {@code Mask.of(1, 2).is(1)} is false even though the mask contains layer 1.
     */
    default boolean is(MaskLike... others) {
        return Mask.of(this).equals(Mask.of(others));
    }

    default boolean is(int... layers) {
        return Mask.of(this).equals(Mask.of(layers));
    }

    default boolean isNot(MaskLike... others) {
        return !is(others);
    }

    default boolean isNot(int... layers) {
        return !is(layers);
    }
}
