package com.ethnicthv.layers;

/**
 * The 32 host layers, in index order.
 * <p>
 * A layer is a label, not a bit: combining two layers always goes through {@link Mask}
 * ({@code Layer.WATER.or(Layer.UI)}), never through integer arithmetic on indices.
 * Hosts that store the layer of an object as a plain {@code int} convert with
 * {@link #of(int)} and {@link #index()}.
 *
 * @see Mask
 */
public enum Layer implements MaskLike {
    DEFAULT,
    TRANSPARENT_FX,
    IGNORE_RAYCAST,
    L3,
    WATER,
    UI,
    L6,
    L7,
    CLICKABLES,
    L9,
    L10,
    L11,
    L12,
    L13,
    L14,
    L15,
    L16,
    L17,
    L18,
    L19,
    L20,
    L21,
    L22,
    L23,
    L24,
    L25,
    L26,
    L27,
    L28,
    L29,
    L30,
    L31;

    /**
     * Size of the layer universe.
     */
    public static final int COUNT = 32;

    private static final Layer[] BY_INDEX = values();

    /**
     * Resolve a host layer index.
     *
     * @throws LayerOutOfRangeException if {@code index} is not in {@code 0..31}
     */
    public static Layer of(int index) {
        return BY_INDEX[checkIndex(index)];
    }

    /**
     * Validate a layer index and return it unchanged.
     *
     * @throws LayerOutOfRangeException if {@code index} is not in {@code 0..31}
     */
    public static int checkIndex(int index) {
        if (index < 0 || index >= COUNT) {
            throw new LayerOutOfRangeException(index);
        }
        return index;
    }

    public int index() {
        return ordinal();
    }

    /**
     * The single bit this layer occupies in a mask.
     */
    public int bit() {
        return 1 << ordinal();
    }

    @Override
    public Mask toMask() {
        return Mask.of(this);
    }
}
