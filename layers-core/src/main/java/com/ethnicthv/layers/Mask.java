package com.ethnicthv.layers;

import com.ethnicthv.layers.names.LayerNameTable;
import com.ethnicthv.layers.names.LayerNames;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Stream;

/**
 * An immutable set of {@link Layer}s backed by a 32-bit pattern, one bit per layer index.
 * <p>
 * IMPORTANT: every {@code int} a mask receives is a layer index (0-31), never a pre-built
 * bit pattern. {@code Mask.of(3)} is layer 3, not layers 0 and 1. The only way to hand over raw
 * bits is {@link #fromBits(int)}; {@link #fromLayer(int)} states the opposite contract at call
 * sites that receive an {@code int} from the host.
 * <p>
 * Two masks are equal iff their bits are equal. Equality against a layer or a group of
 * operands goes through {@link #is(MaskLike...)} and means "exactly these layers", which is
 * stricter than {@link #contains(MaskLike)}.
 * <pre>{@code
 * Mask walkable = Mask.of(Layer.DEFAULT, Layer.WATER);
 * Mask blocking = walkable.or(Layer.CLICKABLES).minus(Layer.WATER);
 * if (blocking.contains().any(Layer.of(hostLayer))) { ... }
 * }</pre>
 */
public final class Mask implements MaskLike, Iterable<Layer> {

    /**
     * The empty mask.
     */
    public static final Mask NONE = new Mask(0);

    /**
     * Every layer of the universe.
     */
    public static final Mask ALL_LAYERS = new Mask(~0);

    enum Op {
        OR {
            @Override
            int apply(int left, int right) {
                return left | right;
            }
        },
        AND {
            @Override
            int apply(int left, int right) {
                return left & right;
            }
        },
        MINUS {
            @Override
            int apply(int left, int right) {
                return left & ~right;
            }
        };

        abstract int apply(int left, int right);
    }

    private final int bits;
    // Ascending, computed once from bits.
    private final Set<Layer> layers;

    private Mask(int bits) {
        this.bits = bits;
        EnumSet<Layer> set = EnumSet.noneOf(Layer.class);
        for (int i = 0; i < Layer.COUNT; i++) {
            if ((bits & (1 << i)) != 0) {
                set.add(Layer.of(i));
            }
        }
        this.layers = Collections.unmodifiableSet(set);
    }

    // =================================================================
    // Factories
    // =================================================================

    public static Mask empty() {
        return NONE;
    }

    /**
     * Use the given pattern verbatim, bit {@code i} standing for layer {@code i}.
     */
    public static Mask fromBits(int bits) {
        return bits == 0 ? NONE : new Mask(bits);
    }

    /**
     * Mask of the single layer with the given index.
     *
     * @throws LayerOutOfRangeException if {@code layer} is not in {@code 0..31}
     */
    public static Mask fromLayer(int layer) {
        return new Mask(1 << Layer.checkIndex(layer));
    }

    public static Mask of(Layer... layers) {
        Objects.requireNonNull(layers, "layers");
        int bits = 0;
        for (Layer layer : layers) {
            bits |= Objects.requireNonNull(layer, "layer").bit();
        }
        return fromBits(bits);
    }

    /**
     * Union of the given layer indices.
     *
     * @throws LayerOutOfRangeException if any index is not in {@code 0..31}
     */
    public static Mask of(int... layers) {
        Objects.requireNonNull(layers, "layers");
        int bits = 0;
        for (int layer : layers) {
            bits |= 1 << Layer.checkIndex(layer);
        }
        return fromBits(bits);
    }

    /**
     * Union of the given masks and layers.
     */
    public static Mask of(MaskLike... operands) {
        Objects.requireNonNull(operands, "operands");
        int bits = 0;
        for (MaskLike operand : operands) {
            bits |= bitsOf(operand, "operand");
        }
        return fromBits(bits);
    }

    public static Mask ofAll(Iterable<? extends MaskLike> operands) {
        Objects.requireNonNull(operands, "operands");
        int bits = 0;
        for (MaskLike operand : operands) {
            bits |= bitsOf(operand, "operand");
        }
        return fromBits(bits);
    }

    public static Builder builder() {
        return new Builder();
    }

    static Mask combine(MaskLike left, Mask right, Op op) {
        int leftBits = bitsOf(left, "left");
        return fromBits(op.apply(leftBits, right.bits));
    }

    private static int bitsOf(MaskLike operand, String name) {
        Mask mask = Objects.requireNonNull(operand, name).toMask();
        if (mask == null) {
            throw new NullPointerException(operand.getClass().getName() + ".toMask() returned null");
        }
        return mask.bits;
    }

    // =================================================================
    // Queries
    // =================================================================

    /**
     * True iff every layer of {@code other} is set here. The empty mask is contained by every mask.
     */
    public boolean contains(MaskLike other) {
        int otherBits = bitsOf(other, "other");
        return (bits & otherBits) == otherBits;
    }

    /**
     * True iff the bit of the given layer index is set.
     *
     * @throws LayerOutOfRangeException if {@code layer} is not in {@code 0..31}
     */
    public boolean contains(int layer) {
        return (bits & (1 << Layer.checkIndex(layer))) != 0;
    }

    /**
     * Like {@link #contains(MaskLike)} but false for an empty {@code other}.
     */
    public boolean containsAndNotEmpty(MaskLike other) {
        int otherBits = bitsOf(other, "other");
        return otherBits != 0 && (bits & otherBits) == otherBits;
    }

    /**
     * True iff at least one layer is set both here and in {@code other}.
     */
    public boolean intersects(MaskLike other) {
        return (bits & bitsOf(other, "other")) != 0;
    }

    /**
     * Fluent containment queries: {@code mask.contains().any(Layer.WATER, Layer.UI)}.
     */
    public ContainsQuery contains() {
        return new ContainsQuery(this);
    }

    /**
     * Fluent identity queries: {@code mask.is().any(Layer.WATER, Layer.UI)}.
     */
    public IsQuery is() {
        return new IsQuery(this);
    }

    // =================================================================
    // Views
    // =================================================================

    /**
     * The raw pattern. {@link #ALL_LAYERS} is {@code -1}; see {@link #unsignedBits()}.
     */
    public int bits() {
        return bits;
    }

    public long unsignedBits() {
        return Integer.toUnsignedLong(bits);
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public boolean isNonEmpty() {
        return bits != 0;
    }

    public int layerCount() {
        return layers.size();
    }

    /**
     * Member layers in ascending index order.
     */
    public Set<Layer> layers() {
        return layers;
    }

    /**
     * Member layer indices in ascending order.
     */
    public int[] layerIndices() {
        int[] indices = new int[layers.size()];
        int idx = 0;
        for (Layer layer : layers) {
            indices[idx++] = layer.index();
        }
        return indices;
    }

    @Override
    public Iterator<Layer> iterator() {
        return layers.iterator();
    }

    public Stream<Layer> stream() {
        return layers.stream();
    }

    @Override
    public Mask toMask() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Mask that = (Mask) o;
        return bits == that.bits;
    }

    @Override
    public int hashCode() {
        return bits;
    }

    /**
     * Labels come from the installed {@link LayerNameTable}, e.g. {@code Mask{Layer.Default, Layer.Water}}.
     */
    @Override
    public String toString() {
        LayerNameTable names = LayerNames.installed();
        StringJoiner joiner = new StringJoiner(", ", "Mask{", "}");
        for (Layer layer : layers) {
            joiner.add(names.label(layer));
        }
        return joiner.toString();
    }

    /**
     * Accumulates layers before producing a single mask.
     */
    public static final class Builder {
        private int bits;

        private Builder() {
        }

        public Builder with(int layer) {
            bits |= 1 << Layer.checkIndex(layer);
            return this;
        }

        public Builder with(MaskLike... operands) {
            bits |= Mask.of(operands).bits;
            return this;
        }

        public Builder without(int layer) {
            bits &= ~(1 << Layer.checkIndex(layer));
            return this;
        }

        public Builder without(MaskLike... operands) {
            bits &= ~Mask.of(operands).bits;
            return this;
        }

        public Mask build() {
            return fromBits(bits);
        }
    }
}
