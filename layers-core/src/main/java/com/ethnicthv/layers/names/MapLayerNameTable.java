package com.ethnicthv.layers.names;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.UnknownLayerLabelException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable {@link LayerNameTable} filled through a {@link Builder}. Missing entries are
 * reported with {@link UnknownLayerLabelException} rather than a placeholder.
 */
public final class MapLayerNameTable implements LayerNameTable {
    private final String[] labels;

    private MapLayerNameTable(String[] labels) {
        this.labels = labels;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String label(int index) {
        String label = labels[Layer.checkIndex(index)];
        if (label == null) {
            throw new UnknownLayerLabelException(index);
        }
        return label;
    }

    /**
     * Number of indices that have a label.
     */
    public int size() {
        int count = 0;
        for (String label : labels) {
            if (label != null) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return "MapLayerNameTable" + Arrays.toString(labels);
    }

    public static final class Builder {
        private final String[] labels = new String[Layer.COUNT];

        private Builder() {
        }

        public Builder put(int index, String label) {
            labels[Layer.checkIndex(index)] = Objects.requireNonNull(label, "label");
            return this;
        }

        public Builder put(Layer layer, String label) {
            return put(layer.index(), label);
        }

        /**
         * Label indices {@code from} (inclusive) to {@code to} (exclusive) as {@code Layer.L<i>}.
         */
        public Builder putNumbered(int from, int to) {
            for (int i = from; i < to; i++) {
                put(i, "Layer.L" + i);
            }
            return this;
        }

        /**
         * Copy every label of a complete table; entries added afterwards override the copies.
         *
         * @throws UnknownLayerLabelException if {@code other} misses an index
         */
        public Builder putAll(LayerNameTable other) {
            Objects.requireNonNull(other, "other");
            for (int i = 0; i < Layer.COUNT; i++) {
                labels[i] = other.label(i);
            }
            return this;
        }

        public MapLayerNameTable build() {
            return new MapLayerNameTable(labels.clone());
        }
    }
}
