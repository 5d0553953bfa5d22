package com.ethnicthv.layers.names;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.UnknownLayerLabelException;

/**
 * Display labels for layer indices, used for diagnostics only.
 * <p>
 * Hosts name their layers differently, so the table is pluggable: register an implementation
 * as a {@link java.util.ServiceLoader} provider and {@link LayerNames#installed()} picks it up.
 */
public interface LayerNameTable {

    /**
     * Label for a layer index.
     *
     * @throws com.ethnicthv.layers.LayerOutOfRangeException if {@code index} is not in {@code 0..31}
     * @throws UnknownLayerLabelException if the table has no entry for {@code index}
     */
    String label(int index);

    default String label(Layer layer) {
        return label(layer.index());
    }

    /**
     * Check that every index of the universe has a label.
     *
     * @throws UnknownLayerLabelException for the first index without one
     */
    default void validate() {
        for (int i = 0; i < Layer.COUNT; i++) {
            if (label(i) == null) {
                throw new UnknownLayerLabelException(i);
            }
        }
    }
}
