package com.ethnicthv.layers;

/**
 * Thrown when a {@link com.ethnicthv.layers.names.LayerNameTable} has no label for a valid layer index.
 * Signals that the label table and the {@link Layer} enumeration have drifted apart.
 */
public class UnknownLayerLabelException extends RuntimeException {
    private final int index;

    public UnknownLayerLabelException(int index) {
        super("No label registered for layer " + index);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
