package com.ethnicthv.layers;

/**
 * Thrown when a layer index outside {@code 0..31} reaches a construction or query path.
 * The offending value is kept so callers validating host input can report it.
 */
public class LayerOutOfRangeException extends IndexOutOfBoundsException {
    private final int index;

    public LayerOutOfRangeException(int index) {
        super("Layer index out of range: " + index + " (expected 0.." + (Layer.COUNT - 1) + ")");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
