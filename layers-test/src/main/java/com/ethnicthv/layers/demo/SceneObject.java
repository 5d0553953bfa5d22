package com.ethnicthv.layers.demo;

import com.ethnicthv.layers.Layer;

/**
 * A host-side object. Like most engines, the host stores the layer as a bare {@code int}.
 */
public class SceneObject {
    private final String name;
    private int layer;

    public SceneObject(String name, int layer) {
        this.name = name;
        this.layer = Layer.checkIndex(layer);
    }

    public SceneObject(String name, Layer layer) {
        this(name, layer.index());
    }

    public String getName() {
        return name;
    }

    /**
     * Raw host layer index.
     */
    public int getLayer() {
        return layer;
    }

    public void setLayer(Layer layer) {
        this.layer = layer.index();
    }

    @Override
    public String toString() {
        return name + "@" + layer;
    }
}
