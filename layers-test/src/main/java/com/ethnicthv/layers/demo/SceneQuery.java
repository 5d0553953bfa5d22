package com.ethnicthv.layers.demo;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.Mask;
import com.ethnicthv.layers.MaskLike;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Filters scene objects by layer.
 * <p>
 * Supports:
 * - in(): objects MUST be on one of these layers (all layers if never called)
 * - notIn(): objects MUST NOT be on any of these layers
 */
public final class SceneQuery {
    private final List<SceneObject> objects;
    private final Mask.Builder include = Mask.builder();
    private final Mask.Builder exclude = Mask.builder();
    private boolean restricted;

    public SceneQuery(List<SceneObject> objects) {
        this.objects = objects;
    }

    public SceneQuery in(MaskLike... layers) {
        include.with(layers);
        restricted = true;
        return this;
    }

    public SceneQuery in(int... layers) {
        for (int layer : layers) {
            include.with(layer);
        }
        restricted = true;
        return this;
    }

    public SceneQuery notIn(MaskLike... layers) {
        exclude.with(layers);
        return this;
    }

    public SceneQuery notIn(int... layers) {
        for (int layer : layers) {
            exclude.with(layer);
        }
        return this;
    }

    /**
     * The layers an object may be on for this query to match it.
     */
    public Mask mask() {
        Mask allowed = restricted ? include.build() : Mask.ALL_LAYERS;
        return allowed.minus(exclude.build());
    }

    public void forEach(Consumer<SceneObject> consumer) {
        Mask allowed = mask();
        for (SceneObject object : objects) {
            if (allowed.contains(object.getLayer())) {
                consumer.accept(object);
            }
        }
    }

    public List<SceneObject> collect() {
        List<SceneObject> result = new ArrayList<>();
        forEach(result::add);
        return result;
    }

    /**
     * Union of the layers the given objects are on.
     */
    public static Mask occupied(List<SceneObject> objects) {
        Mask.Builder builder = Mask.builder();
        for (SceneObject object : objects) {
            builder.with(object.getLayer());
        }
        return builder.build();
    }

    public static boolean isOn(SceneObject object, Layer... layers) {
        return Mask.fromLayer(object.getLayer()).contains().any(layers);
    }
}
