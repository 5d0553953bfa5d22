package com.ethnicthv.layers.names;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.UnknownLayerLabelException;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Access point for the {@link LayerNameTable} in use.
 * <p>
 * The installed table is resolved once, on first use, through {@link ServiceLoader}. Without a
 * provider on the class path the built-in {@link #defaults()} are used. Two or more providers
 * are a configuration error.
 */
public final class LayerNames {

    private static final MapLayerNameTable DEFAULTS = MapLayerNameTable.builder()
            .put(Layer.DEFAULT, "Layer.Default")
            .put(Layer.TRANSPARENT_FX, "Layer.TransparentFX")
            .put(Layer.IGNORE_RAYCAST, "Layer.IgnoreRaycast")
            .put(Layer.L3, "Layer.L3")
            .put(Layer.WATER, "Layer.Water")
            .put(Layer.UI, "Layer.UI")
            .put(Layer.L6, "Layer.L6")
            .put(Layer.L7, "Layer.L7")
            .put(Layer.CLICKABLES, "Layer.Clickables")
            .putNumbered(9, Layer.COUNT)
            .build();

    private static final Installation INSTALLATION = new Installation(LayerNames.class.getClassLoader());

    private LayerNames() {
    }

    /**
     * Built-in labels: {@code Layer.Default}, {@code Layer.TransparentFX}, ..., {@code Layer.L31}.
     */
    public static LayerNameTable defaults() {
        return DEFAULTS;
    }

    /**
     * The table found through {@link ServiceLoader}, resolved on first call.
     *
     * @throws IllegalStateException if more than one provider is registered
     * @throws UnknownLayerLabelException if the provider misses a layer
     */
    public static LayerNameTable installed() {
        return INSTALLATION.get();
    }

    public static String label(Layer layer) {
        return installed().label(layer);
    }

    public static String label(int index) {
        return installed().label(index);
    }

    /**
     * Resolve the provider visible to {@code loader}, validating it before it is handed out.
     *
     * @throws IllegalStateException if more than one provider is registered
     * @throws UnknownLayerLabelException if the provider misses a layer
     */
    static LayerNameTable discover(ClassLoader loader) {
        List<LayerNameTable> found = new ArrayList<>();
        for (LayerNameTable table : ServiceLoader.load(LayerNameTable.class, loader)) {
            found.add(table);
        }
        if (found.isEmpty()) {
            return DEFAULTS;
        }
        if (found.size() > 1) {
            List<String> names = new ArrayList<>();
            for (LayerNameTable table : found) {
                names.add(table.getClass().getName());
            }
            throw new IllegalStateException("Multiple LayerNameTable providers registered: " + names);
        }
        LayerNameTable table = found.get(0);
        table.validate();
        return table;
    }

    /**
     * Lazily resolved provider lookup for one class loader. A failed lookup is remembered and
     * the same exception is thrown again on every later call.
     */
    static final class Installation {
        private final ClassLoader loader;
        private volatile LayerNameTable table;
        private volatile RuntimeException failure;

        Installation(ClassLoader loader) {
            this.loader = loader;
        }

        LayerNameTable get() {
            LayerNameTable resolved = table;
            if (resolved != null) {
                return resolved;
            }
            synchronized (this) {
                if (table == null && failure == null) {
                    try {
                        table = discover(loader);
                    } catch (UnknownLayerLabelException | IllegalStateException e) {
                        failure = e;
                    }
                }
                if (failure != null) {
                    throw failure;
                }
                return table;
            }
        }
    }
}
