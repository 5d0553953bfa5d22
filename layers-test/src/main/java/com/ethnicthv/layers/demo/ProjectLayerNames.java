package com.ethnicthv.layers.demo;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.names.LayerNameTable;
import com.ethnicthv.layers.names.LayerNames;
import com.ethnicthv.layers.names.MapLayerNameTable;
import com.google.auto.service.AutoService;

/**
 * Labels of this project's layer setup. Layers 8-21 were renamed in the host editor after the
 * enumeration was generated, so the labels differ from the constant names.
 */
@AutoService(LayerNameTable.class)
public class ProjectLayerNames implements LayerNameTable {

    private static final MapLayerNameTable TABLE = MapLayerNameTable.builder()
            .putAll(LayerNames.defaults())
            .put(Layer.CLICKABLES, "Layer.IgnoreTopDown")
            .put(Layer.L9, "Layer.Selectable")
            .put(Layer.L10, "Layer.IgnoreVR")
            .put(Layer.L11, "Layer.Floor")
            .put(Layer.L12, "Layer.Player")
            .put(Layer.L13, "Layer.Wall")
            .put(Layer.L14, "Layer.EscapeRoute")
            .put(Layer.L15, "Layer.TestOBJ")
            .put(Layer.L16, "Layer.IgnorePhysics")
            .put(Layer.L17, "Layer.VROnly")
            .put(Layer.L18, "Layer.MiniModelPreview")
            .put(Layer.L19, "Layer.SelectableIcon")
            .put(Layer.L20, "Layer.EndlessPlane")
            .put(Layer.L21, "Layer.ExteriorObjectBlocking")
            .build();

    // Public no-arg constructor for ServiceLoader
    public ProjectLayerNames() {
    }

    @Override
    public String label(int index) {
        return TABLE.label(index);
    }
}
