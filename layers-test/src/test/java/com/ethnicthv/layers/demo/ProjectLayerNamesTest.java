package com.ethnicthv.layers.demo;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.Mask;
import com.ethnicthv.layers.names.LayerNameTable;
import com.ethnicthv.layers.names.LayerNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The project table is registered through AutoService and must replace the built-in labels.
 */
public class ProjectLayerNamesTest {

    @Test
    @DisplayName("ServiceLoader discovers the project label table")
    void testInstalledTableIsProjectTable() {
        LayerNameTable installed = LayerNames.installed();
        assertInstanceOf(ProjectLayerNames.class, installed);
        assertNotSame(LayerNames.defaults(), installed);
    }

    @Test
    void testRenamedLayers() {
        assertEquals("Layer.IgnoreTopDown", LayerNames.label(Layer.CLICKABLES));
        assertEquals("Layer.Selectable", LayerNames.label(9));
        assertEquals("Layer.Floor", LayerNames.label(LayerMaskDemo.FLOOR));
        assertEquals("Layer.ExteriorObjectBlocking", LayerNames.label(Layer.L21));
        // Untouched layers keep the built-in labels
        assertEquals("Layer.Water", LayerNames.label(Layer.WATER));
        assertEquals("Layer.L22", LayerNames.label(22));
    }

    @Test
    void testTableIsComplete() {
        assertDoesNotThrow(() -> new ProjectLayerNames().validate());
    }

    @Test
    void testMaskToStringUsesProjectLabels() {
        Mask mask = Mask.of(LayerMaskDemo.WALL, LayerMaskDemo.PLAYER);
        assertEquals("Mask{Layer.Player, Layer.Wall}", mask.toString());
        System.out.println("✓ " + mask);
    }
}
