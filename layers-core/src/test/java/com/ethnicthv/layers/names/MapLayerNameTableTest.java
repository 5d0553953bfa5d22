package com.ethnicthv.layers.names;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.LayerOutOfRangeException;
import com.ethnicthv.layers.UnknownLayerLabelException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MapLayerNameTableTest {

    @Test
    void testLookup() {
        MapLayerNameTable table = MapLayerNameTable.builder()
                .put(Layer.WATER, "Layer.Water")
                .put(12, "Layer.Player")
                .build();

        assertEquals("Layer.Water", table.label(4));
        assertEquals("Layer.Water", table.label(Layer.WATER));
        assertEquals("Layer.Player", table.label(Layer.L12));
        assertEquals(2, table.size());
    }

    @Test
    void testMissingEntryIsReportedNotDefaulted() {
        MapLayerNameTable table = MapLayerNameTable.builder().put(0, "Layer.Default").build();

        UnknownLayerLabelException e = assertThrows(UnknownLayerLabelException.class, () -> table.label(7));
        assertEquals(7, e.getIndex());
        assertThrows(UnknownLayerLabelException.class, table::validate);
    }

    @Test
    void testOutOfRangeIndex() {
        MapLayerNameTable table = MapLayerNameTable.builder().putNumbered(0, Layer.COUNT).build();

        assertThrows(LayerOutOfRangeException.class, () -> table.label(32));
        assertThrows(LayerOutOfRangeException.class, () -> table.label(-1));
        assertThrows(LayerOutOfRangeException.class, () -> MapLayerNameTable.builder().put(32, "x"));
    }

    @Test
    void testBuiltTableIsDetachedFromBuilder() {
        MapLayerNameTable.Builder builder = MapLayerNameTable.builder().putNumbered(0, Layer.COUNT);
        MapLayerNameTable first = builder.build();
        builder.put(Layer.UI, "Layer.Menu");
        MapLayerNameTable second = builder.build();

        assertEquals("Layer.L5", first.label(Layer.UI));
        assertEquals("Layer.Menu", second.label(Layer.UI));
    }

    @Test
    void testPutAllThenOverride() {
        MapLayerNameTable table = MapLayerNameTable.builder()
                .putAll(LayerNames.defaults())
                .put(Layer.L9, "Layer.Selectable")
                .build();

        table.validate();
        assertEquals(Layer.COUNT, table.size());
        assertEquals("Layer.Selectable", table.label(9));
        assertEquals("Layer.Clickables", table.label(8));
    }

    @Test
    void testNullLabelRejected() {
        assertThrows(NullPointerException.class, () -> MapLayerNameTable.builder().put(Layer.UI, null));
    }
}
