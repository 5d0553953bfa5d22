package com.ethnicthv.layers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for mask.is().exactly/any/not/none
 */
public class IsQueryTest {

    @Test
    void testExactly() {
        assertTrue(Mask.of(5).is().exactly(5));
        assertFalse(Mask.of(5, 6).is().exactly(5));
        assertTrue(Mask.of(5, 6).is().exactly(5, 6));
        assertTrue(Mask.of(5, 6).is().exactly(6, 5, 5));
        assertFalse(Mask.of(5, 6).is().exactly(5, 6, 7));

        assertTrue(Mask.of(5).is().exactly(Layer.UI));
        assertTrue(Mask.of(4, 5).is().exactly(Layer.WATER, Layer.UI));
        assertTrue(Mask.of(4, 5).is().exactly(Mask.of(4), Mask.of(5)));
        assertFalse(Mask.of(4, 5).is().exactly(Mask.of(4)));

        assertTrue(Mask.empty().is().exactly(new int[0]));
        assertFalse(Mask.of(5).is().exactly(new int[0]));
    }

    @Test
    void testAnyComparesEachCandidateOnItsOwn() {
        assertFalse(Mask.of(5, 6).is().any(5, 7));
        assertTrue(Mask.of(5).is().any(5, 7));
        assertTrue(Mask.of(7).is().any(5, 7));
        assertFalse(Mask.of(5).is().any(new int[0]));

        assertFalse(Mask.of(4, 5).is().any(Layer.WATER, Layer.UI));
        assertTrue(Mask.of(4).is().any(Layer.WATER, Layer.UI));

        assertTrue(Mask.of(4, 5).is().any(Mask.of(4), Mask.of(4, 5)));
        assertFalse(Mask.of(4, 5).is().any(Mask.of(4), Mask.of(4, 5, 6)));
        assertTrue(Mask.empty().is().any(Mask.of(1), Mask.empty()));
    }

    @Test
    void testNotIsNegationOfExactly() {
        assertFalse(Mask.of(5).is().not(5));
        assertTrue(Mask.of(5, 6).is().not(5));
        assertFalse(Mask.of(5, 6).is().not(Layer.UI, Layer.L6));
        assertTrue(Mask.of(5, 6).is().not(Mask.of(5)));
    }

    @Test
    void testNoneIsNegationOfAny() {
        assertTrue(Mask.of(5, 6).is().none(5, 7));
        assertFalse(Mask.of(5).is().none(5, 7));
        assertTrue(Mask.of(5).is().none(new int[0]));
        assertTrue(Mask.of(4, 5).is().none(Layer.WATER, Layer.UI));
        assertFalse(Mask.of(4, 5).is().none(Mask.of(4, 5)));
    }

    @Test
    void testShortcutsAgreeWithQuery() {
        Mask mask = Mask.of(2, 9);
        assertEquals(mask.is().exactly(2, 9), mask.is(2, 9));
        assertEquals(mask.is().exactly(Layer.IGNORE_RAYCAST), mask.is(Layer.IGNORE_RAYCAST));
        assertEquals(mask.is().not(2), mask.isNot(2));
    }

    @Test
    void testOutOfRangeCandidates() {
        assertThrows(LayerOutOfRangeException.class, () -> Mask.of(5).is().any(5, 32));
        assertThrows(LayerOutOfRangeException.class, () -> Mask.of(5).is().exactly(-1));
        assertThrows(LayerOutOfRangeException.class, () -> Mask.of(5).is().none(40));
    }
}
