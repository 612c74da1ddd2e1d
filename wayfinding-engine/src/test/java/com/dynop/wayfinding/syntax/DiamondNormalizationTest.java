package com.dynop.wayfinding.syntax;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DiamondNormalizationTest {

    @ParameterizedTest
    @ValueSource(ints = {4, 5, 6, 8, 10, 12, 14, 16})
    void tableAgreesWithClosedForm(int k) {
        assertEquals(DiamondNormalization.closedForm(k), DiamondNormalization.value(k), 1e-3);
    }

    @Test
    void switchesToClosedFormAboveTable() {
        int k = DiamondNormalization.TABLE_LIMIT + 1;
        assertEquals(DiamondNormalization.closedForm(k), DiamondNormalization.value(k), 0.0);
        assertTrue(DiamondNormalization.value(k) < DiamondNormalization.value(k - 1));
    }

    @Test
    void smallestTabulatedValue() {
        assertEquals(0.211, DiamondNormalization.value(3), 0.0);
    }

    @Test
    void rejectsComponentsBelowThree() {
        assertThrows(IllegalArgumentException.class, () -> DiamondNormalization.value(2));
    }
}
