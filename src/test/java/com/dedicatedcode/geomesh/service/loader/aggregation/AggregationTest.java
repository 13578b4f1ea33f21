package com.dedicatedcode.geomesh.service.loader.aggregation;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregationTest {

    private final double[] values = {4.0, 1.0, 3.0, 2.0};

    @Test
    void testMinMaxMean() {
        assertEquals(1.0, new MinAggregation().apply(values));
        assertEquals(4.0, new MaxAggregation().apply(values));
        assertEquals(2.5, new MeanAggregation().apply(values));
    }

    @Test
    void testMedianOfEvenCountIsMeanOfMiddleValues() {
        assertEquals(2.5, new MedianAggregation().apply(values));
        assertEquals(3.0, new MedianAggregation().apply(new double[]{5.0, 3.0, 1.0}));
    }

    @Test
    void testMedianDoesNotReorderInput() {
        new MedianAggregation().apply(values);
        assertEquals(4.0, values[0]);
    }

    @Test
    void testCountWithinBoundsIsInclusive() {
        assertEquals(3.0, new CountWithinBoundsAggregation(2.0, 4.0).apply(values));
        assertEquals(2.0, new CountWithinBoundsAggregation(null, 2.0).apply(values));
        assertEquals(1.0, new CountWithinBoundsAggregation(4.0, null).apply(values));
    }

    @Test
    void testCountWithinBoundsSuffix() {
        assertEquals("within_bounds_0_10", new CountWithinBoundsAggregation(0.0, 10.0).suffix());
        assertEquals("within_bounds_none_2_5", new CountWithinBoundsAggregation(null, 2.5).suffix());
        assertEquals("within_bounds_m1_none", new CountWithinBoundsAggregation(-1.0, null).suffix());
    }

    @Test
    void testCountWithinBoundsNeedsValidBounds() {
        assertThrows(ConfigurationException.class, () -> new CountWithinBoundsAggregation(null, null));
        assertThrows(ConfigurationException.class, () -> new CountWithinBoundsAggregation(5.0, 1.0));
    }
}
