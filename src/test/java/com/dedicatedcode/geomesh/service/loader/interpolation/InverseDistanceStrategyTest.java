package com.dedicatedcode.geomesh.service.loader.interpolation;

import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.model.TemporalKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InverseDistanceStrategyTest {

    private static RawRecord sample(double lat, double lon, Map<String, Double> values) {
        return new RawRecord(lat, lon, TemporalKey.NONE, values);
    }

    @Test
    void testEquidistantSamplesAreAveraged() {
        SampleIndex samples = new SampleIndex(List.of(
                sample(0, 0, Map.of("v", 0.0)),
                sample(0, 2, Map.of("v", 10.0))));
        Map<String, Double> estimate = new InverseDistanceStrategy(2, 2).estimate(samples, 0, 1, List.of("v"));
        assertEquals(5.0, estimate.get("v"), 1e-9);
    }

    @Test
    void testCloserSampleWeighsMore() {
        SampleIndex samples = new SampleIndex(List.of(
                sample(0, 0, Map.of("v", 0.0)),
                sample(0, 3, Map.of("v", 10.0))));
        // d = 1 and d = 2 with power 2: weights 1 and 0.25
        Map<String, Double> estimate = new InverseDistanceStrategy(2, 2).estimate(samples, 0, 1, List.of("v"));
        assertEquals(2.0, estimate.get("v"), 1e-9);
    }

    @Test
    void testExactHitReturnsSampleValue() {
        SampleIndex samples = new SampleIndex(List.of(
                sample(1, 1, Map.of("v", 7.0)),
                sample(0, 0, Map.of("v", 100.0))));
        Map<String, Double> estimate = new InverseDistanceStrategy(2, 2).estimate(samples, 1, 1, List.of("v"));
        assertEquals(7.0, estimate.get("v"));
    }

    @Test
    void testNeighbourhoodIsWidenedForSparseColumn() {
        SampleIndex samples = new SampleIndex(List.of(
                sample(0, 0.1, Map.of("a", 1.0)),
                sample(0, 0.2, Map.of("a", 2.0)),
                sample(0, 5.0, Map.of("a", 3.0, "b", 9.0))));
        Map<String, Double> estimate = new InverseDistanceStrategy(1, 2).estimate(samples, 0, 0, List.of("a", "b"));
        assertTrue(estimate.containsKey("a"));
        assertEquals(9.0, estimate.get("b"), 1e-9);
    }

    @Test
    void testColumnWithoutSamplesIsAbsent() {
        SampleIndex samples = new SampleIndex(List.of(sample(0, 0, Map.of("a", 1.0))));
        Map<String, Double> estimate = new InverseDistanceStrategy(3, 2).estimate(samples, 1, 1, List.of("a", "b"));
        assertEquals(1.0, estimate.get("a"), 1e-9);
        assertFalse(estimate.containsKey("b"));
    }

    @Test
    void testNearestTakesClosestSampleWithValue() {
        SampleIndex samples = new SampleIndex(List.of(
                sample(0, 0.1, Map.of("a", 1.0)),
                sample(0, 0.5, Map.of("a", 2.0, "b", 5.0))));
        Map<String, Double> estimate = new NearestNeighbourStrategy(1).estimate(samples, 0, 0, List.of("a", "b"));
        assertEquals(1.0, estimate.get("a"));
        assertEquals(5.0, estimate.get("b"));
    }

    @Test
    void testEmptyIndexHasNoNeighbours() {
        SampleIndex samples = new SampleIndex(List.of());
        assertTrue(samples.nearest(0, 0, 3).isEmpty());
        assertTrue(new InverseDistanceStrategy(3, 2).estimate(samples, 0, 0, List.of("a")).isEmpty());
    }
}
