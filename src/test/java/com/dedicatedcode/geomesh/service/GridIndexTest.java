package com.dedicatedcode.geomesh.service;

import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.uber.h3core.util.LatLng;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridIndexTest {

    private final GridIndex gridIndex = new GridIndex();

    @Test
    void testCellForPointIsDeterministic() {
        long cell = gridIndex.cellForPoint(52.52, 13.405, 7);
        assertEquals(cell, gridIndex.cellForPoint(52.52, 13.405, 7));
        assertEquals(7, gridIndex.resolution(cell));
    }

    @Test
    void testCentroidLiesInItsOwnCell() {
        long cell = gridIndex.cellForPoint(52.52, 13.405, 5);
        LatLng centroid = gridIndex.centroid(cell);
        assertEquals(cell, gridIndex.cellForPoint(centroid.lat, centroid.lng, 5));
    }

    @Test
    void testParentAndChildren() {
        long cell = gridIndex.cellForPoint(52.52, 13.405, 6);
        long parent = gridIndex.parent(cell);
        assertEquals(5, gridIndex.resolution(parent));
        assertTrue(gridIndex.children(parent).contains(cell));
        assertEquals(gridIndex.parent(cell, 3), gridIndex.parent(gridIndex.parent(gridIndex.parent(cell))));
    }

    @Test
    void testParentOfResolutionZeroFails() {
        long cell = gridIndex.cellForPoint(0, 0, 0);
        assertThrows(InvalidArgumentException.class, () -> gridIndex.parent(cell));
    }

    @Test
    void testChildrenOfFinestResolutionAreEmpty() {
        long cell = gridIndex.cellForPoint(0, 0, 15);
        assertTrue(gridIndex.children(cell).isEmpty());
    }

    @Test
    void testAllCellsCountsMatchH3() {
        assertEquals(122, gridIndex.allCells(0).size());
        assertEquals(842, gridIndex.allCells(1).size());
        assertEquals(gridIndex.numCells(2), gridIndex.allCells(2).size());
    }

    @Test
    void testCellsWithinRadiusMatchesBruteForce() {
        double lat = 48.1;
        double lon = 11.6;
        double radius = 300;
        List<Long> expected = new ArrayList<>();
        for (long cell : gridIndex.allCells(3)) {
            LatLng centroid = gridIndex.centroid(cell);
            if (gridIndex.distance(lat, lon, centroid.lat, centroid.lng) <= radius) {
                expected.add(cell);
            }
        }
        assertFalse(expected.isEmpty());
        assertEquals(expected, gridIndex.cellsWithinRadius(lat, lon, radius, 3));
    }

    @Test
    void testZeroRadiusOnlyReturnsCentroidHits() {
        long cell = gridIndex.cellForPoint(10, 10, 4);
        LatLng centroid = gridIndex.centroid(cell);
        assertEquals(List.of(cell), gridIndex.cellsWithinRadius(centroid.lat, centroid.lng, 0, 4));
    }

    @Test
    void testHalfCircumferenceReturnsEveryCell() {
        List<Long> all = gridIndex.allCells(1);
        assertEquals(all, gridIndex.cellsWithinRadius(0, 0, GridIndex.HALF_CIRCUMFERENCE_KM, 1));
    }

    @Test
    void testDistanceBetweenCells() {
        long a = gridIndex.cellForPoint(52.52, 13.405, 9);
        long b = gridIndex.cellForPoint(48.137, 11.575, 9);
        assertEquals(504, gridIndex.distance(a, b), 5);
        assertEquals(0, gridIndex.distance(a, a), 1e-9);
    }

    @Test
    void testStringConversion() {
        long cell = gridIndex.cellForPoint(60.17, 24.94, 8);
        String text = gridIndex.toString(cell);
        assertEquals(cell, gridIndex.fromString(text));
    }

    @Test
    void testInvalidCellStringIsRejected() {
        assertThrows(InvalidArgumentException.class, () -> gridIndex.fromString("not-a-cell"));
        assertThrows(InvalidArgumentException.class, () -> gridIndex.fromString("0"));
        assertThrows(InvalidArgumentException.class, () -> gridIndex.fromString(""));
    }

    @Test
    void testInvalidCoordinatesAreRejected() {
        assertThrows(InvalidArgumentException.class, () -> gridIndex.cellForPoint(91, 0, 3));
        assertThrows(InvalidArgumentException.class, () -> gridIndex.cellForPoint(0, -181, 3));
        assertThrows(InvalidArgumentException.class, () -> gridIndex.cellForPoint(0, 0, 16));
    }
}
