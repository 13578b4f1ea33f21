/*
 *  This file is part of geomesh.
 *
 *  Geomesh is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Geomesh is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Geomesh. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.geomesh.service;

import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import com.uber.h3core.util.LatLng;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.*;

/**
 * H3 addressing for the loading pipeline and the query engine.
 */
@Service
public class GridIndex {

    public static final int MIN_RESOLUTION = 0;
    public static final int MAX_RESOLUTION = 15;

    /**
     * Distances are measured on the sphere H3 uses, the largest possible one is half its circumference.
     */
    public static final double EARTH_RADIUS_KM = 6371.007180918475;
    public static final double HALF_CIRCUMFERENCE_KM = Math.PI * EARTH_RADIUS_KM;

    // smallest edge of a resolution relative to its average edge, rounded down
    private static final double MIN_EDGE_FACTOR = 0.25;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    public long cellForPoint(double lat, double lon, int resolution) {
        validateCoordinates(lat, lon);
        validateResolution(resolution);
        return h3.latLngToCell(lat, lon, resolution);
    }

    public LatLng centroid(long cell) {
        validateCell(cell);
        return h3.cellToLatLng(cell);
    }

    /**
     * Boundary vertices of the cell in counter-clockwise order. The ring is not closed.
     */
    public List<LatLng> boundary(long cell) {
        validateCell(cell);
        return h3.cellToBoundary(cell);
    }

    public long parent(long cell) {
        int resolution = resolution(cell);
        if (resolution == MIN_RESOLUTION) {
            throw new InvalidArgumentException("Cell " + toString(cell) + " is at resolution 0 and has no parent");
        }
        return h3.cellToParent(cell, resolution - 1);
    }

    public long parent(long cell, int resolution) {
        validateResolution(resolution);
        if (resolution > resolution(cell)) {
            throw new InvalidArgumentException("Resolution " + resolution + " is finer than the resolution of cell " + toString(cell));
        }
        return h3.cellToParent(cell, resolution);
    }

    public List<Long> children(long cell) {
        int resolution = resolution(cell);
        if (resolution == MAX_RESOLUTION) {
            return Collections.emptyList();
        }
        return h3.cellToChildren(cell, resolution + 1);
    }

    /**
     * Great-circle distance between two cell centroids in kilometres.
     */
    public double distance(long a, long b) {
        return h3.greatCircleDistance(centroid(a), centroid(b), LengthUnit.km);
    }

    public double distance(double lat1, double lon1, double lat2, double lon2) {
        return h3.greatCircleDistance(new LatLng(lat1, lon1), new LatLng(lat2, lon2), LengthUnit.km);
    }

    /**
     * All cells at {@code resolution} whose centroid lies within {@code radiusKm} of the given point,
     * boundary inclusive. The candidate disk is sized from the smallest edge length a resolution can have,
     * so no qualifying cell can lie outside of it.
     */
    public List<Long> cellsWithinRadius(double lat, double lon, double radiusKm, int resolution) {
        validateCoordinates(lat, lon);
        validateResolution(resolution);
        if (radiusKm < 0 || Double.isNaN(radiusKm)) {
            throw new InvalidArgumentException("Radius must not be negative: " + radiusKm);
        }
        if (radiusKm >= HALF_CIRCUMFERENCE_KM) {
            return allCells(resolution);
        }

        double averageEdge = h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.km);
        double minSpacing = 1.5 * MIN_EDGE_FACTOR * averageEdge;
        long k = (long) Math.ceil((radiusKm + 2 * averageEdge) / minSpacing) + 1;

        Collection<Long> candidates;
        if (diskSize(k) >= h3.getNumCells(resolution)) {
            candidates = allCells(resolution);
        } else {
            long origin = h3.latLngToCell(lat, lon, resolution);
            candidates = h3.gridDisk(origin, (int) k);
        }

        LatLng center = new LatLng(lat, lon);
        List<Long> result = new ArrayList<>();
        for (long candidate : candidates) {
            if (h3.greatCircleDistance(center, h3.cellToLatLng(candidate), LengthUnit.km) <= radiusKm) {
                result.add(candidate);
            }
        }
        Collections.sort(result);
        return result;
    }

    /**
     * Every cell of a resolution, sorted by id.
     */
    public List<Long> allCells(int resolution) {
        validateResolution(resolution);
        List<Long> cells = new ArrayList<>();
        for (long base : h3.getRes0Cells()) {
            if (resolution == MIN_RESOLUTION) {
                cells.add(base);
            } else {
                cells.addAll(h3.cellToChildren(base, resolution));
            }
        }
        Collections.sort(cells);
        return cells;
    }

    public long numCells(int resolution) {
        validateResolution(resolution);
        return h3.getNumCells(resolution);
    }

    public double averageEdgeLengthKm(int resolution) {
        validateResolution(resolution);
        return h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.km);
    }

    /**
     * Cells whose centroid falls into the polygon described by {@code ring} (lat/lng vertices).
     */
    public List<Long> polygonToCells(List<LatLng> ring, int resolution) {
        validateResolution(resolution);
        return h3.polygonToCells(ring, Collections.emptyList(), resolution);
    }

    public int resolution(long cell) {
        validateCell(cell);
        return h3.getResolution(cell);
    }

    public String toString(long cell) {
        return h3.h3ToString(cell);
    }

    public long fromString(String cell) {
        if (cell == null || cell.isBlank()) {
            throw new InvalidArgumentException("Cell id must not be empty");
        }
        long id;
        try {
            id = h3.stringToH3(cell.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid cell id: " + cell);
        }
        if (!h3.isValidCell(id)) {
            throw new InvalidArgumentException("Invalid cell id: " + cell);
        }
        return id;
    }

    public void validateCoordinates(double lat, double lon) {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new InvalidArgumentException("Invalid latitude " + lat + ". Must be between -90 and 90.");
        }
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw new InvalidArgumentException("Invalid longitude " + lon + ". Must be between -180 and 180.");
        }
    }

    public void validateResolution(int resolution) {
        if (resolution < MIN_RESOLUTION || resolution > MAX_RESOLUTION) {
            throw new InvalidArgumentException("Invalid resolution " + resolution + ". Must be between 0 and 15.");
        }
    }

    private void validateCell(long cell) {
        if (!h3.isValidCell(cell)) {
            throw new InvalidArgumentException("Invalid cell id: " + Long.toHexString(cell));
        }
    }

    private static long diskSize(long k) {
        return 3 * k * (k + 1) + 1;
    }
}
