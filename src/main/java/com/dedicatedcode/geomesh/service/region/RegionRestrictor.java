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

package com.dedicatedcode.geomesh.service.region;

import com.dedicatedcode.geomesh.exception.RegionNotFoundException;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.uber.h3core.util.LatLng;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether points and cells fall into a set of polygons, optionally narrowed to the polygons
 * of one named region. Used while loading to restrict interpolation targets and at query time to
 * answer region queries, so both sides agree on what "inside" means.
 * <p>
 * A point is inside if it lies inside or on the boundary of a selected polygon. A cell is inside if its
 * centroid or any of its boundary vertices is inside, or if any polygon vertex lies within the cell.
 * The last rule keeps regions smaller than a cell from selecting nothing.
 */
public class RegionRestrictor {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();
    private static final double KM_PER_DEGREE = 111.32;

    private final GridIndex gridIndex;
    private final List<Region> selected;
    private final STRtree index = new STRtree();
    private final Envelope envelope = new Envelope();

    /**
     * @param regions    all polygons of the region file
     * @param regionName name of the region to narrow to, or null for all polygons
     * @throws RegionNotFoundException if {@code regionName} matches no polygon
     */
    public RegionRestrictor(GridIndex gridIndex, List<Region> regions, String regionName) {
        this.gridIndex = gridIndex;
        if (regionName == null || regionName.isBlank()) {
            this.selected = List.copyOf(regions);
        } else {
            this.selected = regions.stream().filter(r -> regionName.equals(r.name())).toList();
            if (selected.isEmpty()) {
                throw new RegionNotFoundException("Region '" + regionName + "' not found");
            }
        }
        for (Region region : selected) {
            index.insert(region.geometry().getEnvelopeInternal(), PreparedGeometryFactory.prepare(region.geometry()));
            envelope.expandToInclude(region.geometry().getEnvelopeInternal());
        }
        index.build();
    }

    public List<Region> getSelected() {
        return selected;
    }

    public boolean contains(double lat, double lon) {
        if (!envelope.covers(lon, lat)) {
            return false;
        }
        Point point = GEOMETRY_FACTORY.createPoint(new Coordinate(lon, lat));
        @SuppressWarnings("unchecked")
        List<PreparedGeometry> candidates = index.query(point.getEnvelopeInternal());
        for (PreparedGeometry candidate : candidates) {
            if (candidate.covers(point)) {
                return true;
            }
        }
        return false;
    }

    public boolean cellIntersects(long cell) {
        LatLng centroid = gridIndex.centroid(cell);
        if (contains(centroid.lat, centroid.lng)) {
            return true;
        }
        List<LatLng> boundary = gridIndex.boundary(cell);
        for (LatLng vertex : boundary) {
            if (contains(vertex.lat, vertex.lng)) {
                return true;
            }
        }
        return anyPolygonVertexInside(boundary);
    }

    /**
     * All cells of {@code resolution} passing {@link #cellIntersects(long)}, sorted by id.
     * Candidates are the cells with a centroid inside each polygon's bounding box widened by two edge lengths,
     * plus the cells containing a polygon vertex.
     */
    public List<Long> candidateCells(int resolution) {
        double bufferKm = 2 * gridIndex.averageEdgeLengthKm(resolution);
        Set<Long> candidates = new TreeSet<>();
        for (Region region : selected) {
            Envelope bounds = region.geometry().getEnvelopeInternal();
            double latBuffer = bufferKm / KM_PER_DEGREE;
            double maxAbsLat = Math.min(89.0, Math.max(Math.abs(bounds.getMinY()), Math.abs(bounds.getMaxY())) + latBuffer);
            double lonBuffer = bufferKm / (KM_PER_DEGREE * Math.cos(Math.toRadians(maxAbsLat)));

            double minLat = Math.max(-90, bounds.getMinY() - latBuffer);
            double maxLat = Math.min(90, bounds.getMaxY() + latBuffer);
            double minLon = Math.max(-180, bounds.getMinX() - lonBuffer);
            double maxLon = Math.min(180, bounds.getMaxX() + lonBuffer);

            // polygon fill needs edges shorter than 180 degrees
            for (double west = minLon; west < maxLon; west += 90) {
                double east = Math.min(maxLon, west + 90);
                List<LatLng> rectangle = List.of(
                        new LatLng(minLat, west),
                        new LatLng(minLat, east),
                        new LatLng(maxLat, east),
                        new LatLng(maxLat, west));
                candidates.addAll(gridIndex.polygonToCells(rectangle, resolution));
            }
            for (Coordinate vertex : region.geometry().getCoordinates()) {
                candidates.add(gridIndex.cellForPoint(vertex.y, vertex.x, resolution));
            }
        }
        List<Long> result = new ArrayList<>();
        for (long candidate : candidates) {
            if (cellIntersects(candidate)) {
                result.add(candidate);
            }
        }
        return result;
    }

    private boolean anyPolygonVertexInside(List<LatLng> boundary) {
        Coordinate[] ring = new Coordinate[boundary.size() + 1];
        Envelope cellEnvelope = new Envelope();
        for (int i = 0; i < boundary.size(); i++) {
            LatLng vertex = boundary.get(i);
            ring[i] = new Coordinate(vertex.lng, vertex.lat);
            cellEnvelope.expandToInclude(ring[i]);
        }
        ring[boundary.size()] = ring[0];
        if (cellEnvelope.getWidth() > 180) {
            // cell spans the antimeridian, its lon/lat ring is not a valid planar polygon
            return false;
        }
        if (!cellEnvelope.intersects(envelope)) {
            return false;
        }
        Polygon cellPolygon = GEOMETRY_FACTORY.createPolygon(ring);
        PreparedGeometry preparedCell = PreparedGeometryFactory.prepare(cellPolygon);
        for (Region region : selected) {
            Geometry geometry = region.geometry();
            if (!geometry.getEnvelopeInternal().intersects(cellEnvelope)) {
                continue;
            }
            for (Coordinate vertex : geometry.getCoordinates()) {
                if (cellEnvelope.covers(vertex) && preparedCell.covers(GEOMETRY_FACTORY.createPoint(vertex))) {
                    return true;
                }
            }
        }
        return false;
    }
}
