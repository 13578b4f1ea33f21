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

package com.dedicatedcode.geomesh.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.uber.h3core.util.LatLng;

import java.util.List;

/**
 * GeoJSON polygon of a single grid cell. Besides the standard {@code type} and {@code coordinates}
 * members it names the cell and its resolution, so map clients can label the outline.
 */
@JsonPropertyOrder({"type", "coordinates", "cell", "resolution"})
public class CellPolygon {

    public static final String TYPE = "Polygon";

    @JsonProperty("cell")
    private final String cell;

    @JsonProperty("resolution")
    private final int resolution;

    @JsonProperty("coordinates")
    private final double[][][] coordinates;

    private CellPolygon(String cell, int resolution, double[][][] coordinates) {
        this.cell = cell;
        this.resolution = resolution;
        this.coordinates = coordinates;
    }

    /**
     * Builds the exterior ring in [lon, lat] order and closes it by repeating the first vertex.
     */
    public static CellPolygon of(String cell, int resolution, List<LatLng> boundary) {
        double[][] ring = new double[boundary.size() + 1][];
        for (int i = 0; i < boundary.size(); i++) {
            ring[i] = new double[]{boundary.get(i).lng, boundary.get(i).lat};
        }
        ring[boundary.size()] = ring[0].clone();
        return new CellPolygon(cell, resolution, new double[][][]{ring});
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    public String getCell() {
        return cell;
    }

    public int getResolution() {
        return resolution;
    }

    public double[][][] getCoordinates() {
        return coordinates;
    }

    @JsonIgnore
    public double[][] getExteriorRing() {
        return coordinates[0];
    }
}
