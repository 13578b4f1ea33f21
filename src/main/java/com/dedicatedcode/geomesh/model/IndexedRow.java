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

package com.dedicatedcode.geomesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A row as persisted in a dataset store.
 * <p>
 * Cell rows ({@code h3} and {@code h3_index}) carry the cell id and its centroid. Point rows carry the raw
 * coordinates and the cell containing the point at every resolution from 0 up to the dataset maximum.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexedRow(Long cell,
                         double latitude,
                         double longitude,
                         TemporalKey temporalKey,
                         Map<String, Object> values,
                         List<Long> cells) {

    public IndexedRow {
        temporalKey = temporalKey == null ? TemporalKey.NONE : temporalKey;
        values = values == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        cells = cells == null ? null : List.copyOf(cells);
    }

    public static IndexedRow forCell(long cell, double latitude, double longitude, TemporalKey temporalKey, Map<String, Object> values) {
        return new IndexedRow(cell, latitude, longitude, temporalKey, values, null);
    }

    public static IndexedRow forPoint(double latitude, double longitude, TemporalKey temporalKey, Map<String, Object> values, List<Long> cells) {
        return new IndexedRow(null, latitude, longitude, temporalKey, values, cells);
    }

    public IndexedRow withValues(Map<String, Object> newValues) {
        return new IndexedRow(cell, latitude, longitude, temporalKey, newValues, cells);
    }

    /**
     * Containing cell of a point row at the given resolution, or null if the row does not carry it.
     */
    public Long cellAt(int resolution) {
        if (cells == null || resolution < 0 || resolution >= cells.size()) {
            return null;
        }
        return cells.get(resolution);
    }

    @JsonIgnore
    public boolean isPointRow() {
        return cell == null;
    }

    public Double numericValue(String column) {
        Object value = values.get(column);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }
}
