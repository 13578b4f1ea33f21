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

package com.dedicatedcode.geomesh.service.query;

import com.dedicatedcode.geomesh.dto.CellDataRow;
import com.dedicatedcode.geomesh.dto.PointDataRow;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.service.GridIndex;

import java.util.LinkedHashMap;
import java.util.Map;

final class QueryRows {

    private QueryRows() {
    }

    static CellDataRow toCellRow(GridIndex gridIndex, IndexedRow row) {
        CellDataRow result = new CellDataRow();
        result.setCell(gridIndex.toString(row.cell()));
        result.setLatitude(row.latitude());
        result.setLongitude(row.longitude());
        result.setYear(row.temporalKey().year());
        result.setMonth(row.temporalKey().month());
        result.setDay(row.temporalKey().day());
        result.setValues(new LinkedHashMap<>(row.values()));
        return result;
    }

    static PointDataRow toPointRow(GridIndex gridIndex, IndexedRow row) {
        PointDataRow result = new PointDataRow();
        result.setLatitude(row.latitude());
        result.setLongitude(row.longitude());
        result.setYear(row.temporalKey().year());
        result.setMonth(row.temporalKey().month());
        result.setDay(row.temporalKey().day());
        result.setValues(new LinkedHashMap<>(row.values()));
        Map<String, String> cells = new LinkedHashMap<>();
        if (row.cells() != null) {
            for (int resolution = 0; resolution < row.cells().size(); resolution++) {
                cells.put("res" + resolution, gridIndex.toString(row.cells().get(resolution)));
            }
        }
        result.setCells(cells);
        return result;
    }
}
