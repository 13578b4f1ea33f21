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

package com.dedicatedcode.geomesh.service.loader.postprocessing;

import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.IndexedRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multiplies every numeric value by a constant. Non-numeric values pass through untouched.
 */
public class MultiplyValueStep implements PostprocessingStep {

    private final double multiplyBy;

    public MultiplyValueStep(double multiplyBy) {
        this.multiplyBy = multiplyBy;
    }

    @Override
    public List<IndexedRow> run(List<IndexedRow> rows) {
        List<IndexedRow> result = new ArrayList<>(rows.size());
        for (IndexedRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            row.values().forEach((column, value) -> {
                if (value instanceof Number number) {
                    values.put(column, number.doubleValue() * multiplyBy);
                } else {
                    values.put(column, value);
                }
            });
            result.add(row.withValues(values));
        }
        return result;
    }

    @Override
    public Map<String, ColumnType> transformSchema(Map<String, ColumnType> valueColumns) {
        Map<String, ColumnType> result = new LinkedHashMap<>();
        valueColumns.forEach((column, type) -> result.put(column, type.isNumeric() ? ColumnType.DOUBLE : type));
        return result;
    }
}
