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

package com.dedicatedcode.geomesh.service.loader.reading;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What to read and how to map it onto {@link com.dedicatedcode.geomesh.model.RawRecord}s.
 *
 * @param columns     column names in file order mapped to their type, needed for CSV files without header row
 * @param dataColumns columns carrying the measured values
 * @param yearColumn  source column of the year, or null
 */
public record ReadingSpec(String type,
                          Path filePath,
                          boolean hasHeaderRow,
                          Map<String, String> columns,
                          List<String> dataColumns,
                          String yearColumn,
                          String monthColumn,
                          String dayColumn) {

    public ReadingSpec {
        columns = columns == null ? Map.of() : columns;
        dataColumns = List.copyOf(dataColumns);
    }

    /**
     * Source columns of the temporal key, in year, month, day order.
     */
    public List<String> temporalColumns() {
        List<String> result = new ArrayList<>();
        if (yearColumn != null) {
            result.add(yearColumn);
        }
        if (monthColumn != null) {
            result.add(monthColumn);
        }
        if (dayColumn != null) {
            result.add(dayColumn);
        }
        return result;
    }
}
