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

package com.dedicatedcode.geomesh.store;

import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.Interval;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema record kept in every dataset store. Insert runs are checked against it.
 *
 * @param maxResolution finest resolution the dataset holds; for {@code h3_index} datasets the single
 *                      resolution the rows were aggregated to
 */
public record DatasetSchema(String datasetName,
                            DatasetType datasetType,
                            int maxResolution,
                            Map<String, ColumnType> valueColumns,
                            Map<String, ColumnType> keyColumns) {

    public DatasetSchema {
        valueColumns = Collections.unmodifiableMap(new LinkedHashMap<>(valueColumns));
        keyColumns = keyColumns == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(keyColumns));
    }

    @JsonIgnore
    public Interval interval() {
        return Interval.fromKeyColumns(keyColumns.keySet());
    }

    public boolean sameColumns(DatasetSchema other) {
        return datasetType == other.datasetType
                && valueColumns.equals(other.valueColumns)
                && keyColumns.equals(other.keyColumns);
    }
}
