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

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.IndexedRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Adds a column holding the same value in every row. The column type follows the configured value.
 */
public class AddConstantColumnStep implements PostprocessingStep {

    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final String columnName;
    private final Object columnValue;
    private final ColumnType columnType;

    public AddConstantColumnStep(String columnName, Object columnValue) {
        if (columnName == null || !COLUMN_NAME.matcher(columnName).matches()) {
            throw new ConfigurationException("add_constant_column column_name [" + columnName + "] must contain only '_' and alphanumeric characters");
        }
        if (columnValue == null) {
            throw new ConfigurationException("Mandatory parameter add_constant_column.column_value is missing");
        }
        this.columnName = columnName;
        if (columnValue instanceof Integer || columnValue instanceof Long || columnValue instanceof Short) {
            this.columnValue = ((Number) columnValue).longValue();
            this.columnType = ColumnType.BIGINT;
        } else if (columnValue instanceof Number number) {
            this.columnValue = number.doubleValue();
            this.columnType = ColumnType.DOUBLE;
        } else if (columnValue instanceof Boolean) {
            this.columnValue = columnValue;
            this.columnType = ColumnType.BOOLEAN;
        } else {
            this.columnValue = columnValue.toString();
            this.columnType = ColumnType.VARCHAR;
        }
    }

    public String getColumnName() {
        return columnName;
    }

    public ColumnType getColumnType() {
        return columnType;
    }

    @Override
    public List<IndexedRow> run(List<IndexedRow> rows) {
        List<IndexedRow> result = new ArrayList<>(rows.size());
        for (IndexedRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<>(row.values());
            values.put(columnName, columnValue);
            result.add(row.withValues(values));
        }
        return result;
    }

    @Override
    public Map<String, ColumnType> transformSchema(Map<String, ColumnType> valueColumns) {
        Map<String, ColumnType> result = new LinkedHashMap<>(valueColumns);
        result.put(columnName, columnType);
        return result;
    }
}
