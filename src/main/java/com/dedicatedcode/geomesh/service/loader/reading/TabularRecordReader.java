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

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.model.TemporalKey;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared column handling of the file readers.
 */
abstract class TabularRecordReader implements RawRecordReader {

    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";

    protected void checkColumns(ReadingSpec spec, Collection<String> available) {
        if (!available.contains(LATITUDE)) {
            throw new ConfigurationException("Input " + spec.filePath() + " has no column " + LATITUDE + ". Columns were: " + available);
        }
        if (!available.contains(LONGITUDE)) {
            throw new ConfigurationException("Input " + spec.filePath() + " has no column " + LONGITUDE + ". Columns were: " + available);
        }
        for (String column : spec.dataColumns()) {
            if (!available.contains(column)) {
                throw new ConfigurationException("Data column " + column + " does not exist in " + spec.filePath());
            }
        }
        for (String column : spec.temporalColumns()) {
            if (!available.contains(column)) {
                throw new ConfigurationException("Time column " + column + " does not exist in " + spec.filePath());
            }
        }
    }

    /**
     * @param lookup value of a column in the current row, null or an empty string if missing
     */
    protected RawRecord toRecord(ReadingSpec spec, long rowNumber, Function<String, Object> lookup) {
        Double latitude = number(lookup.apply(LATITUDE), LATITUDE, rowNumber);
        Double longitude = number(lookup.apply(LONGITUDE), LONGITUDE, rowNumber);
        if (latitude == null || longitude == null) {
            throw new InvalidArgumentException("Row " + rowNumber + " has no coordinates");
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (String column : spec.dataColumns()) {
            Double value = number(lookup.apply(column), column, rowNumber);
            if (value != null && !value.isNaN()) {
                values.put(column, value);
            }
        }
        TemporalKey key = new TemporalKey(
                component(spec.yearColumn(), lookup, rowNumber),
                component(spec.monthColumn(), lookup, rowNumber),
                component(spec.dayColumn(), lookup, rowNumber));
        return new RawRecord(latitude, longitude, key, values);
    }

    private Integer component(String column, Function<String, Object> lookup, long rowNumber) {
        if (column == null) {
            return null;
        }
        Double value = number(lookup.apply(column), column, rowNumber);
        if (value == null) {
            throw new InvalidArgumentException("Row " + rowNumber + " has no value for time column " + column);
        }
        if (value != Math.rint(value)) {
            throw new InvalidArgumentException("Row " + rowNumber + " has a non integer value " + value + " in time column " + column);
        }
        return value.intValue();
    }

    private Double number(Object value, String column, long rowNumber) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1.0 : 0.0;
        }
        String text = value.toString().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("nan") || text.equalsIgnoreCase("null")) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Row " + rowNumber + ": value '" + text + "' of column " + column + " is not numeric");
        }
    }
}
