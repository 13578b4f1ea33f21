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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * How often a dataset carries values. The interval decides which temporal key columns
 * (year, month, day) a row has and a query must supply.
 */
public enum Interval {
    ONE_TIME("one_time", List.of()),
    YEARLY("yearly", List.of(TemporalKey.YEAR)),
    MONTHLY("monthly", List.of(TemporalKey.YEAR, TemporalKey.MONTH)),
    DAILY("daily", List.of(TemporalKey.YEAR, TemporalKey.MONTH, TemporalKey.DAY));

    private final String value;
    private final List<String> keyColumns;

    Interval(String value, List<String> keyColumns) {
        this.value = value;
        this.keyColumns = keyColumns;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    public boolean hasMonth() {
        return keyColumns.contains(TemporalKey.MONTH);
    }

    public boolean hasDay() {
        return keyColumns.contains(TemporalKey.DAY);
    }

    public boolean hasYear() {
        return keyColumns.contains(TemporalKey.YEAR);
    }

    /**
     * Derives the interval from the key columns of a dataset. Columns other than
     * year, month and day are ignored.
     */
    public static Interval fromKeyColumns(Collection<String> columns) {
        boolean year = columns.contains(TemporalKey.YEAR);
        boolean month = columns.contains(TemporalKey.MONTH);
        boolean day = columns.contains(TemporalKey.DAY);
        if (year && month && day) {
            return DAILY;
        }
        if (year && month) {
            return MONTHLY;
        }
        if (year) {
            return YEARLY;
        }
        return ONE_TIME;
    }

    public static Optional<Interval> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(i -> i.value.equals(normalized)).findFirst();
    }

    @JsonCreator
    public static Interval parse(String value) {
        return fromValue(value).orElseThrow(() -> new InvalidArgumentException(
                "Invalid interval: " + value + ". Valid intervals are: one_time, yearly, monthly, daily"));
    }

    @Override
    public String toString() {
        return value;
    }
}
