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
import com.dedicatedcode.geomesh.exception.MissingTemporalKeyException;

/**
 * Year, month and day of a row. Components the dataset interval does not carry are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemporalKey(Integer year, Integer month, Integer day) {

    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";

    public static final TemporalKey NONE = new TemporalKey(null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return year == null && month == null && day == null;
    }

    /**
     * Builds the key a query filters on. Every component the interval carries must be present;
     * components the interval does not carry are dropped.
     *
     * @throws MissingTemporalKeyException if a required component is missing
     */
    public static TemporalKey forQuery(Interval interval, Integer year, Integer month, Integer day) {
        if (interval.hasYear() && year == null) {
            throw new MissingTemporalKeyException("Dataset interval " + interval + " requires a year");
        }
        if (interval.hasMonth() && month == null) {
            throw new MissingTemporalKeyException("Dataset interval " + interval + " requires a month");
        }
        if (interval.hasDay() && day == null) {
            throw new MissingTemporalKeyException("Dataset interval " + interval + " requires a day");
        }
        return new TemporalKey(
                interval.hasYear() ? year : null,
                interval.hasMonth() ? month : null,
                interval.hasDay() ? day : null);
    }

    /**
     * Exact match on every component this key carries.
     */
    public boolean matches(TemporalKey stored) {
        TemporalKey other = stored == null ? NONE : stored;
        return (year == null || year.equals(other.year))
                && (month == null || month.equals(other.month))
                && (day == null || day.equals(other.day));
    }
}
