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

package com.dedicatedcode.geomesh.service.loader.aggregation;

import com.dedicatedcode.geomesh.exception.ConfigurationException;

/**
 * Number of values within {@code [min, max]}. Either bound may be left open.
 * <p>
 * The suffix encodes the bounds, e.g. {@code within_bounds_0_10} or {@code within_bounds_none_2_5}, with
 * {@code '.'} written as {@code '_'} and a leading minus as {@code 'm'} so the column name stays valid.
 */
public class CountWithinBoundsAggregation implements Aggregation {

    private final Double min;
    private final Double max;

    public CountWithinBoundsAggregation(Double min, Double max) {
        if (min == null && max == null) {
            throw new ConfigurationException("count_within_bounds needs at least one of min and max");
        }
        if (min != null && max != null && min > max) {
            throw new ConfigurationException("count_within_bounds min " + min + " is greater than max " + max);
        }
        this.min = min;
        this.max = max;
    }

    @Override
    public String suffix() {
        return "within_bounds_" + bound(min) + "_" + bound(max);
    }

    @Override
    public Double apply(double[] values) {
        int count = 0;
        for (double value : values) {
            if ((min == null || value >= min) && (max == null || value <= max)) {
                count++;
            }
        }
        return (double) count;
    }

    private static String bound(Double value) {
        if (value == null) {
            return "none";
        }
        String text = value == Math.rint(value) && !Double.isInfinite(value)
                ? Long.toString(value.longValue())
                : Double.toString(value);
        return text.replace('-', 'm').replace('.', '_');
    }
}
