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

/**
 * Reduces the values of one data column inside one cell to a single number.
 */
public interface Aggregation {

    /**
     * Appended to the data column name, {@code <column>_<suffix>}, to form the output column.
     */
    String suffix();

    /**
     * @param values at least one value
     * @return the aggregate, or null if it is undefined for these values
     */
    Double apply(double[] values);
}
