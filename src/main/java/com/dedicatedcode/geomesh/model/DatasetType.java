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
import java.util.Optional;

/**
 * Kind of a stored dataset.
 * <ul>
 *     <li>{@code h3}: continuous values interpolated onto every cell of every resolution up to the maximum</li>
 *     <li>{@code point}: raw point samples, each carrying its containing cell per resolution</li>
 *     <li>{@code h3_index}: aggregated values at a single resolution</li>
 * </ul>
 */
public enum DatasetType {
    H3("h3"),
    POINT("point"),
    H3_INDEX("h3_index");

    private final String value;

    DatasetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isCellBased() {
        return this != POINT;
    }

    public static Optional<DatasetType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(t -> t.value.equals(normalized)).findFirst();
    }

    @JsonCreator
    public static DatasetType parse(String value) {
        return fromValue(value).orElseThrow(() -> new InvalidArgumentException(
                "Invalid dataset type: " + value + ". Valid dataset types are: h3, point, h3_index"));
    }

    @Override
    public String toString() {
        return value;
    }
}
