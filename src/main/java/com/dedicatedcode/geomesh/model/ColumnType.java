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

import java.util.Map;

/**
 * Canonical column types of dataset schemas.
 */
public enum ColumnType {
    DOUBLE,
    FLOAT,
    INTEGER,
    BIGINT,
    VARCHAR,
    BOOLEAN;

    private static final Map<String, ColumnType> ALIASES = Map.ofEntries(
            Map.entry("DOUBLE", DOUBLE),
            Map.entry("FLOAT8", DOUBLE),
            Map.entry("NUMERIC", DOUBLE),
            Map.entry("DECIMAL", DOUBLE),
            Map.entry("FLOAT", FLOAT),
            Map.entry("FLOAT4", FLOAT),
            Map.entry("REAL", FLOAT),
            Map.entry("INTEGER", INTEGER),
            Map.entry("INT", INTEGER),
            Map.entry("INT4", INTEGER),
            Map.entry("SIGNED", INTEGER),
            Map.entry("BIGINT", BIGINT),
            Map.entry("INT8", BIGINT),
            Map.entry("LONG", BIGINT),
            Map.entry("VARCHAR", VARCHAR),
            Map.entry("STRING", VARCHAR),
            Map.entry("TEXT", VARCHAR),
            Map.entry("CHAR", VARCHAR),
            Map.entry("BPCHAR", VARCHAR),
            Map.entry("BOOLEAN", BOOLEAN),
            Map.entry("BOOL", BOOLEAN),
            Map.entry("LOGICAL", BOOLEAN));

    @JsonValue
    public String getValue() {
        return name();
    }

    public boolean isNumeric() {
        return this != VARCHAR && this != BOOLEAN;
    }

    @JsonCreator
    public static ColumnType parse(String value) {
        ColumnType type = value == null ? null : ALIASES.get(value.trim().toUpperCase());
        if (type == null) {
            throw new InvalidArgumentException("Unsupported column type: " + value);
        }
        return type;
    }
}
