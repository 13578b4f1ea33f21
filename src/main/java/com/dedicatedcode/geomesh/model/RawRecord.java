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

import java.util.Map;

/**
 * One input sample as produced by the readers. Missing values are absent from {@code values}.
 */
public record RawRecord(double latitude, double longitude, TemporalKey temporalKey, Map<String, Double> values) {

    public RawRecord {
        temporalKey = temporalKey == null ? TemporalKey.NONE : temporalKey;
        values = Map.copyOf(values);
    }
}
