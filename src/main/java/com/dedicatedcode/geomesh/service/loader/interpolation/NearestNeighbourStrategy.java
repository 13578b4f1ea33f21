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

package com.dedicatedcode.geomesh.service.loader.interpolation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Takes the value of the closest sample carrying the column.
 */
public class NearestNeighbourStrategy implements InterpolationStrategy {

    public static final String NAME = "nearest";

    private final int searchSize;

    public NearestNeighbourStrategy(int searchSize) {
        this.searchSize = Math.max(1, searchSize);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Double> estimate(SampleIndex samples, double latitude, double longitude, List<String> columns) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (int widening = 1; widening <= InverseDistanceStrategy.MAX_WIDENING; widening++) {
            int k = searchSize * widening;
            List<SampleIndex.Neighbour> neighbours = samples.nearest(latitude, longitude, k);
            for (String column : columns) {
                if (result.containsKey(column)) {
                    continue;
                }
                for (SampleIndex.Neighbour neighbour : neighbours) {
                    Double value = neighbour.sample().values().get(column);
                    if (value != null) {
                        result.put(column, value);
                        break;
                    }
                }
            }
            if (result.size() == columns.size() || neighbours.size() < k) {
                break;
            }
        }
        return result;
    }
}
