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
 * Inverse distance weighting over the k nearest samples: {@code sum(v / d^p) / sum(1 / d^p)}.
 * <p>
 * Samples lacking a column do not take part in its estimate. If a column ends up without any usable sample,
 * the neighbourhood is widened to 2k, 3k and 4k samples before the column is given up.
 * A sample sitting exactly on the location is taken as is.
 */
public class InverseDistanceStrategy implements InterpolationStrategy {

    public static final String NAME = "inverse_distance";

    static final int MAX_WIDENING = 4;

    private final int numNeighbors;
    private final double power;

    public InverseDistanceStrategy(int numNeighbors, double power) {
        this.numNeighbors = numNeighbors;
        this.power = power;
    }

    @Override
    public String name() {
        return NAME;
    }

    public int getNumNeighbors() {
        return numNeighbors;
    }

    public double getPower() {
        return power;
    }

    @Override
    public Map<String, Double> estimate(SampleIndex samples, double latitude, double longitude, List<String> columns) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (int widening = 1; widening <= MAX_WIDENING; widening++) {
            int k = numNeighbors * widening;
            List<SampleIndex.Neighbour> neighbours = samples.nearest(latitude, longitude, k);
            result.clear();
            for (String column : columns) {
                Double value = weighted(neighbours, column);
                if (value != null) {
                    result.put(column, value);
                }
            }
            if (result.size() == columns.size() || neighbours.size() < k) {
                break;
            }
        }
        return result;
    }

    private Double weighted(List<SampleIndex.Neighbour> neighbours, String column) {
        double weightSum = 0;
        double valueSum = 0;
        for (SampleIndex.Neighbour neighbour : neighbours) {
            Double value = neighbour.sample().values().get(column);
            if (value == null) {
                continue;
            }
            if (neighbour.distance() == 0) {
                return value;
            }
            double weight = 1 / Math.pow(neighbour.distance(), power);
            if (Double.isInfinite(weight)) {
                return value;
            }
            weightSum += weight;
            valueSum += weight * value;
        }
        if (weightSum == 0 || !Double.isFinite(weightSum)) {
            return null;
        }
        return valueSum / weightSum;
    }
}
