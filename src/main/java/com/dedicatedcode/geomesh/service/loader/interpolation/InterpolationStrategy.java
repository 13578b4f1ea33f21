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

import java.util.List;
import java.util.Map;

/**
 * Estimates values at an arbitrary location from the samples around it.
 * Implementations must be stateless, they are called concurrently.
 */
public interface InterpolationStrategy {

    String name();

    /**
     * @return estimate per column; columns without a defined estimate are absent
     */
    Map<String, Double> estimate(SampleIndex samples, double latitude, double longitude, List<String> columns);
}
