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

package com.dedicatedcode.geomesh.service;

import com.dedicatedcode.geomesh.dto.CellPolygon;
import com.uber.h3core.util.LatLng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cell outlines for map clients.
 */
@Service
public class CellBoundaryService {

    private static final Logger logger = LoggerFactory.getLogger(CellBoundaryService.class);

    private final GridIndex gridIndex;

    public CellBoundaryService(GridIndex gridIndex) {
        this.gridIndex = gridIndex;
    }

    /**
     * Outline of the cell as a GeoJSON polygon with a closed exterior ring in [lon, lat] order.
     *
     * @throws com.dedicatedcode.geomesh.exception.InvalidArgumentException if the cell id is not valid
     */
    public CellPolygon getCellBoundary(String cellId) {
        long cell = gridIndex.fromString(cellId);
        List<LatLng> boundary = gridIndex.boundary(cell);
        logger.debug("Boundary of cell {} has {} vertices", cellId, boundary.size());
        return CellPolygon.of(gridIndex.toString(cell), gridIndex.resolution(cell), boundary);
    }
}
