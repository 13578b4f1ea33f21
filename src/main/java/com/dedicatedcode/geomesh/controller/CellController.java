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

package com.dedicatedcode.geomesh.controller;

import com.dedicatedcode.geomesh.dto.CellPolygon;
import com.dedicatedcode.geomesh.service.CellBoundaryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for cell geometry.
 */
@RestController
@RequestMapping("/api/v1")
@ConditionalOnProperty(name = "geomesh.load-mode", havingValue = "false", matchIfMissing = true)
public class CellController {

    private static final Logger logger = LoggerFactory.getLogger(CellController.class);

    private final CellBoundaryService cellBoundaryService;

    public CellController(CellBoundaryService cellBoundaryService) {
        this.cellBoundaryService = cellBoundaryService;
    }

    /**
     * Cell outline in GeoJSON. Cell geometry never changes, so responses can be cached indefinitely.
     */
    @GetMapping("/geomesh/cell/{cell}/boundary")
    public ResponseEntity<CellPolygon> boundary(@PathVariable String cell) {
        logger.debug("Boundary request for cell {}", cell);
        CellPolygon geometry = cellBoundaryService.getCellBoundary(cell);
        return ResponseEntity.ok()
                .header("X-Result-Count", "1")
                .header("Cache-Control", "public, max-age=31536000, immutable")
                .body(geometry);
    }
}
