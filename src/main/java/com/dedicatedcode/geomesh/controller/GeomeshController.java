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

import com.dedicatedcode.geomesh.dto.AssetFilterRequest;
import com.dedicatedcode.geomesh.dto.AssetMatch;
import com.dedicatedcode.geomesh.dto.QueryRequest;
import com.dedicatedcode.geomesh.dto.QueryResult;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.service.MetadataService;
import com.dedicatedcode.geomesh.service.query.AssetFilterService;
import com.dedicatedcode.geomesh.service.query.GeomeshQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for spatial queries against registered datasets.
 */
@RestController
@RequestMapping("/api/v1")
@ConditionalOnProperty(name = "geomesh.load-mode", havingValue = "false", matchIfMissing = true)
public class GeomeshController {

    private static final Logger logger = LoggerFactory.getLogger(GeomeshController.class);
    private static final String NO_CACHE = "no-store, no-cache, must-revalidate, proxy-revalidate, max-age=0";

    private final GeomeshQueryService queryService;
    private final AssetFilterService assetFilterService;
    private final MetadataService metadataService;

    public GeomeshController(GeomeshQueryService queryService, AssetFilterService assetFilterService, MetadataService metadataService) {
        this.queryService = queryService;
        this.assetFilterService = assetFilterService;
        this.metadataService = metadataService;
    }

    @PostMapping("/geomesh/{dataset}/latlong/radius")
    public ResponseEntity<QueryResult> latLongRadius(@PathVariable String dataset, @RequestBody QueryRequest request) {
        QueryResult result = queryService.radius(dataset,
                require(request.getLatitude(), "latitude"),
                require(request.getLongitude(), "longitude"),
                require(request.getRadius(), "radius"),
                request.getResolution(), request.getYear(), request.getMonth(), request.getDay());
        return respond(result);
    }

    @PostMapping("/geomesh/{dataset}/latlong/point")
    public ResponseEntity<QueryResult> latLongPoint(@PathVariable String dataset, @RequestBody QueryRequest request) {
        QueryResult result = queryService.pointValue(dataset,
                require(request.getLatitude(), "latitude"),
                require(request.getLongitude(), "longitude"),
                request.getResolution(), request.getYear(), request.getMonth(), request.getDay());
        return respond(result);
    }

    @PostMapping("/geomesh/{dataset}/cell/radius")
    public ResponseEntity<QueryResult> cellRadius(@PathVariable String dataset, @RequestBody QueryRequest request) {
        QueryResult result = queryService.cellRadius(dataset,
                require(request.getCell(), "cell"),
                require(request.getRadius(), "radius"),
                request.getYear(), request.getMonth(), request.getDay());
        return respond(result);
    }

    @PostMapping("/geomesh/{dataset}/cell/point")
    public ResponseEntity<QueryResult> cellPoint(@PathVariable String dataset, @RequestBody QueryRequest request) {
        QueryResult result = queryService.cellValue(dataset,
                require(request.getCell(), "cell"),
                request.getYear(), request.getMonth(), request.getDay());
        return respond(result);
    }

    @PostMapping("/geomesh/{dataset}/region")
    public ResponseEntity<QueryResult> region(@PathVariable String dataset, @RequestBody QueryRequest request) {
        QueryResult result = queryService.region(dataset,
                require(request.getShapefile(), "shapefile"),
                request.getRegion(), request.getResolution(),
                request.getYear(), request.getMonth(), request.getDay());
        return respond(result);
    }

    @PostMapping("/geomesh/filter")
    public ResponseEntity<Map<String, Object>> filter(@RequestBody AssetFilterRequest request) {
        List<AssetMatch> matches = assetFilterService.filter(request);
        Map<String, Object> response = new HashMap<>();
        response.put("assets", matches);
        response.put("count", matches.size());
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(matches.size()))
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("service", "geomesh");
        response.put("datasets", metadataService.showmeta().size());
        return ResponseEntity.ok()
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }

    private ResponseEntity<QueryResult> respond(QueryResult result) {
        int count = result.getCells() != null ? result.getCells().size() : result.getPoints().size();
        logger.debug("Query on {} returned {} rows", result.getDataset(), count);
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(count))
                .header("Cache-Control", NO_CACHE)
                .body(result);
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new InvalidArgumentException("Request field " + field + " is required");
        }
        return value;
    }
}
