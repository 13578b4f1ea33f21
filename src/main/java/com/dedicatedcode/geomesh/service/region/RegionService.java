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

package com.dedicatedcode.geomesh.service.region;

import com.dedicatedcode.geomesh.config.GeomeshConfiguration;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads region files and hands out {@link RegionRestrictor}s for them.
 * <p>
 * Region files are GeoJSON exports of the shapefile repository: a FeatureCollection (or a single Feature)
 * of Polygon / MultiPolygon features, each named by its {@code name} property.
 */
@Service
public class RegionService {

    private static final Logger logger = LoggerFactory.getLogger(RegionService.class);
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final GridIndex gridIndex;
    private final ObjectMapper objectMapper;
    private final Cache<Path, List<Region>> regionCache;

    public RegionService(GridIndex gridIndex, ObjectMapper objectMapper, GeomeshConfiguration config) {
        this.gridIndex = gridIndex;
        this.objectMapper = objectMapper;
        this.regionCache = Caffeine.newBuilder()
                .maximumSize(config.getQueryConfiguration().getRegionCacheSize())
                .recordStats()
                .build();
    }

    /**
     * @param file       region file
     * @param regionName name of the region to narrow to, or null for every polygon in the file
     */
    public RegionRestrictor restrictor(String file, String regionName) {
        return new RegionRestrictor(gridIndex, loadRegions(file), regionName);
    }

    public List<Region> loadRegions(String file) {
        if (file == null || file.isBlank()) {
            throw new InvalidArgumentException("Region file must be given");
        }
        Path path = Paths.get(file).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new InvalidArgumentException("Region file not found: " + file);
        }
        return regionCache.get(path, this::readRegions);
    }

    private List<Region> readRegions(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new InvalidArgumentException("Could not read region file " + path + ": " + e.getMessage());
        }

        List<Region> regions = new ArrayList<>();
        String type = root.path("type").asText();
        if ("FeatureCollection".equals(type)) {
            for (JsonNode feature : root.path("features")) {
                addFeature(feature, regions, path);
            }
        } else if ("Feature".equals(type)) {
            addFeature(root, regions, path);
        } else {
            throw new InvalidArgumentException("Region file " + path + " is not a GeoJSON FeatureCollection");
        }
        logger.info("Loaded {} region polygons from {}", regions.size(), path);
        return List.copyOf(regions);
    }

    private void addFeature(JsonNode feature, List<Region> regions, Path path) {
        JsonNode properties = feature.path("properties");
        String name = properties.hasNonNull("name") ? properties.get("name").asText() : null;
        JsonNode geometry = feature.path("geometry");
        String geometryType = geometry.path("type").asText();
        switch (geometryType) {
            case "Polygon":
                regions.add(new Region(name, toPolygon(geometry.path("coordinates"))));
                break;
            case "MultiPolygon": {
                List<Polygon> polygons = new ArrayList<>();
                for (JsonNode polygon : geometry.path("coordinates")) {
                    polygons.add(toPolygon(polygon));
                }
                Geometry multi = GEOMETRY_FACTORY.createMultiPolygon(polygons.toArray(new Polygon[0]));
                regions.add(new Region(name, multi));
                break;
            }
            default:
                logger.debug("Skipping feature '{}' with geometry type {} in {}", name, geometryType, path);
        }
    }

    private Polygon toPolygon(JsonNode rings) {
        LinearRing shell = null;
        List<LinearRing> holes = new ArrayList<>();
        for (JsonNode ring : rings) {
            LinearRing linearRing = toRing(ring);
            if (shell == null) {
                shell = linearRing;
            } else {
                holes.add(linearRing);
            }
        }
        if (shell == null) {
            throw new InvalidArgumentException("Polygon without exterior ring in region file");
        }
        return GEOMETRY_FACTORY.createPolygon(shell, holes.toArray(new LinearRing[0]));
    }

    private LinearRing toRing(JsonNode ring) {
        List<Coordinate> coordinates = new ArrayList<>();
        for (JsonNode position : ring) {
            coordinates.add(new Coordinate(position.get(0).asDouble(), position.get(1).asDouble()));
        }
        if (coordinates.size() > 0 && !coordinates.get(0).equals2D(coordinates.get(coordinates.size() - 1))) {
            coordinates.add(new Coordinate(coordinates.get(0)));
        }
        if (coordinates.size() < 4) {
            throw new InvalidArgumentException("Polygon ring with fewer than 4 positions in region file");
        }
        return GEOMETRY_FACTORY.createLinearRing(coordinates.toArray(new Coordinate[0]));
    }
}
