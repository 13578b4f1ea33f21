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

package com.dedicatedcode.geomesh.service.query;

import com.dedicatedcode.geomesh.dto.QueryResult;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.exception.UnsupportedDatasetOperationException;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.service.DatasetMetadata;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.MetadataService;
import com.dedicatedcode.geomesh.service.region.RegionRestrictor;
import com.dedicatedcode.geomesh.service.region.RegionService;
import com.dedicatedcode.geomesh.store.DatasetSchema;
import com.dedicatedcode.geomesh.store.DatasetStorage;
import com.dedicatedcode.geomesh.store.DatasetStore;
import com.uber.h3core.util.LatLng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Radius, cell and region queries against registered datasets.
 * <p>
 * Every query resolves the dataset through the metadata registry first, so an unknown dataset fails before
 * any store is opened. Stores are opened read-only per query.
 */
@Service
public class GeomeshQueryService {

    private static final Logger logger = LoggerFactory.getLogger(GeomeshQueryService.class);

    public static final double UNBOUNDED_RADIUS = -1;

    private final MetadataService metadataService;
    private final DatasetStorage storage;
    private final GridIndex gridIndex;
    private final RegionService regionService;

    public GeomeshQueryService(MetadataService metadataService, DatasetStorage storage, GridIndex gridIndex, RegionService regionService) {
        this.metadataService = metadataService;
        this.storage = storage;
        this.gridIndex = gridIndex;
        this.regionService = regionService;
    }

    /**
     * Cells within {@code radiusKm} of the point for cell datasets, points within the radius for point datasets.
     *
     * @param radiusKm   radius in km, -1 for unbounded
     * @param resolution requested resolution of cell datasets, null for the dataset default
     */
    public QueryResult radius(String dataset, double latitude, double longitude, double radiusKm, Integer resolution,
                              Integer year, Integer month, Integer day) {
        logger.debug("Radius query on {} at ({}, {}) radius {} km resolution {}", dataset, latitude, longitude, radiusKm, resolution);
        DatasetMetadata metadata = metadataService.require(dataset);
        gridIndex.validateCoordinates(latitude, longitude);
        boolean unbounded = checkRadius(radiusKm);
        TemporalKey key = TemporalKey.forQuery(metadata.interval(), year, month, day);
        return radiusQuery(metadata, latitude, longitude, radiusKm, unbounded, resolution, key);
    }

    /**
     * Stored rows of the cell containing the point.
     */
    public QueryResult pointValue(String dataset, double latitude, double longitude, Integer resolution,
                                  Integer year, Integer month, Integer day) {
        logger.debug("Point query on {} at ({}, {}) resolution {}", dataset, latitude, longitude, resolution);
        DatasetMetadata metadata = metadataService.require(dataset);
        requireCellBased(metadata, "point value");
        gridIndex.validateCoordinates(latitude, longitude);
        TemporalKey key = TemporalKey.forQuery(metadata.interval(), year, month, day);
        Path databaseDir = metadataService.defaultDatabaseDir();
        if (!storage.exists(databaseDir, dataset)) {
            return new QueryResult(dataset, metadata.datasetType(), resolution);
        }
        try (DatasetStore store = storage.openReadOnly(databaseDir, dataset)) {
            int res = cellResolution(store.schema(), resolution);
            long cell = gridIndex.cellForPoint(latitude, longitude, res);
            QueryResult result = new QueryResult(dataset, metadata.datasetType(), res);
            addCells(result, store, List.of(cell), key);
            return result;
        }
    }

    public QueryResult cellRadius(String dataset, String cellId, double radiusKm, Integer year, Integer month, Integer day) {
        logger.debug("Cell radius query on {} around {} radius {} km", dataset, cellId, radiusKm);
        DatasetMetadata metadata = metadataService.require(dataset);
        long cell = gridIndex.fromString(cellId);
        boolean unbounded = checkRadius(radiusKm);
        TemporalKey key = TemporalKey.forQuery(metadata.interval(), year, month, day);
        LatLng centre = gridIndex.centroid(cell);
        return radiusQuery(metadata, centre.lat, centre.lng, radiusKm, unbounded, gridIndex.resolution(cell), key);
    }

    /**
     * Rows of one cell: its stored value for cell datasets, the points inside it for point datasets.
     */
    public QueryResult cellValue(String dataset, String cellId, Integer year, Integer month, Integer day) {
        logger.debug("Cell query on {} for {}", dataset, cellId);
        DatasetMetadata metadata = metadataService.require(dataset);
        long cell = gridIndex.fromString(cellId);
        int res = gridIndex.resolution(cell);
        TemporalKey key = TemporalKey.forQuery(metadata.interval(), year, month, day);
        Path databaseDir = metadataService.defaultDatabaseDir();
        if (!storage.exists(databaseDir, dataset)) {
            return new QueryResult(dataset, metadata.datasetType(), res);
        }
        try (DatasetStore store = storage.openReadOnly(databaseDir, dataset)) {
            QueryResult result = new QueryResult(dataset, metadata.datasetType(), cellResolution(store.schema(), res));
            if (metadata.datasetType().isCellBased()) {
                addCells(result, store, List.of(cell), key);
            } else {
                checkPointResolution(store.schema(), res);
                addPoints(result, store, key, row -> Long.valueOf(cell).equals(row.cellAt(res)));
            }
            return result;
        }
    }

    /**
     * Cells intersecting the region for cell datasets, points inside it for point datasets.
     */
    public QueryResult region(String dataset, String shapefile, String regionName, Integer resolution,
                              Integer year, Integer month, Integer day) {
        logger.debug("Region query on {} with {} region {} resolution {}", dataset, shapefile, regionName, resolution);
        DatasetMetadata metadata = metadataService.require(dataset);
        TemporalKey key = TemporalKey.forQuery(metadata.interval(), year, month, day);
        RegionRestrictor restrictor = regionService.restrictor(shapefile, regionName);
        Path databaseDir = metadataService.defaultDatabaseDir();
        if (!storage.exists(databaseDir, dataset)) {
            return new QueryResult(dataset, metadata.datasetType(), resolution);
        }
        try (DatasetStore store = storage.openReadOnly(databaseDir, dataset)) {
            if (metadata.datasetType().isCellBased()) {
                int res = cellResolution(store.schema(), resolution);
                QueryResult result = new QueryResult(dataset, metadata.datasetType(), res);
                addCells(result, store, restrictor.candidateCells(res), key);
                return result;
            }
            QueryResult result = new QueryResult(dataset, metadata.datasetType(), resolution);
            addPoints(result, store, key, row -> restrictor.contains(row.latitude(), row.longitude()));
            return result;
        }
    }

    private QueryResult radiusQuery(DatasetMetadata metadata, double latitude, double longitude, double radiusKm,
                                    boolean unbounded, Integer resolution, TemporalKey key) {
        String dataset = metadata.datasetName();
        Path databaseDir = metadataService.defaultDatabaseDir();
        if (!storage.exists(databaseDir, dataset)) {
            return new QueryResult(dataset, metadata.datasetType(), resolution);
        }
        try (DatasetStore store = storage.openReadOnly(databaseDir, dataset)) {
            if (metadata.datasetType().isCellBased()) {
                int res = cellResolution(store.schema(), resolution);
                QueryResult result = new QueryResult(dataset, metadata.datasetType(), res);
                if (unbounded) {
                    store.forEachRow(row -> {
                        if (gridIndex.resolution(row.cell()) == res && key.matches(row.temporalKey())) {
                            result.getCells().add(QueryRows.toCellRow(gridIndex, row));
                        }
                    });
                } else {
                    addCells(result, store, gridIndex.cellsWithinRadius(latitude, longitude, radiusKm, res), key);
                }
                return result;
            }
            if (resolution != null) {
                checkPointResolution(store.schema(), resolution);
            }
            QueryResult result = new QueryResult(dataset, metadata.datasetType(), resolution);
            addPoints(result, store, key, row -> unbounded
                    || gridIndex.distance(latitude, longitude, row.latitude(), row.longitude()) <= radiusKm);
            return result;
        }
    }

    private void addCells(QueryResult result, DatasetStore store, Collection<Long> cells, TemporalKey key) {
        for (long cell : cells) {
            for (IndexedRow row : store.rowsForCell(cell)) {
                if (key.matches(row.temporalKey())) {
                    result.getCells().add(QueryRows.toCellRow(gridIndex, row));
                }
            }
        }
    }

    private void addPoints(QueryResult result, DatasetStore store, TemporalKey key, Predicate<IndexedRow> filter) {
        store.forEachRow(row -> {
            if (key.matches(row.temporalKey()) && filter.test(row)) {
                result.getPoints().add(QueryRows.toPointRow(gridIndex, row));
            }
        });
    }

    private boolean checkRadius(double radiusKm) {
        if (radiusKm == UNBOUNDED_RADIUS) {
            return true;
        }
        if (Double.isNaN(radiusKm) || radiusKm < 0) {
            throw new InvalidArgumentException("Radius must be a non-negative number of km or -1 for unbounded, was " + radiusKm);
        }
        return false;
    }

    /**
     * Resolution a cell query runs at. Index datasets only hold their aggregation resolution.
     */
    private int cellResolution(DatasetSchema schema, Integer requested) {
        if (schema.datasetType() == DatasetType.H3_INDEX) {
            if (requested != null && requested != schema.maxResolution()) {
                throw new InvalidArgumentException("Dataset " + schema.datasetName() + " is indexed at resolution "
                        + schema.maxResolution() + ", resolution " + requested + " is not available");
            }
            return schema.maxResolution();
        }
        if (!schema.datasetType().isCellBased()) {
            return requested == null ? schema.maxResolution() : requested;
        }
        int res = requested == null ? schema.maxResolution() : requested;
        if (res < GridIndex.MIN_RESOLUTION || res > schema.maxResolution()) {
            throw new InvalidArgumentException("Resolution " + res + " is outside of 0.." + schema.maxResolution()
                    + " for dataset " + schema.datasetName());
        }
        return res;
    }

    private void checkPointResolution(DatasetSchema schema, int resolution) {
        if (resolution < GridIndex.MIN_RESOLUTION || resolution > schema.maxResolution()) {
            throw new InvalidArgumentException("Resolution " + resolution + " is outside of 0.." + schema.maxResolution()
                    + " for dataset " + schema.datasetName());
        }
    }

    private void requireCellBased(DatasetMetadata metadata, String operation) {
        if (!metadata.datasetType().isCellBased()) {
            throw new UnsupportedDatasetOperationException("Operation " + operation + " is not supported for "
                    + metadata.datasetType() + " dataset " + metadata.datasetName());
        }
    }
}
