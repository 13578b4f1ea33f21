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

import com.dedicatedcode.geomesh.dto.AssetFilterRequest;
import com.dedicatedcode.geomesh.dto.AssetMatch;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.exception.UnsupportedDatasetOperationException;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.service.DatasetMetadata;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.MetadataService;
import com.dedicatedcode.geomesh.store.DatasetStorage;
import com.dedicatedcode.geomesh.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the assets whose location meets the conditions of every referenced dataset.
 * <p>
 * An asset is looked up in each dataset at the cell containing it, at the dataset's stored resolution.
 * All conditions of a dataset must hold on one stored row of that cell. Assets without a stored row are
 * dropped. Matches are returned in input order.
 */
@Service
public class AssetFilterService {

    private static final Logger logger = LoggerFactory.getLogger(AssetFilterService.class);

    private final MetadataService metadataService;
    private final DatasetStorage storage;
    private final GridIndex gridIndex;

    public AssetFilterService(MetadataService metadataService, DatasetStorage storage, GridIndex gridIndex) {
        this.metadataService = metadataService;
        this.storage = storage;
        this.gridIndex = gridIndex;
    }

    public List<AssetMatch> filter(AssetFilterRequest request) {
        if (request.getDatasets() == null || request.getDatasets().isEmpty()) {
            throw new InvalidArgumentException("At least one dataset filter is required");
        }
        List<AssetFilterRequest.Asset> assets = request.getAssets() == null ? List.of() : request.getAssets();
        for (AssetFilterRequest.Asset asset : assets) {
            gridIndex.validateCoordinates(asset.getLatitude(), asset.getLongitude());
        }

        List<PreparedFilter> filters = new ArrayList<>();
        for (AssetFilterRequest.DatasetFilter datasetFilter : request.getDatasets()) {
            filters.add(prepare(datasetFilter));
        }
        logger.debug("Filtering {} assets against {} datasets", assets.size(), filters.size());

        Path databaseDir = metadataService.defaultDatabaseDir();
        List<DatasetStore> stores = new ArrayList<>();
        try {
            for (PreparedFilter filter : filters) {
                stores.add(storage.exists(databaseDir, filter.metadata.datasetName())
                        ? storage.openReadOnly(databaseDir, filter.metadata.datasetName())
                        : null);
            }

            List<AssetMatch> matches = new ArrayList<>();
            for (AssetFilterRequest.Asset asset : assets) {
                AssetMatch match = new AssetMatch(asset.getId(), asset.getLatitude(), asset.getLongitude());
                boolean all = true;
                for (int i = 0; i < filters.size() && all; i++) {
                    Map<String, Object> values = stores.get(i) == null ? null : matchingRow(filters.get(i), stores.get(i), asset);
                    if (values == null) {
                        all = false;
                    } else {
                        match.getDatasets().put(filters.get(i).metadata.datasetName(), values);
                    }
                }
                if (all) {
                    matches.add(match);
                }
            }
            return matches;
        } finally {
            for (DatasetStore store : stores) {
                if (store != null) {
                    store.close();
                }
            }
        }
    }

    private PreparedFilter prepare(AssetFilterRequest.DatasetFilter datasetFilter) {
        DatasetMetadata metadata = metadataService.require(datasetFilter.getName());
        if (!metadata.datasetType().isCellBased()) {
            throw new UnsupportedDatasetOperationException("Asset filtering is not supported for point dataset " + metadata.datasetName());
        }
        List<Condition> conditions = new ArrayList<>();
        List<AssetFilterRequest.ColumnFilter> columnFilters = datasetFilter.getFilters() == null ? List.of() : datasetFilter.getFilters();
        for (AssetFilterRequest.ColumnFilter columnFilter : columnFilters) {
            if (!metadata.valueColumns().containsKey(columnFilter.getColumn())) {
                throw new InvalidArgumentException("Dataset " + metadata.datasetName() + " has no column " + columnFilter.getColumn()
                        + ", available columns are " + metadata.valueColumns().keySet());
            }
            if (columnFilter.getValue() == null) {
                throw new InvalidArgumentException("Filter on column " + columnFilter.getColumn() + " of dataset "
                        + metadata.datasetName() + " has no value");
            }
            conditions.add(new Condition(columnFilter.getColumn(), FilterComparator.parse(columnFilter.getComparator()), columnFilter.getValue()));
        }
        TemporalKey key = TemporalKey.forQuery(metadata.interval(), datasetFilter.getYear(), datasetFilter.getMonth(), datasetFilter.getDay());
        return new PreparedFilter(metadata, conditions, key);
    }

    private Map<String, Object> matchingRow(PreparedFilter filter, DatasetStore store, AssetFilterRequest.Asset asset) {
        // index datasets store a single resolution, h3 datasets are looked up at their finest one
        int resolution = store.schema().maxResolution();
        long cell = gridIndex.cellForPoint(asset.getLatitude(), asset.getLongitude(), resolution);
        for (IndexedRow row : store.rowsForCell(cell)) {
            if (filter.key.matches(row.temporalKey()) && filter.holds(row)) {
                return new LinkedHashMap<>(row.values());
            }
        }
        return null;
    }

    private record Condition(String column, FilterComparator comparator, double target) {
    }

    private record PreparedFilter(DatasetMetadata metadata, List<Condition> conditions, TemporalKey key) {

        boolean holds(IndexedRow row) {
            for (Condition condition : conditions) {
                Double value = row.numericValue(condition.column());
                if (value == null || !condition.comparator().test(value, condition.target())) {
                    return false;
                }
            }
            return true;
        }
    }
}
