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

import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.loader.LoadStatistics;
import com.dedicatedcode.geomesh.service.loader.WorkPartitioner;
import com.uber.h3core.util.LatLng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Estimates values at the centroids of a set of cells.
 * <p>
 * Records are grouped by temporal key and every group is interpolated on its own. Target cells are split into
 * contiguous ranges, one task per range, and the results are concatenated in range order. The output is
 * therefore the same for any number of workers.
 */
@Service
public class InterpolationEngine {

    private static final Logger logger = LoggerFactory.getLogger(InterpolationEngine.class);

    private final GridIndex gridIndex;

    public InterpolationEngine(GridIndex gridIndex) {
        this.gridIndex = gridIndex;
    }

    /**
     * @param targetCells cells to estimate, sorted by id
     * @return one row per temporal group and cell, cells without an estimate for every column are omitted
     */
    public List<IndexedRow> interpolate(List<RawRecord> records,
                                        List<String> columns,
                                        List<Long> targetCells,
                                        InterpolationStrategy strategy,
                                        ExecutorService executor,
                                        int partitions,
                                        LoadStatistics statistics) {
        Map<TemporalKey, List<RawRecord>> groups = new LinkedHashMap<>();
        for (RawRecord record : records) {
            groups.computeIfAbsent(record.temporalKey(), k -> new ArrayList<>()).add(record);
        }

        List<IndexedRow> rows = new ArrayList<>();
        for (Map.Entry<TemporalKey, List<RawRecord>> group : groups.entrySet()) {
            TemporalKey key = group.getKey();
            SampleIndex samples = new SampleIndex(group.getValue());
            logger.debug("Interpolating {} cells from {} samples for {} using {}", targetCells.size(), samples.size(), key, strategy.name());
            rows.addAll(WorkPartitioner.run(executor, targetCells, partitions,
                    range -> interpolateRange(range, samples, key, columns, strategy, statistics)));
        }
        return rows;
    }

    private List<IndexedRow> interpolateRange(List<Long> cells,
                                              SampleIndex samples,
                                              TemporalKey key,
                                              List<String> columns,
                                              InterpolationStrategy strategy,
                                              LoadStatistics statistics) {
        List<IndexedRow> rows = new ArrayList<>(cells.size());
        for (long cell : cells) {
            LatLng centroid = gridIndex.centroid(cell);
            Map<String, Double> estimate = strategy.estimate(samples, centroid.lat, centroid.lng, columns);
            if (estimate.size() < columns.size()) {
                statistics.incrementCellsOmitted();
                continue;
            }
            rows.add(IndexedRow.forCell(cell, centroid.lat, centroid.lng, key, new LinkedHashMap<>(estimate)));
        }
        statistics.addCellsEvaluated(cells.size());
        return rows;
    }
}
