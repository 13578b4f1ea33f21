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

package com.dedicatedcode.geomesh.service.loader.aggregation;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;

/**
 * Groups raw records by temporal key and containing cell and reduces every group with the configured
 * aggregations. One row per non-empty group, ordered by temporal group (first appearance) and cell id.
 */
@Service
public class CellAggregationEngine {

    private static final Logger logger = LoggerFactory.getLogger(CellAggregationEngine.class);

    private final GridIndex gridIndex;

    public CellAggregationEngine(GridIndex gridIndex) {
        this.gridIndex = gridIndex;
    }

    /**
     * Output column names in order: for every data column, one per aggregation.
     *
     * @throws ConfigurationException if two aggregations produce the same column
     */
    public List<String> outputColumns(List<String> columns, List<Aggregation> aggregations) {
        Set<String> names = new LinkedHashSet<>();
        for (String column : columns) {
            for (Aggregation aggregation : aggregations) {
                String name = column + "_" + aggregation.suffix();
                if (!names.add(name)) {
                    throw new ConfigurationException("Aggregation output column " + name + " is produced more than once");
                }
            }
        }
        return new ArrayList<>(names);
    }

    public List<IndexedRow> aggregate(List<RawRecord> records,
                                      List<String> columns,
                                      List<Aggregation> aggregations,
                                      int resolution,
                                      ExecutorService executor,
                                      int partitions,
                                      LoadStatistics statistics) {
        if (aggregations.isEmpty()) {
            throw new ConfigurationException("At least one aggregation step is required");
        }
        gridIndex.validateResolution(resolution);
        outputColumns(columns, aggregations);

        Map<TemporalKey, TreeMap<Long, List<RawRecord>>> groups = new LinkedHashMap<>();
        for (RawRecord record : records) {
            long cell = gridIndex.cellForPoint(record.latitude(), record.longitude(), resolution);
            groups.computeIfAbsent(record.temporalKey(), k -> new TreeMap<>())
                    .computeIfAbsent(cell, c -> new ArrayList<>())
                    .add(record);
        }

        List<IndexedRow> rows = new ArrayList<>();
        for (Map.Entry<TemporalKey, TreeMap<Long, List<RawRecord>>> group : groups.entrySet()) {
            TemporalKey key = group.getKey();
            List<Map.Entry<Long, List<RawRecord>>> cells = new ArrayList<>(group.getValue().entrySet());
            logger.debug("Aggregating {} cells at resolution {} for {}", cells.size(), resolution, key);
            rows.addAll(WorkPartitioner.run(executor, cells, partitions,
                    range -> aggregateRange(range, key, columns, aggregations, statistics)));
        }
        return rows;
    }

    private List<IndexedRow> aggregateRange(List<Map.Entry<Long, List<RawRecord>>> cells,
                                            TemporalKey key,
                                            List<String> columns,
                                            List<Aggregation> aggregations,
                                            LoadStatistics statistics) {
        List<IndexedRow> rows = new ArrayList<>(cells.size());
        for (Map.Entry<Long, List<RawRecord>> entry : cells) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : columns) {
                double[] columnValues = entry.getValue().stream()
                        .map(r -> r.values().get(column))
                        .filter(v -> v != null)
                        .mapToDouble(Double::doubleValue)
                        .toArray();
                for (Aggregation aggregation : aggregations) {
                    String name = column + "_" + aggregation.suffix();
                    if (columnValues.length == 0) {
                        if (aggregation instanceof CountWithinBoundsAggregation) {
                            values.put(name, 0.0);
                        }
                        continue;
                    }
                    Double result = aggregation.apply(columnValues);
                    if (result != null) {
                        values.put(name, result);
                    }
                }
            }
            LatLng centroid = gridIndex.centroid(entry.getKey());
            rows.add(IndexedRow.forCell(entry.getKey(), centroid.lat, centroid.lng, key, values));
        }
        statistics.addCellsEvaluated(cells.size());
        return rows;
    }
}
