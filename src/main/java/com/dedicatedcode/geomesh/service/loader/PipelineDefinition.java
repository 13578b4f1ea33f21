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

package com.dedicatedcode.geomesh.service.loader;

import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.model.WriteMode;
import com.dedicatedcode.geomesh.service.loader.aggregation.Aggregation;
import com.dedicatedcode.geomesh.service.loader.interpolation.InterpolationStrategy;
import com.dedicatedcode.geomesh.service.loader.postprocessing.PostprocessingStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.PreprocessingStep;
import com.dedicatedcode.geomesh.service.loader.reading.RawRecordReader;
import com.dedicatedcode.geomesh.service.loader.reading.ReadingSpec;
import com.dedicatedcode.geomesh.service.region.RegionRestrictor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully validated pipeline run, parsed from either form of pipeline file.
 *
 * @param maxResolution         finest resolution of {@code h3} and {@code point} datasets, the aggregation
 *                              resolution of {@code h3_index} datasets
 * @param targetRegion          restricts the interpolated cells of an {@code h3} dataset, or null
 * @param interpolation         estimator of {@code h3} datasets, null otherwise
 * @param aggregationResolution resolution the records are grouped at, null without aggregation steps
 */
public record PipelineDefinition(String datasetName,
                                 String description,
                                 DatasetType datasetType,
                                 Path databaseDir,
                                 WriteMode mode,
                                 int maxResolution,
                                 int maxParallelism,
                                 RawRecordReader reader,
                                 ReadingSpec reading,
                                 List<PreprocessingStep> preprocessingSteps,
                                 RegionRestrictor targetRegion,
                                 InterpolationStrategy interpolation,
                                 List<Aggregation> aggregations,
                                 Integer aggregationResolution,
                                 List<PostprocessingStep> postprocessingSteps) {

    public PipelineDefinition {
        preprocessingSteps = List.copyOf(preprocessingSteps);
        aggregations = List.copyOf(aggregations);
        postprocessingSteps = List.copyOf(postprocessingSteps);
    }

    /**
     * Temporal key columns of the dataset in year, month, day order.
     */
    public Map<String, ColumnType> keyColumns() {
        Map<String, ColumnType> keys = new LinkedHashMap<>();
        if (reading.yearColumn() != null) {
            keys.put(TemporalKey.YEAR, ColumnType.INTEGER);
        }
        if (reading.monthColumn() != null) {
            keys.put(TemporalKey.MONTH, ColumnType.INTEGER);
        }
        if (reading.dayColumn() != null) {
            keys.put(TemporalKey.DAY, ColumnType.INTEGER);
        }
        return keys;
    }
}
