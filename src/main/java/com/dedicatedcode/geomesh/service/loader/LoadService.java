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

import com.dedicatedcode.geomesh.exception.SchemaMismatchException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.model.WriteMode;
import com.dedicatedcode.geomesh.service.DatasetMetadata;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.MetadataService;
import com.dedicatedcode.geomesh.service.loader.aggregation.CellAggregationEngine;
import com.dedicatedcode.geomesh.service.loader.interpolation.InterpolationEngine;
import com.dedicatedcode.geomesh.service.loader.output.OutputWriter;
import com.dedicatedcode.geomesh.service.loader.postprocessing.PostprocessingStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.PreprocessingStep;
import com.dedicatedcode.geomesh.store.DatasetSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs pipelines: read, preprocess, interpolate or aggregate, postprocess, write and register.
 * A run either stores all of its rows or none.
 */
@Service
public class LoadService {

    private static final Logger logger = LoggerFactory.getLogger(LoadService.class);

    private final PipelineConfigParser parser;
    private final GridIndex gridIndex;
    private final InterpolationEngine interpolationEngine;
    private final CellAggregationEngine aggregationEngine;
    private final OutputWriter outputWriter;
    private final MetadataService metadataService;

    public LoadService(PipelineConfigParser parser,
                       GridIndex gridIndex,
                       InterpolationEngine interpolationEngine,
                       CellAggregationEngine aggregationEngine,
                       OutputWriter outputWriter,
                       MetadataService metadataService) {
        this.parser = parser;
        this.gridIndex = gridIndex;
        this.interpolationEngine = interpolationEngine;
        this.aggregationEngine = aggregationEngine;
        this.outputWriter = outputWriter;
        this.metadataService = metadataService;
    }

    public LoadStatistics load(Path pipelineFile) {
        return run(parser.parse(pipelineFile));
    }

    public LoadStatistics run(PipelineDefinition pipeline) {
        printHeader(pipeline);
        LoadStatistics stats = new LoadStatistics();

        Optional<DatasetMetadata> registered = metadataService.find(pipeline.databaseDir(), pipeline.datasetName());

        stats.setCurrentPhase(logger, "Reading " + pipeline.reading().filePath());
        List<RawRecord> records = pipeline.reader().read(pipeline.reading());
        stats.addRecordsRead(records.size());

        for (PreprocessingStep step : pipeline.preprocessingSteps()) {
            stats.setCurrentPhase(logger, "Preprocessing with " + step.getClass().getSimpleName());
            records = step.run(records);
        }
        stats.setRecordsKept(records.size());

        Map<String, ColumnType> valueColumns = new LinkedHashMap<>();
        List<IndexedRow> rows;
        ExecutorService executor = createExecutorService(pipeline.maxParallelism());
        try {
            switch (pipeline.datasetType()) {
                case H3:
                    pipeline.reading().dataColumns().forEach(c -> valueColumns.put(c, ColumnType.DOUBLE));
                    rows = interpolate(pipeline, records, executor, stats);
                    break;
                case H3_INDEX:
                    stats.setCurrentPhase(logger, "Aggregating at resolution " + pipeline.aggregationResolution());
                    aggregationEngine.outputColumns(pipeline.reading().dataColumns(), pipeline.aggregations())
                            .forEach(c -> valueColumns.put(c, ColumnType.DOUBLE));
                    rows = aggregationEngine.aggregate(records, pipeline.reading().dataColumns(), pipeline.aggregations(),
                            pipeline.aggregationResolution(), executor, pipeline.maxParallelism(), stats);
                    break;
                case POINT:
                default:
                    pipeline.reading().dataColumns().forEach(c -> valueColumns.put(c, ColumnType.DOUBLE));
                    rows = indexPoints(pipeline, records, stats);
                    break;
            }
        } finally {
            executor.shutdownNow();
        }

        Map<String, ColumnType> schemaColumns = valueColumns;
        for (PostprocessingStep step : pipeline.postprocessingSteps()) {
            stats.setCurrentPhase(logger, "Postprocessing with " + step.getClass().getSimpleName());
            rows = step.run(rows);
            schemaColumns = step.transformSchema(schemaColumns);
        }

        DatasetSchema schema = new DatasetSchema(pipeline.datasetName(), pipeline.datasetType(), pipeline.maxResolution(),
                schemaColumns, pipeline.keyColumns());
        DatasetMetadata entry = metadataService.validate(pipeline.datasetName(), pipeline.description(),
                typeNames(schema.valueColumns()), typeNames(schema.keyColumns()), pipeline.datasetType().getValue());
        registered.ifPresent(existing -> checkRegistered(existing, entry));

        stats.setCurrentPhase(logger, "Writing " + rows.size() + " rows");
        outputWriter.write(pipeline.databaseDir(), schema, rows, pipeline.mode());
        stats.addRowsWritten(rows.size());

        if (pipeline.mode() == WriteMode.CREATE && registered.isEmpty()) {
            try {
                metadataService.addmeta(pipeline.databaseDir(), pipeline.datasetName(), pipeline.description(),
                        typeNames(schema.valueColumns()), typeNames(schema.keyColumns()), pipeline.datasetType().getValue());
            } catch (RuntimeException e) {
                logger.error("Registering dataset {} failed, removing its store", pipeline.datasetName());
                outputWriter.discard(pipeline.databaseDir(), pipeline.datasetName());
                throw e;
            }
        }
        stats.logSummary(logger, pipeline.datasetName());
        return stats;
    }

    private List<IndexedRow> interpolate(PipelineDefinition pipeline, List<RawRecord> records, ExecutorService executor, LoadStatistics stats) {
        List<IndexedRow> rows = new ArrayList<>();
        for (int resolution = GridIndex.MIN_RESOLUTION; resolution <= pipeline.maxResolution(); resolution++) {
            List<Long> targets = pipeline.targetRegion() == null
                    ? gridIndex.allCells(resolution)
                    : pipeline.targetRegion().candidateCells(resolution);
            stats.setCurrentPhase(logger, "Interpolating " + targets.size() + " cells at resolution " + resolution);
            rows.addAll(interpolationEngine.interpolate(records, pipeline.reading().dataColumns(), targets,
                    pipeline.interpolation(), executor, pipeline.maxParallelism(), stats));
        }
        return rows;
    }

    private List<IndexedRow> indexPoints(PipelineDefinition pipeline, List<RawRecord> records, LoadStatistics stats) {
        stats.setCurrentPhase(logger, "Indexing " + records.size() + " points up to resolution " + pipeline.maxResolution());
        List<IndexedRow> rows = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            List<Long> cells = new ArrayList<>(pipeline.maxResolution() + 1);
            for (int resolution = GridIndex.MIN_RESOLUTION; resolution <= pipeline.maxResolution(); resolution++) {
                cells.add(gridIndex.cellForPoint(record.latitude(), record.longitude(), resolution));
            }
            rows.add(IndexedRow.forPoint(record.latitude(), record.longitude(), record.temporalKey(),
                    new LinkedHashMap<>(record.values()), cells));
        }
        return rows;
    }

    // queries follow the registry entry, so it has to match the stored schema
    private static void checkRegistered(DatasetMetadata registered, DatasetMetadata produced) {
        if (registered.datasetType() != produced.datasetType()
                || !registered.valueColumns().equals(produced.valueColumns())
                || !registered.keyColumns().equals(produced.keyColumns())) {
            throw new SchemaMismatchException("Dataset " + produced.datasetName() + " is registered as "
                    + registered.datasetType().getValue() + " with value columns " + registered.valueColumns()
                    + " and key columns " + registered.keyColumns() + " but the pipeline produces "
                    + produced.datasetType().getValue() + " with value columns " + produced.valueColumns()
                    + " and key columns " + produced.keyColumns());
        }
    }

    private static Map<String, String> typeNames(Map<String, ColumnType> columns) {
        Map<String, String> names = new LinkedHashMap<>();
        columns.forEach((name, type) -> names.put(name, type.getValue()));
        return names;
    }

    private ExecutorService createExecutorService(int maxThreads) {
        return Executors.newFixedThreadPool(Math.max(1, maxThreads));
    }

    private void printHeader(PipelineDefinition pipeline) {
        logger.info("==================================================");
        logger.info("geomesh load");
        logger.info("Dataset:          {} ({})", pipeline.datasetName(), pipeline.datasetType());
        logger.info("Input:            {}", pipeline.reading().filePath());
        logger.info("Database dir:     {}", pipeline.databaseDir());
        logger.info("Mode:             {}", pipeline.mode());
        logger.info("Max resolution:   {}", pipeline.maxResolution());
        logger.info("Max parallelism:  {}", pipeline.maxParallelism());
        if (pipeline.interpolation() != null) {
            logger.info("Interpolation:    {}", pipeline.interpolation().name());
        }
        logger.info("==================================================");
    }
}
