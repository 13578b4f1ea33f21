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

import com.dedicatedcode.geomesh.config.GeomeshConfiguration;
import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.Interval;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.model.WriteMode;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.MetadataService;
import com.dedicatedcode.geomesh.service.loader.aggregation.Aggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.CellAggregationEngine;
import com.dedicatedcode.geomesh.service.loader.interpolation.InterpolationStrategy;
import com.dedicatedcode.geomesh.service.loader.interpolation.InverseDistanceStrategy;
import com.dedicatedcode.geomesh.service.loader.interpolation.NearestNeighbourStrategy;
import com.dedicatedcode.geomesh.service.loader.postprocessing.PostprocessingStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.PreprocessingStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.RegionFilterStep;
import com.dedicatedcode.geomesh.service.loader.reading.ReadingSpec;
import com.dedicatedcode.geomesh.service.region.RegionRestrictor;
import com.dedicatedcode.geomesh.service.region.RegionService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses pipeline files into {@link PipelineDefinition}s.
 * <p>
 * Two forms are understood. The simple form names a {@code loader_type} and describes an {@code h3} or
 * {@code point} dataset in flat keys. The advanced form lists a reading step, preprocessing, aggregation and
 * postprocessing steps and an output step with their parameters. Everything is validated here, before any
 * input is read.
 */
@Service
public class PipelineConfigParser {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigParser.class);

    private static final Pattern DATASET_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final List<String> TEMPORAL_KEYS = List.of(TemporalKey.YEAR, TemporalKey.MONTH, TemporalKey.DAY);

    private final YAMLMapper yamlMapper = new YAMLMapper();
    private final GeomeshConfiguration config;
    private final PipelineSteps steps;
    private final RegionService regionService;
    private final CellAggregationEngine aggregationEngine;

    public PipelineConfigParser(GeomeshConfiguration config, PipelineSteps steps, RegionService regionService,
                                CellAggregationEngine aggregationEngine) {
        this.config = config;
        this.steps = steps;
        this.regionService = regionService;
        this.aggregationEngine = aggregationEngine;
    }

    public PipelineDefinition parse(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Pipeline file not found: " + file);
        }
        Map<String, Object> values;
        try {
            values = yamlMapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new ConfigurationException("Could not parse pipeline file " + file + ": " + e.getMessage(), e);
        }
        if (values == null) {
            throw new ConfigurationException("Pipeline file " + file + " is empty");
        }
        logger.info("Parsing pipeline file {}", file);
        return parse(values);
    }

    public PipelineDefinition parse(Map<String, Object> values) {
        ConfigSection root = new ConfigSection("", values);
        if (root.has("reading_step")) {
            return parseAdvanced(root);
        }
        if (root.has("loader_type")) {
            return parseSimple(root);
        }
        throw new ConfigurationException("Pipeline file needs either loader_type or reading_step");
    }

    private PipelineDefinition parseSimple(ConfigSection root) {
        String loaderType = root.requireString("loader_type");
        String datasetName = datasetName(root, "dataset_name");
        DatasetType datasetType = datasetType(root, "dataset_type");
        if (datasetType == DatasetType.H3_INDEX) {
            throw new ConfigurationException("dataset_type h3_index is only supported by the reading_step pipeline form");
        }
        int maxResolution = resolution(root, "max_resolution");

        ReadingSpec reading = new ReadingSpec(
                loaderType,
                filePath(root),
                root.optionalBoolean("has_header_row", true),
                root.stringMap("columns"),
                dataColumns(root),
                root.optionalString("year_column"),
                root.optionalString("month_column"),
                root.optionalString("day_column"));
        checkInterval(root, reading);

        List<PreprocessingStep> preprocessing = new ArrayList<>();
        RegionRestrictor targetRegion = null;
        if (root.has("shapefile")) {
            RegionRestrictor restrictor = regionService.restrictor(root.requireString("shapefile"), root.optionalString("region"));
            if (datasetType == DatasetType.POINT) {
                preprocessing.add(new RegionFilterStep(restrictor));
            } else {
                targetRegion = restrictor;
            }
        } else if (root.has("region")) {
            throw new ConfigurationException("Parameter region needs a shapefile");
        }

        return new PipelineDefinition(
                datasetName,
                root.optionalString("description"),
                datasetType,
                databaseDir(root),
                mode(root),
                maxResolution,
                maxParallelism(root),
                steps.reader(loaderType),
                reading,
                preprocessing,
                targetRegion,
                datasetType == DatasetType.H3 ? interpolation(root.section("interpolation")) : null,
                List.of(),
                null,
                List.of());
    }

    private PipelineDefinition parseAdvanced(ConfigSection root) {
        String readingStep = root.requireString("reading_step");
        ConfigSection readingParams = root.section("reading_step_params");
        ConfigSection output = root.section("output_step_params");
        steps.checkOutput(root.requireString("output_step"));

        List<String> keyColumns = readingParams.stringList("key_columns");
        for (String key : keyColumns) {
            if (!TEMPORAL_KEYS.contains(key)) {
                throw new ConfigurationException("reading_step_params.key_columns may only contain year, month and day, found: " + key);
            }
        }
        ReadingSpec reading = new ReadingSpec(
                readingStep,
                filePath(readingParams),
                readingParams.optionalBoolean("has_header_row", true),
                readingParams.stringMap("columns"),
                dataColumns(readingParams),
                keyColumns.contains(TemporalKey.YEAR) ? TemporalKey.YEAR : null,
                keyColumns.contains(TemporalKey.MONTH) ? TemporalKey.MONTH : null,
                keyColumns.contains(TemporalKey.DAY) ? TemporalKey.DAY : null);
        checkInterval(readingParams, reading);

        List<PreprocessingStep> preprocessing = new ArrayList<>();
        for (ConfigSection step : root.sectionList("preprocessing_steps")) {
            preprocessing.add(steps.preprocessingStep(step));
        }
        List<Aggregation> aggregations = new ArrayList<>();
        for (ConfigSection step : root.sectionList("aggregation_steps")) {
            aggregations.add(steps.aggregation(step));
        }
        List<PostprocessingStep> postprocessing = new ArrayList<>();
        for (ConfigSection step : root.sectionList("postprocessing_steps")) {
            postprocessing.add(steps.postprocessingStep(step));
        }

        DatasetType datasetType;
        int maxResolution;
        Integer aggregationResolution = null;
        if (!aggregations.isEmpty()) {
            if (!root.has("aggregation_resolution")) {
                throw root.missing("aggregation_resolution");
            }
            aggregationResolution = resolution(root, "aggregation_resolution");
            aggregationEngine.outputColumns(reading.dataColumns(), aggregations);
            datasetType = DatasetType.H3_INDEX;
            maxResolution = aggregationResolution;
            if (output.has("dataset_type") && datasetType(output, "dataset_type") != DatasetType.H3_INDEX) {
                throw new ConfigurationException("Pipelines with aggregation steps produce h3_index datasets, output_step_params.dataset_type was "
                        + output.optionalString("dataset_type"));
            }
        } else {
            datasetType = output.has("dataset_type") ? datasetType(output, "dataset_type") : DatasetType.POINT;
            if (datasetType != DatasetType.POINT) {
                throw new ConfigurationException("Pipelines without aggregation steps produce point datasets, output_step_params.dataset_type was "
                        + output.optionalString("dataset_type"));
            }
            maxResolution = resolution(output, "max_resolution");
        }

        return new PipelineDefinition(
                datasetName(output, "dataset_name"),
                output.optionalString("description"),
                datasetType,
                databaseDir(output),
                mode(output),
                maxResolution,
                maxParallelism(output),
                steps.reader(readingStep),
                reading,
                preprocessing,
                null,
                null,
                aggregations,
                aggregationResolution,
                postprocessing);
    }

    private void checkInterval(ConfigSection section, ReadingSpec reading) {
        List<String> given = new ArrayList<>();
        if (reading.yearColumn() != null) {
            given.add(TemporalKey.YEAR);
        }
        if (reading.monthColumn() != null) {
            given.add(TemporalKey.MONTH);
        }
        if (reading.dayColumn() != null) {
            given.add(TemporalKey.DAY);
        }
        Interval derived = Interval.fromKeyColumns(given);
        if (!derived.getKeyColumns().equals(given)) {
            throw new ConfigurationException("Temporal columns " + given + " do not form a valid interval, use year, year+month or year+month+day");
        }
        if (section.has("interval")) {
            String value = section.optionalString("interval");
            Interval interval = Interval.fromValue(value)
                    .orElseThrow(() -> section.invalid("interval", value, "one of one_time, yearly, monthly, daily"));
            if (interval != derived) {
                throw new ConfigurationException("Interval " + interval + " requires the temporal columns " + interval.getKeyColumns()
                        + " but " + given + " were configured");
            }
        }
    }

    private InterpolationStrategy interpolation(ConfigSection section) {
        GeomeshConfiguration.LoadConfiguration defaults = config.getLoadConfiguration();
        String method = section.has("method") ? section.optionalString("method") : InverseDistanceStrategy.NAME;
        Integer numNeighbors = section.optionalInt("num_neighbors");
        int k = numNeighbors == null ? defaults.getNumNeighbors() : numNeighbors;
        if (k < 1) {
            throw section.invalid("num_neighbors", k, "at least 1");
        }
        if (InverseDistanceStrategy.NAME.equals(method)) {
            Double power = section.optionalDouble("power");
            double p = power == null ? defaults.getPower() : power;
            if (p < 0 || !Double.isFinite(p)) {
                throw section.invalid("power", p, "a non-negative number");
            }
            return new InverseDistanceStrategy(k, p);
        }
        if (NearestNeighbourStrategy.NAME.equals(method)) {
            return new NearestNeighbourStrategy(k);
        }
        throw section.invalid("method", method, "one of " + InverseDistanceStrategy.NAME + ", " + NearestNeighbourStrategy.NAME);
    }

    private String datasetName(ConfigSection section, String key) {
        String name = section.requireString(key);
        if (!DATASET_NAME.matcher(name).matches() || MetadataService.METADATA_DB_NAME.equals(name)) {
            throw section.invalid(key, name, "a name of letters, digits, '_' and '-' other than " + MetadataService.METADATA_DB_NAME);
        }
        return name;
    }

    private DatasetType datasetType(ConfigSection section, String key) {
        String value = section.requireString(key);
        return DatasetType.fromValue(value).orElseThrow(() -> section.invalid(key, value, "one of h3, point, h3_index"));
    }

    private int resolution(ConfigSection section, String key) {
        int resolution = section.requireInt(key);
        if (resolution < GridIndex.MIN_RESOLUTION || resolution > GridIndex.MAX_RESOLUTION) {
            throw section.invalid(key, resolution, "between " + GridIndex.MIN_RESOLUTION + " and " + GridIndex.MAX_RESOLUTION);
        }
        return resolution;
    }

    private List<String> dataColumns(ConfigSection section) {
        List<String> columns = section.stringList("data_columns");
        if (columns.isEmpty()) {
            throw section.missing("data_columns");
        }
        for (String column : columns) {
            if (!COLUMN_NAME.matcher(column).matches()) {
                throw section.invalid("data_columns", column, "column names of letters, digits and '_'");
            }
        }
        return columns;
    }

    private Path filePath(ConfigSection section) {
        return Paths.get(section.requireString("file_path"));
    }

    private Path databaseDir(ConfigSection section) {
        String dir = section.optionalString("database_dir");
        return Paths.get(dir == null || dir.isBlank() ? config.getDatabaseDir() : dir);
    }

    private WriteMode mode(ConfigSection section) {
        if (!section.has("mode")) {
            return WriteMode.CREATE;
        }
        String value = section.optionalString("mode");
        WriteMode mode = WriteMode.fromValue(value);
        if (mode == null) {
            throw section.invalid("mode", value, "create or insert");
        }
        return mode;
    }

    private int maxParallelism(ConfigSection section) {
        Integer value = section.optionalInt("max_parallelism");
        int parallelism = value == null ? config.getLoadConfiguration().getMaxParallelism() : value;
        if (parallelism < 1) {
            throw section.invalid("max_parallelism", parallelism, "at least 1");
        }
        return parallelism;
    }
}
