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

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.service.loader.aggregation.Aggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.CountWithinBoundsAggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.MaxAggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.MeanAggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.MedianAggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.MinAggregation;
import com.dedicatedcode.geomesh.service.loader.postprocessing.AddConstantColumnStep;
import com.dedicatedcode.geomesh.service.loader.postprocessing.MultiplyValueStep;
import com.dedicatedcode.geomesh.service.loader.postprocessing.PostprocessingStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.PreprocessingStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.RegionFilterStep;
import com.dedicatedcode.geomesh.service.loader.reading.CsvRecordReader;
import com.dedicatedcode.geomesh.service.loader.reading.ParquetRecordReader;
import com.dedicatedcode.geomesh.service.loader.reading.RawRecordReader;
import com.dedicatedcode.geomesh.service.region.RegionService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves the step kinds of a pipeline file to step instances.
 * <p>
 * A step names its kind with {@code type}, or with {@code class_name} holding the class name of the step,
 * optionally qualified with a module path ({@code loader.aggregation_step.MinAggregation}).
 * New step variants are registered here and nowhere else.
 */
@Component
public class PipelineSteps {

    public static final String OUTPUT_ROCKSDB = "rocksdb";

    private final Map<String, Supplier<RawRecordReader>> readers = new LinkedHashMap<>();
    private final Map<String, Function<ConfigSection, PreprocessingStep>> preprocessing = new LinkedHashMap<>();
    private final Map<String, Function<ConfigSection, Aggregation>> aggregations = new LinkedHashMap<>();
    private final Map<String, Function<ConfigSection, PostprocessingStep>> postprocessing = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    public PipelineSteps(RegionService regionService) {
        readers.put("csv", CsvRecordReader::new);
        readers.put("parquet", ParquetRecordReader::new);
        alias("CSVLoader", "csv");
        alias("CsvFileReader", "csv");
        alias("ParquetLoader", "parquet");
        alias("ParquetFileReader", "parquet");

        preprocessing.put("shapefile_filter", step -> new RegionFilterStep(
                regionService.restrictor(step.requireString("shapefile_path"), step.optionalString("region"))));
        alias("ShapefileFilter", "shapefile_filter");

        aggregations.put("min", step -> new MinAggregation());
        aggregations.put("max", step -> new MaxAggregation());
        aggregations.put("mean", step -> new MeanAggregation());
        aggregations.put("median", step -> new MedianAggregation());
        aggregations.put("count_within_bounds", step -> new CountWithinBoundsAggregation(
                step.optionalDouble("min"), step.optionalDouble("max")));
        alias("MinAggregation", "min");
        alias("MaxAggregation", "max");
        alias("MeanAggregation", "mean");
        alias("MedianAggregation", "median");
        alias("CountWithinBounds", "count_within_bounds");

        postprocessing.put("add_constant_column", step -> {
            if (!step.has("column_value")) {
                throw step.missing("column_value");
            }
            return new AddConstantColumnStep(step.requireString("column_name"), step.raw("column_value"));
        });
        postprocessing.put("multiply_value", step -> new MultiplyValueStep(step.requireDouble("multiply_by")));
        alias("AddConstantColumn", "add_constant_column");
        alias("MultiplyValue", "multiply_value");

        alias("LocalDuckdbOutputStep", OUTPUT_ROCKSDB);
        alias("RocksDbOutputStep", OUTPUT_ROCKSDB);
    }

    public RawRecordReader reader(String kind) {
        Supplier<RawRecordReader> factory = readers.get(canonical(kind));
        if (factory == null) {
            throw unknown("reading step", kind, readers.keySet());
        }
        return factory.get();
    }

    public PreprocessingStep preprocessingStep(ConfigSection step) {
        return create(step, "preprocessing step", preprocessing);
    }

    public Aggregation aggregation(ConfigSection step) {
        return create(step, "aggregation step", aggregations);
    }

    public PostprocessingStep postprocessingStep(ConfigSection step) {
        return create(step, "postprocessing step", postprocessing);
    }

    public void checkOutput(String kind) {
        if (!OUTPUT_ROCKSDB.equals(canonical(kind))) {
            throw unknown("output step", kind, List.of(OUTPUT_ROCKSDB));
        }
    }

    private <T> T create(ConfigSection step, String category, Map<String, Function<ConfigSection, T>> factories) {
        String kind = step.has("type") ? step.optionalString("type") : step.optionalString("class_name");
        if (kind == null) {
            throw new ConfigurationException(category + " " + step.getName() + " names no type, known types are: " + factories.keySet());
        }
        Function<ConfigSection, T> factory = factories.get(canonical(kind));
        if (factory == null) {
            throw unknown(category, kind, factories.keySet());
        }
        return factory.apply(step);
    }

    private void alias(String className, String kind) {
        aliases.put(className, kind);
    }

    private String canonical(String kind) {
        if (kind == null) {
            return null;
        }
        String name = kind.trim();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            name = name.substring(dot + 1);
        }
        String aliased = aliases.get(name);
        return aliased != null ? aliased : name.toLowerCase();
    }

    private static ConfigurationException unknown(String category, String kind, Iterable<String> known) {
        return new ConfigurationException("Unknown " + category + " '" + kind + "', known types are: " + String.join(", ", known));
    }
}
