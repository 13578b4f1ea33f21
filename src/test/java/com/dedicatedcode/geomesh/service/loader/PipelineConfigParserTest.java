package com.dedicatedcode.geomesh.service.loader;

import com.dedicatedcode.geomesh.GeomeshFixture;
import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.exception.RegionNotFoundException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.WriteMode;
import com.dedicatedcode.geomesh.service.loader.aggregation.CountWithinBoundsAggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.MaxAggregation;
import com.dedicatedcode.geomesh.service.loader.aggregation.MinAggregation;
import com.dedicatedcode.geomesh.service.loader.interpolation.InverseDistanceStrategy;
import com.dedicatedcode.geomesh.service.loader.interpolation.NearestNeighbourStrategy;
import com.dedicatedcode.geomesh.service.loader.postprocessing.AddConstantColumnStep;
import com.dedicatedcode.geomesh.service.loader.preprocessing.RegionFilterStep;
import com.dedicatedcode.geomesh.service.loader.reading.CsvRecordReader;
import com.dedicatedcode.geomesh.service.loader.reading.ParquetRecordReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigParserTest {

    private static final String SIMPLE = """
            loader_type: csv
            dataset_name: temperature
            dataset_type: h3
            max_resolution: 3
            data_columns: [temperature]
            year_column: year
            file_path: src/test/resources/samples.csv
            """;

    private static final String ADVANCED = """
            reading_step: csv
            reading_step_params:
              file_path: src/test/resources/samples.csv
              data_columns: [temperature]
              key_columns: [year]
            aggregation_steps:
              - type: mean
            aggregation_resolution: 4
            output_step: rocksdb
            output_step_params:
              dataset_name: temperature_index
            """;

    @TempDir
    Path tempDir;

    private GeomeshFixture fixture;
    private PipelineConfigParser parser;

    @BeforeEach
    void setUp() {
        fixture = new GeomeshFixture(tempDir);
        parser = fixture.parser;
    }

    @Test
    void testParseSimplePipelineFile() {
        PipelineDefinition pipeline = parser.parse(Path.of("src/test/resources/pipelines/simple_h3.yml"));

        assertEquals("temperature", pipeline.datasetName());
        assertEquals("Yearly temperature", pipeline.description());
        assertEquals(DatasetType.H3, pipeline.datasetType());
        assertEquals(3, pipeline.maxResolution());
        assertEquals(2, pipeline.maxParallelism());
        assertEquals(WriteMode.CREATE, pipeline.mode());
        assertEquals(fixture.databaseDir(), pipeline.databaseDir());
        assertInstanceOf(CsvRecordReader.class, pipeline.reader());
        assertEquals(List.of("temperature"), pipeline.reading().dataColumns());
        assertEquals(Map.of("year", ColumnType.INTEGER), pipeline.keyColumns());
        assertNotNull(pipeline.targetRegion());
        assertTrue(pipeline.preprocessingSteps().isEmpty());

        InverseDistanceStrategy strategy = assertInstanceOf(InverseDistanceStrategy.class, pipeline.interpolation());
        assertEquals(2, strategy.getNumNeighbors());
        assertEquals(2.0, strategy.getPower());
    }

    @Test
    void testParseAdvancedPipelineFile() {
        PipelineDefinition pipeline = parser.parse(Path.of("src/test/resources/pipelines/advanced_index.yml"));

        assertEquals("temperature_index", pipeline.datasetName());
        assertEquals(DatasetType.H3_INDEX, pipeline.datasetType());
        assertEquals(4, pipeline.maxResolution());
        assertEquals(4, pipeline.aggregationResolution());
        assertEquals(1, pipeline.preprocessingSteps().size());
        assertInstanceOf(RegionFilterStep.class, pipeline.preprocessingSteps().get(0));
        assertEquals(3, pipeline.aggregations().size());
        assertInstanceOf(MinAggregation.class, pipeline.aggregations().get(0));
        assertInstanceOf(MaxAggregation.class, pipeline.aggregations().get(1));
        assertInstanceOf(CountWithinBoundsAggregation.class, pipeline.aggregations().get(2));
        assertEquals("within_bounds_11_none", pipeline.aggregations().get(2).suffix());
        AddConstantColumnStep constant = assertInstanceOf(AddConstantColumnStep.class, pipeline.postprocessingSteps().get(0));
        assertEquals("source", constant.getColumnName());
        assertNull(pipeline.interpolation());
    }

    @Test
    void testSimpleDefaultsComeFromConfiguration() throws IOException {
        PipelineDefinition pipeline = parse(SIMPLE);

        InverseDistanceStrategy strategy = assertInstanceOf(InverseDistanceStrategy.class, pipeline.interpolation());
        assertEquals(fixture.config.getLoadConfiguration().getNumNeighbors(), strategy.getNumNeighbors());
        assertEquals(fixture.config.getLoadConfiguration().getPower(), strategy.getPower());
        assertEquals(2, pipeline.maxParallelism());
        assertNull(pipeline.targetRegion());
    }

    @Test
    void testNearestInterpolation() throws IOException {
        PipelineDefinition pipeline = parse(SIMPLE + "interpolation:\n  method: nearest\n");
        assertInstanceOf(NearestNeighbourStrategy.class, pipeline.interpolation());
    }

    @Test
    void testUnknownInterpolationMethodFails() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "interpolation:\n  method: kriging\n"));
    }

    @Test
    void testInvalidInterpolationParametersFail() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "interpolation:\n  num_neighbors: 0\n"));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "interpolation:\n  power: -1\n"));
    }

    @Test
    void testPointDatasetGetsRegionFilter() throws IOException {
        String yaml = SIMPLE.replace("dataset_type: h3", "dataset_type: point")
                + "shapefile: " + GeomeshFixture.REGIONS + "\nregion: south\n";
        PipelineDefinition pipeline = parse(yaml);

        assertEquals(DatasetType.POINT, pipeline.datasetType());
        assertNull(pipeline.targetRegion());
        assertNull(pipeline.interpolation());
        assertInstanceOf(RegionFilterStep.class, pipeline.preprocessingSteps().get(0));
    }

    @Test
    void testRegionWithoutShapefileFails() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "region: north\n"));
    }

    @Test
    void testUnknownRegionFails() throws IOException {
        assertThrows(RegionNotFoundException.class,
                () -> parse(SIMPLE + "shapefile: " + GeomeshFixture.REGIONS + "\nregion: west\n"));
    }

    @Test
    void testIndexTypeNeedsAdvancedForm() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE.replace("dataset_type: h3", "dataset_type: h3_index")));
    }

    @Test
    void testIntervalMustMatchTemporalColumns() throws IOException {
        assertEquals(DatasetType.H3, parse(SIMPLE + "interval: yearly\n").datasetType());
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "interval: monthly\n"));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "interval: weekly\n"));
    }

    @Test
    void testDayWithoutMonthFails() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "day_column: day\n"));
    }

    @Test
    void testInvalidFieldsFail() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE.replace("max_resolution: 3", "max_resolution: 16")));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE.replace("dataset_name: temperature", "dataset_name: dataset_metadata")));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE.replace("dataset_name: temperature", "dataset_name: my dataset")));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE.replace("data_columns: [temperature]", "data_columns: []")));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "mode: replace\n"));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE + "max_parallelism: 0\n"));
        assertThrows(ConfigurationException.class, () -> parse(SIMPLE.replace("loader_type: csv", "loader_type: geotiff")));
    }

    @Test
    void testDataColumnNamesAreValidated() throws IOException {
        ConfigurationException simple = assertThrows(ConfigurationException.class,
                () -> parse(SIMPLE.replace("data_columns: [temperature]", "data_columns: [temp-c]")));
        assertTrue(simple.getMessage().contains("temp-c"));
        assertThrows(ConfigurationException.class,
                () -> parse(ADVANCED.replace("data_columns: [temperature]", "data_columns: [temperature, rain fall]")));
    }

    @Test
    void testFormMustBeRecognisable() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse("dataset_name: temperature\n"));
        assertThrows(ConfigurationException.class, () -> parser.parse(tempDir.resolve("missing.yml")));
    }

    @Test
    void testReaderAliases() throws IOException {
        assertInstanceOf(CsvRecordReader.class, parse(SIMPLE.replace("loader_type: csv", "loader_type: CSVLoader")).reader());
        assertInstanceOf(ParquetRecordReader.class, parse(SIMPLE.replace("loader_type: csv", "loader_type: parquet")).reader());
    }

    @Test
    void testAdvancedAggregationNeedsResolution() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(ADVANCED.replace("aggregation_resolution: 4\n", "")));
    }

    @Test
    void testAdvancedDuplicateAggregationFails() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(ADVANCED.replace("  - type: mean\n",
                "  - type: mean\n  - class_name: loader.aggregation_step.MeanAggregation\n")));
    }

    @Test
    void testAdvancedUnknownStepFails() throws IOException {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> parse(ADVANCED.replace("  - type: mean\n", "  - type: mode\n")));
        assertTrue(e.getMessage().contains("mode"));
        assertThrows(ConfigurationException.class, () -> parse(ADVANCED.replace("output_step: rocksdb", "output_step: duckdb")));
    }

    @Test
    void testAdvancedOutputAlias() throws IOException {
        assertEquals("temperature_index",
                parse(ADVANCED.replace("output_step: rocksdb", "output_step: LocalDuckdbOutputStep")).datasetName());
    }

    @Test
    void testAdvancedKeyColumnsAreTemporal() throws IOException {
        assertThrows(ConfigurationException.class, () -> parse(ADVANCED.replace("key_columns: [year]", "key_columns: [station]")));
    }

    @Test
    void testAdvancedAggregationProducesIndexDataset() throws IOException {
        assertThrows(ConfigurationException.class,
                () -> parse(ADVANCED + "  dataset_type: h3\n"));
        assertEquals(DatasetType.H3_INDEX, parse(ADVANCED + "  dataset_type: h3_index\n").datasetType());
    }

    @Test
    void testAdvancedWithoutAggregationProducesPointDataset() throws IOException {
        String yaml = ADVANCED.replace("aggregation_steps:\n  - type: mean\naggregation_resolution: 4\n", "")
                + "  max_resolution: 6\n";
        PipelineDefinition pipeline = parse(yaml);

        assertEquals(DatasetType.POINT, pipeline.datasetType());
        assertEquals(6, pipeline.maxResolution());
        assertNull(pipeline.aggregationResolution());
        assertThrows(ConfigurationException.class, () -> parse(yaml.replace("  max_resolution: 6\n", "")));
    }

    private PipelineDefinition parse(String yaml) throws IOException {
        Path file = Files.createTempFile(tempDir, "pipeline", ".yml");
        Files.writeString(file, yaml);
        return parser.parse(file);
    }
}
