package com.dedicatedcode.geomesh.service.loader.output;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.exception.DatasetExistsException;
import com.dedicatedcode.geomesh.exception.SchemaMismatchException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.model.WriteMode;
import com.dedicatedcode.geomesh.store.DatasetSchema;
import com.dedicatedcode.geomesh.store.DatasetStore;
import com.dedicatedcode.geomesh.store.RocksDatasetStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputWriterTest {

    private static final long CELL = 0x841f8d7ffffffffL;

    @TempDir
    Path tempDir;

    private final RocksDatasetStorage storage = new RocksDatasetStorage(new ObjectMapper());
    private final OutputWriter outputWriter = new OutputWriter(storage);

    @Test
    void testInsertAppendsToExistingDataset() {
        DatasetSchema schema = indexSchema(4);
        outputWriter.write(tempDir, schema, List.of(row(2020, 1.0)), WriteMode.CREATE);
        outputWriter.write(tempDir, schema, List.of(row(2021, 2.0)), WriteMode.INSERT);

        try (DatasetStore store = storage.openReadOnly(tempDir, "flood")) {
            assertEquals(2, store.rowsForCell(CELL).size());
        }
    }

    @Test
    void testCreateOnExistingDatasetFails() {
        outputWriter.write(tempDir, indexSchema(4), List.of(row(2020, 1.0)), WriteMode.CREATE);
        assertThrows(DatasetExistsException.class,
                () -> outputWriter.write(tempDir, indexSchema(4), List.of(row(2020, 1.0)), WriteMode.CREATE));
    }

    @Test
    void testInsertIntoMissingDatasetFails() {
        assertThrows(UnknownDatasetException.class,
                () -> outputWriter.write(tempDir, indexSchema(4), List.of(row(2020, 1.0)), WriteMode.INSERT));
    }

    @Test
    void testInsertWithDifferentColumnsFails() {
        outputWriter.write(tempDir, indexSchema(4), List.of(row(2020, 1.0)), WriteMode.CREATE);
        DatasetSchema other = new DatasetSchema("flood", DatasetType.H3_INDEX, 4,
                Map.of("rainfall", ColumnType.DOUBLE), Map.of("year", ColumnType.INTEGER));
        assertThrows(SchemaMismatchException.class,
                () -> outputWriter.write(tempDir, other, List.of(), WriteMode.INSERT));
    }

    @Test
    void testInsertWithDifferentResolutionFails() {
        outputWriter.write(tempDir, indexSchema(4), List.of(row(2020, 1.0)), WriteMode.CREATE);
        assertThrows(SchemaMismatchException.class,
                () -> outputWriter.write(tempDir, indexSchema(5), List.of(), WriteMode.INSERT));
    }

    @Test
    void testInsertIntoH3DatasetWithoutTemporalKeyFails() {
        DatasetSchema schema = new DatasetSchema("static", DatasetType.H3, 2, Map.of("depth", ColumnType.DOUBLE), Map.of());
        outputWriter.write(tempDir, schema, List.of(), WriteMode.CREATE);
        assertThrows(ConfigurationException.class,
                () -> outputWriter.write(tempDir, schema, List.of(), WriteMode.INSERT));
    }

    private static DatasetSchema indexSchema(int resolution) {
        return new DatasetSchema("flood", DatasetType.H3_INDEX, resolution,
                Map.of("depth", ColumnType.DOUBLE), Map.of("year", ColumnType.INTEGER));
    }

    private static IndexedRow row(int year, double depth) {
        return IndexedRow.forCell(CELL, 50.0, 10.0, new TemporalKey(year, null, null), Map.of("depth", depth));
    }
}
