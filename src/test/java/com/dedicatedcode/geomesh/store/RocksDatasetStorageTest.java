package com.dedicatedcode.geomesh.store;

import com.dedicatedcode.geomesh.exception.DatasetExistsException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RocksDatasetStorageTest {

    @TempDir
    Path tempDir;

    private final RocksDatasetStorage storage = new RocksDatasetStorage(new ObjectMapper());

    private final DatasetSchema schema = new DatasetSchema("temperature", DatasetType.H3, 3,
            Map.of("temperature", ColumnType.DOUBLE), Map.of("year", ColumnType.INTEGER));

    @Test
    void testCreateAndReadRowsOfCell() {
        List<IndexedRow> rows = List.of(
                IndexedRow.forCell(0x831f8dfffffffffL, 50.0, 10.0, new TemporalKey(2020, null, null), Map.of("temperature", 1.5)),
                IndexedRow.forCell(0x831f8dfffffffffL, 50.0, 10.0, new TemporalKey(2021, null, null), Map.of("temperature", 2.5)),
                IndexedRow.forCell(0x831f89fffffffffL, 51.0, 10.0, new TemporalKey(2020, null, null), Map.of("temperature", 3.5)));
        storage.create(tempDir, schema, rows);

        assertTrue(storage.exists(tempDir, "temperature"));
        assertEquals(schema, storage.readSchema(tempDir, "temperature").orElseThrow());
        try (DatasetStore store = storage.openReadOnly(tempDir, "temperature")) {
            List<IndexedRow> cellRows = store.rowsForCell(0x831f8dfffffffffL);
            assertEquals(2, cellRows.size());
            assertEquals(2020, cellRows.get(0).temporalKey().year());
            assertEquals(2.5, cellRows.get(1).numericValue("temperature"));

            List<IndexedRow> all = new ArrayList<>();
            store.forEachRow(all::add);
            assertEquals(3, all.size());
        }
    }

    @Test
    void testCreateTwiceFails() {
        storage.create(tempDir, schema, List.of());
        assertThrows(DatasetExistsException.class, () -> storage.create(tempDir, schema, List.of()));
    }

    @Test
    void testAppendKeepsExistingRows() {
        storage.create(tempDir, schema, List.of(
                IndexedRow.forCell(0x831f8dfffffffffL, 50.0, 10.0, new TemporalKey(2020, null, null), Map.of("temperature", 1.0))));
        storage.append(tempDir, "temperature", List.of(
                IndexedRow.forCell(0x831f8dfffffffffL, 50.0, 10.0, new TemporalKey(2021, null, null), Map.of("temperature", 2.0))));

        try (DatasetStore store = storage.openReadOnly(tempDir, "temperature")) {
            List<IndexedRow> rows = store.rowsForCell(0x831f8dfffffffffL);
            assertEquals(2, rows.size());
            assertEquals(1.0, rows.get(0).numericValue("temperature"));
            assertEquals(2.0, rows.get(1).numericValue("temperature"));
        }
    }

    @Test
    void testDeleteRemovesStore() {
        storage.create(tempDir, schema, List.of(
                IndexedRow.forCell(0x831f8dfffffffffL, 50.0, 10.0, new TemporalKey(2020, null, null), Map.of("temperature", 1.0))));

        storage.delete(tempDir, "temperature");

        assertFalse(storage.exists(tempDir, "temperature"));
        storage.delete(tempDir, "temperature");
        storage.create(tempDir, schema, List.of());
        assertTrue(storage.exists(tempDir, "temperature"));
    }

    @Test
    void testAppendToMissingDatasetFails() {
        assertThrows(UnknownDatasetException.class, () -> storage.append(tempDir, "missing", List.of()));
        assertFalse(storage.exists(tempDir, "missing"));
    }

    @Test
    void testPointRowsKeepTheirCells() {
        DatasetSchema pointSchema = new DatasetSchema("wells", DatasetType.POINT, 2, Map.of("depth", ColumnType.DOUBLE), Map.of());
        IndexedRow row = IndexedRow.forPoint(50.5, 10.5, TemporalKey.NONE, Map.of("depth", 12.0), List.of(1L, 2L, 3L));
        storage.create(tempDir, pointSchema, List.of(row, row));

        try (DatasetStore store = storage.openReadOnly(tempDir, "wells")) {
            List<IndexedRow> all = new ArrayList<>();
            store.forEachRow(all::add);
            assertEquals(2, all.size());
            assertTrue(all.get(0).isPointRow());
            assertEquals(Long.valueOf(2L), all.get(0).cellAt(1));
            assertTrue(all.get(0).temporalKey().isEmpty());
        }
    }
}
