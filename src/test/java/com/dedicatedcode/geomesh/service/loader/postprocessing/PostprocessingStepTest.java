package com.dedicatedcode.geomesh.service.loader.postprocessing;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.TemporalKey;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostprocessingStepTest {

    private final IndexedRow row = IndexedRow.forCell(0x831f8dfffffffffL, 50.0, 10.0, TemporalKey.NONE,
            new LinkedHashMap<>(Map.of("depth", 2.0)));

    @Test
    void testAddConstantColumnTypes() {
        assertEquals(ColumnType.BIGINT, new AddConstantColumnStep("c", 3).getColumnType());
        assertEquals(ColumnType.DOUBLE, new AddConstantColumnStep("c", 3.5).getColumnType());
        assertEquals(ColumnType.BOOLEAN, new AddConstantColumnStep("c", true).getColumnType());
        assertEquals(ColumnType.VARCHAR, new AddConstantColumnStep("c", "station").getColumnType());
    }

    @Test
    void testAddConstantColumn() {
        AddConstantColumnStep step = new AddConstantColumnStep("source", "station");
        List<IndexedRow> rows = step.run(List.of(row));

        assertEquals("station", rows.get(0).values().get("source"));
        assertEquals(2.0, rows.get(0).values().get("depth"));
        assertEquals(Map.of("depth", ColumnType.DOUBLE, "source", ColumnType.VARCHAR),
                step.transformSchema(Map.of("depth", ColumnType.DOUBLE)));
    }

    @Test
    void testAddConstantColumnValidatesName() {
        assertThrows(ConfigurationException.class, () -> new AddConstantColumnStep("bad name", 1));
        assertThrows(ConfigurationException.class, () -> new AddConstantColumnStep("ok", null));
    }

    @Test
    void testMultiplyValueLeavesTextAlone() {
        IndexedRow withText = new AddConstantColumnStep("source", "station").run(List.of(row)).get(0);
        MultiplyValueStep step = new MultiplyValueStep(100);
        IndexedRow result = step.run(List.of(withText)).get(0);

        assertEquals(200.0, result.values().get("depth"));
        assertEquals("station", result.values().get("source"));
        assertEquals(Map.of("depth", ColumnType.DOUBLE, "n", ColumnType.DOUBLE, "source", ColumnType.VARCHAR),
                step.transformSchema(Map.of("depth", ColumnType.DOUBLE, "n", ColumnType.INTEGER, "source", ColumnType.VARCHAR)));
    }
}
