package com.dedicatedcode.geomesh.service.loader.aggregation;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.model.TemporalKey;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.loader.LoadStatistics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class CellAggregationEngineTest {

    private static final TemporalKey Y2020 = new TemporalKey(2020, null, null);
    private static final TemporalKey Y2021 = new TemporalKey(2021, null, null);

    private final GridIndex gridIndex = new GridIndex();
    private final CellAggregationEngine engine = new CellAggregationEngine(gridIndex);
    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testOutputColumns() {
        List<String> columns = engine.outputColumns(List.of("t", "r"),
                List.of(new MinAggregation(), new CountWithinBoundsAggregation(0.0, 1.0)));
        assertEquals(List.of("t_min", "t_within_bounds_0_1", "r_min", "r_within_bounds_0_1"), columns);
    }

    @Test
    void testDuplicateOutputColumnFails() {
        assertThrows(ConfigurationException.class,
                () -> engine.outputColumns(List.of("t"), List.of(new MinAggregation(), new MinAggregation())));
    }

    @Test
    void testGroupsByTemporalKeyAndCell() {
        List<RawRecord> records = List.of(
                new RawRecord(50.20, 10.20, Y2020, Map.of("t", 1.0)),
                new RawRecord(50.20, 10.20, Y2020, Map.of("t", 3.0)),
                new RawRecord(40.50, 10.50, Y2020, Map.of("t", 8.0)),
                new RawRecord(50.20, 10.20, Y2021, Map.of("t", 5.0)));
        long north = gridIndex.cellForPoint(50.20, 10.20, 5);

        LoadStatistics statistics = new LoadStatistics();
        List<IndexedRow> rows = engine.aggregate(records, List.of("t"),
                List.of(new MeanAggregation(), new MaxAggregation()), 5, executor, 2, statistics);

        assertEquals(3, rows.size());
        IndexedRow northRow = rows.stream()
                .filter(r -> r.cell() == north && r.temporalKey().equals(Y2020))
                .findFirst().orElseThrow();
        assertEquals(2.0, northRow.numericValue("t_mean"));
        assertEquals(3.0, northRow.numericValue("t_max"));
        assertEquals(Y2021, rows.get(2).temporalKey());
        assertEquals(3, statistics.getCellsEvaluated());
    }

    @Test
    void testCellsAreOrderedWithinTemporalGroup() {
        List<RawRecord> records = List.of(
                new RawRecord(50.2, 10.2, Y2020, Map.of("t", 1.0)),
                new RawRecord(-33.9, 151.2, Y2020, Map.of("t", 1.0)),
                new RawRecord(40.7, -74.0, Y2020, Map.of("t", 1.0)));
        List<IndexedRow> rows = engine.aggregate(records, List.of("t"), List.of(new MinAggregation()), 3, executor, 2, new LoadStatistics());

        assertEquals(3, rows.size());
        assertTrue(rows.get(0).cell() < rows.get(1).cell());
        assertTrue(rows.get(1).cell() < rows.get(2).cell());
    }

    @Test
    void testMissingColumnValues() {
        List<RawRecord> records = List.of(new RawRecord(50.2, 10.2, Y2020, Map.of("t", 1.0)));
        List<IndexedRow> rows = engine.aggregate(records, List.of("t", "r"),
                List.of(new MinAggregation(), new CountWithinBoundsAggregation(0.0, null)), 4, executor, 1, new LoadStatistics());

        Map<String, Object> values = rows.get(0).values();
        assertEquals(1.0, values.get("t_min"));
        assertEquals(1.0, values.get("t_within_bounds_0_none"));
        assertFalse(values.containsKey("r_min"));
        assertEquals(0.0, values.get("r_within_bounds_0_none"));
    }

    @Test
    void testNoAggregationFails() {
        assertThrows(ConfigurationException.class,
                () -> engine.aggregate(List.of(), List.of("t"), List.of(), 4, executor, 1, new LoadStatistics()));
    }
}
