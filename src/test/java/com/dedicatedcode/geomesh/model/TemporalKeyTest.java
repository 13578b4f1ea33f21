package com.dedicatedcode.geomesh.model;

import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.exception.MissingTemporalKeyException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemporalKeyTest {

    @Test
    void testQueryKeyKeepsComponentsOfInterval() {
        assertEquals(new TemporalKey(2020, null, null), TemporalKey.forQuery(Interval.YEARLY, 2020, 5, 3));
        assertEquals(new TemporalKey(2020, 5, null), TemporalKey.forQuery(Interval.MONTHLY, 2020, 5, null));
        assertEquals(TemporalKey.NONE, TemporalKey.forQuery(Interval.ONE_TIME, 2020, null, null));
    }

    @Test
    void testQueryKeyNeedsEveryComponentOfInterval() {
        assertThrows(MissingTemporalKeyException.class, () -> TemporalKey.forQuery(Interval.YEARLY, null, null, null));
        assertThrows(MissingTemporalKeyException.class, () -> TemporalKey.forQuery(Interval.MONTHLY, 2020, null, null));
        assertThrows(MissingTemporalKeyException.class, () -> TemporalKey.forQuery(Interval.DAILY, 2020, 5, null));
    }

    @Test
    void testMatches() {
        TemporalKey stored = new TemporalKey(2020, 5, 3);
        assertTrue(TemporalKey.NONE.matches(stored));
        assertTrue(new TemporalKey(2020, null, null).matches(stored));
        assertTrue(new TemporalKey(2020, 5, 3).matches(stored));
        assertFalse(new TemporalKey(2021, null, null).matches(stored));
        assertFalse(new TemporalKey(2020, 5, 3).matches(TemporalKey.NONE));
    }

    @Test
    void testIntervalFromKeyColumns() {
        assertEquals(Interval.ONE_TIME, Interval.fromKeyColumns(List.of()));
        assertEquals(Interval.YEARLY, Interval.fromKeyColumns(List.of("year", "station")));
        assertEquals(Interval.MONTHLY, Interval.fromKeyColumns(List.of("month", "year")));
        assertEquals(Interval.DAILY, Interval.fromKeyColumns(List.of("year", "month", "day")));
        assertEquals(Interval.ONE_TIME, Interval.fromKeyColumns(List.of("month")));
    }

    @Test
    void testIntervalParse() {
        assertEquals(Interval.MONTHLY, Interval.parse(" Monthly "));
        assertTrue(Interval.fromValue("weekly").isEmpty());
        assertThrows(InvalidArgumentException.class, () -> Interval.parse("weekly"));
    }

    @Test
    void testColumnTypeAliases() {
        assertEquals(ColumnType.DOUBLE, ColumnType.parse("float8"));
        assertEquals(ColumnType.INTEGER, ColumnType.parse("int"));
        assertEquals(ColumnType.VARCHAR, ColumnType.parse("text"));
        assertFalse(ColumnType.VARCHAR.isNumeric());
        assertThrows(InvalidArgumentException.class, () -> ColumnType.parse("geometry"));
    }

    @Test
    void testDatasetType() {
        assertEquals(DatasetType.H3_INDEX, DatasetType.parse("h3_index"));
        assertTrue(DatasetType.H3.isCellBased());
        assertFalse(DatasetType.POINT.isCellBased());
        assertTrue(DatasetType.fromValue("raster").isEmpty());
    }
}
