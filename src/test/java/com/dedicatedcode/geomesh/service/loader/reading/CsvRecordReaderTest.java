package com.dedicatedcode.geomesh.service.loader.reading;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.model.TemporalKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvRecordReaderTest {

    private final CsvRecordReader reader = new CsvRecordReader();

    @Test
    void testReadWithHeaderRow() {
        ReadingSpec spec = new ReadingSpec("csv", Path.of("src/test/resources/samples.csv"), true, null,
                List.of("temperature", "rainfall"), "year", null, null);

        List<RawRecord> records = reader.read(spec);
        assertEquals(6, records.size());

        RawRecord first = records.get(0);
        assertEquals(50.2, first.latitude(), 1e-9);
        assertEquals(10.2, first.longitude(), 1e-9);
        assertEquals(new TemporalKey(2020, null, null), first.temporalKey());
        assertEquals(10.0, first.values().get("temperature"));
        assertEquals(1.0, first.values().get("rainfall"));
    }

    @Test
    void testMissingValueIsAbsent() {
        ReadingSpec spec = new ReadingSpec("csv", Path.of("src/test/resources/samples.csv"), true, null,
                List.of("temperature", "rainfall"), "year", null, null);

        RawRecord third = reader.read(spec).get(2);
        assertEquals(12.0, third.values().get("temperature"));
        assertFalse(third.values().containsKey("rainfall"));
    }

    @Test
    void testReadWithoutHeaderRowUsesColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("latitude", "double");
        columns.put("longitude", "double");
        columns.put("value", "double");
        ReadingSpec spec = new ReadingSpec("csv", Path.of("src/test/resources/samples_no_header.csv"), false, columns,
                List.of("value"), null, null, null);

        List<RawRecord> records = reader.read(spec);
        assertEquals(2, records.size());
        assertEquals(14.0, records.get(1).values().get("value"));
        assertTrue(records.get(1).temporalKey().isEmpty());
    }

    @Test
    void testWithoutHeaderRowColumnsAreMandatory() {
        ReadingSpec spec = new ReadingSpec("csv", Path.of("src/test/resources/samples_no_header.csv"), false, null,
                List.of("value"), null, null, null);
        assertThrows(ConfigurationException.class, () -> reader.read(spec));
    }

    @Test
    void testMissingDataColumnFails() {
        ReadingSpec spec = new ReadingSpec("csv", Path.of("src/test/resources/samples.csv"), true, null,
                List.of("humidity"), null, null, null);
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> reader.read(spec));
        assertTrue(e.getMessage().contains("humidity"));
    }

    @Test
    void testNonNumericValueFails(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("broken.csv");
        Files.writeString(file, "latitude,longitude,value\n50.0,10.0,high\n");
        ReadingSpec spec = new ReadingSpec("csv", file, true, null, List.of("value"), null, null, null);
        InvalidArgumentException exception = assertThrows(InvalidArgumentException.class, () -> reader.read(spec));
        assertTrue(exception.getMessage().contains("column value"));
    }

    @Test
    void testFractionalYearFails(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("years.csv");
        Files.writeString(file, "latitude,longitude,year,value\n50.0,10.0,2020.5,1.0\n");
        ReadingSpec spec = new ReadingSpec("csv", file, true, null, List.of("value"), "year", null, null);
        assertThrows(InvalidArgumentException.class, () -> reader.read(spec));
    }
}
