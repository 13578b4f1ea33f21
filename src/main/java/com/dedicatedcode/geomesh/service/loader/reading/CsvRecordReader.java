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

package com.dedicatedcode.geomesh.service.loader.reading;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.exception.StorageException;
import com.dedicatedcode.geomesh.model.RawRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads comma separated files, with or without a header row. Without header the {@code columns} mapping
 * of the pipeline file gives the column order.
 */
public class CsvRecordReader extends TabularRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(CsvRecordReader.class);

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public List<RawRecord> read(ReadingSpec spec) {
        CsvSchema schema;
        if (spec.hasHeaderRow()) {
            schema = CsvSchema.emptySchema().withHeader();
        } else {
            if (spec.columns().isEmpty()) {
                throw new ConfigurationException("CSV file " + spec.filePath() + " has no header row, parameter columns is mandatory");
            }
            CsvSchema.Builder builder = CsvSchema.builder();
            spec.columns().keySet().forEach(builder::addColumn);
            schema = builder.build().withoutHeader();
        }

        List<RawRecord> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> iterator = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(spec.filePath().toFile())) {
            boolean checked = false;
            long rowNumber = 0;
            while (iterator.hasNextValue()) {
                Map<String, String> row = iterator.nextValue();
                rowNumber++;
                if (!checked) {
                    checkColumns(spec, row.keySet());
                    checked = true;
                }
                records.add(toRecord(spec, rowNumber, row::get));
            }
        } catch (IOException e) {
            throw new StorageException("Could not read CSV file " + spec.filePath() + ": " + e.getMessage(), e);
        }
        logger.info("Read {} records from {}", records.size(), spec.filePath());
        return records;
    }
}
