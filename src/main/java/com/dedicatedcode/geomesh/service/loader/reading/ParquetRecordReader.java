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

import com.dedicatedcode.geomesh.exception.StorageException;
import com.dedicatedcode.geomesh.model.RawRecord;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads flat Parquet files from the local file system. Only primitive top level columns are considered.
 */
public class ParquetRecordReader extends TabularRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(ParquetRecordReader.class);

    @Override
    public List<RawRecord> read(ReadingSpec spec) {
        List<RawRecord> records = new ArrayList<>();
        try (ParquetFileReader reader = ParquetFileReader.open(new LocalInputFile(spec.filePath()))) {
            MessageType schema = reader.getFooter().getFileMetaData().getSchema();
            List<String> available = schema.getFields().stream().map(Type::getName).toList();
            checkColumns(spec, available);

            MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
            long rowNumber = 0;
            PageReadStore rowGroup;
            while ((rowGroup = reader.readNextRowGroup()) != null) {
                RecordReader<Group> recordReader = columnIO.getRecordReader(rowGroup, new GroupRecordConverter(schema));
                for (long i = 0; i < rowGroup.getRowCount(); i++) {
                    Group group = recordReader.read();
                    rowNumber++;
                    records.add(toRecord(spec, rowNumber, column -> value(group, schema, column)));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Could not read Parquet file " + spec.filePath() + ": " + e.getMessage(), e);
        }
        logger.info("Read {} records from {}", records.size(), spec.filePath());
        return records;
    }

    private Object value(Group group, MessageType schema, String column) {
        int index = schema.getFieldIndex(column);
        Type type = schema.getType(index);
        if (!type.isPrimitive() || group.getFieldRepetitionCount(index) == 0) {
            return null;
        }
        PrimitiveType.PrimitiveTypeName primitive = type.asPrimitiveType().getPrimitiveTypeName();
        switch (primitive) {
            case DOUBLE:
                return group.getDouble(index, 0);
            case FLOAT:
                return group.getFloat(index, 0);
            case INT32:
                return group.getInteger(index, 0);
            case INT64:
                return group.getLong(index, 0);
            case BOOLEAN:
                return group.getBoolean(index, 0);
            case BINARY:
            case FIXED_LEN_BYTE_ARRAY:
                return group.getString(index, 0);
            default:
                return group.getValueToString(index, 0);
        }
    }
}
