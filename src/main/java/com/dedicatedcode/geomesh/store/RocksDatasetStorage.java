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

package com.dedicatedcode.geomesh.store;

import com.dedicatedcode.geomesh.exception.DatasetExistsException;
import com.dedicatedcode.geomesh.exception.StorageException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * RocksDB backed dataset storage.
 * <p>
 * Key layout of a dataset store:
 * <pre>
 * 'M'                          -> schema (JSON)
 * 'S'                          -> next row sequence (8 bytes)
 * 'R' cell(8) sequence(8)      -> cell row (JSON)
 * 'R' lat(8) lon(8) sequence(8) -> point row (JSON)
 * </pre>
 * Cell rows are grouped by their cell id, so the rows of a cell are found with one prefix scan.
 */
@Service
public class RocksDatasetStorage implements DatasetStorage {

    private static final Logger logger = LoggerFactory.getLogger(RocksDatasetStorage.class);

    private static final byte[] SCHEMA_KEY = {'M'};
    private static final byte[] SEQUENCE_KEY = {'S'};
    private static final byte ROW_PREFIX = 'R';

    private final ObjectMapper objectMapper;

    public RocksDatasetStorage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        RocksDB.loadLibrary();
    }

    @Override
    public boolean exists(Path databaseDir, String datasetName) {
        return Files.isDirectory(storePath(databaseDir, datasetName));
    }

    @Override
    public Optional<DatasetSchema> readSchema(Path databaseDir, String datasetName) {
        if (!exists(databaseDir, datasetName)) {
            return Optional.empty();
        }
        try (DatasetStore store = openReadOnly(databaseDir, datasetName)) {
            return Optional.of(store.schema());
        }
    }

    @Override
    public void create(Path databaseDir, DatasetSchema schema, List<IndexedRow> rows) {
        Path path = storePath(databaseDir, schema.datasetName());
        if (Files.exists(path)) {
            throw new DatasetExistsException("Dataset " + schema.datasetName() + " already exists at " + path);
        }
        try {
            Files.createDirectories(databaseDir);
        } catch (IOException e) {
            throw new StorageException("Could not create database directory " + databaseDir, e);
        }

        try (Options options = new Options().setCreateIfMissing(true).setErrorIfExists(true);
             RocksDB db = RocksDB.open(options, path.toString())) {
            writeRows(db, rows, 0L, schema);
        } catch (RocksDBException | IOException | RuntimeException e) {
            cleanupDatabase(path);
            throw new StorageException("Failed to create dataset " + schema.datasetName() + ": " + e.getMessage(), e);
        }
        logger.info("Created dataset {} with {} rows at {}", schema.datasetName(), rows.size(), path);
    }

    @Override
    public void append(Path databaseDir, String datasetName, List<IndexedRow> rows) {
        Path path = storePath(databaseDir, datasetName);
        if (!Files.isDirectory(path)) {
            throw new UnknownDatasetException("Dataset " + datasetName + " does not exist at " + path);
        }
        try (Options options = new Options().setCreateIfMissing(false);
             RocksDB db = RocksDB.open(options, path.toString())) {
            byte[] sequence = db.get(SEQUENCE_KEY);
            long next = sequence == null ? 0L : ByteBuffer.wrap(sequence).getLong();
            writeRows(db, rows, next, null);
        } catch (RocksDBException | IOException e) {
            throw new StorageException("Failed to append to dataset " + datasetName + ": " + e.getMessage(), e);
        }
        logger.info("Appended {} rows to dataset {}", rows.size(), datasetName);
    }

    @Override
    public void delete(Path databaseDir, String datasetName) {
        Path path = storePath(databaseDir, datasetName);
        try {
            deleteRecursively(path);
        } catch (IOException e) {
            throw new StorageException("Failed to remove dataset " + datasetName + " at " + path + ": " + e.getMessage(), e);
        }
        logger.info("Removed dataset store {}", path);
    }

    @Override
    public DatasetStore openReadOnly(Path databaseDir, String datasetName) {
        Path path = storePath(databaseDir, datasetName);
        if (!Files.isDirectory(path)) {
            throw new UnknownDatasetException("Dataset " + datasetName + " has no store at " + path);
        }
        Options options = new Options().setCreateIfMissing(false);
        RocksDB db;
        try {
            db = RocksDB.openReadOnly(options, path.toString());
        } catch (RocksDBException e) {
            options.close();
            throw new StorageException("Failed to open dataset " + datasetName + ": " + e.getMessage(), e);
        }
        try {
            byte[] schema = db.get(SCHEMA_KEY);
            if (schema == null) {
                throw new StorageException("Dataset " + datasetName + " has no schema record", null);
            }
            return new RocksDatasetStore(options, db, objectMapper.readValue(schema, DatasetSchema.class));
        } catch (RocksDBException | IOException | RuntimeException e) {
            db.close();
            options.close();
            if (e instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Failed to open dataset " + datasetName + ": " + e.getMessage(), e);
        }
    }

    // single batch per run, so a run is visible completely or not at all
    private void writeRows(RocksDB db, List<IndexedRow> rows, long firstSequence, DatasetSchema schema) throws RocksDBException, IOException {
        try (WriteBatch batch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions().setSync(true)) {
            if (schema != null) {
                batch.put(SCHEMA_KEY, objectMapper.writeValueAsBytes(schema));
            }
            long sequence = firstSequence;
            for (IndexedRow row : rows) {
                batch.put(rowKey(row, sequence++), objectMapper.writeValueAsBytes(row));
            }
            batch.put(SEQUENCE_KEY, ByteBuffer.allocate(Long.BYTES).putLong(sequence).array());
            db.write(writeOptions, batch);
        }
    }

    static byte[] rowKey(IndexedRow row, long sequence) {
        if (row.isPointRow()) {
            return ByteBuffer.allocate(1 + 3 * Long.BYTES)
                    .put(ROW_PREFIX)
                    .putLong(Double.doubleToLongBits(row.latitude()))
                    .putLong(Double.doubleToLongBits(row.longitude()))
                    .putLong(sequence)
                    .array();
        }
        return ByteBuffer.allocate(1 + 2 * Long.BYTES)
                .put(ROW_PREFIX)
                .putLong(row.cell())
                .putLong(sequence)
                .array();
    }

    static byte[] cellPrefix(long cell) {
        return ByteBuffer.allocate(1 + Long.BYTES).put(ROW_PREFIX).putLong(cell).array();
    }

    private Path storePath(Path databaseDir, String datasetName) {
        return databaseDir.resolve(datasetName);
    }

    private void cleanupDatabase(Path dbPath) {
        try {
            deleteRecursively(dbPath);
            logger.info("Removed incomplete dataset store {}", dbPath);
        } catch (IOException e) {
            logger.error("Could not remove incomplete dataset store {}: {}", dbPath, e.getMessage());
        }
    }

    private static void deleteRecursively(Path dbPath) throws IOException {
        if (!Files.exists(dbPath)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dbPath)) {
            for (Path path : paths.sorted((a, b) -> b.compareTo(a)).toList()) {
                Files.delete(path);
            }
        }
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        return key.length >= prefix.length && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    private class RocksDatasetStore implements DatasetStore {

        private final Options options;
        private final RocksDB db;
        private final DatasetSchema schema;

        private RocksDatasetStore(Options options, RocksDB db, DatasetSchema schema) {
            this.options = options;
            this.db = db;
            this.schema = schema;
        }

        @Override
        public DatasetSchema schema() {
            return schema;
        }

        @Override
        public List<IndexedRow> rowsForCell(long cell) {
            List<IndexedRow> rows = new ArrayList<>();
            scan(cellPrefix(cell), rows::add);
            return rows;
        }

        @Override
        public void forEachRow(Consumer<IndexedRow> consumer) {
            scan(new byte[]{ROW_PREFIX}, consumer);
        }

        private void scan(byte[] prefix, Consumer<IndexedRow> consumer) {
            try (RocksIterator iterator = db.newIterator()) {
                for (iterator.seek(prefix); iterator.isValid() && startsWith(iterator.key(), prefix); iterator.next()) {
                    consumer.accept(objectMapper.readValue(iterator.value(), IndexedRow.class));
                }
                iterator.status();
            } catch (RocksDBException | IOException e) {
                throw new StorageException("Failed to read dataset " + schema.datasetName() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            db.close();
            options.close();
        }
    }
}
