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

package com.dedicatedcode.geomesh.service.loader.output;

import com.dedicatedcode.geomesh.exception.ConfigurationException;
import com.dedicatedcode.geomesh.exception.SchemaMismatchException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.IndexedRow;
import com.dedicatedcode.geomesh.model.WriteMode;
import com.dedicatedcode.geomesh.store.DatasetSchema;
import com.dedicatedcode.geomesh.store.DatasetStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persists the rows of a pipeline run. Writes to the same dataset are serialised, different datasets
 * are written independently.
 */
@Service
public class OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(OutputWriter.class);

    private final DatasetStorage storage;
    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public OutputWriter(DatasetStorage storage) {
        this.storage = storage;
    }

    /**
     * @throws com.dedicatedcode.geomesh.exception.DatasetExistsException if {@code mode} is create and the dataset exists
     * @throws UnknownDatasetException  if {@code mode} is insert and the dataset does not exist
     * @throws SchemaMismatchException  if {@code mode} is insert and the stored schema differs
     * @throws ConfigurationException   if {@code mode} is insert into an h3 dataset without temporal key
     */
    public void write(Path databaseDir, DatasetSchema schema, List<IndexedRow> rows, WriteMode mode) {
        Path key = databaseDir.toAbsolutePath().normalize().resolve(schema.datasetName());
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            if (mode == WriteMode.CREATE) {
                storage.create(databaseDir, schema, rows);
                return;
            }
            DatasetSchema stored = storage.readSchema(databaseDir, schema.datasetName())
                    .orElseThrow(() -> new UnknownDatasetException("Cannot insert into dataset " + schema.datasetName()
                            + ", it does not exist in " + databaseDir));
            if (!stored.sameColumns(schema)
                    || (stored.datasetType() == DatasetType.H3_INDEX && stored.maxResolution() != schema.maxResolution())) {
                throw new SchemaMismatchException("Schema of dataset " + schema.datasetName() + " does not match: stored "
                        + describe(stored) + ", incoming " + describe(schema));
            }
            if (stored.datasetType() == DatasetType.H3 && stored.keyColumns().isEmpty()) {
                throw new ConfigurationException("Inserting into h3 dataset " + schema.datasetName()
                        + " requires at least one temporal key column");
            }
            storage.append(databaseDir, schema.datasetName(), rows);
            logger.debug("Inserted {} rows into {}", rows.size(), schema.datasetName());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops a store this run has just created, used when the run fails after the rows were written.
     */
    public void discard(Path databaseDir, String datasetName) {
        Path key = databaseDir.toAbsolutePath().normalize().resolve(datasetName);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            storage.delete(databaseDir, datasetName);
        } finally {
            lock.unlock();
        }
    }

    private static String describe(DatasetSchema schema) {
        return schema.datasetType() + " resolution " + schema.maxResolution()
                + " values " + schema.valueColumns() + " keys " + schema.keyColumns();
    }
}
