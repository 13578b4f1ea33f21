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

package com.dedicatedcode.geomesh.service;

import com.dedicatedcode.geomesh.config.GeomeshConfiguration;
import com.dedicatedcode.geomesh.exception.DuplicateDatasetException;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.exception.StorageException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of the datasets below a database directory. A dataset is only queryable once it has an entry here.
 * <p>
 * Entries live in their own RocksDB store at {@code <databaseDir>/dataset_metadata}, keyed by dataset name.
 */
@Service
public class MetadataService {

    private static final Logger logger = LoggerFactory.getLogger(MetadataService.class);

    public static final String METADATA_DB_NAME = "dataset_metadata";

    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern DATASET_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final GeomeshConfiguration config;
    private final ObjectMapper objectMapper;

    public MetadataService(GeomeshConfiguration config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        RocksDB.loadLibrary();
    }

    public DatasetMetadata addmeta(String datasetName, String description, Map<String, String> valueColumns,
                                   Map<String, String> keyColumns, String datasetType) {
        return addmeta(defaultDatabaseDir(), datasetName, description, valueColumns, keyColumns, datasetType);
    }

    /**
     * Validates and registers a dataset. Column types are stored in their canonical form.
     *
     * @throws InvalidArgumentException   if the name is reserved or malformed, a column name contains characters
     *                                    other than letters, digits and '_', a column type is unknown or the
     *                                    dataset type is invalid
     * @throws DuplicateDatasetException if an entry with this name already exists
     */
    public synchronized DatasetMetadata addmeta(Path databaseDir, String datasetName, String description,
                                                Map<String, String> valueColumns, Map<String, String> keyColumns,
                                                String datasetType) {
        DatasetMetadata entry = validate(datasetName, description, valueColumns, keyColumns, datasetType);

        try {
            Files.createDirectories(databaseDir);
        } catch (IOException e) {
            throw new StorageException("Could not create database directory " + databaseDir, e);
        }
        Path metadataPath = databaseDir.resolve(METADATA_DB_NAME);
        byte[] key = datasetName.getBytes(StandardCharsets.UTF_8);
        try (Options options = new Options().setCreateIfMissing(true);
             RocksDB db = RocksDB.open(options, metadataPath.toString())) {
            if (db.get(key) != null) {
                throw new DuplicateDatasetException("Dataset with name " + datasetName + " already exists");
            }
            db.put(key, objectMapper.writeValueAsBytes(entry));
        } catch (RocksDBException | IOException e) {
            throw new StorageException("Failed to write metadata for " + datasetName + ": " + e.getMessage(), e);
        }
        logger.info("Added metadata entry for dataset {}", datasetName);
        return entry;
    }

    public List<DatasetMetadata> showmeta() {
        return showmeta(defaultDatabaseDir());
    }

    /**
     * All entries, sorted by dataset name.
     */
    public List<DatasetMetadata> showmeta(Path databaseDir) {
        Path metadataPath = databaseDir.resolve(METADATA_DB_NAME);
        List<DatasetMetadata> entries = new ArrayList<>();
        if (!Files.isDirectory(metadataPath)) {
            logger.debug("No metadata store at {}", metadataPath);
            return entries;
        }
        try (Options options = new Options().setCreateIfMissing(false);
             RocksDB db = RocksDB.openReadOnly(options, metadataPath.toString());
             RocksIterator iterator = db.newIterator()) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                entries.add(objectMapper.readValue(iterator.value(), DatasetMetadata.class));
            }
            iterator.status();
        } catch (RocksDBException | IOException e) {
            throw new StorageException("Failed to read metadata from " + metadataPath + ": " + e.getMessage(), e);
        }
        return entries;
    }

    public Optional<DatasetMetadata> find(String datasetName) {
        return find(defaultDatabaseDir(), datasetName);
    }

    public Optional<DatasetMetadata> find(Path databaseDir, String datasetName) {
        Path metadataPath = databaseDir.resolve(METADATA_DB_NAME);
        if (datasetName == null || !Files.isDirectory(metadataPath)) {
            return Optional.empty();
        }
        try (Options options = new Options().setCreateIfMissing(false);
             RocksDB db = RocksDB.openReadOnly(options, metadataPath.toString())) {
            byte[] value = db.get(datasetName.getBytes(StandardCharsets.UTF_8));
            return value == null ? Optional.empty() : Optional.of(objectMapper.readValue(value, DatasetMetadata.class));
        } catch (RocksDBException | IOException e) {
            throw new StorageException("Failed to read metadata for " + datasetName + ": " + e.getMessage(), e);
        }
    }

    public DatasetMetadata require(String datasetName) {
        return require(defaultDatabaseDir(), datasetName);
    }

    /**
     * @throws UnknownDatasetException if the dataset is not registered
     */
    public DatasetMetadata require(Path databaseDir, String datasetName) {
        return find(databaseDir, datasetName)
                .orElseThrow(() -> new UnknownDatasetException("Dataset " + datasetName + " not registered in metadata"));
    }

    public Path defaultDatabaseDir() {
        return Paths.get(config.getDatabaseDir());
    }

    /**
     * Builds the entry {@link #addmeta} would store, without touching any store.
     *
     * @throws InvalidArgumentException if the entry would be rejected by {@link #addmeta}
     */
    public DatasetMetadata validate(String datasetName, String description, Map<String, String> valueColumns,
                                    Map<String, String> keyColumns, String datasetType) {
        if (datasetName == null || datasetName.isBlank()) {
            throw new InvalidArgumentException("Dataset name must not be empty");
        }
        if (METADATA_DB_NAME.equals(datasetName)) {
            throw new InvalidArgumentException("Name " + METADATA_DB_NAME + " is reserved and cannot be used as a dataset name");
        }
        if (!DATASET_NAME.matcher(datasetName).matches()) {
            throw new InvalidArgumentException("Dataset name " + datasetName + " may only contain letters, digits, '_' and '-'");
        }
        if (valueColumns == null || valueColumns.isEmpty()) {
            throw new InvalidArgumentException("Dataset " + datasetName + " needs at least one value column");
        }
        DatasetType type = DatasetType.fromValue(datasetType).orElseThrow(() -> new InvalidArgumentException(
                "Dataset type " + datasetType + " is not valid. Valid dataset types are: h3, point, h3_index"));

        List<String> errors = new ArrayList<>();
        Map<String, ColumnType> values = canonicalColumns(valueColumns, errors);
        Map<String, ColumnType> keys = canonicalColumns(keyColumns == null ? Map.of() : keyColumns, errors);
        if (!errors.isEmpty()) {
            throw new InvalidArgumentException("One or more columns are invalid: " + String.join("; ", errors));
        }
        return new DatasetMetadata(datasetName, description == null ? "" : description, values, keys, type);
    }

    private Map<String, ColumnType> canonicalColumns(Map<String, String> columns, List<String> errors) {
        Map<String, ColumnType> canonical = new LinkedHashMap<>();
        columns.forEach((name, type) -> {
            if (name == null || !COLUMN_NAME.matcher(name).matches()) {
                errors.add("column name [" + name + "] must contain only '_' and alphanumeric characters");
                return;
            }
            try {
                canonical.put(name, ColumnType.parse(type));
            } catch (InvalidArgumentException e) {
                errors.add("column " + name + ": " + e.getMessage());
            }
        });
        return canonical;
    }
}
