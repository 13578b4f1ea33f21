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

import com.dedicatedcode.geomesh.model.IndexedRow;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Physical persistence of datasets below a database directory, one store per dataset
 * at {@code <databaseDir>/<datasetName>}.
 * <p>
 * Both write operations are all-or-nothing: either every row becomes visible or the store is left
 * as it was. Callers serialise writes to the same dataset.
 */
public interface DatasetStorage {

    boolean exists(Path databaseDir, String datasetName);

    Optional<DatasetSchema> readSchema(Path databaseDir, String datasetName);

    /**
     * Creates a new store holding {@code rows}. A failed create leaves no store behind.
     */
    void create(Path databaseDir, DatasetSchema schema, List<IndexedRow> rows);

    /**
     * Appends {@code rows} to an existing store. Existing rows are not touched.
     */
    void append(Path databaseDir, String datasetName, List<IndexedRow> rows);

    /**
     * Removes the store of a dataset together with all of its rows. Does nothing if there is no store.
     */
    void delete(Path databaseDir, String datasetName);

    DatasetStore openReadOnly(Path databaseDir, String datasetName);
}
