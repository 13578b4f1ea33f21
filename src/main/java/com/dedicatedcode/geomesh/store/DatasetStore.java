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

import java.util.List;
import java.util.function.Consumer;

/**
 * Read access to one stored dataset.
 */
public interface DatasetStore extends AutoCloseable {

    DatasetSchema schema();

    /**
     * All rows stored for a cell, in insertion order. Only meaningful for cell datasets.
     */
    List<IndexedRow> rowsForCell(long cell);

    void forEachRow(Consumer<IndexedRow> consumer);

    @Override
    void close();
}
