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

package com.dedicatedcode.geomesh.service.loader.postprocessing;

import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.IndexedRow;

import java.util.List;
import java.util.Map;

/**
 * Row transform applied after interpolation or aggregation. Returns as many rows as it receives.
 */
public interface PostprocessingStep {

    List<IndexedRow> run(List<IndexedRow> rows);

    /**
     * Value columns after this step, given the value columns before it.
     */
    Map<String, ColumnType> transformSchema(Map<String, ColumnType> valueColumns);
}
