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

package com.dedicatedcode.geomesh.dto;

import com.dedicatedcode.geomesh.model.DatasetType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a spatial query. Cell datasets fill {@code cells}, point datasets fill {@code points}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {

    @JsonProperty("dataset")
    private String dataset;

    @JsonProperty("dataset_type")
    private DatasetType datasetType;

    @JsonProperty("resolution")
    private Integer resolution;

    @JsonProperty("cells")
    private List<CellDataRow> cells;

    @JsonProperty("points")
    private List<PointDataRow> points;

    public QueryResult() {}

    public QueryResult(String dataset, DatasetType datasetType, Integer resolution) {
        this.dataset = dataset;
        this.datasetType = datasetType;
        this.resolution = resolution;
        if (datasetType.isCellBased()) {
            this.cells = new ArrayList<>();
        } else {
            this.points = new ArrayList<>();
        }
    }

    public String getDataset() { return dataset; }
    public void setDataset(String dataset) { this.dataset = dataset; }

    public DatasetType getDatasetType() { return datasetType; }
    public void setDatasetType(DatasetType datasetType) { this.datasetType = datasetType; }

    public Integer getResolution() { return resolution; }
    public void setResolution(Integer resolution) { this.resolution = resolution; }

    public List<CellDataRow> getCells() { return cells; }
    public void setCells(List<CellDataRow> cells) { this.cells = cells; }

    public List<PointDataRow> getPoints() { return points; }
    public void setPoints(List<PointDataRow> points) { this.points = points; }
}
