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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public class MetadataRequest {

    @JsonProperty("dataset_name")
    private String datasetName;

    @JsonProperty("description")
    private String description;

    @JsonProperty("value_columns")
    private Map<String, String> valueColumns = new LinkedHashMap<>();

    @JsonProperty("key_columns")
    private Map<String, String> keyColumns = new LinkedHashMap<>();

    @JsonProperty("dataset_type")
    private String datasetType;

    public MetadataRequest() {}

    public String getDatasetName() { return datasetName; }
    public void setDatasetName(String datasetName) { this.datasetName = datasetName; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public Map<String, String> getValueColumns() { return valueColumns; }
    public void setValueColumns(Map<String, String> valueColumns) { this.valueColumns = valueColumns; }

    public Map<String, String> getKeyColumns() { return keyColumns; }
    public void setKeyColumns(Map<String, String> keyColumns) { this.keyColumns = keyColumns; }

    public String getDatasetType() { return datasetType; }
    public void setDatasetType(String datasetType) { this.datasetType = datasetType; }
}
