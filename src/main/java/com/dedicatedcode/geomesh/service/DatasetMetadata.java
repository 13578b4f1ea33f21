package com.dedicatedcode.geomesh.service;

import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.model.Interval;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(value = {"interval"}, allowGetters = true)
public record DatasetMetadata(
        @JsonProperty("dataset_name") String datasetName,
        @JsonProperty("description") String description,
        @JsonProperty("value_columns") Map<String, ColumnType> valueColumns,
        @JsonProperty("key_columns") Map<String, ColumnType> keyColumns,
        @JsonProperty("dataset_type") DatasetType datasetType
) {

    @JsonProperty("interval")
    public Interval interval() {
        return Interval.fromKeyColumns(keyColumns.keySet());
    }
}
