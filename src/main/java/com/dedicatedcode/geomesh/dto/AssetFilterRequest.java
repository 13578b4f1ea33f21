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

import java.util.ArrayList;
import java.util.List;

/**
 * Assets to filter and the per-dataset conditions they have to meet.
 */
public class AssetFilterRequest {

    @JsonProperty("assets")
    private List<Asset> assets = new ArrayList<>();

    @JsonProperty("datasets")
    private List<DatasetFilter> datasets = new ArrayList<>();

    public AssetFilterRequest() {}

    public AssetFilterRequest(List<Asset> assets, List<DatasetFilter> datasets) {
        this.assets = assets;
        this.datasets = datasets;
    }

    public List<Asset> getAssets() { return assets; }
    public void setAssets(List<Asset> assets) { this.assets = assets; }

    public List<DatasetFilter> getDatasets() { return datasets; }
    public void setDatasets(List<DatasetFilter> datasets) { this.datasets = datasets; }

    public static class Asset {
        @JsonProperty("id")
        private String id;

        @JsonProperty("latitude")
        private double latitude;

        @JsonProperty("longitude")
        private double longitude;

        public Asset() {}

        public Asset(String id, double latitude, double longitude) {
            this.id = id;
            this.latitude = latitude;
            this.longitude = longitude;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public double getLatitude() { return latitude; }
        public void setLatitude(double latitude) { this.latitude = latitude; }

        public double getLongitude() { return longitude; }
        public void setLongitude(double longitude) { this.longitude = longitude; }
    }

    public static class DatasetFilter {
        @JsonProperty("name")
        private String name;

        @JsonProperty("filters")
        private List<ColumnFilter> filters = new ArrayList<>();

        @JsonProperty("year")
        private Integer year;

        @JsonProperty("month")
        private Integer month;

        @JsonProperty("day")
        private Integer day;

        public DatasetFilter() {}

        public DatasetFilter(String name, List<ColumnFilter> filters) {
            this.name = name;
            this.filters = filters;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<ColumnFilter> getFilters() { return filters; }
        public void setFilters(List<ColumnFilter> filters) { this.filters = filters; }

        public Integer getYear() { return year; }
        public void setYear(Integer year) { this.year = year; }

        public Integer getMonth() { return month; }
        public void setMonth(Integer month) { this.month = month; }

        public Integer getDay() { return day; }
        public void setDay(Integer day) { this.day = day; }
    }

    public static class ColumnFilter {
        @JsonProperty("column")
        private String column;

        @JsonProperty("comparator")
        private String comparator;

        @JsonProperty("value")
        private Double value;

        public ColumnFilter() {}

        public ColumnFilter(String column, String comparator, Double value) {
            this.column = column;
            this.comparator = comparator;
            this.value = value;
        }

        public String getColumn() { return column; }
        public void setColumn(String column) { this.column = column; }

        public String getComparator() { return comparator; }
        public void setComparator(String comparator) { this.comparator = comparator; }

        public Double getValue() { return value; }
        public void setValue(Double value) { this.value = value; }
    }
}
