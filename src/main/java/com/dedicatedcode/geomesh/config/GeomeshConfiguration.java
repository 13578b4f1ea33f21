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

package com.dedicatedcode.geomesh.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Name;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "geomesh")
public class GeomeshConfiguration {

    private String databaseDir = "./data";

    @Name("load")
    private LoadConfiguration loadConfiguration = new LoadConfiguration();
    @Name("query")
    private QueryConfiguration queryConfiguration = new QueryConfiguration();

    public String getDatabaseDir() {
        return databaseDir;
    }

    public void setDatabaseDir(String databaseDir) {
        this.databaseDir = databaseDir;
    }

    public LoadConfiguration getLoadConfiguration() {
        return loadConfiguration;
    }

    public void setLoadConfiguration(LoadConfiguration loadConfiguration) {
        this.loadConfiguration = loadConfiguration;
    }

    public QueryConfiguration getQueryConfiguration() {
        return queryConfiguration;
    }

    public void setQueryConfiguration(QueryConfiguration queryConfiguration) {
        this.queryConfiguration = queryConfiguration;
    }

    public static class LoadConfiguration {

        /**
         * Number of worker threads used when a pipeline file does not set max_parallelism.
         */
        private int maxParallelism = 4;
        /**
         * Default neighbour count of the inverse distance estimator.
         */
        private int numNeighbors = 3;
        /**
         * Default distance exponent of the inverse distance estimator.
         */
        private double power = 2.0;

        public int getMaxParallelism() {
            return maxParallelism;
        }

        public void setMaxParallelism(int maxParallelism) {
            this.maxParallelism = Math.max(1, maxParallelism);
        }

        public int getNumNeighbors() {
            return numNeighbors;
        }

        public void setNumNeighbors(int numNeighbors) {
            this.numNeighbors = Math.max(1, numNeighbors);
        }

        public double getPower() {
            return power;
        }

        public void setPower(double power) {
            this.power = power;
        }
    }

    public static class QueryConfiguration {

        /**
         * Number of parsed region files kept in memory.
         */
        private int regionCacheSize = 16;

        public int getRegionCacheSize() {
            return regionCacheSize;
        }

        public void setRegionCacheSize(int regionCacheSize) {
            this.regionCacheSize = Math.max(1, regionCacheSize);
        }
    }
}
