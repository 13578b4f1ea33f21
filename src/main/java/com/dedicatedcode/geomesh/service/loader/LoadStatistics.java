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

package com.dedicatedcode.geomesh.service.loader;

import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one pipeline run. Workers update them concurrently.
 */
public class LoadStatistics {

    private final AtomicLong recordsRead = new AtomicLong(0);
    private final AtomicLong recordsKept = new AtomicLong(0);
    private final AtomicLong cellsEvaluated = new AtomicLong(0);
    private final AtomicLong cellsOmitted = new AtomicLong(0);
    private final AtomicLong rowsWritten = new AtomicLong(0);
    private final long startTime = System.currentTimeMillis();
    private volatile String currentPhase = "Initializing";
    private volatile long phaseStartTime = System.currentTimeMillis();

    public void setCurrentPhase(Logger logger, String phase) {
        long now = System.currentTimeMillis();
        logger.info("{} finished after {} ms, starting {}", currentPhase, now - phaseStartTime, phase);
        this.currentPhase = phase;
        this.phaseStartTime = now;
    }

    public String getCurrentPhase() {
        return currentPhase;
    }

    public void addRecordsRead(long count) {
        recordsRead.addAndGet(count);
    }

    public void setRecordsKept(long count) {
        recordsKept.set(count);
    }

    public void addCellsEvaluated(long count) {
        cellsEvaluated.addAndGet(count);
    }

    public void incrementCellsOmitted() {
        cellsOmitted.incrementAndGet();
    }

    public void addRowsWritten(long count) {
        rowsWritten.addAndGet(count);
    }

    public long getRecordsRead() {
        return recordsRead.get();
    }

    public long getRecordsKept() {
        return recordsKept.get();
    }

    public long getCellsEvaluated() {
        return cellsEvaluated.get();
    }

    public long getCellsOmitted() {
        return cellsOmitted.get();
    }

    public long getRowsWritten() {
        return rowsWritten.get();
    }

    public long getElapsedMillis() {
        return System.currentTimeMillis() - startTime;
    }

    public void logSummary(Logger logger, String datasetName) {
        logger.info("Load of {} finished in {} ms: records read={}, records kept={}, cells evaluated={}, cells omitted={}, rows written={}",
                datasetName, getElapsedMillis(), getRecordsRead(), getRecordsKept(), getCellsEvaluated(), getCellsOmitted(), getRowsWritten());
    }
}
