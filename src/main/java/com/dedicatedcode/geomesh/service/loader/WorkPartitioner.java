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

import com.dedicatedcode.geomesh.exception.GeomeshException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Splits sorted work into contiguous ranges, runs one task per range and concatenates the results
 * in range order, so the outcome does not depend on the number of workers.
 */
public final class WorkPartitioner {

    private WorkPartitioner() {
    }

    public static <T> List<List<T>> partition(List<T> items, int parts) {
        List<List<T>> ranges = new ArrayList<>();
        if (items.isEmpty()) {
            return ranges;
        }
        int count = Math.max(1, Math.min(parts, items.size()));
        int base = items.size() / count;
        int remainder = items.size() % count;
        int start = 0;
        for (int i = 0; i < count; i++) {
            int end = start + base + (i < remainder ? 1 : 0);
            ranges.add(items.subList(start, end));
            start = end;
        }
        return ranges;
    }

    public static <T, R> List<R> run(ExecutorService executor, List<T> items, int parts, Function<List<T>, List<R>> work) {
        List<Future<List<R>>> futures = new ArrayList<>();
        for (List<T> range : partition(items, parts)) {
            Callable<List<R>> task = () -> work.apply(range);
            futures.add(executor.submit(task));
        }
        List<R> merged = new ArrayList<>();
        try {
            for (Future<List<R>> future : futures) {
                merged.addAll(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new GeomeshException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new GeomeshException("Worker failed: " + e.getCause().getMessage(), e.getCause());
        }
        return merged;
    }
}
