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

package com.dedicatedcode.geomesh.service.loader.interpolation;

import com.dedicatedcode.geomesh.model.RawRecord;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.ItemBoundable;
import org.locationtech.jts.index.strtree.ItemDistance;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Nearest neighbour lookup over the samples of one temporal group.
 * <p>
 * Distances are euclidean in degree space (latitude, longitude). The tree is built on construction and only
 * read afterwards, so one index can be shared by all interpolation workers.
 */
public class SampleIndex {

    public record Sample(int order, double latitude, double longitude, Map<String, Double> values) {
    }

    public record Neighbour(Sample sample, double distance) {
    }

    private static final ItemDistance DEGREE_DISTANCE = new ItemDistance() {
        @Override
        public double distance(ItemBoundable item1, ItemBoundable item2) {
            return SampleIndex.distance((Sample) item1.getItem(), (Sample) item2.getItem());
        }
    };

    private static final Comparator<Neighbour> BY_DISTANCE = Comparator
            .comparingDouble(Neighbour::distance)
            .thenComparingInt(n -> n.sample().order());

    private final STRtree tree = new STRtree();
    private final int size;

    public SampleIndex(List<RawRecord> records) {
        for (int i = 0; i < records.size(); i++) {
            RawRecord record = records.get(i);
            Sample sample = new Sample(i, record.latitude(), record.longitude(), record.values());
            tree.insert(envelope(record.latitude(), record.longitude()), sample);
        }
        this.size = records.size();
        tree.build();
    }

    public int size() {
        return size;
    }

    /**
     * Up to {@code k} samples closest to the location, nearest first.
     */
    public List<Neighbour> nearest(double latitude, double longitude, int k) {
        if (size == 0 || k <= 0) {
            return List.of();
        }
        Sample query = new Sample(-1, latitude, longitude, Map.of());
        Object[] items = tree.nearestNeighbour(envelope(latitude, longitude), query, DEGREE_DISTANCE, Math.min(k, size));
        List<Neighbour> neighbours = new ArrayList<>(items.length);
        for (Object item : items) {
            Sample sample = (Sample) item;
            neighbours.add(new Neighbour(sample, distance(query, sample)));
        }
        neighbours.sort(BY_DISTANCE);
        return neighbours;
    }

    private static Envelope envelope(double latitude, double longitude) {
        return new Envelope(longitude, longitude, latitude, latitude);
    }

    private static double distance(Sample a, Sample b) {
        double dLat = a.latitude() - b.latitude();
        double dLon = a.longitude() - b.longitude();
        return Math.sqrt(dLat * dLat + dLon * dLon);
    }
}
