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

package com.dedicatedcode.geomesh.service.loader.preprocessing;

import com.dedicatedcode.geomesh.model.RawRecord;
import com.dedicatedcode.geomesh.service.region.RegionRestrictor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Keeps the records located inside a region, boundary inclusive.
 */
public class RegionFilterStep implements PreprocessingStep {

    private static final Logger logger = LoggerFactory.getLogger(RegionFilterStep.class);

    private final RegionRestrictor restrictor;

    public RegionFilterStep(RegionRestrictor restrictor) {
        this.restrictor = restrictor;
    }

    @Override
    public List<RawRecord> run(List<RawRecord> records) {
        List<RawRecord> kept = records.stream()
                .filter(r -> restrictor.contains(r.latitude(), r.longitude()))
                .toList();
        logger.info("Region filter kept {} of {} records", kept.size(), records.size());
        return kept;
    }
}
