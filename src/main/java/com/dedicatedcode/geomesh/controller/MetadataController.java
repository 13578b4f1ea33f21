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

package com.dedicatedcode.geomesh.controller;

import com.dedicatedcode.geomesh.dto.MetadataRequest;
import com.dedicatedcode.geomesh.service.DatasetMetadata;
import com.dedicatedcode.geomesh.service.MetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the dataset registry.
 */
@RestController
@RequestMapping("/api/v1")
@ConditionalOnProperty(name = "geomesh.load-mode", havingValue = "false", matchIfMissing = true)
public class MetadataController {

    private static final Logger logger = LoggerFactory.getLogger(MetadataController.class);

    private final MetadataService metadataService;

    public MetadataController(MetadataService metadataService) {
        this.metadataService = metadataService;
    }

    @PostMapping("/metadata")
    public ResponseEntity<DatasetMetadata> addmeta(@RequestBody MetadataRequest request) {
        logger.debug("Registering dataset {}", request.getDatasetName());
        DatasetMetadata entry = metadataService.addmeta(request.getDatasetName(), request.getDescription(),
                request.getValueColumns(), request.getKeyColumns(), request.getDatasetType());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/metadata")
    public ResponseEntity<List<DatasetMetadata>> showmeta() {
        List<DatasetMetadata> entries = metadataService.showmeta();
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(entries.size()))
                .header("Cache-Control", "no-store, no-cache, must-revalidate, proxy-revalidate, max-age=0")
                .body(entries);
    }
}
