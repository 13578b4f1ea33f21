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

package com.dedicatedcode.geomesh;

import com.dedicatedcode.geomesh.service.loader.LoadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Paths;

@SpringBootApplication
public class GeomeshApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(GeomeshApplication.class);

    @Autowired
    private LoadService loadService;

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(GeomeshApplication.class);

        // Check if this is load mode
        boolean isLoadMode = false;
        for (String arg : args) {
            if ("--load".equals(arg)) {
                isLoadMode = true;
                break;
            }
        }

        if (isLoadMode) {
            logger.info("Starting in load mode");
            app.setWebApplicationType(org.springframework.boot.WebApplicationType.NONE);
            System.setProperty("geomesh.load-mode", "true");
            app.run(args);
        } else {
            logger.info("Starting in API server mode");
            System.setProperty("geomesh.load-mode", "false");
            app.run(args);
        }
    }

    private void printApiInfo() {
        logger.info("GEOMESH is now serving data under the following endpoints:");
        logger.info("  Health Check:     GET  /api/v1/health");
        logger.info("  Datasets:         GET  /api/v1/metadata");
        logger.info("  Register:         POST /api/v1/metadata");
        logger.info("  Radius query:     POST /api/v1/geomesh/{dataset}/latlong/radius");
        logger.info("  Point query:      POST /api/v1/geomesh/{dataset}/latlong/point");
        logger.info("  Cell radius:      POST /api/v1/geomesh/{dataset}/cell/radius");
        logger.info("  Cell query:       POST /api/v1/geomesh/{dataset}/cell/point");
        logger.info("  Region query:     POST /api/v1/geomesh/{dataset}/region");
        logger.info("  Asset filter:     POST /api/v1/geomesh/filter");
        logger.info("  Cell boundary:    GET  /api/v1/geomesh/cell/{cell}/boundary");
        logger.info("");
        logger.info("Sample requests:");
        logger.info("  curl 'http://localhost:8080/api/v1/health'");
        logger.info("  curl -X POST -H 'Content-Type: application/json' -d '{\"latitude\":51.5,\"longitude\":-0.1,\"radius\":10,\"resolution\":5}' 'http://localhost:8080/api/v1/geomesh/temperature/latlong/radius'");
        logger.info("");
    }

    @Override
    public void run(String... args) {
        // Only run the pipeline if --load is present
        boolean isLoadMode = false;
        String pipelineFile = null;

        for (int i = 0; i < args.length; i++) {
            if ("--load".equals(args[i])) {
                isLoadMode = true;
                if (i + 1 < args.length) {
                    pipelineFile = args[i + 1];
                }
            }
        }

        if (isLoadMode) {
            if (pipelineFile == null) {
                logger.error("Load mode requires a pipeline file: --load <pipeline.yml>");
                System.exit(1);
            }

            try {
                loadService.load(Paths.get(pipelineFile));
                System.exit(0);
            } catch (Exception e) {
                logger.error("Load failed", e);
                System.exit(1);
            }
        } else {
            printApiInfo();
        }
    }
}
