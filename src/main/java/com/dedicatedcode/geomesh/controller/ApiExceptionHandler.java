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

import com.dedicatedcode.geomesh.exception.DatasetExistsException;
import com.dedicatedcode.geomesh.exception.DuplicateDatasetException;
import com.dedicatedcode.geomesh.exception.GeomeshException;
import com.dedicatedcode.geomesh.exception.StorageException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps domain errors to JSON error bodies: unknown dataset 404, duplicates 409, storage failures 500,
 * everything else 400.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GeomeshException.class)
    public ResponseEntity<Map<String, Object>> handle(GeomeshException e) {
        HttpStatus status;
        if (e instanceof UnknownDatasetException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof DuplicateDatasetException || e instanceof DatasetExistsException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof StorageException) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            logger.error("Storage error: {}", e.getMessage(), e);
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        logger.debug("Request failed with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(error(e.getMessage(), e.getClass().getSimpleName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(error("Malformed request body: " + e.getMostSpecificCause().getMessage(), "InvalidArgumentException"));
    }

    private static Map<String, Object> error(String message, String type) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        error.put("type", type);
        return error;
    }
}
