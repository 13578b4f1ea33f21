package com.dedicatedcode.geomesh.controller;

import com.dedicatedcode.geomesh.exception.DuplicateDatasetException;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.model.ColumnType;
import com.dedicatedcode.geomesh.model.DatasetType;
import com.dedicatedcode.geomesh.service.DatasetMetadata;
import com.dedicatedcode.geomesh.service.MetadataService;
import com.dedicatedcode.geomesh.service.loader.LoadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MetadataController.class)
class MetadataControllerTest {

    private static final String FLOOD = "{\"dataset_name\":\"flood\",\"description\":\"Flood depth\","
            + "\"value_columns\":{\"depth\":\"float8\"},\"key_columns\":{\"year\":\"int\"},\"dataset_type\":\"h3_index\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MetadataService metadataService;

    @MockitoBean
    private LoadService loadService;

    private final DatasetMetadata flood = new DatasetMetadata("flood", "Flood depth",
            Map.of("depth", ColumnType.DOUBLE), Map.of("year", ColumnType.INTEGER), DatasetType.H3_INDEX);

    @Test
    void testAddMetadata() throws Exception {
        when(metadataService.addmeta(eq("flood"), eq("Flood depth"), eq(Map.of("depth", "float8")), eq(Map.of("year", "int")), eq("h3_index")))
                .thenReturn(flood);

        mockMvc.perform(post("/api/v1/metadata").contentType(MediaType.APPLICATION_JSON).content(FLOOD))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.dataset_name").value("flood"))
                .andExpect(jsonPath("$.value_columns.depth").value("DOUBLE"))
                .andExpect(jsonPath("$.dataset_type").value("h3_index"))
                .andExpect(jsonPath("$.interval").value("yearly"));
    }

    @Test
    void testDuplicateIsConflict() throws Exception {
        when(metadataService.addmeta(any(), any(), anyMap(), anyMap(), any()))
                .thenThrow(new DuplicateDatasetException("Dataset with name flood already exists"));

        mockMvc.perform(post("/api/v1/metadata").contentType(MediaType.APPLICATION_JSON).content(FLOOD))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Dataset with name flood already exists"));
    }

    @Test
    void testInvalidEntryIsBadRequest() throws Exception {
        when(metadataService.addmeta(any(), any(), anyMap(), anyMap(), any()))
                .thenThrow(new InvalidArgumentException("One or more columns are invalid"));

        mockMvc.perform(post("/api/v1/metadata").contentType(MediaType.APPLICATION_JSON).content(FLOOD))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("InvalidArgumentException"));
    }

    @Test
    void testShowMetadata() throws Exception {
        when(metadataService.showmeta()).thenReturn(List.of(flood));

        mockMvc.perform(get("/api/v1/metadata"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Result-Count", "1"))
                .andExpect(jsonPath("$[0].dataset_name").value("flood"))
                .andExpect(jsonPath("$[0].key_columns.year").value("INTEGER"));
    }
}
