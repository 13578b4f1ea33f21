package com.dedicatedcode.geomesh.controller;

import com.dedicatedcode.geomesh.service.CellBoundaryService;
import com.dedicatedcode.geomesh.service.GridIndex;
import com.dedicatedcode.geomesh.service.loader.LoadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CellController.class)
@Import({CellBoundaryService.class, GridIndex.class})
class CellControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LoadService loadService;

    @Test
    void testCellBoundary() throws Exception {
        mockMvc.perform(get("/api/v1/geomesh/cell/8928308280fffff/boundary"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "public, max-age=31536000, immutable"))
                .andExpect(jsonPath("$.type").value("Polygon"))
                .andExpect(jsonPath("$.coordinates[0].length()").value(7))
                .andExpect(jsonPath("$.cell").value("8928308280fffff"))
                .andExpect(jsonPath("$.resolution").value(9))
                .andExpect(jsonPath("$.exteriorRing").doesNotExist());
    }

    @Test
    void testInvalidCellIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/geomesh/cell/zzz/boundary"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("InvalidArgumentException"));
    }
}
