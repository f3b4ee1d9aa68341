package com.merchandise.inventory.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.merchandise.inventory.InventoryImportApplication;
import com.merchandise.inventory.repository.ProductRepository;
import com.merchandise.inventory.test.util.CatalogTestHelper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = InventoryImportApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class InventorySessionControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private ProductRepository productRepository;
    @Autowired private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        CatalogTestHelper.clearDatabase(jdbcTemplate);
    }

    @Test
    void shouldCreateAndSyncSession() throws Exception {
        CatalogTestHelper.saveProduct(productRepository, "A1", "Counted", null, null, "1");

        String created = mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Shelf 4",
                                 "grid": [["barcode", "realQuantity"], ["A1", "8"], ["Q9", "2"]]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.syncStatus").value("NOT_ATTEMPTED"))
                .andReturn().getResponse().getContentAsString();

        JsonNode session = objectMapper.readTree(created);
        long id = session.get("id").asLong();

        mockMvc.perform(post("/api/sessions/{id}/sync", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attemptedUpdates").value(2))
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.failed").value(1));

        mockMvc.perform(get("/api/sessions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.syncStatus").value("ATTEMPTED_WITH_ERRORS"))
                .andExpect(jsonPath("$.grid[0][2]").value("SyncError"))
                .andExpect(jsonPath("$.grid[2][2]").value("Barcode not found"));

        assertThat(productRepository.findByBarcode("A1").getStockQuantity()).isEqualByComparingTo("8");
    }

    @Test
    void shouldRejectSessionWithoutGrid() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Empty\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() throws Exception {
        mockMvc.perform(get("/api/sessions/{id}", 999999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        mockMvc.perform(post("/api/sessions/{id}/sync", 999999))
                .andExpect(status().isNotFound());
    }
}
