package com.merchandise.inventory.web;

import com.merchandise.inventory.InventoryImportApplication;
import com.merchandise.inventory.repository.ProductRepository;
import com.merchandise.inventory.test.util.CatalogTestHelper;
import lombok.extern.slf4j.Slf4j;
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
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ImportController Test - analyze, review round-trip, apply over HTTP
 */
@SpringBootTest(classes = InventoryImportApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Slf4j
class ImportControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ProductRepository productRepository;
    @Autowired private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        CatalogTestHelper.clearDatabase(jdbcTemplate);
    }

    @Test
    void shouldRejectGridWithoutBarcodeColumn() throws Exception {
        mockMvc.perform(post("/api/imports/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"header": ["productName"], "rows": [["Widget"]]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_FORMAT"));
    }

    @Test
    void shouldRejectRequestWithoutHeader() throws Exception {
        mockMvc.perform(post("/api/imports/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"header": [], "rows": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void shouldAnalyzeThenApplyReviewedResult() throws Exception {
        CatalogTestHelper.saveProduct(productRepository, "B2", "Gadget", "5", "9.99", null);

        String analyzed = mockMvc.perform(post("/api/imports/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"header": ["barcode", "productName", "purchasePrice", "retailPrice"],
                                 "rows": [["B2", "Gadget", "5", "10,99"], ["N1", "Brand new", "", "1"]]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasChanges").value(true))
                .andExpect(jsonPath("$.newProducts", hasSize(1)))
                .andExpect(jsonPath("$.updatedProducts[0].changedFields[0]").value("retailPrice"))
                .andReturn().getResponse().getContentAsString();

        log.info("Analyzed: {}", analyzed);

        mockMvc.perform(post("/api/imports/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(analyzed))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(1))
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.priceHistoryEntries").value(2));

        assertThat(productRepository.findByBarcode("B2").getRetailPrice()).isEqualByComparingTo("10.99");
        assertThat(productRepository.findByBarcode("N1")).isNotNull();

        mockMvc.perform(get("/api/products/B2/prices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].priceType").value("RETAIL"))
                .andExpect(jsonPath("$[0].source").value("IMPORT_EXCEL"));
    }

    @Test
    void shouldAnalyzeMappedRows() throws Exception {
        mockMvc.perform(post("/api/imports/analyze-mapped")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"barcode": "M1", "quantity": "2"}, {"barcode": "M1", "quantity": "3"}]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newProducts[0].stockQuantity").value(5))
                .andExpect(jsonPath("$.warnings[0].rowNumbers", hasSize(2)));
    }

    @Test
    void shouldReturnNotFoundForUnknownProductPrices() throws Exception {
        mockMvc.perform(get("/api/products/NOPE/prices"))
                .andExpect(status().isNotFound());
    }
}
