package com.merchandise.inventory.web;

import com.merchandise.inventory.dto.internal.ApplySummary;
import com.merchandise.inventory.dto.internal.ReconciliationResult;
import com.merchandise.inventory.dto.request.AnalyzeImportRequest;
import com.merchandise.inventory.entity.Product;
import com.merchandise.inventory.entity.ProductPrice;
import com.merchandise.inventory.repository.ProductPriceRepository;
import com.merchandise.inventory.repository.ProductRepository;
import com.merchandise.inventory.service.ProductImportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Import analysis, apply, and price history endpoints
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ImportController {

    private final ProductImportService productImportService;
    private final ProductRepository productRepository;
    private final ProductPriceRepository productPriceRepository;

    @PostMapping("/imports/analyze")
    public ReconciliationResult analyze(@Valid @RequestBody AnalyzeImportRequest request) {
        return productImportService.analyzeGrid(request.getHeader(), request.getRows());
    }

    @PostMapping("/imports/analyze-mapped")
    public ReconciliationResult analyzeMapped(@RequestBody List<Map<String, String>> rows) {
        return productImportService.analyzeMappedRows(rows);
    }

    @PostMapping("/imports/apply")
    public ApplySummary apply(@RequestBody ReconciliationResult result) {
        return productImportService.applyImport(result);
    }

    @GetMapping("/products/{barcode}/prices")
    public ResponseEntity<List<ProductPrice>> priceHistory(@PathVariable String barcode) {
        Product product = productRepository.findByBarcode(barcode);
        if (product == null) {
            log.debug("Price history requested for unknown barcode {}", barcode);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(productPriceRepository.findByProductId(product.getId()));
    }
}
