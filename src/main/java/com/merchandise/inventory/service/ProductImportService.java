package com.merchandise.inventory.service;

import com.merchandise.inventory.dto.internal.ApplySummary;
import com.merchandise.inventory.dto.internal.CatalogSnapshot;
import com.merchandise.inventory.dto.internal.GroupedRows;
import com.merchandise.inventory.dto.internal.ImportGrid;
import com.merchandise.inventory.dto.internal.ReconciliationResult;
import com.merchandise.inventory.processor.CatalogDiffEngine;
import com.merchandise.inventory.processor.ChangeSetApplier;
import com.merchandise.inventory.processor.RowGrouper;
import com.merchandise.inventory.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ProductImportService - Entry point of a reconciliation run
 *
 * 1. analyze: group rows, diff against one catalog snapshot (read-only)
 * 2. review happens outside this service
 * 3. apply: commit the reviewed change-set as a single transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductImportService {

    private final RowGrouper rowGrouper;
    private final CatalogDiffEngine catalogDiffEngine;
    private final ChangeSetApplier changeSetApplier;
    private final ProductRepository productRepository;

    /**
     * Analyze a decoded spreadsheet: header plus string rows
     */
    public ReconciliationResult analyzeGrid(List<String> header, List<List<String>> dataRows) {
        return analyze(ImportGrid.of(header, dataRows));
    }

    /**
     * Analyze rows given as column maps. The header is the union of all keys
     * in first-seen order.
     */
    public ReconciliationResult analyzeMappedRows(List<Map<String, String>> rows) {
        List<String> header = inferHeader(rows);
        List<List<String>> dataRows = new ArrayList<>();
        for (Map<String, String> row : rows) {
            List<String> cells = new ArrayList<>(header.size());
            for (String column : header) {
                String value = row.get(column);
                cells.add(value == null ? "" : value);
            }
            dataRows.add(cells);
        }
        return analyze(ImportGrid.of(header, dataRows));
    }

    public ReconciliationResult analyze(ImportGrid grid) {
        long startTime = System.currentTimeMillis();
        log.info("🔍 Analyzing import: {} columns, {} rows", grid.getHeader().size(), grid.getRowCount());

        GroupedRows grouped = rowGrouper.group(grid);
        CatalogSnapshot snapshot = CatalogSnapshot.of(productRepository.findAll());
        ReconciliationResult result = catalogDiffEngine.diff(grouped, snapshot);

        log.info("Analysis completed in {}ms - {}", System.currentTimeMillis() - startTime, result.getSummary());
        return result;
    }

    /**
     * Commit a reviewed change-set. Nothing is persisted when this throws.
     */
    public ApplySummary applyImport(ReconciliationResult result) {
        if (result == null || !result.hasChanges()) {
            log.info("No changes to apply");
            return ApplySummary.builder().build();
        }

        try {
            return changeSetApplier.apply(result);
        } catch (DataAccessException e) {
            log.error("❌ Import apply failed, transaction rolled back: {}", e.getMessage(), e);
            throw new ImportApplyException("Error while applying the import: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    List<String> inferHeader(List<Map<String, String>> rows) {
        Set<String> ordered = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            ordered.addAll(row.keySet());
        }
        return new ArrayList<>(ordered);
    }
}
