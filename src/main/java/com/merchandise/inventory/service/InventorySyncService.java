package com.merchandise.inventory.service;

import com.merchandise.inventory.config.ImportProperties;
import com.merchandise.inventory.dto.internal.SyncResult;
import com.merchandise.inventory.entity.InventorySession;
import com.merchandise.inventory.entity.PriceType;
import com.merchandise.inventory.entity.Product;
import com.merchandise.inventory.entity.SyncStatus;
import com.merchandise.inventory.processor.PriceHistoryRecorder;
import com.merchandise.inventory.repository.InventorySessionRepository;
import com.merchandise.inventory.repository.ProductRepository;
import com.merchandise.inventory.util.ImportColumns;
import com.merchandise.inventory.util.NumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * InventorySyncService - Apply a counted inventory grid to the catalog
 *
 * - counted quantity from realQuantity, else quantity
 * - overwrites stockQuantity, and retailPrice when the grid carries one
 * - retail changes are logged as price history with the sync source tag
 * - per-row problems go to the SyncError column, the batch continues
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventorySyncService {

    private final InventorySessionRepository sessionRepository;
    private final ProductRepository productRepository;
    private final PriceHistoryRecorder priceHistoryRecorder;
    private final ImportProperties importProperties;
    private final MessageSource messageSource;

    @Transactional(rollbackFor = Exception.class)
    public SyncResult sync(Long sessionId) {
        InventorySession session = sessionRepository.findById(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return sync(session);
    }

    @Transactional(rollbackFor = Exception.class)
    public SyncResult sync(InventorySession session) {
        List<List<String>> grid = copyOf(session.getGrid());
        if (grid.isEmpty()) {
            log.info("Session {} has an empty grid, nothing to sync", session.getId());
            return result(0, 0, 0, 0);
        }

        List<String> header = grid.get(0);
        String errorColumn = importProperties.getSyncErrorColumn();
        int errorIndex = header.indexOf(errorColumn);
        if (errorIndex < 0) {
            header.add(errorColumn);
            errorIndex = header.size() - 1;
        }

        int barcodeIndex = header.indexOf(ImportColumns.BARCODE);
        int quantityIndex = header.indexOf(ImportColumns.QUANTITY);
        int realQuantityIndex = header.indexOf(ImportColumns.REAL_QUANTITY);
        int retailPriceIndex = ImportColumns.indexOfIgnoreCase(header, ImportColumns.SYNC_RETAIL_PRICE);

        if (barcodeIndex < 0) {
            log.warn("Session {} has no barcode column, grid saved without sync", session.getId());
            session.setGrid(grid);
            sessionRepository.updateGridAndStatus(session);
            return result(0, 0, 0, 0);
        }

        int processed = 0;
        int attempted = 0;
        int succeeded = 0;
        int failed = 0;

        for (int rowIndex = 1; rowIndex < grid.size(); rowIndex++) {
            processed++;

            List<String> row = padRow(grid.get(rowIndex), header.size());
            grid.set(rowIndex, row);
            row.set(errorIndex, "");

            String barcode = row.get(barcodeIndex).trim();
            if (barcode.isEmpty()) {
                continue;
            }

            String quantityText;
            if (realQuantityIndex >= 0) {
                quantityText = row.get(realQuantityIndex);
            } else if (quantityIndex >= 0) {
                quantityText = row.get(quantityIndex);
            } else {
                quantityText = "";
            }

            if (NumberNormalizer.normalizeNumberString(quantityText).isEmpty()) {
                // Not counted yet
                continue;
            }

            attempted++;

            BigDecimal quantity = NumberNormalizer.parseDecimal(quantityText);
            if (quantity == null || quantity.signum() < 0 || !NumberNormalizer.fitsStorage(quantity)) {
                row.set(errorIndex, message("sync.error.invalid-quantity"));
                failed++;
                log.debug("Row {} ({}): invalid quantity '{}'", rowIndex, barcode, quantityText);
                continue;
            }

            BigDecimal retailPrice = null;
            if (retailPriceIndex >= 0) {
                String priceText = row.get(retailPriceIndex);
                if (!NumberNormalizer.normalizeNumberString(priceText).isEmpty()) {
                    retailPrice = NumberNormalizer.parseDecimal(priceText);
                    if (retailPrice == null || retailPrice.signum() < 0 || !NumberNormalizer.fitsStorage(retailPrice)) {
                        row.set(errorIndex, message("sync.error.invalid-retail-price"));
                        failed++;
                        log.debug("Row {} ({}): invalid retail price '{}'", rowIndex, barcode, priceText);
                        continue;
                    }
                }
            }

            Product product = productRepository.findByBarcode(barcode);
            if (product == null) {
                row.set(errorIndex, message("sync.error.barcode-not-found"));
                failed++;
                log.debug("Row {}: barcode {} not found", rowIndex, barcode);
                continue;
            }

            product.setStockQuantity(quantity);
            if (retailPrice != null) {
                product.setRetailPrice(retailPrice);
            }
            productRepository.update(product);

            if (retailPrice != null) {
                priceHistoryRecorder.append(product, PriceType.RETAIL, retailPrice,
                        LocalDateTime.now(), importProperties.getSyncPriceSource(), null);
            }

            succeeded++;
        }

        session.setGrid(grid);

        if (attempted > 0) {
            session.setSyncStatus(failed == 0 ? SyncStatus.SYNCED_SUCCESSFULLY : SyncStatus.ATTEMPTED_WITH_ERRORS);
        }
        sessionRepository.updateGridAndStatus(session);

        log.info("Inventory sync of session {} - Processed: {}, Attempted: {}, Succeeded: {}, Failed: {}, Status: {}",
                session.getId(), processed, attempted, succeeded, failed, session.getSyncStatus());

        return result(processed, attempted, succeeded, failed);
    }

    private SyncResult result(int processed, int attempted, int succeeded, int failed) {
        return SyncResult.builder()
                .processedRows(processed)
                .attemptedUpdates(attempted)
                .succeeded(succeeded)
                .failed(failed)
                .summaryMessage(messageSource.getMessage("sync.summary",
                        new Object[]{attempted, succeeded, failed}, importProperties.getMessageLocale()))
                .build();
    }

    private String message(String code) {
        return messageSource.getMessage(code, null, importProperties.getMessageLocale());
    }

    private List<String> padRow(List<String> row, int width) {
        List<String> padded = new ArrayList<>(row.size());
        for (String cell : row) {
            padded.add(cell == null ? "" : cell);
        }
        while (padded.size() < width) {
            padded.add("");
        }
        return padded;
    }

    private List<List<String>> copyOf(List<List<String>> grid) {
        List<List<String>> copy = new ArrayList<>();
        if (grid == null) return copy;
        for (List<String> row : grid) {
            copy.add(new ArrayList<>(row));
        }
        return copy;
    }
}
