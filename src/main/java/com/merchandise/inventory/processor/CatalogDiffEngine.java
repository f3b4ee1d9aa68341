package com.merchandise.inventory.processor;

import com.merchandise.inventory.dto.internal.CatalogSnapshot;
import com.merchandise.inventory.dto.internal.DuplicateWarning;
import com.merchandise.inventory.dto.internal.GroupedRows;
import com.merchandise.inventory.dto.internal.PendingRow;
import com.merchandise.inventory.dto.internal.ProductDraft;
import com.merchandise.inventory.dto.internal.ProductField;
import com.merchandise.inventory.dto.internal.ProductUpdateDraft;
import com.merchandise.inventory.dto.internal.ReconciliationResult;
import com.merchandise.inventory.util.ImportColumns;
import com.merchandise.inventory.util.NumberNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * CatalogDiffEngine - Classify grouped rows against a catalog snapshot
 * Read-only: produces new drafts, update drafts and duplicate warnings.
 */
@Component
@Slf4j
public class CatalogDiffEngine {

    public ReconciliationResult diff(GroupedRows grouped, CatalogSnapshot snapshot) {
        ReconciliationResult result = ReconciliationResult.builder()
                .errors(new ArrayList<>(grouped.getErrors()))
                .build();

        // SortedMap iteration gives barcode-lexicographic order
        for (Map.Entry<String, PendingRow> entry : grouped.getPendingByBarcode().entrySet()) {
            String barcode = entry.getKey();
            PendingRow pending = entry.getValue();
            ProductDraft draft = toDraft(barcode, pending);

            ProductDraft existing = snapshot.findDraft(barcode);
            if (existing == null) {
                result.getNewProducts().add(draft);
            } else {
                List<ProductField> changedFields = changedFields(existing, draft);
                if (!changedFields.isEmpty()) {
                    result.getUpdatedProducts().add(ProductUpdateDraft.builder()
                            .barcode(barcode)
                            .oldDraft(existing)
                            .newDraft(draft)
                            .changedFields(changedFields)
                            .build());
                } else {
                    log.debug("Barcode {} unchanged", barcode);
                }
            }

            if (pending.isDuplicated()) {
                result.getWarnings().add(DuplicateWarning.builder()
                        .barcode(barcode)
                        .rowNumbers(new ArrayList<>(pending.getRowNumbers()))
                        .build());
            }
        }

        log.info("Diff against {} catalog products: {}", snapshot.size(), result.getSummary());
        return result;
    }

    /**
     * Fields that differ between stored and incoming state, in declared order
     */
    public List<ProductField> changedFields(ProductDraft oldDraft, ProductDraft newDraft) {
        return Arrays.stream(ProductField.values())
                .filter(field -> field.differs(oldDraft, newDraft))
                .toList();
    }

    ProductDraft toDraft(String barcode, PendingRow pending) {
        return ProductDraft.builder()
                .barcode(barcode)
                .itemNumber(NumberNormalizer.trimmedOrNull(pending.value(ImportColumns.ITEM_NUMBER)))
                .productName(NumberNormalizer.trimmedOrNull(pending.value(ImportColumns.PRODUCT_NAME)))
                .secondProductName(NumberNormalizer.trimmedOrNull(pending.value(ImportColumns.SECOND_PRODUCT_NAME)))
                .purchasePrice(NumberNormalizer.parseDecimal(pending.value(ImportColumns.PURCHASE_PRICE)))
                .retailPrice(NumberNormalizer.parseDecimal(pending.value(ImportColumns.RETAIL_PRICE)))
                .stockQuantity(pending.resolveStockQuantity())
                .supplierName(NumberNormalizer.trimmedOrNull(pending.value(ImportColumns.SUPPLIER)))
                .categoryName(NumberNormalizer.trimmedOrNull(pending.value(ImportColumns.CATEGORY)))
                .build();
    }
}
