package com.merchandise.inventory.processor;

import com.merchandise.inventory.config.ImportProperties;
import com.merchandise.inventory.dto.internal.ApplySummary;
import com.merchandise.inventory.dto.internal.ProductDraft;
import com.merchandise.inventory.dto.internal.ProductField;
import com.merchandise.inventory.dto.internal.ProductUpdateDraft;
import com.merchandise.inventory.dto.internal.ReconciliationResult;
import com.merchandise.inventory.entity.Product;
import com.merchandise.inventory.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * ChangeSetApplier - Write a reviewed reconciliation result to the catalog
 * The whole change-set is one transaction: any failure rolls everything back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeSetApplier {

    private final ProductRepository productRepository;
    private final ReferenceResolver referenceResolver;
    private final PriceHistoryRecorder priceHistoryRecorder;
    private final ImportProperties importProperties;

    @Transactional(rollbackFor = Exception.class)
    public ApplySummary apply(ReconciliationResult result) {
        long startTime = System.currentTimeMillis();
        ApplySummary summary = ApplySummary.builder().build();
        String source = importProperties.getImportPriceSource();

        log.info("Applying change-set: {}", result.getSummary());

        for (ProductDraft draft : result.getNewProducts()) {
            createProduct(draft, source, summary);
        }

        for (ProductUpdateDraft update : result.getUpdatedProducts()) {
            updateProduct(update, source, summary);
        }

        summary.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("✅ Change-set applied - Created: {}, Updated: {}, Skipped: {}, Price history: {}, Duration: {}ms",
                summary.getCreated(), summary.getUpdated(), summary.getSkipped(),
                summary.getPriceHistoryEntries(), summary.getProcessingTimeMs());
        return summary;
    }

    private void createProduct(ProductDraft draft, String source, ApplySummary summary) {
        Product product = Product.builder()
                .barcode(draft.getBarcode())
                .itemNumber(draft.getItemNumber())
                .productName(draft.getProductName())
                .secondProductName(draft.getSecondProductName())
                .purchasePrice(draft.getPurchasePrice())
                .retailPrice(draft.getRetailPrice())
                .stockQuantity(draft.getStockQuantity())
                .build();
        product.assignSupplier(referenceResolver.resolveSupplier(draft.getSupplierName()));
        product.assignCategory(referenceResolver.resolveCategory(draft.getCategoryName()));

        productRepository.insert(product);
        summary.setCreated(summary.getCreated() + 1);

        int written = priceHistoryRecorder.recordChanges(product,
                null, draft.getPurchasePrice(),
                null, draft.getRetailPrice(),
                source);
        summary.setPriceHistoryEntries(summary.getPriceHistoryEntries() + written);
    }

    private void updateProduct(ProductUpdateDraft update, String source, ApplySummary summary) {
        // Live row, never the snapshot used while diffing
        Product product = productRepository.findByBarcode(update.getBarcode());
        if (product == null) {
            log.warn("Product {} disappeared since analysis, update skipped", update.getBarcode());
            summary.setSkipped(summary.getSkipped() + 1);
            return;
        }

        ProductDraft newDraft = update.getNewDraft();
        BigDecimal oldPurchase = product.getPurchasePrice();
        BigDecimal oldRetail = product.getRetailPrice();

        for (ProductField field : update.getChangedFields()) {
            applyField(product, field, newDraft);
        }

        productRepository.update(product);
        summary.setUpdated(summary.getUpdated() + 1);

        int written = priceHistoryRecorder.recordChanges(product,
                oldPurchase, newDraft.getPurchasePrice(),
                oldRetail, newDraft.getRetailPrice(),
                source);
        summary.setPriceHistoryEntries(summary.getPriceHistoryEntries() + written);
    }

    private void applyField(Product product, ProductField field, ProductDraft draft) {
        switch (field) {
            case ITEM_NUMBER -> product.setItemNumber(draft.getItemNumber());
            case PRODUCT_NAME -> product.setProductName(draft.getProductName());
            case SECOND_PRODUCT_NAME -> product.setSecondProductName(draft.getSecondProductName());
            case PURCHASE_PRICE -> product.setPurchasePrice(draft.getPurchasePrice());
            case RETAIL_PRICE -> product.setRetailPrice(draft.getRetailPrice());
            case STOCK_QUANTITY -> product.setStockQuantity(draft.getStockQuantity());
            case SUPPLIER_NAME -> product.assignSupplier(referenceResolver.resolveSupplier(draft.getSupplierName()));
            case CATEGORY_NAME -> product.assignCategory(referenceResolver.resolveCategory(draft.getCategoryName()));
        }
    }
}
