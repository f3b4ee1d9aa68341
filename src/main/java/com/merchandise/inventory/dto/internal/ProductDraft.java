package com.merchandise.inventory.dto.internal;

import com.merchandise.inventory.entity.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Store-independent snapshot of one product, keyed by barcode.
 * Supplier and category are carried as names, not references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDraft {

    private String barcode;
    private String itemNumber;
    private String productName;
    private String secondProductName;
    private BigDecimal purchasePrice;
    private BigDecimal retailPrice;
    private BigDecimal stockQuantity;
    private String supplierName;
    private String categoryName;

    public static ProductDraft fromProduct(Product product) {
        return ProductDraft.builder()
                .barcode(product.getBarcode())
                .itemNumber(product.getItemNumber())
                .productName(product.getProductName())
                .secondProductName(product.getSecondProductName())
                .purchasePrice(product.getPurchasePrice())
                .retailPrice(product.getRetailPrice())
                .stockQuantity(product.getStockQuantity())
                .supplierName(product.getSupplierName())
                .categoryName(product.getCategoryName())
                .build();
    }
}
