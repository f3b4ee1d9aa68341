package com.merchandise.inventory.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Product Entity - Maps to tbl_product table
 * Natural key is the barcode (unique). Supplier and category names are
 * resolved through the reference tables when the row is read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    private Long id;
    private String barcode;

    private String itemNumber;
    private String productName;
    private String secondProductName;

    private BigDecimal purchasePrice;
    private BigDecimal retailPrice;
    private BigDecimal stockQuantity;

    // References
    private Long supplierId;
    private Long categoryId;

    // Read-only, joined from tbl_supplier / tbl_category
    private String supplierName;
    private String categoryName;

    public void assignSupplier(Supplier supplier) {
        this.supplierId = supplier == null ? null : supplier.getId();
        this.supplierName = supplier == null ? null : supplier.getName();
    }

    public void assignCategory(Category category) {
        this.categoryId = category == null ? null : category.getId();
        this.categoryName = category == null ? null : category.getName();
    }
}
