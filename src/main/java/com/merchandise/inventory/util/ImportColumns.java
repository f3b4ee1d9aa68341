package com.merchandise.inventory.util;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Raw column names recognized in imported and counted grids (case-sensitive)
 */
@UtilityClass
public class ImportColumns {

    public static final String BARCODE = "barcode";
    public static final String ITEM_NUMBER = "itemNumber";
    public static final String PRODUCT_NAME = "productName";
    public static final String SECOND_PRODUCT_NAME = "secondProductName";
    public static final String PURCHASE_PRICE = "purchasePrice";
    public static final String RETAIL_PRICE = "retailPrice";
    public static final String STOCK_QUANTITY = "stockQuantity";
    public static final String QUANTITY = "quantity";
    public static final String SUPPLIER = "supplier";
    public static final String CATEGORY = "category";

    // Inventory count grids
    public static final String REAL_QUANTITY = "realQuantity";
    public static final String SYNC_RETAIL_PRICE = "RetailPrice";

    /**
     * Index of the exact column, falling back to a case-insensitive match
     */
    public int indexOfIgnoreCase(List<String> header, String column) {
        int exact = header.indexOf(column);
        if (exact >= 0) return exact;

        for (int i = 0; i < header.size(); i++) {
            if (column.equalsIgnoreCase(header.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
