package com.merchandise.inventory.dto.internal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.merchandise.inventory.util.NumberNormalizer;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

/**
 * Comparable product fields, in the order changes are reported.
 * Text fields treat empty and absent as equal; decimal fields use the
 * normalizer's epsilon comparison.
 */
public enum ProductField {

    ITEM_NUMBER("itemNumber", Kind.TEXT, ProductDraft::getItemNumber),
    PRODUCT_NAME("productName", Kind.TEXT, ProductDraft::getProductName),
    SECOND_PRODUCT_NAME("secondProductName", Kind.TEXT, ProductDraft::getSecondProductName),
    PURCHASE_PRICE("purchasePrice", Kind.DECIMAL, ProductDraft::getPurchasePrice),
    RETAIL_PRICE("retailPrice", Kind.DECIMAL, ProductDraft::getRetailPrice),
    STOCK_QUANTITY("stockQuantity", Kind.DECIMAL, ProductDraft::getStockQuantity),
    SUPPLIER_NAME("supplierName", Kind.TEXT, ProductDraft::getSupplierName),
    CATEGORY_NAME("categoryName", Kind.TEXT, ProductDraft::getCategoryName);

    enum Kind { TEXT, DECIMAL }

    private final String fieldName;
    private final Kind kind;
    private final Function<ProductDraft, Object> accessor;

    ProductField(String fieldName, Kind kind, Function<ProductDraft, Object> accessor) {
        this.fieldName = fieldName;
        this.kind = kind;
        this.accessor = accessor;
    }

    @JsonValue
    public String getFieldName() {
        return fieldName;
    }

    public Object valueOf(ProductDraft draft) {
        return draft == null ? null : accessor.apply(draft);
    }

    public boolean differs(ProductDraft oldDraft, ProductDraft newDraft) {
        Object before = valueOf(oldDraft);
        Object after = valueOf(newDraft);

        if (kind == Kind.TEXT) {
            return !Objects.equals(textOf(before), textOf(after));
        }
        return !NumberNormalizer.decimalsEqual((BigDecimal) before, (BigDecimal) after);
    }

    @JsonCreator
    public static ProductField fromFieldName(String name) {
        return Arrays.stream(values())
                .filter(field -> field.fieldName.equals(name) || field.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown product field: " + name));
    }

    private static String textOf(Object value) {
        return value == null ? "" : value.toString();
    }
}
