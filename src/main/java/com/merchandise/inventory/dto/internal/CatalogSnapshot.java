package com.merchandise.inventory.dto.internal;

import com.merchandise.inventory.entity.Product;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the catalog, keyed by barcode, taken once per run.
 * Only the diff step reads it; applying changes always re-reads live rows.
 */
public final class CatalogSnapshot {

    private final Map<String, Product> byBarcode;

    private CatalogSnapshot(Map<String, Product> byBarcode) {
        this.byBarcode = Map.copyOf(byBarcode);
    }

    public static CatalogSnapshot of(List<Product> products) {
        Map<String, Product> map = new HashMap<>();
        for (Product product : products) {
            map.putIfAbsent(product.getBarcode(), product.toBuilder().build());
        }
        return new CatalogSnapshot(map);
    }

    /**
     * Stored state of the barcode as a draft, null when not in the catalog
     */
    public ProductDraft findDraft(String barcode) {
        Product product = byBarcode.get(barcode);
        return product == null ? null : ProductDraft.fromProduct(product);
    }

    public int size() {
        return byBarcode.size();
    }
}
