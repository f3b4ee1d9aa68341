package com.merchandise.inventory.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * ProductPrice Entity - Maps to tbl_product_price table
 * Append-only price history; rows are never updated or deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductPrice {

    private Long id;
    private Long productId;

    private PriceType priceType;
    private BigDecimal price;

    @Builder.Default
    private LocalDateTime effectiveAt = LocalDateTime.now();

    private String source;
    private String note;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
