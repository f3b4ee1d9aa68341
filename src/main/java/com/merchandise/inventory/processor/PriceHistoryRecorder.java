package com.merchandise.inventory.processor;

import com.merchandise.inventory.entity.PriceType;
import com.merchandise.inventory.entity.Product;
import com.merchandise.inventory.entity.ProductPrice;
import com.merchandise.inventory.repository.ProductPriceRepository;
import com.merchandise.inventory.util.NumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * PriceHistoryRecorder - Append price history rows for actual price changes
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceHistoryRecorder {

    private final ProductPriceRepository productPriceRepository;

    /**
     * Log purchase and retail prices that moved from their previous value.
     * An absent new price never produces an entry.
     *
     * @return number of history rows written (0-2)
     */
    public int recordChanges(Product product,
                             BigDecimal oldPurchase, BigDecimal newPurchase,
                             BigDecimal oldRetail, BigDecimal newRetail,
                             String source) {
        LocalDateTime now = LocalDateTime.now();
        int written = 0;

        if (newPurchase != null && !NumberNormalizer.decimalsEqual(oldPurchase, newPurchase)) {
            append(product, PriceType.PURCHASE, newPurchase, now, source, null);
            written++;
        }
        if (newRetail != null && !NumberNormalizer.decimalsEqual(oldRetail, newRetail)) {
            append(product, PriceType.RETAIL, newRetail, now, source, null);
            written++;
        }
        return written;
    }

    /**
     * Unconditional entry
     */
    public ProductPrice append(Product product, PriceType type, BigDecimal price,
                               LocalDateTime effectiveAt, String source, String note) {
        ProductPrice entry = productPriceRepository.insert(ProductPrice.builder()
                .productId(product.getId())
                .priceType(type)
                .price(price)
                .effectiveAt(effectiveAt)
                .source(source)
                .note(note)
                .createdAt(effectiveAt)
                .build());

        log.debug("{} price of {} recorded: {} ({})", type, product.getBarcode(), price, source);
        return entry;
    }
}
