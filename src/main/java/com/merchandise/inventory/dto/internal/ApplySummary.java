package com.merchandise.inventory.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts of one committed change-set application
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplySummary {

    @Builder.Default private Integer created = 0;
    @Builder.Default private Integer updated = 0;
    @Builder.Default private Integer skipped = 0;
    @Builder.Default private Integer priceHistoryEntries = 0;
    @Builder.Default private Long processingTimeMs = 0L;
}
