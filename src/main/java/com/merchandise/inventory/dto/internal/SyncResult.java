package com.merchandise.inventory.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of applying one inventory count grid to the catalog
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    @Builder.Default private Integer processedRows = 0;
    @Builder.Default private Integer attemptedUpdates = 0;
    @Builder.Default private Integer succeeded = 0;
    @Builder.Default private Integer failed = 0;

    // Ready-to-display text, localized
    private String summaryMessage;

    public boolean isSuccess() {
        return failed == 0;
    }
}
