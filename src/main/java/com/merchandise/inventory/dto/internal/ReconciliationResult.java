package com.merchandise.inventory.dto.internal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reviewable change-set of one reconciliation run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    @Builder.Default
    private List<ProductDraft> newProducts = new ArrayList<>();

    @Builder.Default
    private List<ProductUpdateDraft> updatedProducts = new ArrayList<>();

    @Builder.Default
    private List<DuplicateWarning> warnings = new ArrayList<>();

    @Builder.Default
    private List<RowError> errors = new ArrayList<>();

    @JsonProperty(value = "hasChanges", access = JsonProperty.Access.READ_ONLY)
    public boolean hasChanges() {
        return !newProducts.isEmpty() || !updatedProducts.isEmpty();
    }

    @JsonIgnore
    public String getSummary() {
        return String.format("new=%d, updated=%d, duplicates=%d, errors=%d",
                newProducts.size(), updatedProducts.size(), warnings.size(), errors.size());
    }
}
