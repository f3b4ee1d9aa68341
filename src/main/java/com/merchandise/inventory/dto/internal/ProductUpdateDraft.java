package com.merchandise.inventory.dto.internal;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Existing product (old) against incoming row (new) for one barcode.
 * Applied as a whole: every listed field is written, or none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductUpdateDraft {

    private String barcode;

    @JsonProperty("old")
    private ProductDraft oldDraft;

    @JsonProperty("new")
    private ProductDraft newDraft;

    @Builder.Default
    private List<ProductField> changedFields = new ArrayList<>();
}
