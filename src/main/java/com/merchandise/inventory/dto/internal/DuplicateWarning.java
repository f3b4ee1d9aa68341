package com.merchandise.inventory.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Barcode that appeared on more than one input row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateWarning {

    private String barcode;

    @Builder.Default
    private List<Integer> rowNumbers = new ArrayList<>();
}
