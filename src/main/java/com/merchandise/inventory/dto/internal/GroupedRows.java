package com.merchandise.inventory.dto.internal;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Output of the row grouper: one pending row per barcode, sorted by barcode
 */
@Data
@Builder
public class GroupedRows {

    @Builder.Default
    private SortedMap<String, PendingRow> pendingByBarcode = new TreeMap<>();

    @Builder.Default
    private List<RowError> errors = new ArrayList<>();
}
