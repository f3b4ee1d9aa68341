package com.merchandise.inventory.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * InventorySession Entity - Maps to tbl_inventory_session table
 * Holds one counted grid: first row is the header, the rest are data rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventorySession {

    private Long id;

    @Builder.Default private String title = "";
    @Builder.Default private String supplier = "";
    @Builder.Default private String category = "";

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @Builder.Default
    private List<List<String>> grid = new ArrayList<>();

    @Builder.Default
    private SyncStatus syncStatus = SyncStatus.NOT_ATTEMPTED;
}
