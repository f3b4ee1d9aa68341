package com.merchandise.inventory.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Supplier Entity - Maps to tbl_supplier table, unique by name
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Supplier {

    private Long id;
    private String name;

    public boolean isTransient() {
        return id == null;
    }
}
