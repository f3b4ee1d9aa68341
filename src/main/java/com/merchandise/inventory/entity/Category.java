package com.merchandise.inventory.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Category Entity - Maps to tbl_category table, unique by name
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {

    private Long id;
    private String name;

    public boolean isTransient() {
        return id == null;
    }
}
