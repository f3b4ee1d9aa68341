package com.merchandise.inventory.processor;

import com.merchandise.inventory.entity.Category;
import com.merchandise.inventory.entity.Supplier;
import com.merchandise.inventory.repository.CategoryRepository;
import com.merchandise.inventory.repository.SupplierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * ReferenceResolver - Find-or-create for supplier and category names
 * An empty name yields a transient, unsaved entity instead of an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceResolver {

    private final SupplierRepository supplierRepository;
    private final CategoryRepository categoryRepository;

    public Supplier findOrCreateSupplier(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            return Supplier.builder().name("").build();
        }

        Supplier existing = supplierRepository.findByName(trimmed);
        if (existing != null) {
            return existing;
        }

        log.info("Creating supplier '{}'", trimmed);
        return supplierRepository.insert(trimmed);
    }

    public Category findOrCreateCategory(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            return Category.builder().name("").build();
        }

        Category existing = categoryRepository.findByName(trimmed);
        if (existing != null) {
            return existing;
        }

        log.info("Creating category '{}'", trimmed);
        return categoryRepository.insert(trimmed);
    }

    /**
     * Supplier for a non-blank name, null otherwise
     */
    public Supplier resolveSupplier(String name) {
        return isBlank(name) ? null : findOrCreateSupplier(name);
    }

    /**
     * Category for a non-blank name, null otherwise
     */
    public Category resolveCategory(String name) {
        return isBlank(name) ? null : findOrCreateCategory(name);
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
