package com.merchandise.inventory.repository;

import com.merchandise.inventory.entity.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/**
 * Supplier Repository - JDBC operations on tbl_supplier (reference table, unique by name)
 */
@Repository
@Slf4j
public class SupplierRepository {

    private final JdbcTemplate jdbcTemplate;
    private final SimpleJdbcInsert supplierInsert;

    public SupplierRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.supplierInsert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("tbl_supplier")
                .usingGeneratedKeyColumns("id");
    }

    /**
     * Exact, case-sensitive name match
     */
    public Supplier findByName(String name) {
        List<Supplier> results = jdbcTemplate.query(
                "SELECT id, name FROM tbl_supplier WHERE name = ?", supplierRowMapper(), name);
        return results.isEmpty() ? null : results.get(0);
    }

    public List<Supplier> findAll() {
        return jdbcTemplate.query("SELECT id, name FROM tbl_supplier ORDER BY name", supplierRowMapper());
    }

    public long count() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tbl_supplier", Long.class);
    }

    public Supplier insert(String name) {
        Number id = supplierInsert.executeAndReturnKey(Map.of("name", name));
        log.debug("Created supplier '{}' with id {}", name, id);
        return Supplier.builder().id(id.longValue()).name(name).build();
    }

    private RowMapper<Supplier> supplierRowMapper() {
        return (rs, rowNum) -> Supplier.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .build();
    }
}
