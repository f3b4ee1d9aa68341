package com.merchandise.inventory.repository;

import com.merchandise.inventory.entity.Category;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/**
 * Category Repository - JDBC operations on tbl_category (reference table, unique by name)
 */
@Repository
@Slf4j
public class CategoryRepository {

    private final JdbcTemplate jdbcTemplate;
    private final SimpleJdbcInsert categoryInsert;

    public CategoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.categoryInsert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("tbl_category")
                .usingGeneratedKeyColumns("id");
    }

    /**
     * Exact, case-sensitive name match
     */
    public Category findByName(String name) {
        List<Category> results = jdbcTemplate.query(
                "SELECT id, name FROM tbl_category WHERE name = ?", categoryRowMapper(), name);
        return results.isEmpty() ? null : results.get(0);
    }

    public List<Category> findAll() {
        return jdbcTemplate.query("SELECT id, name FROM tbl_category ORDER BY name", categoryRowMapper());
    }

    public long count() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tbl_category", Long.class);
    }

    public Category insert(String name) {
        Number id = categoryInsert.executeAndReturnKey(Map.of("name", name));
        log.debug("Created category '{}' with id {}", name, id);
        return Category.builder().id(id.longValue()).name(name).build();
    }

    private RowMapper<Category> categoryRowMapper() {
        return (rs, rowNum) -> Category.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .build();
    }
}
