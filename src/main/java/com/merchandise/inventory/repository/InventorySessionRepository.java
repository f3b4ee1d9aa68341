package com.merchandise.inventory.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.merchandise.inventory.entity.InventorySession;
import com.merchandise.inventory.entity.SyncStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Inventory Session Repository - counted grids stored as JSON text
 */
@Repository
@Slf4j
public class InventorySessionRepository {

    private static final TypeReference<List<List<String>>> GRID_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SimpleJdbcInsert sessionInsert;

    public InventorySessionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.sessionInsert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("tbl_inventory_session")
                .usingGeneratedKeyColumns("id");
    }

    public InventorySession insert(InventorySession session) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("title", session.getTitle())
                .addValue("supplier", session.getSupplier())
                .addValue("category", session.getCategory())
                .addValue("created_at", Timestamp.valueOf(session.getCreatedAt()))
                .addValue("grid_json", writeGrid(session.getGrid()))
                .addValue("sync_status", session.getSyncStatus().name());

        session.setId(sessionInsert.executeAndReturnKey(params).longValue());
        log.debug("Created inventory session {} ({} grid rows)", session.getId(), session.getGrid().size());
        return session;
    }

    public InventorySession findById(Long id) {
        List<InventorySession> results = jdbcTemplate.query(
                "SELECT * FROM tbl_inventory_session WHERE id = ?", sessionRowMapper(), id);
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * Persist the grid and sync status of an existing session
     */
    public int updateGridAndStatus(InventorySession session) {
        return jdbcTemplate.update(
                "UPDATE tbl_inventory_session SET grid_json = ?, sync_status = ? WHERE id = ?",
                writeGrid(session.getGrid()), session.getSyncStatus().name(), session.getId());
    }

    public long count() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tbl_inventory_session", Long.class);
    }

    private String writeGrid(List<List<String>> grid) {
        try {
            return objectMapper.writeValueAsString(grid == null ? List.of() : grid);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize inventory grid", e);
        }
    }

    private List<List<String>> readGrid(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, GRID_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read inventory grid", e);
        }
    }

    private RowMapper<InventorySession> sessionRowMapper() {
        return (rs, rowNum) -> InventorySession.builder()
                .id(rs.getLong("id"))
                .title(rs.getString("title"))
                .supplier(rs.getString("supplier"))
                .category(rs.getString("category"))
                .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                .grid(readGrid(rs.getString("grid_json")))
                .syncStatus(SyncStatus.valueOf(rs.getString("sync_status")))
                .build();
    }
}
