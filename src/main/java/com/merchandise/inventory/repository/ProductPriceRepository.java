package com.merchandise.inventory.repository;

import com.merchandise.inventory.entity.PriceType;
import com.merchandise.inventory.entity.ProductPrice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Product Price Repository - append-only price history in tbl_product_price
 */
@Repository
@Slf4j
public class ProductPriceRepository {

    private final JdbcTemplate jdbcTemplate;
    private final SimpleJdbcInsert priceInsert;

    private static final String SELECT_SQL = """
        SELECT id, product_id, price_type, price, effective_at, price_source, note, created_at
        FROM tbl_product_price
        """;

    public ProductPriceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.priceInsert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("tbl_product_price")
                .usingGeneratedKeyColumns("id");
    }

    public ProductPrice insert(ProductPrice price) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("product_id", price.getProductId())
                .addValue("price_type", price.getPriceType().name())
                .addValue("price", price.getPrice())
                .addValue("effective_at", Timestamp.valueOf(price.getEffectiveAt()))
                .addValue("price_source", price.getSource())
                .addValue("note", price.getNote())
                .addValue("created_at", Timestamp.valueOf(price.getCreatedAt()));

        price.setId(priceInsert.executeAndReturnKey(params).longValue());
        return price;
    }

    /**
     * History of one product, newest first
     */
    public List<ProductPrice> findByProductId(Long productId) {
        return jdbcTemplate.query(SELECT_SQL + " WHERE product_id = ? ORDER BY effective_at DESC, id DESC",
                priceRowMapper(), productId);
    }

    public List<ProductPrice> findByProductIdAndType(Long productId, PriceType priceType) {
        return jdbcTemplate.query(
                SELECT_SQL + " WHERE product_id = ? AND price_type = ? ORDER BY effective_at DESC, id DESC",
                priceRowMapper(), productId, priceType.name());
    }

    public long count() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tbl_product_price", Long.class);
    }

    private RowMapper<ProductPrice> priceRowMapper() {
        return (rs, rowNum) -> ProductPrice.builder()
                .id(rs.getLong("id"))
                .productId(rs.getLong("product_id"))
                .priceType(PriceType.valueOf(rs.getString("price_type")))
                .price(rs.getBigDecimal("price"))
                .effectiveAt(rs.getTimestamp("effective_at").toLocalDateTime())
                .source(rs.getString("price_source"))
                .note(rs.getString("note"))
                .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                .build();
    }
}
