package com.merchandise.inventory.repository;

import com.merchandise.inventory.entity.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Product Repository - JDBC operations on tbl_product
 * Reads join the supplier and category names through their references.
 */
@Repository
@Slf4j
public class ProductRepository {

    private final JdbcTemplate jdbcTemplate;
    private final SimpleJdbcInsert productInsert;

    private static final String SELECT_SQL = """
        SELECT p.id, p.barcode, p.item_number, p.product_name, p.second_product_name,
               p.purchase_price, p.retail_price, p.stock_quantity,
               p.supplier_id, p.category_id,
               s.name AS supplier_name, c.name AS category_name
        FROM tbl_product p
        LEFT JOIN tbl_supplier s ON s.id = p.supplier_id
        LEFT JOIN tbl_category c ON c.id = p.category_id
        """;

    private static final String UPDATE_SQL = """
        UPDATE tbl_product SET
            barcode = ?, item_number = ?, product_name = ?, second_product_name = ?,
            purchase_price = ?, retail_price = ?, stock_quantity = ?,
            supplier_id = ?, category_id = ?
        WHERE id = ?
        """;

    public ProductRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.productInsert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("tbl_product")
                .usingGeneratedKeyColumns("id");
    }

    /**
     * Full catalog, ordered by barcode
     */
    public List<Product> findAll() {
        return jdbcTemplate.query(SELECT_SQL + " ORDER BY p.barcode", productRowMapper());
    }

    public Product findByBarcode(String barcode) {
        List<Product> results = jdbcTemplate.query(SELECT_SQL + " WHERE p.barcode = ?", productRowMapper(), barcode);
        return results.isEmpty() ? null : results.get(0);
    }

    public long count() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tbl_product", Long.class);
    }

    /**
     * Insert and assign the generated id to the product
     */
    public Product insert(Product product) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("barcode", product.getBarcode())
                .addValue("item_number", product.getItemNumber())
                .addValue("product_name", product.getProductName())
                .addValue("second_product_name", product.getSecondProductName())
                .addValue("purchase_price", product.getPurchasePrice())
                .addValue("retail_price", product.getRetailPrice())
                .addValue("stock_quantity", product.getStockQuantity())
                .addValue("supplier_id", product.getSupplierId())
                .addValue("category_id", product.getCategoryId());

        Number id = productInsert.executeAndReturnKey(params);
        product.setId(id.longValue());
        log.debug("Inserted product {} with id {}", product.getBarcode(), product.getId());
        return product;
    }

    public int update(Product product) {
        return jdbcTemplate.update(UPDATE_SQL,
                product.getBarcode(), product.getItemNumber(), product.getProductName(),
                product.getSecondProductName(), product.getPurchasePrice(), product.getRetailPrice(),
                product.getStockQuantity(), product.getSupplierId(), product.getCategoryId(),
                product.getId());
    }

    private RowMapper<Product> productRowMapper() {
        return (rs, rowNum) -> Product.builder()
                .id(rs.getLong("id"))
                .barcode(rs.getString("barcode"))
                .itemNumber(rs.getString("item_number"))
                .productName(rs.getString("product_name"))
                .secondProductName(rs.getString("second_product_name"))
                .purchasePrice(rs.getBigDecimal("purchase_price"))
                .retailPrice(rs.getBigDecimal("retail_price"))
                .stockQuantity(rs.getBigDecimal("stock_quantity"))
                .supplierId(rs.getObject("supplier_id", Long.class))
                .categoryId(rs.getObject("category_id", Long.class))
                .supplierName(rs.getString("supplier_name"))
                .categoryName(rs.getString("category_name"))
                .build();
    }
}
