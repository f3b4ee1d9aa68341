package com.merchandise.inventory.dto.internal;

import com.merchandise.inventory.util.ImportColumns;
import com.merchandise.inventory.util.NumberNormalizer;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * All input rows seen for one barcode during a reconciliation run.
 * Every column is last-write-wins except the quantity, which is summed.
 */
@Getter
public class PendingRow {

    private Map<String, String> lastRow;
    private final List<Integer> rowNumbers = new ArrayList<>();
    private BigDecimal quantitySum;

    public PendingRow(Map<String, String> row, int rowNumber, BigDecimal quantity) {
        this.lastRow = row;
        this.rowNumbers.add(rowNumber);
        this.quantitySum = quantity;
    }

    public void merge(Map<String, String> row, int rowNumber, BigDecimal quantity) {
        this.lastRow = row;
        this.rowNumbers.add(rowNumber);
        this.quantitySum = quantitySum.add(quantity);
    }

    public List<Integer> getRowNumbers() {
        return Collections.unmodifiableList(rowNumbers);
    }

    public boolean isDuplicated() {
        return rowNumbers.size() > 1;
    }

    public String value(String column) {
        return lastRow.get(column);
    }

    /**
     * Positive sum wins. Otherwise the last row's own literal is kept, so an
     * explicit "0" stays zero and a missing quantity column stays null.
     * The stockQuantity column shadows quantity whenever the header has it.
     */
    public BigDecimal resolveStockQuantity() {
        if (quantitySum.signum() > 0) {
            return quantitySum;
        }

        String literal = lastRow.containsKey(ImportColumns.STOCK_QUANTITY)
                ? lastRow.get(ImportColumns.STOCK_QUANTITY)
                : lastRow.get(ImportColumns.QUANTITY);
        return NumberNormalizer.parseDecimal(literal);
    }
}
