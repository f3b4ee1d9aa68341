package com.merchandise.inventory.processor;

import com.merchandise.inventory.dto.internal.GroupedRows;
import com.merchandise.inventory.dto.internal.ImportGrid;
import com.merchandise.inventory.dto.internal.PendingRow;
import com.merchandise.inventory.dto.internal.RowError;
import com.merchandise.inventory.service.InvalidImportFormatException;
import com.merchandise.inventory.util.ImportColumns;
import com.merchandise.inventory.util.NumberNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * RowGrouper - Normalize raw rows and group them by barcode
 * Quantity is summed across rows of the same barcode, every other column is
 * taken from the last row seen.
 */
@Component
@Slf4j
public class RowGrouper {

    public static final String MISSING_BARCODE_COLUMN = "Cannot find the 'barcode' column in the file.";
    public static final String MISSING_BARCODE = "Missing barcode.";
    public static final String VALUE_OUT_OF_RANGE = "Value out of range in column '%s'.";
    public static final String QUANTITY_TOTAL_OUT_OF_RANGE = "Quantity total out of range.";

    private static final List<String> NUMERIC_COLUMNS = List.of(
            ImportColumns.PURCHASE_PRICE,
            ImportColumns.RETAIL_PRICE,
            ImportColumns.STOCK_QUANTITY,
            ImportColumns.QUANTITY);

    public GroupedRows group(ImportGrid grid) {
        List<String> header = grid.getHeader();
        if (!header.contains(ImportColumns.BARCODE)) {
            throw new InvalidImportFormatException(MISSING_BARCODE_COLUMN);
        }

        SortedMap<String, PendingRow> pendingByBarcode = new TreeMap<>();
        GroupedRows result = GroupedRows.builder()
                .pendingByBarcode(pendingByBarcode)
                .build();

        List<List<String>> rows = grid.getRows();
        for (int index = 0; index < rows.size(); index++) {
            int rowNumber = index + 1;
            Map<String, String> row = toColumnMap(header, rows.get(index));

            String barcode = row.getOrDefault(ImportColumns.BARCODE, "");
            if (barcode.isEmpty()) {
                log.debug("Row {} skipped: missing barcode", rowNumber);
                result.getErrors().add(rowError(rowNumber, MISSING_BARCODE, row));
                continue;
            }

            String oversized = firstOversizedColumn(row);
            if (oversized != null) {
                log.debug("Row {} ({}) skipped: {} out of range", rowNumber, barcode, oversized);
                result.getErrors().add(rowError(rowNumber, String.format(VALUE_OUT_OF_RANGE, oversized), row));
                continue;
            }

            BigDecimal quantity = quantityContribution(row);
            PendingRow pending = pendingByBarcode.get(barcode);
            if (pending == null) {
                pendingByBarcode.put(barcode, new PendingRow(row, rowNumber, quantity));
            } else if (!NumberNormalizer.fitsStorage(pending.getQuantitySum().add(quantity))) {
                log.debug("Row {} ({}) skipped: quantity total out of range", rowNumber, barcode);
                result.getErrors().add(rowError(rowNumber, QUANTITY_TOTAL_OUT_OF_RANGE, row));
            } else {
                pending.merge(row, rowNumber, quantity);
            }
        }

        log.info("Grouped {} rows into {} barcodes ({} rows rejected)",
                rows.size(), pendingByBarcode.size(), result.getErrors().size());
        return result;
    }

    /**
     * Header-ordered map of trimmed cells; missing cells become empty strings.
     * A repeated header name keeps its last cell.
     */
    Map<String, String> toColumnMap(List<String> header, List<String> cells) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int col = 0; col < header.size(); col++) {
            String raw = cells != null && col < cells.size() ? cells.get(col) : "";
            row.put(header.get(col), raw == null ? "" : raw.trim());
        }
        return row;
    }

    private String firstOversizedColumn(Map<String, String> row) {
        for (String column : NUMERIC_COLUMNS) {
            if (!NumberNormalizer.fitsStorage(NumberNormalizer.parseDecimal(row.get(column)))) {
                return column;
            }
        }
        return null;
    }

    private RowError rowError(int rowNumber, String reason, Map<String, String> row) {
        return RowError.builder()
                .rowNumber(rowNumber)
                .reason(reason)
                .rowContent(row)
                .build();
    }

    /**
     * stockQuantity, then quantity, otherwise zero
     */
    private BigDecimal quantityContribution(Map<String, String> row) {
        BigDecimal quantity = NumberNormalizer.parseDecimal(row.get(ImportColumns.STOCK_QUANTITY));
        if (quantity == null) {
            quantity = NumberNormalizer.parseDecimal(row.get(ImportColumns.QUANTITY));
        }
        return quantity == null ? BigDecimal.ZERO : quantity;
    }
}
