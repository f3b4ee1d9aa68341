package com.merchandise.inventory.processor;

import com.merchandise.inventory.dto.internal.GroupedRows;
import com.merchandise.inventory.dto.internal.ImportGrid;
import com.merchandise.inventory.dto.internal.PendingRow;
import com.merchandise.inventory.service.InvalidImportFormatException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RowGrouperTest {

    private final RowGrouper rowGrouper = new RowGrouper();

    @Test
    void shouldFailFastWithoutBarcodeColumn() {
        ImportGrid grid = ImportGrid.of(List.of("code", "productName"), List.of(List.of("B1", "Widget")));

        assertThatThrownBy(() -> rowGrouper.group(grid))
                .isInstanceOf(InvalidImportFormatException.class)
                .hasMessageContaining("barcode");
    }

    @Test
    void shouldSumQuantityAndKeepLastRowForOtherFields() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "productName", "purchasePrice", "quantity"),
                List.of(
                        List.of("B1", "Widget", "10", "3"),
                        List.of("B2", "Gadget", "4", "1"),
                        List.of("B1", "Widget v2", "12", "2")));

        GroupedRows grouped = rowGrouper.group(grid);

        assertThat(grouped.getPendingByBarcode()).containsOnlyKeys("B1", "B2");
        PendingRow b1 = grouped.getPendingByBarcode().get("B1");
        assertThat(b1.getRowNumbers()).containsExactly(1, 3);
        assertThat(b1.getQuantitySum()).isEqualByComparingTo("5");
        assertThat(b1.value("productName")).isEqualTo("Widget v2");
        assertThat(b1.value("purchasePrice")).isEqualTo("12");
        assertThat(b1.resolveStockQuantity()).isEqualByComparingTo("5");
        assertThat(grouped.getErrors()).isEmpty();
    }

    @Test
    void shouldRejectRowsWithBlankBarcode() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "productName", "quantity"),
                List.of(
                        List.of("   ", "Ghost", "7"),
                        List.of("B1", "Widget", "1"),
                        List.of("", "Other ghost", "2")));

        GroupedRows grouped = rowGrouper.group(grid);

        assertThat(grouped.getPendingByBarcode()).containsOnlyKeys("B1");
        assertThat(grouped.getErrors()).hasSize(2);
        assertThat(grouped.getErrors().get(0).getRowNumber()).isEqualTo(1);
        assertThat(grouped.getErrors().get(0).getReason()).isEqualTo(RowGrouper.MISSING_BARCODE);
        assertThat(grouped.getErrors().get(0).getRowContent()).containsEntry("productName", "Ghost");
        assertThat(grouped.getErrors().get(1).getRowNumber()).isEqualTo(3);
        assertThat(grouped.getPendingByBarcode().get("B1").getQuantitySum()).isEqualByComparingTo("1");
    }

    @Test
    void shouldPadShortRowsAndTrimCells() {
        Map<String, String> row = rowGrouper.toColumnMap(
                List.of("barcode", "productName", "retailPrice"),
                List.of("  B9 ", " Name  "));

        assertThat(row).containsExactly(
                entry("barcode", "B9"),
                entry("productName", "Name"),
                entry("retailPrice", ""));
    }

    @Test
    void shouldPreferStockQuantityOverQuantityColumn() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "stockQuantity", "quantity"),
                List.of(
                        List.of("B1", "4", "100"),
                        List.of("B1", "", "6")));

        PendingRow pending = rowGrouper.group(grid).getPendingByBarcode().get("B1");

        assertThat(pending.getQuantitySum()).isEqualByComparingTo("10");
    }

    @Test
    void shouldKeepExplicitZeroWhenSumIsZero() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "quantity"),
                List.of(
                        List.of("B1", "0"),
                        List.of("B1", "0")));

        PendingRow pending = rowGrouper.group(grid).getPendingByBarcode().get("B1");

        assertThat(pending.getQuantitySum()).isEqualByComparingTo("0");
        assertThat(pending.resolveStockQuantity()).isNotNull().isEqualByComparingTo("0");
    }

    @Test
    void shouldLeaveQuantityAbsentWithoutQuantityColumn() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "productName"),
                List.of(List.of("B1", "Widget"), List.of("B1", "Widget")));

        PendingRow pending = rowGrouper.group(grid).getPendingByBarcode().get("B1");

        assertThat(pending.getQuantitySum()).isEqualByComparingTo("0");
        assertThat(pending.resolveStockQuantity()).isNull();
    }

    @Test
    void shouldUseLastLiteralWhenSumIsNotPositive() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "quantity"),
                List.of(
                        List.of("B1", "3"),
                        List.of("B1", "-5")));

        PendingRow pending = rowGrouper.group(grid).getPendingByBarcode().get("B1");

        assertThat(pending.getQuantitySum()).isEqualByComparingTo("-2");
        assertThat(pending.resolveStockQuantity()).isEqualByComparingTo("-5");
    }

    @Test
    void shouldSumIdenticallyForAnyRowOrder() {
        List<List<String>> rows = new ArrayList<>(List.of(
                List.of("B1", "A", "1,5"),
                List.of("B1", "B", "2"),
                List.of("B1", "C", "0.25"),
                List.of("B1", "D", "x")));
        List<String> header = List.of("barcode", "productName", "quantity");

        PendingRow original = rowGrouper.group(ImportGrid.of(header, rows)).getPendingByBarcode().get("B1");
        Collections.reverse(rows);
        PendingRow reversed = rowGrouper.group(ImportGrid.of(header, rows)).getPendingByBarcode().get("B1");

        assertThat(reversed.getQuantitySum()).isEqualByComparingTo(original.getQuantitySum());
        assertThat(original.getQuantitySum()).isEqualByComparingTo("3.75");
        // last-write-wins fields follow input order
        assertThat(original.value("productName")).isEqualTo("D");
        assertThat(reversed.value("productName")).isEqualTo("A");
    }

    @Test
    void shouldSortPendingRowsByBarcode() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode"),
                List.of(List.of("C3"), List.of("A1"), List.of("B2")));

        assertThat(rowGrouper.group(grid).getPendingByBarcode().keySet()).containsExactly("A1", "B2", "C3");
    }

    @Test
    void shouldIgnoreExponentQuantityWhenMergingDuplicates() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "quantity"),
                List.of(List.of("B1", "1e999999999"), List.of("B1", "1")));

        PendingRow b1 = rowGrouper.group(grid).getPendingByBarcode().get("B1");

        assertThat(b1.getRowNumbers()).containsExactly(1, 2);
        assertThat(b1.resolveStockQuantity()).isEqualByComparingTo("1");
    }

    @Test
    void shouldRejectRowWithValueTooLargeToStore() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "retailPrice", "quantity"),
                List.of(
                        List.of("B1", "1000000000000000", "1"),
                        List.of("B2", "9,99", "2")));

        GroupedRows grouped = rowGrouper.group(grid);

        assertThat(grouped.getPendingByBarcode()).containsOnlyKeys("B2");
        assertThat(grouped.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getRowNumber()).isEqualTo(1);
            assertThat(error.getReason()).isEqualTo("Value out of range in column 'retailPrice'.");
        });
    }

    @Test
    void shouldRejectDuplicateRowThatOverflowsQuantityTotal() {
        ImportGrid grid = ImportGrid.of(
                List.of("barcode", "quantity"),
                List.of(
                        List.of("B1", "99999999999999"),
                        List.of("B1", "1"),
                        List.of("B1", "-5")));

        GroupedRows grouped = rowGrouper.group(grid);

        PendingRow b1 = grouped.getPendingByBarcode().get("B1");
        assertThat(b1.getRowNumbers()).containsExactly(1, 3);
        assertThat(b1.getQuantitySum()).isEqualByComparingTo("99999999999994");
        assertThat(grouped.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getRowNumber()).isEqualTo(2);
            assertThat(error.getReason()).isEqualTo(RowGrouper.QUANTITY_TOTAL_OUT_OF_RANGE);
        });
    }
}
