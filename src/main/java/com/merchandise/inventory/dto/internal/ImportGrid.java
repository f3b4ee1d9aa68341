package com.merchandise.inventory.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoded tabular source: header plus untyped string rows
 * Rows may be shorter or longer than the header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportGrid {

    @Builder.Default
    private List<String> header = new ArrayList<>();

    @Builder.Default
    private List<List<String>> rows = new ArrayList<>();

    public static ImportGrid of(List<String> header, List<List<String>> rows) {
        return new ImportGrid(
                header == null ? new ArrayList<>() : header,
                rows == null ? new ArrayList<>() : rows);
    }

    public int getRowCount() {
        return rows.size();
    }
}
