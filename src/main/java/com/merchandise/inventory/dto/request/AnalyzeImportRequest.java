package com.merchandise.inventory.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoded spreadsheet submitted for analysis
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeImportRequest {

    @NotEmpty(message = "Header is required.")
    private List<String> header;

    @NotNull(message = "Rows are required.")
    @Builder.Default
    private List<List<String>> rows = new ArrayList<>();
}
