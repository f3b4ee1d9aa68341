package com.merchandise.inventory.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input row that could not be classified
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowError {

    private Integer rowNumber;
    private String reason;

    @Builder.Default
    private Map<String, String> rowContent = new LinkedHashMap<>();
}
