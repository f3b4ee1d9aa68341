package com.merchandise.inventory.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * NumberNormalizer - Parse comma/period decimal strings and clean text cells
 * Only comma and period decimal separators are understood, no thousands grouping
 * and no exponent notation.
 */
@UtilityClass
public class NumberNormalizer {

    public static final BigDecimal DEFAULT_EPSILON = new BigDecimal("0.0001");

    // Integer digits of a NUMERIC(20,6) catalog column
    public static final int MAX_INTEGER_DIGITS = 14;

    private static final Pattern DECIMAL_LITERAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    /**
     * Replace comma with period and trim whitespace
     */
    public String normalizeNumberString(String text) {
        if (text == null) return "";
        return text.replace(',', '.').trim();
    }

    /**
     * Parse a decimal literal, null when empty or malformed
     */
    public BigDecimal parseDecimal(String text) {
        String normalized = normalizeNumberString(text);
        if (!DECIMAL_LITERAL.matcher(normalized).matches()) return null;
        return new BigDecimal(normalized);
    }

    /**
     * Whether the value can be stored in a catalog quantity or price column
     */
    public boolean fitsStorage(BigDecimal value) {
        if (value == null) return true;
        return value.precision() - value.scale() <= MAX_INTEGER_DIGITS;
    }

    /**
     * Trimmed value, null instead of empty string
     */
    public String trimmedOrNull(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public boolean decimalsEqual(BigDecimal a, BigDecimal b) {
        return decimalsEqual(a, b, DEFAULT_EPSILON);
    }

    /**
     * Null-aware comparison: both null are equal, one null is never equal,
     * otherwise equal when the absolute difference is below epsilon.
     */
    public boolean decimalsEqual(BigDecimal a, BigDecimal b, BigDecimal epsilon) {
        if (a == null && b == null) return true;
        if (a == null || b == null) return false;
        return a.subtract(b).abs().compareTo(epsilon) < 0;
    }
}
