package com.merchandise.inventory.service;

/**
 * Structural problem with an imported source (e.g. no barcode column).
 * Raised before any row is classified.
 */
public class InvalidImportFormatException extends RuntimeException {

    public InvalidImportFormatException(String message) {
        super(message);
    }
}
