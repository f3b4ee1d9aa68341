package com.merchandise.inventory.service;

/**
 * Applying a change-set failed; the transaction has been rolled back
 */
public class ImportApplyException extends RuntimeException {

    public ImportApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
