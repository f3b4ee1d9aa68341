package com.merchandise.inventory.entity;

/**
 * Outcome of the last inventory count sync of a session
 */
public enum SyncStatus {
    NOT_ATTEMPTED,
    SYNCED_SUCCESSFULLY,
    ATTEMPTED_WITH_ERRORS
}
