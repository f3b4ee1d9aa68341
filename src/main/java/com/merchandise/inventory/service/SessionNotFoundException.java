package com.merchandise.inventory.service;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(Long sessionId) {
        super("Inventory session not found: " + sessionId);
    }
}
