package com.merchandise.inventory.web;

import com.merchandise.inventory.dto.internal.SyncResult;
import com.merchandise.inventory.dto.request.CreateSessionRequest;
import com.merchandise.inventory.entity.InventorySession;
import com.merchandise.inventory.repository.InventorySessionRepository;
import com.merchandise.inventory.service.InventorySyncService;
import com.merchandise.inventory.service.SessionNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inventory count sessions and their sync
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class InventorySessionController {

    private final InventorySessionRepository sessionRepository;
    private final InventorySyncService inventorySyncService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public InventorySession create(@Valid @RequestBody CreateSessionRequest request) {
        InventorySession session = InventorySession.builder()
                .title(request.getTitle() == null ? "" : request.getTitle())
                .supplier(request.getSupplier() == null ? "" : request.getSupplier())
                .category(request.getCategory() == null ? "" : request.getCategory())
                .grid(request.getGrid())
                .build();
        return sessionRepository.insert(session);
    }

    @GetMapping("/{id}")
    public InventorySession get(@PathVariable Long id) {
        InventorySession session = sessionRepository.findById(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    @PostMapping("/{id}/sync")
    public SyncResult sync(@PathVariable Long id) {
        return inventorySyncService.sync(id);
    }
}
