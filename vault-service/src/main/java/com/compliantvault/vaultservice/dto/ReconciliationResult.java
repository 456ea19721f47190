package com.compliantvault.vaultservice.dto;

import com.compliantvault.vaultservice.model.VaultEventType;

public record ReconciliationResult(
        String requestId,
        VaultEventType outcome
) {}
