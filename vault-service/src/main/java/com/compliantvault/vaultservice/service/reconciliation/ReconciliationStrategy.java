package com.compliantvault.vaultservice.service.reconciliation;

import com.compliantvault.vaultservice.model.PendingRequest;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.model.VaultEventType;

/**
 * Effects applied when a pending request of one kind reaches a terminal state.
 * Each method records its own event and returns its type.
 */
public interface ReconciliationStrategy {

    boolean supports(RequestKind kind);

    VaultEventType approve(PendingRequest request);

    VaultEventType reject(PendingRequest request);

    VaultEventType expire(PendingRequest request);
}
