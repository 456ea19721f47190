package com.compliantvault.vaultservice.service.reconciliation;

public enum VerificationVerdict {
    APPROVED,
    REJECTED,
    ERRORED
}
