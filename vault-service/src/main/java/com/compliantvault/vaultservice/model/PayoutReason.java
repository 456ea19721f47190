package com.compliantvault.vaultservice.model;

public enum PayoutReason {
    REFUND, // Escrowed deposit handed back
    WITHDRAWAL
}
