package com.compliantvault.vaultservice.model;

public enum OutboxStatus {
    PENDING,
    PROCESSED
}
