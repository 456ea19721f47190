package com.compliantvault.vaultservice.model;

/**
 * Observable events of the vault. Each one is written to the outbox in the same
 * transaction as the state change it reports.
 */
public enum VaultEventType {

    DEPOSIT_REQUESTED("vault.requests"),
    WITHDRAWAL_REQUESTED("vault.requests"),

    /** Approved deposit, escrow credited to the requester's balance. */
    DEPOSIT_FULFILLED("vault.settlements"),

    /** Rejected deposit, escrow refunded. Balance untouched. */
    DEPOSIT_CANCELLED("vault.settlements"),

    /** Approved withdrawal, balance debited and amount paid out. */
    WITHDRAWAL_FULFILLED("vault.settlements"),

    /** Rejected withdrawal, or approved but no longer covered by the balance. */
    WITHDRAWAL_CANCELLED("vault.settlements"),

    /** The oracle reported an error. No funds moved. */
    REQUEST_FAILED("vault.anomalies"),

    /** Callback for an id that is unknown or already consumed. */
    NO_PENDING_REQUEST("vault.anomalies"),

    /** Retired by the expiry sweep before any callback arrived. */
    REQUEST_EXPIRED("vault.anomalies");

    private final String topic;

    VaultEventType(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
