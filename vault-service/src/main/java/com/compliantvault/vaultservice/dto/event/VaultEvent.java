package com.compliantvault.vaultservice.dto.event;

import com.compliantvault.vaultservice.model.VaultEventType;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

public record VaultEvent(
        UUID eventId,
        VaultEventType eventType,
        String requestId,
        String principal, // null for NO_PENDING_REQUEST
        BigInteger amount,
        String reason,
        Instant timestamp
) {}
