package com.compliantvault.vaultservice.client.oracle.dto;

import java.util.List;

/**
 * What the oracle needs to run the checker script for one request.
 * {@code args[0]} is the request kind code, {@code args[1]} the requester,
 * and for withdrawals {@code args[2]} the amount in decimal.
 */
public record VerificationRequest(
        String source,
        String encryptedSecrets,
        List<String> args,
        Long subscriptionId,
        String donId,
        Integer gasLimit
) {}
