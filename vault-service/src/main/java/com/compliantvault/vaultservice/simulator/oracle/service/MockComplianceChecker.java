package com.compliantvault.vaultservice.simulator.oracle.service;

import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stand-in for the remote checker script. Denied addresses (case-insensitive) are non-compliant,
 * anything else passes. Bad arguments raise, as the real script does.
 */
@Component
@Profile("dev")
public class MockComplianceChecker {

    private final Set<String> denied;

    public MockComplianceChecker(@Value("${app.mock-oracle.denied:}") Set<String> denied) {
        this.denied = denied.stream()
                .map(address -> address.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    public byte[] check(VerificationRequest request) {
        if (request.args() == null || request.args().size() < 2) {
            throw new IllegalArgumentException("Missing arguments");
        }

        String kind = request.args().get(0);
        String address = request.args().get(1).toLowerCase(Locale.ROOT);

        if (!"0".equals(kind) && !"1".equals(kind)) {
            throw new IllegalArgumentException("Invalid request type");
        }

        if ("1".equals(kind) && request.args().size() < 3) {
            throw new IllegalArgumentException("Withdrawal check needs an amount");
        }

        boolean compliant = !denied.contains(address);
        return Uint256Codec.encode(compliant ? BigInteger.ONE : BigInteger.ZERO);
    }
}
