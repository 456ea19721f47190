package com.compliantvault.vaultservice.service;

import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;
import com.compliantvault.vaultservice.client.oracle.service.VerificationOracle;
import com.compliantvault.vaultservice.model.OracleSettings;
import com.compliantvault.vaultservice.model.RequestKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Builds verification requests from the current oracle settings and hands them
 * to the oracle. Does not touch balances or the registry.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VerificationDispatcher {

    private final VerificationOracle oracle;
    private final OracleSettingsService settingsService;

    public String dispatch(RequestKind kind, String requester, BigInteger amount) {
        OracleSettings settings = settingsService.current();

        VerificationRequest request = new VerificationRequest(
                settings.getSource(),
                settings.getEncryptedSecrets(),
                buildArgs(kind, requester, amount),
                settings.getSubscriptionId(),
                settings.getDonId(),
                settings.getGasLimit()
        );

        String requestId = oracle.dispatch(request);
        log.info("Dispatched {} verification for {} as request {}", kind, requester, requestId);
        return requestId;
    }

    static List<String> buildArgs(RequestKind kind, String requester, BigInteger amount) {
        return switch (kind) {
            case DEPOSIT -> List.of(kind.getCode(), requester);
            case WITHDRAWAL -> List.of(kind.getCode(), requester, amount.toString());
        };
    }
}
