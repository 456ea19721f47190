package com.compliantvault.vaultservice.service.reconciliation;

import com.compliantvault.vaultservice.core.exception.MalformedPayloadException;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.dto.ReconciliationResult;
import com.compliantvault.vaultservice.model.PendingRequest;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.model.VaultEventType;
import com.compliantvault.vaultservice.service.MutationGuard;
import com.compliantvault.vaultservice.service.PendingRequestRegistry;
import com.compliantvault.vaultservice.service.VaultEventPublisher;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for oracle callbacks. Every callback retires its pending request,
 * whatever the outcome, and applies at most one effect.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Reconciler {

    private static final int MAX_REASON_LENGTH = 500;

    private final PendingRequestRegistry registry;
    private final VaultEventPublisher events;
    private final MutationGuard guard;
    private final List<ReconciliationStrategy> strategies;

    private final Map<RequestKind, ReconciliationStrategy> strategyMap = new EnumMap<>(RequestKind.class);

    @PostConstruct
    public void initStrategies() {
        for (RequestKind kind : RequestKind.values()) {
            strategies.stream()
                    .filter(s -> s.supports(kind))
                    .findFirst()
                    .ifPresentOrElse(
                            s -> strategyMap.put(kind, s),
                            () -> log.warn("No reconciliation strategy found for RequestKind: {}", kind)
                    );
        }
    }

    /**
     * @param response hex encoded success payload, may be null or empty
     * @param error    hex encoded error payload, may be null or empty
     */
    public ReconciliationResult onOutcome(String requestId, String response, String error) {
        try {
            return guard.execute(() -> reconcile(requestId, response, error));
        } catch (RuntimeException e) {
            // The failed transaction rolled back any ledger change; retire the entry on its own
            log.error("Reconciliation of request {} failed, retiring it without effect", requestId, e);
            return guard.execute(() -> retireAfterFailure(requestId, e));
        }
    }

    /**
     * Retires requests that have waited longer than allowed. Deposits get their escrow back.
     *
     * @return number of requests retired
     */
    public int expireCreatedBefore(Instant threshold, int batchSize) {
        return guard.execute(() -> {
            List<PendingRequest> stale = registry.findCreatedBefore(threshold, batchSize);

            for (PendingRequest request : stale) {
                registry.consume(request.getRequestId());
                strategyFor(request.getKind()).expire(request);
            }

            return stale.size();
        });
    }

    private ReconciliationResult reconcile(String requestId, String response, String error) {
        Optional<PendingRequest> pending = registry.consume(requestId);

        if (pending.isEmpty()) {
            log.warn("Callback for request {} has no pending entry. Ignoring.", requestId);
            events.publish(VaultEventType.NO_PENDING_REQUEST, requestId, null, null, null);
            return new ReconciliationResult(requestId, VaultEventType.NO_PENDING_REQUEST);
        }

        PendingRequest request = pending.get();
        ReconciliationStrategy strategy = strategyFor(request.getKind());

        VaultEventType outcome = switch (classify(requestId, response, error)) {
            case APPROVED -> strategy.approve(request);
            case REJECTED -> strategy.reject(request);
            case ERRORED -> {
                log.warn("Verification of request {} failed: {}", requestId, describeError(error));
                events.publish(VaultEventType.REQUEST_FAILED, requestId, request.getRequester(), request.getAmount(), describeError(error));
                yield VaultEventType.REQUEST_FAILED;
            }
        };

        log.info("Request {} ({}) reconciled as {}", requestId, request.getKind(), outcome);
        return new ReconciliationResult(requestId, outcome);
    }

    private ReconciliationResult retireAfterFailure(String requestId, RuntimeException cause) {
        Optional<PendingRequest> pending = registry.consume(requestId);

        if (pending.isEmpty()) {
            events.publish(VaultEventType.NO_PENDING_REQUEST, requestId, null, null, null);
            return new ReconciliationResult(requestId, VaultEventType.NO_PENDING_REQUEST);
        }

        PendingRequest request = pending.get();
        events.publish(VaultEventType.REQUEST_FAILED, requestId, request.getRequester(), request.getAmount(),
                truncate("RECONCILIATION_ERROR: " + cause.getMessage()));
        return new ReconciliationResult(requestId, VaultEventType.REQUEST_FAILED);
    }

    VerificationVerdict classify(String requestId, String response, String error) {
        if (hasContent(error)) {
            return VerificationVerdict.ERRORED;
        }

        try {
            BigInteger decoded = Uint256Codec.decode(Uint256Codec.fromHex(response));
            return Uint256Codec.isApproved(decoded) ? VerificationVerdict.APPROVED : VerificationVerdict.REJECTED;
        } catch (MalformedPayloadException e) {
            log.warn("Undecodable response for request {}: {}", requestId, e.getMessage());
            return VerificationVerdict.ERRORED;
        }
    }

    private ReconciliationStrategy strategyFor(RequestKind kind) {
        ReconciliationStrategy strategy = strategyMap.get(kind);
        if (strategy == null) {
            throw new UnsupportedOperationException("No reconciliation strategy for kind: " + kind);
        }
        return strategy;
    }

    private static boolean hasContent(String hex) {
        if (hex == null) return false;

        String digits = hex.strip();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }
        return !digits.isEmpty();
    }

    // Oracle errors are utf-8 text sent as bytes
    private static String describeError(String error) {
        if (!hasContent(error)) {
            return "EMPTY_OR_MALFORMED_RESPONSE";
        }

        try {
            return truncate(new String(Uint256Codec.fromHex(error), StandardCharsets.UTF_8));
        } catch (MalformedPayloadException e) {
            return truncate(error);
        }
    }

    private static String truncate(String reason) {
        return reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
    }
}
