package com.compliantvault.vaultservice.service;

import com.compliantvault.vaultservice.core.exception.DuplicateRequestIdException;
import com.compliantvault.vaultservice.model.PendingRequest;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.repository.PayoutRepository;
import com.compliantvault.vaultservice.repository.PendingRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * In-flight verification requests keyed by the oracle's request id.
 * Entries are inserted once and removed once; they are never updated.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PendingRequestRegistry {

    private final PendingRequestRepository repository;
    private final PayoutRepository payoutRepository;

    // Ids with a recorded payout count as used even after their entry is gone
    public PendingRequest record(String requestId, String requester, BigInteger amount, RequestKind kind) {
        if (repository.existsById(requestId) || payoutRepository.existsByRequestId(requestId)) {
            throw new DuplicateRequestIdException(requestId);
        }

        return repository.save(PendingRequest.builder()
                .requestId(requestId)
                .requester(requester)
                .amount(amount)
                .kind(kind)
                .build());
    }

    /**
     * Removes and returns the entry. A second call for the same id finds nothing.
     */
    public Optional<PendingRequest> consume(String requestId) {
        Optional<PendingRequest> pending = repository.findById(requestId);
        pending.ifPresent(repository::delete);
        return pending;
    }

    public BigInteger escrowedDeposits() {
        BigInteger sum = repository.sumAmountByKind(RequestKind.DEPOSIT);
        return sum != null ? sum : BigInteger.ZERO;
    }

    public List<PendingRequest> findCreatedBefore(Instant threshold, int limit) {
        return repository.findByCreatedAtBeforeOrderByCreatedAt(threshold, PageRequest.of(0, limit));
    }
}
