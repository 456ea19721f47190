package com.compliantvault.vaultservice.service;

import com.compliantvault.vaultservice.model.Payout;
import com.compliantvault.vaultservice.model.PayoutReason;
import com.compliantvault.vaultservice.repository.PayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Records value leaving the vault. A request can be paid out at most once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PayoutService {

    private final PayoutRepository payoutRepository;

    public Payout pay(String requestId, String recipient, BigInteger amount, PayoutReason reason) {
        if (payoutRepository.existsByRequestId(requestId)) {
            throw new IllegalStateException("Payout already recorded for request " + requestId);
        }

        Payout payout = payoutRepository.save(Payout.builder()
                .requestId(requestId)
                .recipient(recipient)
                .amount(amount)
                .reason(reason)
                .build());

        log.info("Paid {} to {} for request {} ({})", amount, recipient, requestId, reason);
        return payout;
    }
}
