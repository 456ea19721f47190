package com.compliantvault.vaultservice.service.reconciliation;

import com.compliantvault.vaultservice.model.PayoutReason;
import com.compliantvault.vaultservice.model.PendingRequest;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.model.VaultEventType;
import com.compliantvault.vaultservice.service.PayoutService;
import com.compliantvault.vaultservice.service.VaultEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
@Slf4j
@RequiredArgsConstructor
public class WithdrawalReconciliationStrategy implements ReconciliationStrategy {

    static final String INSUFFICIENT_FUNDS = "INSUFFICIENT_FUNDS";

    private final Ledger ledger;
    private final PayoutService payoutService;
    private final VaultEventPublisher events;

    @Override
    public boolean supports(RequestKind kind) {
        return kind == RequestKind.WITHDRAWAL;
    }

    @Override
    public VaultEventType approve(PendingRequest request) {
        // Eligibility was checked at dispatch; other withdrawals may have settled since
        BigInteger available = ledger.balanceOf(request.getRequester());
        if (request.getAmount().compareTo(available) > 0) {
            log.warn("Withdrawal {} approved but {} holds only {} of {}. Cancelling.",
                    request.getRequestId(), request.getRequester(), available, request.getAmount());
            events.publish(VaultEventType.WITHDRAWAL_CANCELLED, request.getRequestId(), request.getRequester(), request.getAmount(), INSUFFICIENT_FUNDS);
            return VaultEventType.WITHDRAWAL_CANCELLED;
        }

        BigInteger debited = ledger.debit(request.getRequester(), request.getAmount());
        payoutService.pay(request.getRequestId(), request.getRequester(), debited, PayoutReason.WITHDRAWAL);

        log.info("Withdrawal {} of {} for {} fulfilled", request.getRequestId(), debited, request.getRequester());
        events.publish(VaultEventType.WITHDRAWAL_FULFILLED, request.getRequestId(), request.getRequester(), debited, null);
        return VaultEventType.WITHDRAWAL_FULFILLED;
    }

    @Override
    public VaultEventType reject(PendingRequest request) {
        log.warn("Withdrawal {} of {} for {} rejected", request.getRequestId(), request.getAmount(), request.getRequester());
        events.publish(VaultEventType.WITHDRAWAL_CANCELLED, request.getRequestId(), request.getRequester(), request.getAmount(), "REJECTED");
        return VaultEventType.WITHDRAWAL_CANCELLED;
    }

    @Override
    public VaultEventType expire(PendingRequest request) {
        // Nothing was locked besides eligibility
        log.warn("Withdrawal {} expired without an outcome", request.getRequestId());
        events.publish(VaultEventType.REQUEST_EXPIRED, request.getRequestId(), request.getRequester(), request.getAmount(), "NO_OUTCOME");
        return VaultEventType.REQUEST_EXPIRED;
    }
}
