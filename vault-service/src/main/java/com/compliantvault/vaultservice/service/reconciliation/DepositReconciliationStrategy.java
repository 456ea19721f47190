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

@Component
@Slf4j
@RequiredArgsConstructor
public class DepositReconciliationStrategy implements ReconciliationStrategy {

    static final String BALANCE_OVERFLOW = "BALANCE_OVERFLOW";

    private final Ledger ledger;
    private final PayoutService payoutService;
    private final VaultEventPublisher events;

    @Override
    public boolean supports(RequestKind kind) {
        return kind == RequestKind.DEPOSIT;
    }

    @Override
    public VaultEventType approve(PendingRequest request) {
        if (!ledger.canCredit(request.getRequester(), request.getAmount())) {
            payoutService.pay(request.getRequestId(), request.getRequester(), request.getAmount(), PayoutReason.REFUND);

            log.warn("Deposit {} approved but would overflow the balance of {}, escrow refunded", request.getRequestId(), request.getRequester());
            events.publish(VaultEventType.DEPOSIT_CANCELLED, request.getRequestId(), request.getRequester(), request.getAmount(), BALANCE_OVERFLOW);
            return VaultEventType.DEPOSIT_CANCELLED;
        }

        ledger.credit(request.getRequester(), request.getAmount());

        log.info("Deposit {} of {} for {} fulfilled", request.getRequestId(), request.getAmount(), request.getRequester());
        events.publish(VaultEventType.DEPOSIT_FULFILLED, request.getRequestId(), request.getRequester(), request.getAmount(), null);
        return VaultEventType.DEPOSIT_FULFILLED;
    }

    @Override
    public VaultEventType reject(PendingRequest request) {
        // Escrow was never credited, so only the refund moves
        payoutService.pay(request.getRequestId(), request.getRequester(), request.getAmount(), PayoutReason.REFUND);

        log.warn("Deposit {} of {} for {} rejected, escrow refunded", request.getRequestId(), request.getAmount(), request.getRequester());
        events.publish(VaultEventType.DEPOSIT_CANCELLED, request.getRequestId(), request.getRequester(), request.getAmount(), "REJECTED");
        return VaultEventType.DEPOSIT_CANCELLED;
    }

    @Override
    public VaultEventType expire(PendingRequest request) {
        payoutService.pay(request.getRequestId(), request.getRequester(), request.getAmount(), PayoutReason.REFUND);

        log.warn("Deposit {} expired without an outcome, escrow refunded to {}", request.getRequestId(), request.getRequester());
        events.publish(VaultEventType.REQUEST_EXPIRED, request.getRequestId(), request.getRequester(), request.getAmount(), "ESCROW_REFUNDED");
        return VaultEventType.REQUEST_EXPIRED;
    }
}
