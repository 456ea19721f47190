package com.compliantvault.vaultservice.service.imp;

import com.compliantvault.vaultservice.core.exception.AmountOutOfRangeException;
import com.compliantvault.vaultservice.core.exception.InsufficientFundsException;
import com.compliantvault.vaultservice.core.exception.ZeroAmountException;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.model.VaultEventType;
import com.compliantvault.vaultservice.service.MutationGuard;
import com.compliantvault.vaultservice.service.PendingRequestRegistry;
import com.compliantvault.vaultservice.service.VaultEventPublisher;
import com.compliantvault.vaultservice.service.VaultService;
import com.compliantvault.vaultservice.service.VerificationDispatcher;
import com.compliantvault.vaultservice.service.reconciliation.Ledger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

@Service
@Slf4j
@RequiredArgsConstructor
public class VaultServiceImp implements VaultService {

    private final MutationGuard guard;
    private final VerificationDispatcher dispatcher;
    private final PendingRequestRegistry registry;
    private final Ledger ledger;
    private final VaultEventPublisher events;

    @Override
    public String requestDeposit(String requester, BigInteger amount) {
        validateAmount(requester, amount);

        return guard.execute(() -> {
            String requestId = dispatcher.dispatch(RequestKind.DEPOSIT, requester, amount);
            registry.record(requestId, requester, amount, RequestKind.DEPOSIT);
            events.publish(VaultEventType.DEPOSIT_REQUESTED, requestId, requester, amount, null);

            log.info("Deposit {} of {} for {} escrowed, awaiting verification", requestId, amount, requester);
            return requestId;
        });
    }

    @Override
    public String requestWithdrawal(String requester, BigInteger amount) {
        validateAmount(requester, amount);

        return guard.execute(() -> {
            BigInteger available = ledger.balanceOf(requester);
            if (amount.compareTo(available) > 0) {
                log.warn("Withdrawal of {} refused for {}: balance is {}", amount, requester, available);
                throw new InsufficientFundsException(requester, amount, available);
            }

            String requestId = dispatcher.dispatch(RequestKind.WITHDRAWAL, requester, amount);
            registry.record(requestId, requester, amount, RequestKind.WITHDRAWAL);
            events.publish(VaultEventType.WITHDRAWAL_REQUESTED, requestId, requester, amount, null);

            log.info("Withdrawal {} of {} for {} awaiting verification", requestId, amount, requester);
            return requestId;
        });
    }

    @Override
    public BigInteger balanceOf(String principal) {
        return ledger.balanceOf(principal);
    }

    @Override
    public BigInteger escrowedTotal() {
        return registry.escrowedDeposits();
    }

    private void validateAmount(String requester, BigInteger amount) {
        if (requester == null || requester.isBlank()) {
            throw new IllegalArgumentException("Requester is required");
        }

        if (amount == null || amount.signum() == 0) {
            throw new ZeroAmountException();
        }

        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }

        if (amount.compareTo(Uint256Codec.MAX) > 0) {
            throw new AmountOutOfRangeException(amount);
        }
    }
}
