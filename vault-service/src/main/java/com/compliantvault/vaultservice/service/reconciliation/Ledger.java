package com.compliantvault.vaultservice.service.reconciliation;

import com.compliantvault.vaultservice.core.exception.AmountOutOfRangeException;
import com.compliantvault.vaultservice.core.exception.InsufficientFundsException;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.model.Balance;
import com.compliantvault.vaultservice.repository.BalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Per-principal balances. Only the reconciliation effects in this package can
 * credit or debit; everyone else gets {@link #balanceOf(String)}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class Ledger {

    private final BalanceRepository balanceRepository;

    public BigInteger balanceOf(String principal) {
        return balanceRepository.findById(principal)
                .map(Balance::getAmount)
                .orElse(BigInteger.ZERO);
    }

    /**
     * Whether a credit of {@code amount} keeps the balance within uint256.
     */
    boolean canCredit(String principal, BigInteger amount) {
        requireNonNegative(amount);
        return balanceOf(principal).add(amount).compareTo(Uint256Codec.MAX) <= 0;
    }

    void credit(String principal, BigInteger amount) {
        requireNonNegative(amount);

        Balance balance = balanceRepository.findById(principal)
                .orElseGet(() -> Balance.builder().principal(principal).build());

        BigInteger updated = balance.getAmount().add(amount);
        if (updated.compareTo(Uint256Codec.MAX) > 0) {
            throw new AmountOutOfRangeException(updated);
        }

        balance.setAmount(updated);
        balanceRepository.save(balance);

        log.debug("Credited {} to {}, balance now {}", amount, principal, balance.getAmount());
    }

    /**
     * All or nothing: either the full amount is removed or the balance is left as it was.
     *
     * @return the debited amount, to be paid out
     */
    BigInteger debit(String principal, BigInteger amount) {
        requireNonNegative(amount);

        BigInteger available = balanceOf(principal);
        if (amount.compareTo(available) > 0) {
            throw new InsufficientFundsException(principal, amount, available);
        }

        Balance balance = balanceRepository.findById(principal)
                .orElseThrow(() -> new InsufficientFundsException(principal, amount, BigInteger.ZERO));

        balance.setAmount(available.subtract(amount));
        balanceRepository.save(balance);

        log.debug("Debited {} from {}, balance now {}", amount, principal, balance.getAmount());
        return amount;
    }

    private void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be a non-negative quantity: " + amount);
        }
    }
}
