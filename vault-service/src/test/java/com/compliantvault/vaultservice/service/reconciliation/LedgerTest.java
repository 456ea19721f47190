package com.compliantvault.vaultservice.service.reconciliation;

import com.compliantvault.vaultservice.core.exception.AmountOutOfRangeException;
import com.compliantvault.vaultservice.core.exception.InsufficientFundsException;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.model.Balance;
import com.compliantvault.vaultservice.repository.BalanceRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerTest {

    @Mock
    private BalanceRepository balanceRepository;

    @InjectMocks
    private Ledger ledger;

    @Test
    @DisplayName("Unknown principal reads as zero")
    void testBalanceOfUnknown() {
        when(balanceRepository.findById("alice")).thenReturn(Optional.empty());

        assertThat(ledger.balanceOf("alice")).isZero();
    }

    @Test
    @DisplayName("Credit opens a balance for a new principal")
    void testCreditNewPrincipal() {
        when(balanceRepository.findById("alice")).thenReturn(Optional.empty());

        ledger.credit("alice", BigInteger.valueOf(1000));

        verify(balanceRepository).save(argThat(b ->
                b.getPrincipal().equals("alice") && b.getAmount().equals(BigInteger.valueOf(1000))));
    }

    @Test
    @DisplayName("Credit adds to an existing balance")
    void testCreditExisting() {
        Balance balance = Balance.builder().principal("alice").amount(BigInteger.valueOf(250)).build();
        when(balanceRepository.findById("alice")).thenReturn(Optional.of(balance));

        ledger.credit("alice", BigInteger.valueOf(750));

        assertThat(balance.getAmount()).isEqualTo(BigInteger.valueOf(1000));
    }

    @Test
    @DisplayName("Debit removes the amount and returns it for payout")
    void testDebit() {
        Balance balance = Balance.builder().principal("alice").amount(BigInteger.valueOf(1000)).build();
        when(balanceRepository.findById("alice")).thenReturn(Optional.of(balance));

        BigInteger paid = ledger.debit("alice", BigInteger.valueOf(400));

        assertThat(paid).isEqualTo(BigInteger.valueOf(400));
        assertThat(balance.getAmount()).isEqualTo(BigInteger.valueOf(600));
    }

    @Test
    @DisplayName("Debit of the whole balance leaves exactly zero")
    void testDebitWholeBalance() {
        Balance balance = Balance.builder().principal("alice").amount(BigInteger.valueOf(1000)).build();
        when(balanceRepository.findById("alice")).thenReturn(Optional.of(balance));

        BigInteger paid = ledger.debit("alice", BigInteger.valueOf(1000));

        assertThat(paid).isEqualTo(BigInteger.valueOf(1000));
        assertThat(balance.getAmount()).isZero();
        verify(balanceRepository).save(balance);
    }

    @Test
    @DisplayName("Credit past the uint256 maximum is refused and nothing is saved")
    void testCreditOverflow() {
        Balance balance = Balance.builder().principal("alice").amount(Uint256Codec.MAX).build();
        when(balanceRepository.findById("alice")).thenReturn(Optional.of(balance));

        assertThat(ledger.canCredit("alice", BigInteger.ONE)).isFalse();
        assertThat(ledger.canCredit("alice", BigInteger.ZERO)).isTrue();
        assertThatThrownBy(() -> ledger.credit("alice", BigInteger.ONE))
                .isInstanceOf(AmountOutOfRangeException.class);

        assertThat(balance.getAmount()).isEqualTo(Uint256Codec.MAX);
        verify(balanceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Debit beyond the balance fails and leaves it untouched")
    void testDebitInsufficient() {
        Balance balance = Balance.builder().principal("alice").amount(BigInteger.valueOf(100)).build();
        when(balanceRepository.findById("alice")).thenReturn(Optional.of(balance));

        assertThatThrownBy(() -> ledger.debit("alice", BigInteger.valueOf(101)))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(balance.getAmount()).isEqualTo(BigInteger.valueOf(100));
        verify(balanceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Negative amounts are refused")
    void testNegativeAmount() {
        assertThatThrownBy(() -> ledger.credit("alice", BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(balanceRepository);
    }
}
