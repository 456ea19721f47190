package com.compliantvault.vaultservice.service;

import com.compliantvault.vaultservice.core.exception.AmountOutOfRangeException;
import com.compliantvault.vaultservice.core.exception.DuplicateRequestIdException;
import com.compliantvault.vaultservice.core.exception.InsufficientFundsException;
import com.compliantvault.vaultservice.core.exception.VerificationDispatchException;
import com.compliantvault.vaultservice.core.exception.ZeroAmountException;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.model.VaultEventType;
import com.compliantvault.vaultservice.service.imp.VaultServiceImp;
import com.compliantvault.vaultservice.service.reconciliation.Ledger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VaultServiceUnitTest {

    @Mock
    private MutationGuard guard;
    @Mock
    private VerificationDispatcher dispatcher;
    @Mock
    private PendingRequestRegistry registry;
    @Mock
    private Ledger ledger;
    @Mock
    private VaultEventPublisher events;

    @InjectMocks
    private VaultServiceImp vaultService;

    @BeforeEach
    void setUp() {
        lenient().doAnswer(invocation -> ((Supplier<?>) invocation.getArgument(0)).get())
                .when(guard).execute(any());
    }

    @Test
    @DisplayName("Deposit: dispatched, recorded and announced under the oracle's id")
    void testRequestDeposit() {
        BigInteger amount = BigInteger.valueOf(1000);
        when(dispatcher.dispatch(RequestKind.DEPOSIT, "alice", amount)).thenReturn("0x01");

        String requestId = vaultService.requestDeposit("alice", amount);

        assertThat(requestId).isEqualTo("0x01");
        verify(registry).record("0x01", "alice", amount, RequestKind.DEPOSIT);
        verify(events).publish(VaultEventType.DEPOSIT_REQUESTED, "0x01", "alice", amount, null);
        verifyNoInteractions(ledger);
    }

    @Test
    @DisplayName("Zero amount is refused before anything is dispatched")
    void testZeroAmount() {
        assertThatThrownBy(() -> vaultService.requestDeposit("alice", BigInteger.ZERO))
                .isInstanceOf(ZeroAmountException.class);
        assertThatThrownBy(() -> vaultService.requestWithdrawal("alice", BigInteger.ZERO))
                .isInstanceOf(ZeroAmountException.class);

        verifyNoInteractions(dispatcher, registry, events);
    }

    @Test
    @DisplayName("Negative amount or missing requester is an invalid argument")
    void testInvalidArguments() {
        assertThatThrownBy(() -> vaultService.requestDeposit("alice", BigInteger.valueOf(-5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> vaultService.requestDeposit(" ", BigInteger.TEN))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Amount above the uint256 maximum is refused before anything is dispatched")
    void testAmountOutOfRange() {
        BigInteger tooLarge = Uint256Codec.MAX.add(BigInteger.ONE);

        assertThatThrownBy(() -> vaultService.requestDeposit("alice", tooLarge))
                .isInstanceOf(AmountOutOfRangeException.class);
        assertThatThrownBy(() -> vaultService.requestWithdrawal("alice", BigInteger.TEN.pow(78)))
                .isInstanceOf(AmountOutOfRangeException.class);

        verifyNoInteractions(dispatcher, registry, events, ledger);
    }

    @Test
    @DisplayName("Withdrawal above balance is refused and nothing is dispatched")
    void testWithdrawalInsufficientFunds() {
        when(ledger.balanceOf("alice")).thenReturn(BigInteger.valueOf(100));

        assertThatThrownBy(() -> vaultService.requestWithdrawal("alice", BigInteger.valueOf(101)))
                .isInstanceOf(InsufficientFundsException.class);

        verifyNoInteractions(dispatcher, registry, events);
    }

    @Test
    @DisplayName("Withdrawal of the exact balance is dispatched and moves no funds yet")
    void testWithdrawalExactBalance() {
        BigInteger amount = BigInteger.valueOf(100);
        when(ledger.balanceOf("alice")).thenReturn(amount);
        when(dispatcher.dispatch(RequestKind.WITHDRAWAL, "alice", amount)).thenReturn("0x02");

        String requestId = vaultService.requestWithdrawal("alice", amount);

        assertThat(requestId).isEqualTo("0x02");
        verify(registry).record("0x02", "alice", amount, RequestKind.WITHDRAWAL);
        verify(events).publish(VaultEventType.WITHDRAWAL_REQUESTED, "0x02", "alice", amount, null);
    }

    @Test
    @DisplayName("Dispatch failure leaves no pending entry")
    void testDispatchFailure() {
        when(dispatcher.dispatch(eq(RequestKind.DEPOSIT), eq("alice"), any()))
                .thenThrow(new VerificationDispatchException("Verification oracle unavailable"));

        assertThatThrownBy(() -> vaultService.requestDeposit("alice", BigInteger.TEN))
                .isInstanceOf(VerificationDispatchException.class);

        verifyNoInteractions(registry, events);
    }

    @Test
    @DisplayName("Reused oracle id is reported, not overwritten")
    void testDuplicateRequestId() {
        when(dispatcher.dispatch(RequestKind.DEPOSIT, "alice", BigInteger.TEN)).thenReturn("0x01");
        when(registry.record("0x01", "alice", BigInteger.TEN, RequestKind.DEPOSIT))
                .thenThrow(new DuplicateRequestIdException("0x01"));

        assertThatThrownBy(() -> vaultService.requestDeposit("alice", BigInteger.TEN))
                .isInstanceOf(DuplicateRequestIdException.class);

        verifyNoInteractions(events);
    }

    @Test
    @DisplayName("Escrow total reads pending deposits only")
    void testEscrowedTotal() {
        when(registry.escrowedDeposits()).thenReturn(BigInteger.valueOf(1500));

        assertThat(vaultService.escrowedTotal()).isEqualTo(BigInteger.valueOf(1500));
    }
}
