package com.compliantvault.vaultservice.service.reconciliation;

import com.compliantvault.vaultservice.model.PayoutReason;
import com.compliantvault.vaultservice.model.PendingRequest;
import com.compliantvault.vaultservice.model.RequestKind;
import com.compliantvault.vaultservice.model.VaultEventType;
import com.compliantvault.vaultservice.service.PayoutService;
import com.compliantvault.vaultservice.service.VaultEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WithdrawalReconciliationStrategyTest {

    private static final BigInteger THOUSAND = BigInteger.valueOf(1000);

    @Mock
    private Ledger ledger;
    @Mock
    private PayoutService payoutService;
    @Mock
    private VaultEventPublisher events;

    @InjectMocks
    private WithdrawalReconciliationStrategy strategy;

    private PendingRequest request;

    @BeforeEach
    void setUp() {
        request = PendingRequest.builder()
                .requestId("0xabc")
                .requester("alice")
                .amount(THOUSAND)
                .kind(RequestKind.WITHDRAWAL)
                .build();
    }

    @Test
    @DisplayName("Approved and covered -> debit, pay out, WithdrawalFulfilled")
    void testApproveCovered() {
        when(ledger.balanceOf("alice")).thenReturn(THOUSAND);
        when(ledger.debit("alice", THOUSAND)).thenReturn(THOUSAND);

        VaultEventType outcome = strategy.approve(request);

        assertThat(outcome).isEqualTo(VaultEventType.WITHDRAWAL_FULFILLED);
        verify(payoutService).pay("0xabc", "alice", THOUSAND, PayoutReason.WITHDRAWAL);
        verify(events).publish(VaultEventType.WITHDRAWAL_FULFILLED, "0xabc", "alice", THOUSAND, null);
    }

    @Test
    @DisplayName("Approved but balance shrank since dispatch -> cancelled, nothing debited")
    void testApproveNoLongerCovered() {
        when(ledger.balanceOf("alice")).thenReturn(BigInteger.valueOf(999));

        VaultEventType outcome = strategy.approve(request);

        assertThat(outcome).isEqualTo(VaultEventType.WITHDRAWAL_CANCELLED);
        verify(ledger, never()).debit(anyString(), any());
        verifyNoInteractions(payoutService);
        verify(events).publish(VaultEventType.WITHDRAWAL_CANCELLED, "0xabc", "alice", THOUSAND,
                WithdrawalReconciliationStrategy.INSUFFICIENT_FUNDS);
    }

    @Test
    @DisplayName("Rejected -> balance untouched, no payout")
    void testReject() {
        VaultEventType outcome = strategy.reject(request);

        assertThat(outcome).isEqualTo(VaultEventType.WITHDRAWAL_CANCELLED);
        verifyNoInteractions(ledger, payoutService);
    }

    @Test
    @DisplayName("Expired -> only the event is recorded")
    void testExpire() {
        assertThat(strategy.expire(request)).isEqualTo(VaultEventType.REQUEST_EXPIRED);
        verifyNoInteractions(ledger, payoutService);
    }
}
