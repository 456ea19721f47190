package com.compliantvault.vaultservice.simulator;

import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.simulator.oracle.service.MockComplianceChecker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockComplianceCheckerTest {

    private final MockComplianceChecker checker = new MockComplianceChecker(Set.of("0xABCdef"));

    @Test
    @DisplayName("Clean address passes, denied address fails regardless of case")
    void testVerdicts() {
        assertThat(Uint256Codec.decode(checker.check(request("0", "0x123")))).isEqualTo(BigInteger.ONE);
        assertThat(Uint256Codec.decode(checker.check(request("1", "0xabcdef", "10")))).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("Bad arguments raise instead of answering")
    void testBadArguments() {
        assertThatThrownBy(() -> checker.check(request("0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> checker.check(request("7", "0x123")))
                .hasMessage("Invalid request type");
        assertThatThrownBy(() -> checker.check(request("1", "0x123")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static VerificationRequest request(String... args) {
        return new VerificationRequest("", "", List.of(args), 1L, "don", 250_000);
    }
}
