package com.compliantvault.vaultservice.dto;

import java.math.BigInteger;

public record BalanceResponse(
        String principal,
        BigInteger balance
) {}
