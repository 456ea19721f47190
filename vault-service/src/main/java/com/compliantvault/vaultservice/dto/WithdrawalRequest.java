package com.compliantvault.vaultservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

public record WithdrawalRequest(
        @NotNull @PositiveOrZero BigInteger amount
) {}
