package com.compliantvault.vaultservice.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Result delivered by the oracle. {@code response} and {@code error} are hex
 * strings; exactly one of them is expected to be non-empty.
 */
public record OracleCallback(
        @NotBlank String requestId,
        String response,
        String error
) {}
