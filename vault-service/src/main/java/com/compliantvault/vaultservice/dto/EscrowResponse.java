package com.compliantvault.vaultservice.dto;

import java.math.BigInteger;

public record EscrowResponse(BigInteger escrowed) {}
