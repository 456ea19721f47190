package com.compliantvault.vaultservice.client.oracle.dto;

public record DispatchResponse(String requestId) {}
