package com.compliantvault.vaultservice.dto;

public record RequestAcceptedResponse(String requestId) {}
