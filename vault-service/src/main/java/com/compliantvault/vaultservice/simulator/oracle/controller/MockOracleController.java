package com.compliantvault.vaultservice.simulator.oracle.controller;

import com.compliantvault.vaultservice.client.oracle.dto.DispatchResponse;
import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;
import com.compliantvault.vaultservice.core.util.Uint256Codec;
import com.compliantvault.vaultservice.dto.OracleCallback;
import com.compliantvault.vaultservice.dto.ReconciliationResult;
import com.compliantvault.vaultservice.simulator.oracle.service.MockComplianceChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.client.RestClient;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local oracle for development. Requests are held until someone fulfills them,
 * which runs the mock checker and posts the result to the vault callback.
 */
@RestController
@RequestMapping("/mock-oracle")
@Profile("dev")
@Slf4j
public class MockOracleController {

    private final Map<String, VerificationRequest> received = new ConcurrentHashMap<>();
    private final MockComplianceChecker checker;
    private final RestClient restClient;
    private final String callbackUrl;

    public MockOracleController(MockComplianceChecker checker,
                                RestClient.Builder builder,
                                @Value("${app.mock-oracle.callback-url}") String callbackUrl) {
        this.checker = checker;
        this.restClient = builder.build();
        this.callbackUrl = callbackUrl;
    }

    @PostMapping("/requests")
    public DispatchResponse accept(@RequestBody VerificationRequest request) {
        String requestId = "0x" + UUID.randomUUID().toString().replace("-", "");
        received.put(requestId, request);

        log.info("Mock oracle accepted request {} with args {}", requestId, request.args());
        return new DispatchResponse(requestId);
    }

    @PostMapping("/requests/{requestId}/fulfill")
    public ReconciliationResult fulfill(@PathVariable String requestId) {
        VerificationRequest request = received.remove(requestId);
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown request " + requestId);
        }

        OracleCallback callback;
        try {
            callback = new OracleCallback(requestId, Uint256Codec.toHex(checker.check(request)), null);
        } catch (IllegalArgumentException e) {
            callback = new OracleCallback(requestId, null,
                    Uint256Codec.toHex(e.getMessage().getBytes(StandardCharsets.UTF_8)));
        }

        return restClient.post()
                .uri(callbackUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(callback)
                .retrieve()
                .body(ReconciliationResult.class);
    }
}
