package com.compliantvault.vaultservice.controller;

import com.compliantvault.vaultservice.dto.OracleCallback;
import com.compliantvault.vaultservice.dto.ReconciliationResult;
import com.compliantvault.vaultservice.service.reconciliation.Reconciler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/oracle")
@RequiredArgsConstructor
public class OracleCallbackController {

    private final Reconciler reconciler;

    // Always 200 once parsed: unknown ids and failures are outcomes, not errors
    @PostMapping("/callback")
    public ReconciliationResult callback(@RequestBody @Valid OracleCallback callback) {
        return reconciler.onOutcome(callback.requestId(), callback.response(), callback.error());
    }
}
