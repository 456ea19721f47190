package com.compliantvault.vaultservice.controller;

import com.compliantvault.vaultservice.dto.BalanceResponse;
import com.compliantvault.vaultservice.dto.DepositRequest;
import com.compliantvault.vaultservice.dto.EscrowResponse;
import com.compliantvault.vaultservice.dto.RequestAcceptedResponse;
import com.compliantvault.vaultservice.dto.WithdrawalRequest;
import com.compliantvault.vaultservice.service.VaultService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/vault")
@RequiredArgsConstructor
public class VaultController {

    private final VaultService vaultService;

    @PostMapping("/deposits")
    public ResponseEntity<RequestAcceptedResponse> requestDeposit(
            @RequestHeader("X-User-ID") String requester,
            @RequestBody @Valid DepositRequest request
    ) {
        String requestId = vaultService.requestDeposit(requester, request.amount());
        return new ResponseEntity<>(new RequestAcceptedResponse(requestId), HttpStatus.ACCEPTED);
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<RequestAcceptedResponse> requestWithdrawal(
            @RequestHeader("X-User-ID") String requester,
            @RequestBody @Valid WithdrawalRequest request
    ) {
        String requestId = vaultService.requestWithdrawal(requester, request.amount());
        return new ResponseEntity<>(new RequestAcceptedResponse(requestId), HttpStatus.ACCEPTED);
    }

    @GetMapping("/balances/{principal}")
    public BalanceResponse balanceOf(@PathVariable String principal) {
        return new BalanceResponse(principal, vaultService.balanceOf(principal));
    }

    @GetMapping("/escrow")
    public EscrowResponse escrow() {
        return new EscrowResponse(vaultService.escrowedTotal());
    }
}
