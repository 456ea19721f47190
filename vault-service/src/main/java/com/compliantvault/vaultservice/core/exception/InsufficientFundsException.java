package com.compliantvault.vaultservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigInteger;

@ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
public class InsufficientFundsException extends RuntimeException {
    public InsufficientFundsException(String principal, BigInteger requested, BigInteger available) {
        super("Insufficient funds for " + principal + ": requested " + requested + ", available " + available);
    }
}
