package com.compliantvault.vaultservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigInteger;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class AmountOutOfRangeException extends RuntimeException {
    public AmountOutOfRangeException(BigInteger amount) {
        super("Amount exceeds the uint256 range: " + amount);
    }
}
