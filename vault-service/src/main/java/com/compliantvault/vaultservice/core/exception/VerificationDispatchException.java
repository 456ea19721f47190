package com.compliantvault.vaultservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class VerificationDispatchException extends RuntimeException {

    public VerificationDispatchException(String message) {
        super(message);
    }

    public VerificationDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
