package com.compliantvault.vaultservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateRequestIdException extends RuntimeException {
    public DuplicateRequestIdException(String requestId) {
        super("Request id is already in use: " + requestId);
    }
}
