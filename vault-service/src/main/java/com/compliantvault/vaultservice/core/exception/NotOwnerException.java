package com.compliantvault.vaultservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class NotOwnerException extends RuntimeException {
    public NotOwnerException(String caller) {
        super("Only the vault owner may do this, caller was: " + caller);
    }
}
