package com.compliantvault.vaultservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class MissingOracleSettingsException extends RuntimeException {
    public MissingOracleSettingsException() {
        super("Oracle settings have not been initialized");
    }
}
