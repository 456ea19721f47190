package com.compliantvault.vaultservice.model;

/**
 * Kind of a verification request. The code is what the checker script
 * receives as its first argument.
 */
public enum RequestKind {

    DEPOSIT("0"),

    WITHDRAWAL("1");

    private final String code;

    RequestKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
