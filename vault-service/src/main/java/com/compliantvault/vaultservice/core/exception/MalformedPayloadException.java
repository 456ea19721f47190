package com.compliantvault.vaultservice.core.exception;

public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String msg) {super(msg);}
}
