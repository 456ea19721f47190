package com.compliantvault.vaultservice.core.config;

import com.compliantvault.vaultservice.core.exception.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ZeroAmountException.class)
    public ResponseEntity<Object> handleZeroAmount(ZeroAmountException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "ZERO_AMOUNT", ex.getMessage());
    }

    @ExceptionHandler(AmountOutOfRangeException.class)
    public ResponseEntity<Object> handleAmountOutOfRange(AmountOutOfRangeException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "AMOUNT_OUT_OF_RANGE", ex.getMessage());
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<Object> handleNSF(InsufficientFundsException ex) {
        return buildResponse(HttpStatus.PAYMENT_REQUIRED, "INSUFFICIENT_FUNDS", ex.getMessage());
    }

    @ExceptionHandler(VerificationDispatchException.class)
    public ResponseEntity<Object> handleDispatch(VerificationDispatchException ex) {
        return buildResponse(HttpStatus.BAD_GATEWAY, "VERIFICATION_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(DuplicateRequestIdException.class)
    public ResponseEntity<Object> handleDuplicate(DuplicateRequestIdException ex) {
        return buildResponse(HttpStatus.CONFLICT, "DUPLICATE_REQUEST_ID", ex.getMessage());
    }

    @ExceptionHandler(NotOwnerException.class)
    public ResponseEntity<Object> handleNotOwner(NotOwnerException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "NOT_OWNER", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgument(IllegalArgumentException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Object> handleMissingHeader(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "MISSING_HEADER", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
