package com.autonomous.gateway.controller;

import com.autonomous.gateway.exception.AdmissionTimeoutException;
import com.autonomous.gateway.exception.BudgetExceededException;
import com.autonomous.gateway.exception.CallCancelledException;
import com.autonomous.gateway.exception.CallFailureException;
import com.autonomous.gateway.exception.ScopeClosedException;
import com.autonomous.gateway.exception.TypeValidationExhaustedException;
import com.autonomous.gateway.exception.UnknownEndpointException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(BudgetExceededException.class)
    public ResponseEntity<?> budgetExceeded(BudgetExceededException e) {
        return error(HttpStatus.PAYMENT_REQUIRED, "budget_exceeded", e);
    }

    @ExceptionHandler(AdmissionTimeoutException.class)
    public ResponseEntity<?> admissionTimeout(AdmissionTimeoutException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "admission_timeout", e);
    }

    @ExceptionHandler(UnknownEndpointException.class)
    public ResponseEntity<?> unknownEndpoint(UnknownEndpointException e) {
        return error(HttpStatus.NOT_FOUND, "unknown_endpoint", e);
    }

    @ExceptionHandler(TypeValidationExhaustedException.class)
    public ResponseEntity<?> typeValidation(TypeValidationExhaustedException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "type_validation_exhausted", e);
    }

    @ExceptionHandler(CallFailureException.class)
    public ResponseEntity<?> callFailure(CallFailureException e) {
        return error(HttpStatus.BAD_GATEWAY, "call_failed", e);
    }

    @ExceptionHandler(CallCancelledException.class)
    public ResponseEntity<?> cancelled(CallCancelledException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "call_cancelled", e);
    }

    @ExceptionHandler({ScopeClosedException.class, IllegalArgumentException.class})
    public ResponseEntity<?> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e);
    }

    private ResponseEntity<?> error(HttpStatus status, String kind, RuntimeException e) {
        log.warn("Request failed with {}: {}", kind, e.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", kind, "message", String.valueOf(e.getMessage())));
    }
}
