package com.meritmarket.web;

import com.meritmarket.gateway.CustodyTransferException;
import com.meritmarket.service.LedgerInsolvencyException;
import com.meritmarket.service.ReentrantOperationException;
import com.meritmarket.service.ResolutionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps protocol failures onto a single error body. Every response carries a lower-case {@code code};
 * {@code fieldErrors} is populated only for rejected request bodies.
 */
@RestControllerAdvice
public class ResolutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ResolutionExceptionHandler.class);
    private static final String INVALID_REQUEST = "invalid_request";

    @ExceptionHandler(ResolutionValidationException.class)
    public ResponseEntity<ResolutionErrorResponse> handle(ResolutionValidationException ex) {
        return error(ex.getError().status(), ex.getError().name().toLowerCase(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ResolutionErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );
        String message = fieldErrors.isEmpty()
                ? "Request rejected"
                : "Request rejected: " + String.join("; ", fieldErrors.values());
        log.debug("Rejected {} request body: {}", ex.getParameter().getExecutable().getName(), fieldErrors);
        return ResponseEntity.badRequest()
                .body(new ResolutionErrorResponse(INVALID_REQUEST, message, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ResolutionErrorResponse> handle(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, INVALID_REQUEST, "Request body is missing or malformed");
    }

    @ExceptionHandler(LedgerInsolvencyException.class)
    public ResponseEntity<ResolutionErrorResponse> handle(LedgerInsolvencyException ex) {
        log.error("Rejected operation on solvency grounds: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "ledger_insolvent", ex.getMessage());
    }

    @ExceptionHandler(CustodyTransferException.class)
    public ResponseEntity<ResolutionErrorResponse> handle(CustodyTransferException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "transfer_failed", ex.getMessage());
    }

    @ExceptionHandler(ReentrantOperationException.class)
    public ResponseEntity<ResolutionErrorResponse> handle(ReentrantOperationException ex) {
        return error(HttpStatus.CONFLICT, "reentrant_operation", ex.getMessage());
    }

    private static ResponseEntity<ResolutionErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ResolutionErrorResponse(code, message, Map.of()));
    }

    public record ResolutionErrorResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
