package com.vcc.router.web;

import com.vcc.router.dto.ErrorResponse;
import com.vcc.router.exception.ExhaustedFallbackException;
import com.vcc.router.exception.InternalRoutingException;
import com.vcc.router.exception.InvalidPolicyException;
import com.vcc.router.exception.PolicyDenyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps routing failures onto HTTP statuses with a stable reason code and audit id.
 */
@RestControllerAdvice
public class RoutingExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RoutingExceptionHandler.class);

    static final String INVALID_REQUEST = "invalid_request";

    @ExceptionHandler(PolicyDenyException.class)
    public ResponseEntity<ErrorResponse> handleDeny(PolicyDenyException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of(e.getAuditId(), e.getReason(), e.getMessage()));
    }

    @ExceptionHandler(ExhaustedFallbackException.class)
    public ResponseEntity<ErrorResponse> handleExhausted(ExhaustedFallbackException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(e.getAuditId(), e.getReason(), e.getMessage(),
                        e.getAttemptedChain(), e.getRemediation(), null));
    }

    @ExceptionHandler(InvalidPolicyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPolicy(InvalidPolicyException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(null, e.getReason(), e.getMessage(), null, null, e.getViolations()));
    }

    @ExceptionHandler(InternalRoutingException.class)
    public ResponseEntity<ErrorResponse> handleInternal(InternalRoutingException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(e.getAuditId(), e.getReason(), "Internal routing error"));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBind(WebExchangeBindException e) {
        List<String> errors = e.getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        log.debug("Rejected request: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(null, INVALID_REQUEST, "Request validation failed", null, null, errors));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(null, INVALID_REQUEST, e.getReason()));
    }
}
