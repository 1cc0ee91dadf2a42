package com.hyperhook.backend.exception;

import com.hyperhook.backend.dto.ResponseEnvelope;
import com.hyperhook.backend.model.ErrorType;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Last-resort mapping for faults raised outside the dispatcher, so callers always
 * receive a response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ResponseEnvelope> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Invalid JSON in request body", request, ex);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ResponseEnvelope> handleMethod(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return buildError(HttpStatus.METHOD_NOT_ALLOWED, ErrorType.VALIDATION, ex.getMessage(), request, ex);
    }

    @ExceptionHandler(WalletNotConfiguredException.class)
    public ResponseEntity<ResponseEnvelope> handleWallet(WalletNotConfiguredException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ErrorType.EXCHANGE, ex.getMessage(), request, ex);
    }

    @ExceptionHandler({ExchangeCircuitOpenException.class, ExchangeRateLimitException.class})
    public ResponseEntity<ResponseEnvelope> handleExchangeUnavailable(RuntimeException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ErrorType.EXCHANGE, ex.getMessage(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ResponseEnvelope> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.EXCHANGE, "Unexpected error", request, ex);
    }

    private ResponseEntity<ResponseEnvelope> buildError(HttpStatus status, ErrorType errorType, String message,
                                                        HttpServletRequest request, Exception ex) {
        log.warn("{} {} -> {} {} (requestId={})", request.getMethod(), request.getRequestURI(), status.value(),
                message, MDC.get("requestId"), ex);
        return ResponseEntity.status(status).body(ResponseEnvelope.error(errorType, message));
    }
}
