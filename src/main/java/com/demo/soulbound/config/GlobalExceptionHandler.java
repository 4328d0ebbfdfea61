package com.demo.soulbound.config;

import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.CredentialNotFoundException;
import com.demo.soulbound.service.error.EmptyRecoveryException;
import com.demo.soulbound.service.error.InsufficientValueException;
import com.demo.soulbound.service.error.InvalidStateException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.error.MintWindowException;
import com.demo.soulbound.service.error.SoulboundException;
import com.demo.soulbound.service.treasury.TreasuryForwardException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SoulboundException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(SoulboundException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex);
        return ResponseEntity.status(status).body(body(status, ex.getClass().getSimpleName(),
                ex.reason(), ex.getMessage(), req));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(Exception ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "Bad Request", "INVALID_REQUEST", ex.getMessage(), req);
    }

    @ExceptionHandler(TreasuryForwardException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleTreasury(TreasuryForwardException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_GATEWAY, "Treasury Error", "TREASURY_UNAVAILABLE", ex.getMessage(), req);
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleSql(DataAccessException ex, HttpServletRequest req) {
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Database Error", "DATABASE_ERROR",
                ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL", ex.getMessage(), req);
    }

    static HttpStatus statusOf(SoulboundException ex) {
        if (ex instanceof AuthorizationException) return HttpStatus.FORBIDDEN;
        if (ex instanceof InvalidStateException) return HttpStatus.CONFLICT;
        if (ex instanceof CredentialNotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof MintWindowException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof InsufficientValueException) return HttpStatus.PAYMENT_REQUIRED;
        if (ex instanceof InvariantViolationException) return HttpStatus.CONFLICT;
        if (ex instanceof EmptyRecoveryException) return HttpStatus.UNPROCESSABLE_ENTITY;
        return HttpStatus.BAD_REQUEST;
    }

    private static Map<String, Object> body(HttpStatus status, String error, String reason,
                                            String message, HttpServletRequest req) {
        // LinkedHashMap: message may be null
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp", Instant.now());
        out.put("status", status.value());
        out.put("error", error);
        out.put("reason", reason);
        out.put("message", message);
        out.put("path", req.getRequestURI());
        return out;
    }
}
