package com.identityguardian.mitigation.controller;

import com.identityguardian.common.directory.DirectoryException;
import com.identityguardian.common.exception.IdentityGuardianException;
import com.identityguardian.common.exception.PrincipalNotFoundException;
import com.identityguardian.common.trace.TraceContextUtil;
import com.identityguardian.mitigation.approval.CallbackAuthException;
import com.identityguardian.mitigation.approval.CallbackValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

import java.util.Map;

/** Maps domain exceptions to {@code {code, message, traceId}} bodies. */
@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(CallbackAuthException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleCallbackAuth(CallbackAuthException ex, ServerWebExchange exchange) {
        log.warn("Approval callback rejected. reason={}", ex.getMessage());
        return body("CALLBACK_AUTH_FAILED", "Shared secret mismatch", exchange);
    }

    @ExceptionHandler(CallbackValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleCallbackValidation(CallbackValidationException ex, ServerWebExchange exchange) {
        log.warn("Approval callback invalid. reason={}", ex.getMessage());
        return body("CALLBACK_INVALID", ex.getMessage(), exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        return body("INVALID_REQUEST", ex.getMessage(), exchange);
    }

    @ExceptionHandler(PrincipalNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(PrincipalNotFoundException ex, ServerWebExchange exchange) {
        return body("PRINCIPAL_NOT_FOUND", ex.getMessage(), exchange);
    }

    @ExceptionHandler(DirectoryException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleDirectory(DirectoryException ex, ServerWebExchange exchange) {
        log.error("Directory call failed. error={}", ex.getMessage());
        return body("DIRECTORY_UNAVAILABLE", ex.getMessage(), exchange);
    }

    @ExceptionHandler(IdentityGuardianException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleUpstream(IdentityGuardianException ex, ServerWebExchange exchange) {
        log.error("Upstream call failed. component={} error={}", ex.getComponent(), ex.getMessage());
        return body("UPSTREAM_FAILED", ex.getMessage(), exchange);
    }

    private static Map<String, Object> body(String code, String message, ServerWebExchange exchange) {
        String traceId = exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_HEADER);
        return Map.of(
            "code", code,
            "message", message == null ? "" : message,
            "traceId", traceId == null ? "unknown" : traceId
        );
    }
}
