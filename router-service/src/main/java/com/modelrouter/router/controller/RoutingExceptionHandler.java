package com.modelrouter.router.controller;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.exception.NoEligibleCandidatesException;
import com.modelrouter.common.exception.RoutingCancelledException;
import com.modelrouter.common.exception.RoutingException;
import com.modelrouter.common.trace.RequestTrace;
import com.modelrouter.router.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

/**
 * Maps the routing error taxonomy to HTTP:
 * <pre>
 *   ConfigException               → 400
 *   NoEligibleCandidatesException → 503
 *   RoutingCancelledException     → 504
 *   anything else                 → 500
 * </pre>
 */
@RestControllerAdvice
public class RoutingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RoutingExceptionHandler.class);

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ErrorResponse> handleConfig(ConfigException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, ex, exchange);
    }

    @ExceptionHandler(NoEligibleCandidatesException.class)
    public ResponseEntity<ErrorResponse> handleNoEligible(NoEligibleCandidatesException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, exchange);
    }

    @ExceptionHandler(RoutingCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(RoutingCancelledException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex, exchange);
    }

    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<ErrorResponse> handleRouting(RoutingException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        log.error("Unhandled routing error. traceId={}", traceId, ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", ex.getMessage(), traceId));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, RoutingException ex, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        log.warn("Routing request failed. status={} code={} traceId={} message={}",
                 status.value(), ex.getCode(), traceId, ex.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(ex.getCode().name(), ex.getMessage(), traceId));
    }

    private static String traceId(ServerWebExchange exchange) {
        return RequestTrace.orUnknown(exchange.getRequest().getHeaders().getFirst(RequestTrace.TRACE_HEADER));
    }
}
