package dev.jobboard.web;

import dev.jobboard.exception.JobBoardException;
import dev.jobboard.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps failures to a uniform JSON error body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(JobBoardException.class)
    public ResponseEntity<ErrorResponse> handleDomain(JobBoardException e, ServerWebExchange exchange) {
        log.debug("{} on {}: {}", e.getStatus().value(), path(exchange), e.getMessage());
        return build(e.getStatus(), e.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e, ServerWebExchange exchange) {
        String message = e.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "Invalid request";
        }
        return build(HttpStatus.BAD_REQUEST, message, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e, ServerWebExchange exchange) {
        return build(HttpStatus.BAD_REQUEST, e.getReason() != null ? e.getReason() : "Invalid request", exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e, ServerWebExchange exchange) {
        return build(e.getStatusCode(), e.getReason() != null ? e.getReason() : e.getMessage(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, ServerWebExchange exchange) {
        log.error("Unexpected error on {}: {}", path(exchange), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatusCode status, String message, ServerWebExchange exchange) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()))
                .message(message)
                .path(path(exchange))
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
