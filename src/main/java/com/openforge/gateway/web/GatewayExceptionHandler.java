package com.openforge.gateway.web;

import com.openforge.gateway.llm.AllBackendsFailedException;
import com.openforge.gateway.llm.BackendException;
import com.openforge.gateway.llm.BreakerOpenException;
import com.openforge.gateway.llm.LlmException;
import com.openforge.gateway.llm.LlmRateLimitException;
import com.openforge.gateway.llm.NoBackendAvailableException;
import com.openforge.gateway.web.dto.ErrorBody;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Maps the gateway exception taxonomy to HTTP statuses.
 *
 *   400  invalid body or parameters
 *   429  agent over its request limit, or upstream rate limit
 *   502  BackendException, AllBackendsFailedException, other LlmException
 *   503  BreakerOpenException, NoBackendAvailableException
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorBody> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getAllErrors().stream()
                .map(e -> e.getDefaultMessage() == null ? e.toString() : e.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(new ErrorBody("validation failed", "validation_failed", details));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MissingServletRequestParameterException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorBody> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getMessage(), "bad_request"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> handleStatus(ResponseStatusException ex) {
        String type = ex.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                ? "rate_limited" : "request_rejected";
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorBody.of(ex.getReason() != null ? ex.getReason() : ex.getMessage(), type));
    }

    @ExceptionHandler({BreakerOpenException.class, NoBackendAvailableException.class})
    public ResponseEntity<ErrorBody> handleUnavailable(LlmException ex) {
        log.warn("[Gateway] Unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of(ex.getMessage(), "backend_unavailable"));
    }

    @ExceptionHandler(LlmRateLimitException.class)
    public ResponseEntity<ErrorBody> handleUpstreamRateLimit(LlmRateLimitException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(ErrorBody.of(ex.getMessage(), "rate_limited"));
    }

    @ExceptionHandler({BackendException.class, AllBackendsFailedException.class})
    public ResponseEntity<ErrorBody> handleBackendFailure(LlmException ex) {
        log.warn("[Gateway] Backend failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of(ex.getMessage(), "backend_failed"));
    }

    @ExceptionHandler(LlmException.class)
    public ResponseEntity<ErrorBody> handleLlm(LlmException ex) {
        log.warn("[Gateway] LLM error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of(ex.getMessage(), "llm_error"));
    }
}
