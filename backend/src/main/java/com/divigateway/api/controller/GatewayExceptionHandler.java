package com.divigateway.api.controller;

import com.divigateway.api.validation.InvalidRequestException;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.ResponseNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps anything thrown by a handler to the envelope: 400 for bad input, the exception's own
 * status for other ResponseStatusExceptions, 500 with a generic message otherwise.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GatewayExceptionHandler {

    private final ResponseNormalizer normalizer;

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<GatewayResponse> handleInvalidRequest(InvalidRequestException ex) {
        return normalizer.badRequest(ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<GatewayResponse> handleInput(ServerWebInputException ex) {
        String message = ex.getMethodParameter() != null && ex.getMethodParameter().getParameterName() != null
                ? "Invalid value for parameter '" + ex.getMethodParameter().getParameterName() + "'"
                : "Invalid request";
        return normalizer.badRequest(message);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<GatewayResponse> handleStatus(ResponseStatusException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Request failed";
        return normalizer.failure(ex.getStatusCode(), message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GatewayResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return normalizer.internalError();
    }
}
