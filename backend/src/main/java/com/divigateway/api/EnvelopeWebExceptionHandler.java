package com.divigateway.api;

import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.ResponseNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Last line of defence for errors raised outside controller methods (unknown routes, filters):
 * still answers with the envelope. Ordered ahead of Spring Boot's default error handler.
 */
@Component
@Order(-2)
@RequiredArgsConstructor
@Slf4j
public class EnvelopeWebExceptionHandler implements WebExceptionHandler {

    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(ex);
        }
        ResponseEntity<GatewayResponse> envelope = toEnvelope(ex);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(envelope.getBody());
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        response.setStatusCode(envelope.getStatusCode());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }

    private ResponseEntity<GatewayResponse> toEnvelope(Throwable ex) {
        if (ex instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            String message = status != null ? status.getReasonPhrase() : "Request failed";
            return normalizer.failure(statusException.getStatusCode(), message);
        }
        log.error("Unhandled error outside controllers", ex);
        return normalizer.internalError();
    }
}
