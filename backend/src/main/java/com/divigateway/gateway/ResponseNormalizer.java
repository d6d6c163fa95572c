package com.divigateway.gateway;

import com.divigateway.domain.GatewayResponse;
import com.divigateway.rpc.RpcOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Turns an {@link RpcOutcome} into the gateway envelope and its HTTP status.
 * Failure messages are fixed per failure kind; raw upstream text is only logged.
 */
@Component
public class ResponseNormalizer {

    public static final String UNAVAILABLE_MESSAGE = "Service Unavailable. Try again later.";
    public static final String TIMEOUT_MESSAGE = "Request Timeout. Service took too long to respond. Try again later.";
    public static final String UNAUTHORIZED_MESSAGE = "The node refused the gateway credentials.";
    public static final String PROTOCOL_ERROR_MESSAGE = "The node returned an HTTP error. Check your request and try again.";
    public static final String UPSTREAM_ERROR_MESSAGE = "The node rejected the request. Check your parameters and try again.";
    public static final String UNKNOWN_MESSAGE = "Unexpected failure while contacting the node. Try again later.";
    public static final String INTERNAL_ERROR_MESSAGE = "Internal server error.";

    private final Clock clock;

    public ResponseNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Success carries the (unwrapped) payload and a null error; failures carry a null result.
     * A node reply of {@code "result": null} therefore yields a JSON null result and a null error.
     */
    public GatewayResponse normalize(RpcOutcome outcome) {
        if (outcome instanceof RpcOutcome.Success success) {
            return GatewayResponse.success(unwrap(success.payload()), now());
        }
        return GatewayResponse.failure(messageFor(outcome), now());
    }

    public HttpStatus statusFor(RpcOutcome outcome) {
        if (outcome instanceof RpcOutcome.Success) {
            return HttpStatus.OK;
        }
        if (outcome instanceof RpcOutcome.TransportFailure failure) {
            return switch (failure.kind()) {
                case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
                case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
                case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
                case PROTOCOL_ERROR -> HttpStatus.BAD_REQUEST;
                case UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
            };
        }
        if (outcome instanceof RpcOutcome.UpstreamError) {
            return HttpStatus.BAD_REQUEST;
        }
        throw new IllegalStateException("Unhandled outcome: " + outcome);
    }

    public ResponseEntity<GatewayResponse> toResponseEntity(RpcOutcome outcome) {
        return ResponseEntity.status(statusFor(outcome)).body(normalize(outcome));
    }

    /** Envelope for input rejected before any upstream call. */
    public ResponseEntity<GatewayResponse> badRequest(String message) {
        return failure(HttpStatus.BAD_REQUEST, message);
    }

    public ResponseEntity<GatewayResponse> internalError() {
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE);
    }

    public ResponseEntity<GatewayResponse> failure(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(GatewayResponse.failure(message, now()));
    }

    /**
     * True when the payload is already a JSON-RPC envelope ({@code {"result": ..., "error": ..., "id": ...}}).
     */
    public static boolean isEnvelope(JsonNode payload) {
        return payload != null && payload.isObject() && payload.has("result");
    }

    /**
     * Strips exactly one envelope level; any other payload is returned as is.
     */
    public static JsonNode unwrap(JsonNode payload) {
        return isEnvelope(payload) ? payload.get("result") : payload;
    }

    private static String messageFor(RpcOutcome outcome) {
        if (outcome instanceof RpcOutcome.TransportFailure failure) {
            return switch (failure.kind()) {
                case UNAVAILABLE -> UNAVAILABLE_MESSAGE;
                case TIMEOUT -> TIMEOUT_MESSAGE;
                case UNAUTHORIZED -> UNAUTHORIZED_MESSAGE;
                case PROTOCOL_ERROR -> PROTOCOL_ERROR_MESSAGE;
                case UNKNOWN -> UNKNOWN_MESSAGE;
            };
        }
        if (outcome instanceof RpcOutcome.UpstreamError) {
            return UPSTREAM_ERROR_MESSAGE;
        }
        throw new IllegalStateException("Unhandled outcome: " + outcome);
    }

    private String now() {
        return DateTimeFormatter.ISO_INSTANT.format(clock.instant());
    }
}
