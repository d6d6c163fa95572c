package com.divigateway.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Maps an HTTP answer or a transport error to an {@link RpcOutcome}.
 */
public final class RpcOutcomeClassifier {

    private static final int BODY_SNIPPET_LENGTH = 200;

    private RpcOutcomeClassifier() {
    }

    /**
     * Classify a received response. A JSON-RPC error object wins over the HTTP status,
     * since the node reports method errors with HTTP 500 and an error body.
     */
    public static RpcOutcome fromResponse(int status, String body, ObjectMapper objectMapper) {
        JsonNode root = readBody(body, objectMapper);
        if (root != null && root.isObject()) {
            JsonNode error = root.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                return new RpcOutcome.UpstreamError(errorMessage(error), errorCode(error));
            }
        }
        if (status == 401 || status == 403) {
            return new RpcOutcome.TransportFailure(TransportFailureKind.UNAUTHORIZED, httpDetail(status, body));
        }
        if (status >= 400) {
            return new RpcOutcome.TransportFailure(TransportFailureKind.PROTOCOL_ERROR, httpDetail(status, body));
        }
        if (root == null) {
            return new RpcOutcome.TransportFailure(TransportFailureKind.UNKNOWN, "Unreadable response body (HTTP " + status + ")");
        }
        return new RpcOutcome.Success(root);
    }

    /**
     * Classify an error raised before a response was read.
     */
    public static RpcOutcome fromError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            // io.netty.channel.ConnectTimeoutException is a ConnectException: unreachable, not slow
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return new RpcOutcome.TransportFailure(TransportFailureKind.UNAVAILABLE, describe(t));
            }
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return new RpcOutcome.TransportFailure(TransportFailureKind.TIMEOUT, describe(t));
            }
        }
        if (error instanceof WebClientRequestException) {
            return new RpcOutcome.TransportFailure(TransportFailureKind.UNAVAILABLE, describe(error));
        }
        return new RpcOutcome.TransportFailure(TransportFailureKind.UNKNOWN, describe(error));
    }

    private static JsonNode readBody(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String errorMessage(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        return error.path("message").asText(error.toString());
    }

    private static Integer errorCode(JsonNode error) {
        JsonNode code = error.path("code");
        return code.isInt() ? code.intValue() : null;
    }

    /** "HTTP 401" plus the start of the body, for the log line. */
    static String httpDetail(int status, String body) {
        if (body == null || body.isBlank()) {
            return "HTTP " + status;
        }
        String snippet = body.strip().replaceAll("\\s+", " ");
        if (snippet.length() > BODY_SNIPPET_LENGTH) {
            snippet = snippet.substring(0, BODY_SNIPPET_LENGTH) + "...";
        }
        return "HTTP " + status + ": " + snippet;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
