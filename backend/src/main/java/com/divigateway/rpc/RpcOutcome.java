package com.divigateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of one upstream call. Failures are values, never exceptions.
 */
public sealed interface RpcOutcome permits RpcOutcome.Success, RpcOutcome.TransportFailure, RpcOutcome.UpstreamError {

    /** Parsed response body, passed through un-inspected. */
    record Success(JsonNode payload) implements RpcOutcome {
    }

    record TransportFailure(TransportFailureKind kind, String message) implements RpcOutcome {
    }

    /** The node answered with a JSON-RPC error object. Code is null when the node sent none. */
    record UpstreamError(String message, Integer code) implements RpcOutcome {
    }
}
