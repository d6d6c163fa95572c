package com.divigateway.rpc;

/**
 * Failure classes for an upstream call that produced no usable JSON-RPC answer.
 */
public enum TransportFailureKind {
    /** Node unreachable: connection refused, unknown host, connect timeout. */
    UNAVAILABLE,
    /** No response within the call deadline. */
    TIMEOUT,
    /** Node answered 401/403: credentials rejected. */
    UNAUTHORIZED,
    /** Node answered another HTTP error status without a JSON-RPC error body. */
    PROTOCOL_ERROR,
    UNKNOWN
}
