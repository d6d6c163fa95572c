package com.divigateway.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Uniform response envelope for every endpoint except /ping.
 * At most one of result / error is non-null on the wire. Both are null for a successful call whose node
 * reply carried {@code "result": null}. Timestamp is ISO 8601 UTC.
 */
public record GatewayResponse(
        JsonNode result,
        ErrorDetail error,
        @JsonProperty("timestamp_utc") String timestampUtc
) {

    public static GatewayResponse success(JsonNode result, String timestampUtc) {
        return new GatewayResponse(result, null, timestampUtc);
    }

    public static GatewayResponse failure(String message, String timestampUtc) {
        return new GatewayResponse(null, new ErrorDetail(message), timestampUtc);
    }
}
