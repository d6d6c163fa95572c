package com.divigateway.api.dto;

/**
 * Body of GET /ping. Not wrapped in the envelope.
 */
public record PingResponse(String message) {

    public static PingResponse pong() {
        return new PingResponse("pong");
    }
}
