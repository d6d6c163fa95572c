package com.divigateway.domain;

/**
 * Error part of the envelope. Only a human-readable message is exposed.
 */
public record ErrorDetail(String message) {
}
