package com.divigateway.api.validation;

/**
 * Thrown when an inbound parameter fails local validation. No upstream call is made.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
