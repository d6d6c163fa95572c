package com.divigateway.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Local checks on path and query parameters before anything is sent to the node.
 */
@Component
public class RequestValidator {

    /** Block hashes and txids: 32 bytes, hex encoded. */
    private static final Pattern HASH = Pattern.compile("^[0-9a-fA-F]{64}$");
    /** Raw transactions: whole bytes of hex. */
    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");
    private static final Pattern HEIGHT = Pattern.compile("^[0-9]{1,18}$");
    /** Base58 address or vault owner key. */
    private static final Pattern ADDRESS = Pattern.compile("^[A-Za-z0-9]{1,128}$");

    public boolean isValidHash(String value) {
        return value != null && HASH.matcher(value).matches();
    }

    public boolean isValidHex(String value) {
        return value != null && HEX.matcher(value).matches();
    }

    public boolean isValidHeight(String value) {
        return value != null && HEIGHT.matcher(value).matches();
    }

    public boolean isValidAddress(String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    public String requireHash(String value, String name) {
        if (!isValidHash(value)) {
            throw new InvalidRequestException("Invalid " + name + ": expected 64 hexadecimal characters");
        }
        return value;
    }

    public String requireHex(String value, String name) {
        if (!isValidHex(value)) {
            throw new InvalidRequestException("Invalid " + name + ": expected a non-empty, even-length hexadecimal string");
        }
        return value;
    }

    public long requireHeight(String value) {
        if (!isValidHeight(value)) {
            throw new InvalidRequestException("Invalid block height: expected a non-negative integer");
        }
        return Long.parseLong(value);
    }

    public String requireAddress(String value) {
        if (!isValidAddress(value)) {
            throw new InvalidRequestException("Invalid address or vault owner key");
        }
        return value;
    }

    /**
     * Path flags such as isVault: "true" in any case is true, anything else false.
     */
    public static boolean parseFlag(String value) {
        return value != null && "true".equalsIgnoreCase(value.strip());
    }
}
