package com.divigateway.peer;

/**
 * Thrown when a peer address is neither {@code [ipv6]:port} nor {@code host:port}.
 */
public class MalformedPeerAddressException extends RuntimeException {

    private final String address;

    public MalformedPeerAddressException(String address) {
        super("Malformed peer address: " + address);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
