package com.divigateway.peer;

/**
 * Host and port of a peer, both as reported by the node (port is not range-checked).
 */
public record PeerAddress(String ip, String port) {

    /**
     * Parse {@code [ipv6]:port} or {@code host:port}.
     *
     * @throws MalformedPeerAddressException when neither form matches
     */
    public static PeerAddress parse(String addr) {
        if (addr == null) {
            throw new MalformedPeerAddressException(null);
        }
        if (isBracketed(addr)) {
            int close = addr.indexOf("]:");
            if (close < 0) {
                throw new MalformedPeerAddressException(addr);
            }
            return new PeerAddress(addr.substring(1, close), addr.substring(close + 2));
        }
        int colon = addr.lastIndexOf(':');
        if (colon < 0) {
            throw new MalformedPeerAddressException(addr);
        }
        return new PeerAddress(addr.substring(0, colon), addr.substring(colon + 1));
    }

    /** IPv6 peers are reported in bracket notation. */
    public static boolean isBracketed(String addr) {
        return addr != null && addr.startsWith("[");
    }
}
