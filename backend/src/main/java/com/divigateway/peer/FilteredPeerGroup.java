package com.divigateway.peer;

import java.util.List;

/**
 * Peers sharing one client version string, in the order they were reported.
 */
public record FilteredPeerGroup(String core, List<PeerAddress> peers) {
}
