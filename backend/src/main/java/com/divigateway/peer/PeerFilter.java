package com.divigateway.peer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps peers running a recent client that are close to the chain tip, grouped by client version.
 * <p>
 * The version check is a plain string comparison against the minimum version, not a semantic
 * version comparison: {@code "DIVI Core: 10.0.0.0"} sorts below {@code "DIVI Core: 3.0.0.0"}.
 * Known limitation, kept so results match what the node operators already rely on.
 */
public class PeerFilter {

    private final String minimumVersion;
    private final long heightWindow;

    public PeerFilter(String minimumVersion, long heightWindow) {
        if (minimumVersion == null) {
            throw new IllegalArgumentException("minimumVersion is required");
        }
        this.minimumVersion = minimumVersion;
        this.heightWindow = heightWindow;
    }

    /**
     * Groups are ordered by first occurrence of their version string; peers keep input order.
     *
     * @throws MalformedPeerAddressException for an address that cannot be parsed
     */
    public List<FilteredPeerGroup> filter(List<PeerRecord> peers, long currentHeight, boolean includeIpv6) {
        Map<String, List<PeerAddress>> groups = new LinkedHashMap<>();
        for (PeerRecord peer : peers) {
            if (!includeIpv6 && PeerAddress.isBracketed(peer.addr())) {
                continue;
            }
            PeerAddress address = PeerAddress.parse(peer.addr());
            if (!isRecentVersion(peer) || !isNearTip(peer, currentHeight)) {
                continue;
            }
            groups.computeIfAbsent(peer.subver(), v -> new ArrayList<>()).add(address);
        }
        return groups.entrySet().stream()
                .map(e -> new FilteredPeerGroup(e.getKey(), List.copyOf(e.getValue())))
                .toList();
    }

    private boolean isRecentVersion(PeerRecord peer) {
        return peer.subver() != null && peer.subver().compareTo(minimumVersion) >= 0;
    }

    private boolean isNearTip(PeerRecord peer, long currentHeight) {
        return peer.startingheight() >= currentHeight - heightWindow;
    }
}
