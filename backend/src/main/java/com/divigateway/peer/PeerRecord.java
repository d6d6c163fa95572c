package com.divigateway.peer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The getpeerinfo fields the peer view needs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeerRecord(String subver, long startingheight, String addr) {
}
